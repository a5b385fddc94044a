package dev.cellfmt.aligner.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A header statement followed by a body. Conditional and exception handling blocks chain their further branches
 * through {@link #next()}; the closing {@code END} belongs to the first branch.
 */
public final class Block implements Node {

    private final BlockType type;
    private Statement header;
    private List<Node> body;
    private Block next;
    private Statement end;

    public Block(BlockType type, Statement header, List<? extends Node> body, Statement end) {
        this.type = Objects.requireNonNull(type, "type");
        this.header = Objects.requireNonNull(header, "header");
        this.body = new ArrayList<>(Objects.requireNonNull(body, "body"));
        this.end = end;
    }

    public Block(BlockType type, Statement header, List<? extends Node> body) {
        this(type, header, body, null);
    }

    public BlockType type() {
        return type;
    }

    public Statement header() {
        return header;
    }

    public void setHeader(Statement header) {
        this.header = Objects.requireNonNull(header, "header");
    }

    public List<Node> body() {
        return List.copyOf(body);
    }

    public void setBody(List<? extends Node> body) {
        this.body = new ArrayList<>(Objects.requireNonNull(body, "body"));
    }

    public Optional<Block> next() {
        return Optional.ofNullable(next);
    }

    public Block withNext(Block branch) {
        this.next = branch;
        return this;
    }

    public Optional<Statement> end() {
        return Optional.ofNullable(end);
    }

    public void setEnd(Statement end) {
        this.end = end;
    }

    public boolean isInline() {
        return header.kind() == StatementKind.INLINE_IF_HEADER;
    }

    /**
     * Statements placed directly in this branch, without descending into nested blocks.
     */
    public List<Statement> directStatements() {
        List<Statement> statements = new ArrayList<>();
        for (Node node : body) {
            if (node instanceof Statement statement) {
                statements.add(statement);
            }
        }
        return statements;
    }

    @Override
    public int startLine() {
        return header.startLine();
    }

    @Override
    public int endLine() {
        if (end != null) {
            return end.endLine();
        }
        if (next != null) {
            return next.endLine();
        }
        if (!body.isEmpty()) {
            return body.get(body.size() - 1).endLine();
        }
        return header.endLine();
    }

    @Override
    public String render() {
        StringBuilder builder = new StringBuilder(header.render());
        body.forEach(node -> builder.append(node.render()));
        if (next != null) {
            builder.append(next.render());
        }
        if (end != null) {
            builder.append(end.render());
        }
        return builder.toString();
    }
}
