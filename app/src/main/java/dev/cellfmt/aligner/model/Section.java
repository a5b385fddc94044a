package dev.cellfmt.aligner.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A top level section. The implicit comment section at the start of a file has no header.
 */
public final class Section implements Node {

    private final SectionType type;
    private final Statement header;
    private List<Node> body;

    public Section(SectionType type, Statement header, List<? extends Node> body) {
        this.type = Objects.requireNonNull(type, "type");
        this.header = header;
        this.body = new ArrayList<>(Objects.requireNonNull(body, "body"));
    }

    public SectionType type() {
        return type;
    }

    public Optional<Statement> header() {
        return Optional.ofNullable(header);
    }

    public List<Node> body() {
        return List.copyOf(body);
    }

    public void setBody(List<? extends Node> body) {
        this.body = new ArrayList<>(Objects.requireNonNull(body, "body"));
    }

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
        if (header != null) {
            return header.startLine();
        }
        return body.isEmpty() ? 1 : body.get(0).startLine();
    }

    @Override
    public int endLine() {
        if (!body.isEmpty()) {
            return body.get(body.size() - 1).endLine();
        }
        return header == null ? startLine() : header.endLine();
    }

    @Override
    public String render() {
        StringBuilder builder = new StringBuilder();
        if (header != null) {
            builder.append(header.render());
        }
        body.forEach(node -> builder.append(node.render()));
        return builder.toString();
    }
}
