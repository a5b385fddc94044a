package dev.cellfmt.aligner.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An ordered sequence of lines; the first one is the primary line, the rest are continuation lines.
 */
public final class Statement implements Node {

    private final StatementKind kind;
    private final List<Line> lines;
    private final int lineNumber;
    private final List<String> errors;

    public Statement(StatementKind kind, List<Line> lines, int lineNumber, List<String> errors) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be positive");
        }
        this.lineNumber = lineNumber;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public Statement(StatementKind kind, List<Line> lines, int lineNumber) {
        this(kind, lines, lineNumber, List.of());
    }

    /**
     * Rebuilds a statement from a flat cell sequence, starting a new line after every line end.
     */
    public static Statement fromCells(StatementKind kind, int lineNumber, List<String> errors, List<Cell> cells) {
        List<Line> lines = new ArrayList<>();
        List<Cell> current = new ArrayList<>();
        for (Cell cell : cells) {
            current.add(cell);
            if (cell.is(CellType.END_OF_LINE)) {
                lines.add(new Line(current));
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            lines.add(new Line(current));
        }
        return new Statement(kind, lines, lineNumber, errors);
    }

    public Statement withCells(List<Cell> cells) {
        return fromCells(kind, lineNumber, errors, cells);
    }

    public StatementKind kind() {
        return kind;
    }

    public List<Line> lines() {
        return lines;
    }

    public List<Cell> cells() {
        List<Cell> cells = new ArrayList<>();
        lines.forEach(line -> cells.addAll(line.cells()));
        return cells;
    }

    public List<Cell> dataCells() {
        List<Cell> cells = new ArrayList<>();
        lines.forEach(line -> cells.addAll(line.dataCells()));
        return cells;
    }

    public List<String> errors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Name of the called keyword, present for keyword calls only.
     */
    public Optional<String> keywordName() {
        return cells().stream()
                .filter(cell -> cell.is(CellType.KEYWORD))
                .map(Cell::text)
                .findFirst();
    }

    /**
     * Name of the declared variable, present for variable table rows only.
     */
    public Optional<String> variableName() {
        return cells().stream()
                .filter(cell -> cell.is(CellType.VARIABLE))
                .map(cell -> cell.text().strip())
                .findFirst();
    }

    @Override
    public int startLine() {
        return lineNumber;
    }

    @Override
    public int endLine() {
        return lineNumber + Math.max(0, lines.size() - 1);
    }

    @Override
    public String render() {
        StringBuilder builder = new StringBuilder();
        lines.forEach(line -> builder.append(line.render()));
        return builder.toString();
    }

    @Override
    public String toString() {
        return kind + "@" + lineNumber + lines;
    }
}
