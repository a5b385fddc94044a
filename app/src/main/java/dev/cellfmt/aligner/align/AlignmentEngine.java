package dev.cellfmt.aligner.align;

import dev.cellfmt.aligner.config.AlignmentConfig;
import dev.cellfmt.aligner.config.FormattingConfig;
import dev.cellfmt.aligner.config.OverflowPolicy;
import dev.cellfmt.aligner.model.Cell;
import dev.cellfmt.aligner.model.CellType;
import dev.cellfmt.aligner.model.Line;
import dev.cellfmt.aligner.model.Statement;
import dev.cellfmt.aligner.split.LineSplitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the separators between the cells of a statement so that they line up with the columns of the
 * current {@link AlignmentContext}. Only separator cells are rewritten; data cells are never added or removed.
 */
public final class AlignmentEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentEngine.class);

    private static final int COMMENT_SEPARATOR = 2;

    private final AlignmentConfig config;
    private final FormattingConfig formatting;
    private final boolean keepAssignments;
    private final LineSplitter splitter;

    /**
     * @param keepAssignments leave the spacing of leading assignment targets as it is
     * @param splitter        collaborator used when an aligned line gets too long, {@code null} when absent
     */
    public AlignmentEngine(AlignmentConfig config, FormattingConfig formatting, boolean keepAssignments,
                           LineSplitter splitter) {
        this.config = Objects.requireNonNull(config, "config");
        this.formatting = Objects.requireNonNull(formatting, "formatting");
        this.keepAssignments = keepAssignments;
        this.splitter = splitter;
    }

    public Optional<LineSplitter> splitter() {
        return Optional.ofNullable(splitter);
    }

    /**
     * Aligns every line of the statement.
     *
     * @param settingsKind          measure against the settings table instead of the body table
     * @param enforceLineLength     hand over to the line splitter when an aligned line is too long
     * @param hasLeadingAssignment  the statement may start with assignment targets
     */
    public Statement align(Statement statement, AlignmentContext context, boolean settingsKind,
                           boolean enforceLineLength, boolean hasLeadingAssignment) {
        WidthTable table = context.table(settingsKind);
        String indent = formatting.indent(context.depth());
        List<Cell> result = new ArrayList<>();
        for (Line line : statement.lines()) {
            AssignmentSplit split = splitAssignment(line.cells(), hasLeadingAssignment);
            List<Cell> aligned = alignLine(split.remaining(), split.skipWidth(), table);
            if (aligned == null) {
                result.addAll(line.cells());
                continue;
            }
            List<Cell> alignedLine = new ArrayList<>();
            alignedLine.add(Cell.separator(indent));
            alignedLine.addAll(split.assignments());
            alignedLine.addAll(aligned);
            if (enforceLineLength && isTooLong(alignedLine)) {
                LOGGER.debug("Line {} of statement at line {} exceeds {} characters, splitting",
                        statement.lines().indexOf(line) + 1, statement.startLine(), formatting.lineLength());
                Statement restructured = splitter.split(statement);
                return align(restructured, context, settingsKind, false, false);
            }
            result.addAll(alignedLine);
        }
        return statement.withCells(result);
    }

    /**
     * Sets the separator after the documentation label ({@code [Documentation]} or {@code ...}) of every line
     * from the first column width; the documentation text itself is left alone.
     */
    public Statement alignDocumentation(Statement statement, AlignmentContext context) {
        int width = context.table(true).width(0);
        int minSeparator = formatting.spaceCount();
        for (Line line : statement.lines()) {
            boolean firstSeparator = true;
            Cell previous = null;
            for (Cell cell : line.cells()) {
                if (cell.is(CellType.SEPARATOR)) {
                    if (firstSeparator) {
                        cell.setText(formatting.indent(1));
                        firstSeparator = false;
                        continue;
                    }
                    if (previous != null) {
                        int separator = width == 0
                                ? WidthTable.roundToFour(previous.length() + minSeparator) - previous.length()
                                : Math.max(width - previous.length(), minSeparator);
                        cell.setText(" ".repeat(separator));
                    }
                    break;
                }
                previous = cell;
            }
        }
        return statement;
    }

    /**
     * Moves a block header or {@code END} marker to the given depth.
     */
    public Statement reindent(Statement statement, int depth) {
        List<Cell> cells = new ArrayList<>(statement.cells());
        Cell indent = Cell.separator(formatting.indent(depth));
        if (!cells.isEmpty() && cells.get(0).is(CellType.SEPARATOR)) {
            cells.set(0, indent);
        } else {
            cells.add(0, indent);
        }
        return statement.withCells(cells);
    }

    List<Cell> alignLine(List<Cell> cells, int skipWidth, WidthTable table) {
        if (Line.isBlankContinuation(cells)) {
            cells.get(cells.size() - 1).stripLeadingWhitespace();
            return cells;
        }
        List<Cell> tokens = new ArrayList<>();
        List<Cell> comments = new ArrayList<>();
        for (Cell cell : cells) {
            if (!config.alignComments() && cell.is(CellType.COMMENT)) {
                comments.add(cell);
            } else {
                tokens.add(cell);
            }
        }
        if (tokens.size() < 2) {
            return null;
        }
        List<Cell> aligned = alignTokens(tokens.subList(0, tokens.size() - 2), skipWidth, table);
        Cell last = tokens.get(tokens.size() - 2);
        if (!last.text().isEmpty()) {
            last.setText(last.text().strip());
        }
        aligned.add(last);
        for (Cell comment : comments) {
            aligned.add(Cell.separator(COMMENT_SEPARATOR));
            aligned.add(comment);
        }
        aligned.add(tokens.get(tokens.size() - 1));
        return aligned;
    }

    List<Cell> alignTokens(List<Cell> tokens, int skipWidth, WidthTable table) {
        int minSeparator = formatting.spaceCount();
        int column = 0;
        int prevOverflow = 0;
        int misalignedColumns = 0;
        List<Cell> aligned = new ArrayList<>();
        if (skipWidth > 0) {
            int remaining = skipWidth;
            while (remaining > 0) {
                remaining -= table.overflowWidth(column, minSeparator);
                column++;
            }
            remaining = Math.abs(remaining);
            if (remaining < minSeparator) {
                prevOverflow = minSeparator - remaining;
                remaining = minSeparator;
            }
            aligned.add(Cell.separator(remaining));
        }
        for (int index = 0; index < tokens.size(); index++) {
            Cell token = tokens.get(index);
            aligned.add(token);
            int length = token.length();
            int width = table.width(column);
            int separator;
            if (width == 0) {
                separator = WidthTable.roundToFour(length + minSeparator) - length;
            } else {
                separator = width - length - prevOverflow;
                if (separator >= minSeparator) {
                    prevOverflow = 0;
                    misalignedColumns = 0;
                } else if (config.overflowPolicy() == OverflowPolicy.IGNORE_LINE) {
                    LOGGER.debug("Cell '{}' does not fit column {}, ignoring alignment of the line", token.text(), column);
                    return alignFixed(tokens, minSeparator, skipWidth > 0);
                } else if (config.overflowPolicy() == OverflowPolicy.IGNORE_REST) {
                    LOGGER.debug("Cell '{}' does not fit column {}, ignoring alignment of the rest", token.text(), column);
                    aligned.addAll(alignFixed(tokens.subList(index + 1, tokens.size()), minSeparator, true));
                    return aligned;
                } else if (config.overflowPolicy() == OverflowPolicy.COMPACT_OVERFLOW) {
                    int required = length + minSeparator + prevOverflow;
                    separator = minSeparator;
                    prevOverflow = required - width;
                    misalignedColumns++;
                    while (prevOverflow > width) {
                        column++;
                        width = table.overflowWidth(column, minSeparator);
                        prevOverflow -= width;
                        misalignedColumns++;
                    }
                    if (misalignedColumns >= config.compactOverflowLimit() && prevOverflow != 0
                            && index < tokens.size() - 1) {
                        Cell next = tokens.get(index + 1);
                        int nextWidth = table.overflowWidth(column + 1, minSeparator);
                        if (nextWidth - prevOverflow - next.length() < minSeparator) {
                            column++;
                            separator = nextWidth - prevOverflow + minSeparator;
                            prevOverflow = 0;
                        }
                    }
                } else {
                    while (WidthTable.roundToFour(length + minSeparator) > width) {
                        column++;
                        width += table.overflowWidth(column, minSeparator);
                    }
                    separator = width - length;
                }
            }
            separator = Math.max(minSeparator, separator);
            aligned.add(Cell.separator(separator));
            column += separator == width ? 2 : 1;
        }
        return aligned;
    }

    private AssignmentSplit splitAssignment(List<Cell> cells, boolean hasLeadingAssignment) {
        boolean containsAssignment = cells.stream().anyMatch(cell -> cell.is(CellType.ASSIGNMENT));
        if (!hasLeadingAssignment || !keepAssignments || !containsAssignment) {
            return new AssignmentSplit(List.of(), withoutSeparators(cells), 0);
        }
        List<Cell> assignments = new ArrayList<>();
        boolean assignmentFound = false;
        int start = !cells.isEmpty() && cells.get(0).is(CellType.SEPARATOR) ? 1 : 0;
        for (int index = start; index < cells.size(); index++) {
            Cell cell = cells.get(index);
            if (cell.is(CellType.ASSIGNMENT)) {
                assignmentFound = true;
            } else if (assignmentFound && !cell.is(CellType.SEPARATOR)) {
                List<Cell> kept = assignments.subList(0, assignments.size() - 1);
                int skipWidth = kept.stream().mapToInt(Cell::length).sum();
                return new AssignmentSplit(List.copyOf(kept), withoutSeparators(cells.subList(index, cells.size())),
                        skipWidth);
            }
            assignments.add(cell);
        }
        return new AssignmentSplit(assignments, List.of(), 0);
    }

    private boolean isTooLong(List<Cell> line) {
        if (splitter == null || !splitter.splitsOnEveryArgument()) {
            return false;
        }
        return line.stream().mapToInt(Cell::length).sum() > formatting.lineLength();
    }

    private static List<Cell> alignFixed(List<Cell> tokens, int separator, boolean leadingSeparator) {
        List<Cell> aligned = new ArrayList<>();
        if (leadingSeparator) {
            aligned.add(Cell.separator(separator));
        }
        for (Cell token : tokens) {
            aligned.add(token);
            aligned.add(Cell.separator(separator));
        }
        return aligned;
    }

    private static List<Cell> withoutSeparators(List<Cell> cells) {
        List<Cell> data = new ArrayList<>();
        for (Cell cell : cells) {
            if (!cell.is(CellType.SEPARATOR)) {
                data.add(cell);
            }
        }
        return data;
    }

    private record AssignmentSplit(List<Cell> assignments, List<Cell> remaining, int skipWidth) {
    }
}
