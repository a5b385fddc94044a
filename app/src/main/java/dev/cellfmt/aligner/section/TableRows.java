package dev.cellfmt.aligner.section;

import dev.cellfmt.aligner.model.Cell;
import dev.cellfmt.aligner.model.Line;
import dev.cellfmt.aligner.model.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Helpers shared by the aligners of the variables and settings tables.
 */
final class TableRows {

    private TableRows() {
    }

    /**
     * Cells of every non-empty line without separators, the first cell trimmed.
     */
    static List<List<Cell>> cellsByLine(Statement statement) {
        List<List<Cell>> lines = new ArrayList<>();
        for (Line line : statement.lines()) {
            if (!line.hasContent()) {
                continue;
            }
            List<Cell> cells = line.withoutSeparators();
            Cell first = cells.get(0);
            if (first.type().isData()) {
                first.setText(first.text().strip());
            }
            lines.add(cells);
        }
        return lines;
    }

    /**
     * Removes whitespace in front of a comment or empty line.
     */
    static Statement leftAlign(Statement statement) {
        List<Cell> cells = statement.cells();
        if (!cells.isEmpty()) {
            cells.get(0).stripLeadingWhitespace();
        }
        return statement.withCells(cells);
    }

    /**
     * Appends one table row, calling {@code separator} for the gap after each cell but the last value.
     */
    static void appendRow(List<Cell> row, List<Cell> target, SeparatorFunction separator) {
        if (row.size() < 2) {
            target.addAll(row);
            return;
        }
        if (Line.isBlankContinuation(row)) {
            row.get(row.size() - 1).stripLeadingWhitespace();
            target.addAll(row);
            return;
        }
        for (int index = 0; index < row.size() - 2; index++) {
            Cell cell = row.get(index);
            target.add(cell);
            target.add(Cell.separator(separator.width(index, cell)));
        }
        Cell last = row.get(row.size() - 2);
        if (!last.text().isEmpty()) {
            last.setText(last.text().strip());
        }
        target.add(last);
        target.add(row.get(row.size() - 1));
    }

    @FunctionalInterface
    interface SeparatorFunction {
        int width(int column, Cell cell);
    }
}
