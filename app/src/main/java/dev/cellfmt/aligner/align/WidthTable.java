package dev.cellfmt.aligner.align;

import dev.cellfmt.aligner.config.AlignmentConfig;
import java.util.List;
import java.util.Objects;

/**
 * Column widths of one scope. A width of {@code 0} marks an uncapped column; columns past the end of the table
 * reuse the last width, and an empty table falls back to {@link AlignmentConfig#DEFAULT_WIDTH}.
 */
public final class WidthTable {

    public static final WidthTable EMPTY = new WidthTable(List.of());

    private final List<Integer> widths;

    private WidthTable(List<Integer> widths) {
        this.widths = widths;
    }

    public static WidthTable of(List<Integer> widths) {
        List<Integer> copy = List.copyOf(Objects.requireNonNull(widths, "widths"));
        for (Integer width : copy) {
            if (width < 0) {
                throw new IllegalArgumentException("Column width must not be negative: " + width);
            }
        }
        return copy.isEmpty() ? EMPTY : new WidthTable(copy);
    }

    public static WidthTable of(Integer... widths) {
        return of(List.of(widths));
    }

    /**
     * Rounds up to the closest multiple of four.
     */
    public static int roundToFour(int number) {
        int remainder = number % 4;
        return remainder == 0 ? number : number + 4 - remainder;
    }

    public int width(int column) {
        if (widths.isEmpty()) {
            return AlignmentConfig.DEFAULT_WIDTH;
        }
        if (column < widths.size()) {
            return widths.get(column);
        }
        return widths.get(widths.size() - 1);
    }

    /**
     * Width of a column a cell overflows into. Uncapped columns count as the minimal separator so that
     * overflowing always makes progress.
     */
    public int overflowWidth(int column, int minSeparator) {
        int width = width(column);
        return width == 0 ? minSeparator : width;
    }

    public List<Integer> widths() {
        return widths;
    }

    public boolean isEmpty() {
        return widths.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof WidthTable table && widths.equals(table.widths);
    }

    @Override
    public int hashCode() {
        return widths.hashCode();
    }

    @Override
    public String toString() {
        return widths.isEmpty() ? "[default " + AlignmentConfig.DEFAULT_WIDTH + "]" : widths.toString();
    }
}
