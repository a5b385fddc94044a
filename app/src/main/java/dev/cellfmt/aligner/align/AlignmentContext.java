package dev.cellfmt.aligner.align;

import java.util.Objects;

/**
 * Width tables of the scope being aligned together with the indentation depth of its statements.
 * Entering a nested block produces a new context; the enclosing one is never modified.
 */
public record AlignmentContext(ScopeWidths widths, int depth) {

    public AlignmentContext {
        Objects.requireNonNull(widths, "widths");
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative");
        }
    }

    public static AlignmentContext root(ScopeWidths widths) {
        return new AlignmentContext(widths, 0);
    }

    public AlignmentContext enter(ScopeWidths nested) {
        return new AlignmentContext(nested, depth + 1);
    }

    public WidthTable table(boolean setting) {
        return widths.table(setting);
    }
}
