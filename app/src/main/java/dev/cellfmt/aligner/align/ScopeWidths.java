package dev.cellfmt.aligner.align;

import java.util.Objects;

/**
 * Width tables of one scope: one for ordinary calls and one for settings.
 */
public record ScopeWidths(WidthTable body, WidthTable settings) {

    public ScopeWidths {
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(settings, "settings");
    }

    public static ScopeWidths shared(WidthTable table) {
        return new ScopeWidths(table, table);
    }

    public WidthTable table(boolean setting) {
        return setting ? settings : body;
    }
}
