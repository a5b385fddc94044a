package dev.cellfmt.aligner.config;

import java.util.Locale;

/**
 * Strategy applied when a cell does not fit the width of its column.
 */
public enum OverflowPolicy {
    OVERFLOW,
    COMPACT_OVERFLOW,
    IGNORE_LINE,
    IGNORE_REST;

    public static OverflowPolicy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return OVERFLOW;
        }
        String normalized = raw.trim().replace('-', '_');
        for (OverflowPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(normalized)) {
                return policy;
            }
        }
        throw new InvalidParameterValueException("handle_too_long", raw,
                "Choose between modes: 'overflow' (align to the next column), 'compact_overflow' (fit the next cell "
                        + "behind the overflowing one), 'ignore_line' (ignore this line in alignment) or 'ignore_rest' "
                        + "(align up to the long cell and ignore the rest).");
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
