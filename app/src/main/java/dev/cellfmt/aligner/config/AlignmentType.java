package dev.cellfmt.aligner.config;

/**
 * Source of the column widths: fixed from configuration or measured per scope.
 */
public enum AlignmentType {
    FIXED,
    AUTO;

    public static AlignmentType from(String raw) {
        if (raw == null || raw.isBlank()) {
            return FIXED;
        }
        for (AlignmentType type : values()) {
            if (type.name().equalsIgnoreCase(raw.trim())) {
                return type;
            }
        }
        throw new InvalidParameterValueException("alignment_type", raw,
                "Choose between two modes: 'fixed' (align to fixed width) or 'auto' (align to longest token in column).");
    }
}
