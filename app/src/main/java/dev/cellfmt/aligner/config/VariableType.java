package dev.cellfmt.aligner.config;

/**
 * Variable flavours distinguished by the sigil of the variable name.
 */
public enum VariableType {
    SCALAR('$'),
    LIST('@'),
    DICT('&');

    private final char sigil;

    VariableType(char sigil) {
        this.sigil = sigil;
    }

    public char sigil() {
        return sigil;
    }

    public static VariableType from(String raw) {
        if (raw != null) {
            for (VariableType type : values()) {
                if (type.name().equalsIgnoreCase(raw.trim())) {
                    return type;
                }
            }
        }
        throw new InvalidParameterValueException("skip_types", raw,
                "Variable types should be provided in comma separated list: skip_types=dict,list,scalar");
    }
}
