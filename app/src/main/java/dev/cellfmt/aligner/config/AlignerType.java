package dev.cellfmt.aligner.config;

import java.util.EnumSet;
import java.util.Set;

/**
 * Available section aligners, named as they are referenced by disablers and selection options.
 */
public enum AlignerType {
    KEYWORDS("AlignKeywordsSection"),
    TEST_CASES("AlignTestCasesSection"),
    VARIABLES("AlignVariablesSection"),
    SETTINGS("AlignSettingsSection");

    private final String formatterName;

    AlignerType(String formatterName) {
        this.formatterName = formatterName;
    }

    public String formatterName() {
        return formatterName;
    }

    public static AlignerType from(String raw) {
        if (raw != null) {
            String value = raw.trim();
            for (AlignerType type : values()) {
                if (type.formatterName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
        }
        throw new InvalidParameterValueException("select", raw,
                "Choose from AlignKeywordsSection, AlignTestCasesSection, AlignVariablesSection, AlignSettingsSection.");
    }

    public static Set<AlignerType> all() {
        return EnumSet.allOf(AlignerType.class);
    }
}
