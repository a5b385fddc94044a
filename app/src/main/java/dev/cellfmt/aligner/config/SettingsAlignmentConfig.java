package dev.cellfmt.aligner.config;

import java.util.OptionalInt;

/**
 * Settings of the settings table aligner.
 *
 * @param argumentIndent extra indentation of continued setup, teardown and import arguments
 */
public record SettingsAlignmentConfig(
        int upToColumn,
        int argumentIndent,
        OptionalInt minWidth,
        OptionalInt fixedWidth
) {

    public static final int DEFAULT_UP_TO_COLUMN = 2;
    public static final int DEFAULT_ARGUMENT_INDENT = 4;

    public SettingsAlignmentConfig {
        if (upToColumn < 0) {
            throw new InvalidParameterValueException("up_to_column", String.valueOf(upToColumn),
                    "The column should be a number equal or greater than 0.");
        }
        if (argumentIndent < 0) {
            throw new InvalidParameterValueException("argument_indent", String.valueOf(argumentIndent),
                    "The indent should be a number equal or greater than 0.");
        }
        minWidth = minWidth == null ? OptionalInt.empty() : minWidth;
        fixedWidth = fixedWidth == null ? OptionalInt.empty() : fixedWidth;
    }

    public static SettingsAlignmentConfig defaults() {
        return new SettingsAlignmentConfig(DEFAULT_UP_TO_COLUMN, DEFAULT_ARGUMENT_INDENT, OptionalInt.empty(),
                OptionalInt.empty());
    }
}
