package dev.cellfmt.aligner.config;

import java.util.Objects;

/**
 * Global formatting settings shared with the rest of the formatting tool.
 *
 * @param spaceCount minimum separator width
 * @param indent     one indentation unit
 * @param lineLength maximum rendered line length; longer aligned lines are handed to the line splitter
 */
public record FormattingConfig(int spaceCount, String indent, int lineLength) {

    public static final int DEFAULT_SPACE_COUNT = 4;
    public static final int DEFAULT_LINE_LENGTH = 120;

    public FormattingConfig {
        if (spaceCount < 1) {
            throw new InvalidParameterValueException("space_count", String.valueOf(spaceCount),
                    "The separator should be at least one space wide.");
        }
        Objects.requireNonNull(indent, "indent");
        if (indent.isEmpty() || !indent.chars().allMatch(ch -> ch == ' ' || ch == '\t')) {
            throw new InvalidParameterValueException("indent", indent, "The indent should consist of spaces or tabs.");
        }
        if (lineLength < 1) {
            throw new InvalidParameterValueException("line_length", String.valueOf(lineLength),
                    "The line length should be a positive number.");
        }
    }

    public static FormattingConfig defaults() {
        return new FormattingConfig(DEFAULT_SPACE_COUNT, " ".repeat(DEFAULT_SPACE_COUNT), DEFAULT_LINE_LENGTH);
    }

    public static FormattingConfig withIndentWidth(int spaceCount, int indentWidth, int lineLength) {
        if (indentWidth < 1) {
            throw new InvalidParameterValueException("indent", String.valueOf(indentWidth),
                    "The indent should be a positive number of spaces.");
        }
        return new FormattingConfig(spaceCount, " ".repeat(indentWidth), lineLength);
    }

    public String indent(int depth) {
        return indent.repeat(Math.max(0, depth));
    }
}
