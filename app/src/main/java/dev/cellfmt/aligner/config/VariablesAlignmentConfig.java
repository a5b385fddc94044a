package dev.cellfmt.aligner.config;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Settings of the variables table aligner.
 *
 * @param upToColumn number of leading columns aligned to the longest cell, {@code 0} for all of them
 */
public record VariablesAlignmentConfig(
        int upToColumn,
        OptionalInt minWidth,
        OptionalInt fixedWidth,
        Set<VariableType> skipTypes
) {

    public static final int DEFAULT_UP_TO_COLUMN = 2;

    public VariablesAlignmentConfig {
        if (upToColumn < 0) {
            throw new InvalidParameterValueException("up_to_column", String.valueOf(upToColumn),
                    "The column should be a number equal or greater than 0.");
        }
        minWidth = minWidth == null ? OptionalInt.empty() : minWidth;
        fixedWidth = fixedWidth == null ? OptionalInt.empty() : fixedWidth;
        skipTypes = skipTypes == null || skipTypes.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(skipTypes));
    }

    public static VariablesAlignmentConfig defaults() {
        return new VariablesAlignmentConfig(DEFAULT_UP_TO_COLUMN, OptionalInt.empty(), OptionalInt.empty(), Set.of());
    }

    public static Set<VariableType> parseSkipTypes(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        Set<VariableType> types = EnumSet.noneOf(VariableType.class);
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(VariableType::from)
                .forEach(types::add);
        return types;
    }

    public boolean skips(char sigil) {
        return skipTypes.stream().anyMatch(type -> type.sigil() == sigil);
    }
}
