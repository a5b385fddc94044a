package dev.cellfmt.aligner.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Validated settings of the scoped aligners.
 *
 * @param widths                  per-column caps, {@code 0} meaning uncapped; empty when nothing is configured
 * @param compactOverflowLimit    consecutive misaligned columns tolerated by {@link OverflowPolicy#COMPACT_OVERFLOW}
 * @param alignSettingsSeparately measure settings statements in their own width table
 */
public record AlignmentConfig(
        List<Integer> widths,
        AlignmentType alignmentType,
        OverflowPolicy overflowPolicy,
        int compactOverflowLimit,
        boolean alignComments,
        boolean alignSettingsSeparately
) {

    public static final int DEFAULT_WIDTH = 24;
    public static final int DEFAULT_COMPACT_OVERFLOW_LIMIT = 2;

    private static final String WIDTHS_HINT = "Widths should be comma separated list of numbers equal or greater than 0.";

    public AlignmentConfig {
        widths = widths == null ? List.of() : List.copyOf(widths);
        for (Integer width : widths) {
            if (width == null || width < 0) {
                throw new InvalidParameterValueException("widths", String.valueOf(widths), WIDTHS_HINT);
            }
        }
        alignmentType = Objects.requireNonNull(alignmentType, "alignmentType");
        overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        if (compactOverflowLimit < 1) {
            throw new InvalidParameterValueException("compact_overflow_limit", String.valueOf(compactOverflowLimit),
                    "The limit should be a number equal or greater than 1.");
        }
    }

    public static AlignmentConfig defaults() {
        return new AlignmentConfig(List.of(), AlignmentType.FIXED, OverflowPolicy.OVERFLOW,
                DEFAULT_COMPACT_OVERFLOW_LIMIT, false, false);
    }

    public static AlignmentConfig parse(String widths, String alignmentType, String handleTooLong,
                                        int compactOverflowLimit, boolean alignComments,
                                        boolean alignSettingsSeparately) {
        return new AlignmentConfig(parseWidths(widths), AlignmentType.from(alignmentType),
                OverflowPolicy.from(handleTooLong), compactOverflowLimit, alignComments, alignSettingsSeparately);
    }

    public static List<Integer> parseWidths(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<Integer> parsed = new ArrayList<>();
        for (String part : raw.split(",")) {
            try {
                int width = Integer.parseInt(part.trim());
                if (width < 0) {
                    throw new InvalidParameterValueException("widths", raw, WIDTHS_HINT);
                }
                parsed.add(width);
            } catch (NumberFormatException ex) {
                throw new InvalidParameterValueException("widths", raw, WIDTHS_HINT, ex);
            }
        }
        return parsed;
    }

    public boolean isFixed() {
        return alignmentType == AlignmentType.FIXED;
    }

    public AlignmentConfig withWidths(List<Integer> newWidths) {
        return new AlignmentConfig(newWidths, alignmentType, overflowPolicy, compactOverflowLimit, alignComments,
                alignSettingsSeparately);
    }

    public AlignmentConfig withAlignmentType(AlignmentType newType) {
        return new AlignmentConfig(widths, newType, overflowPolicy, compactOverflowLimit, alignComments,
                alignSettingsSeparately);
    }

    public AlignmentConfig withOverflowPolicy(OverflowPolicy newPolicy) {
        return new AlignmentConfig(widths, alignmentType, newPolicy, compactOverflowLimit, alignComments,
                alignSettingsSeparately);
    }

    public String describeWidths() {
        if (widths.isEmpty()) {
            return String.valueOf(DEFAULT_WIDTH);
        }
        return widths.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
