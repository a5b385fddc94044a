package dev.cellfmt.aligner.config;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Raw skip configuration: which statement kinds, keyword calls and sections must be left untouched.
 */
public record SkipConfig(
        Set<String> options,
        Set<String> keywordCalls,
        Set<String> keywordCallPatterns,
        Set<String> sections
) {

    public static final Set<String> SUPPORTED_OPTIONS = Set.of("documentation", "return_values", "settings",
            "arguments", "setup", "teardown", "timeout", "template", "return_statement", "tags", "comments",
            "block_comments");

    public SkipConfig {
        options = options == null ? Set.of() : normalizeOptions(options);
        keywordCalls = keywordCalls == null ? Set.of() : Set.copyOf(keywordCalls);
        keywordCallPatterns = keywordCallPatterns == null ? Set.of() : Set.copyOf(keywordCallPatterns);
        sections = sections == null ? Set.of() : Set.copyOf(sections);
    }

    public static SkipConfig empty() {
        return new SkipConfig(Set.of(), Set.of(), Set.of(), Set.of());
    }

    public static SkipConfig parse(String options, String keywordCalls, String keywordCallPatterns, String sections) {
        return new SkipConfig(splitList(options), splitList(keywordCalls), splitList(keywordCallPatterns),
                splitList(sections));
    }

    public boolean has(String option) {
        return options.contains(option);
    }

    private static Set<String> normalizeOptions(Set<String> raw) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String option : raw) {
            String value = option.trim().toLowerCase(Locale.ROOT);
            if (value.startsWith("skip_")) {
                value = value.substring("skip_".length());
            }
            if (!SUPPORTED_OPTIONS.contains(value)) {
                throw new InvalidParameterValueException("skip", option,
                        "Supported values: " + String.join(", ", SUPPORTED_OPTIONS.stream().sorted().toList()) + ".");
            }
            normalized.add(value);
        }
        return Set.copyOf(normalized);
    }

    private static Set<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
