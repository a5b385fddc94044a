package dev.cellfmt.aligner.skip;

import dev.cellfmt.aligner.config.InvalidParameterValueException;
import dev.cellfmt.aligner.config.SkipConfig;
import dev.cellfmt.aligner.model.CellType;
import dev.cellfmt.aligner.model.Line;
import dev.cellfmt.aligner.model.Statement;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Answers whether a statement, setting or section is excluded from formatting.
 */
public final class Skip {

    private static final Set<String> SETTING_OPTIONS = Set.of("settings", "arguments", "setup", "teardown", "timeout",
            "template", "return_statement", "tags");

    private final boolean documentation;
    private final boolean returnValues;
    private final boolean comments;
    private final boolean blockComments;
    private final Set<String> keywordCallNames;
    private final List<Pattern> keywordCallPatterns;
    private final Set<String> skippedSettings;
    private final Set<String> sections;

    public Skip(SkipConfig config) {
        Objects.requireNonNull(config, "config");
        this.documentation = config.has("documentation");
        this.returnValues = config.has("return_values");
        this.comments = config.has("comments");
        this.blockComments = config.has("block_comments");
        this.keywordCallNames = config.keywordCalls().stream()
                .map(Skip::normalizeName)
                .collect(Collectors.toUnmodifiableSet());
        this.keywordCallPatterns = config.keywordCallPatterns().stream()
                .map(Skip::compile)
                .collect(Collectors.toUnmodifiableList());
        this.skippedSettings = config.options().stream()
                .filter(SETTING_OPTIONS::contains)
                .collect(Collectors.toUnmodifiableSet());
        this.sections = Set.copyOf(config.sections());
    }

    public static Skip none() {
        return new Skip(SkipConfig.empty());
    }

    public boolean documentation() {
        return documentation;
    }

    public boolean returnValues() {
        return returnValues;
    }

    public boolean keywordCall(Statement statement) {
        if (keywordCallNames.isEmpty() && keywordCallPatterns.isEmpty()) {
            return false;
        }
        Optional<String> keyword = statement.keywordName().filter(name -> !name.isEmpty());
        if (keyword.isEmpty()) {
            return false;
        }
        if (keywordCallNames.contains(normalizeName(keyword.get()))) {
            return true;
        }
        return keywordCallPatterns.stream().anyMatch(pattern -> pattern.matcher(keyword.get()).find());
    }

    /**
     * @param name setting name such as {@code Tags} or {@code Return_Statement}
     */
    public boolean setting(String name) {
        if (skippedSettings.isEmpty() || name == null) {
            return false;
        }
        if (skippedSettings.contains("settings")) {
            return true;
        }
        return skippedSettings.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * Block comments are comment statements starting at the very beginning of the line.
     */
    public boolean comment(Statement statement) {
        if (comments) {
            return true;
        }
        if (!blockComments) {
            return false;
        }
        List<Line> lines = statement.lines();
        return !lines.isEmpty() && !lines.get(0).cells().isEmpty() && lines.get(0).cells().get(0).is(CellType.COMMENT);
    }

    public boolean section(String name) {
        return sections.contains(name);
    }

    static String normalizeName(String name) {
        return name.toLowerCase(Locale.ROOT).replace("_", "").replace(" ", "");
    }

    private static Pattern compile(String pattern) {
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException ex) {
            throw new InvalidParameterValueException("skip_keyword_call_pattern", pattern,
                    "'" + pattern + "' is not a valid regular expression.", ex);
        }
    }
}
