package dev.cellfmt.aligner.config;

import dev.cellfmt.aligner.cli.CliArguments;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_ALIGN_WIDTHS = "ALIGN_WIDTHS";
    static final String ENV_ALIGNMENT_TYPE = "ALIGNMENT_TYPE";
    static final String ENV_HANDLE_TOO_LONG = "HANDLE_TOO_LONG";
    static final String ENV_COMPACT_OVERFLOW_LIMIT = "COMPACT_OVERFLOW_LIMIT";
    static final String ENV_ALIGN_COMMENTS = "ALIGN_COMMENTS";
    static final String ENV_ALIGN_SETTINGS_SEPARATELY = "ALIGN_SETTINGS_SEPARATELY";
    static final String ENV_SPACE_COUNT = "SPACE_COUNT";
    static final String ENV_INDENT = "INDENT";
    static final String ENV_LINE_LENGTH = "LINE_LENGTH";
    static final String ENV_SKIP = "SKIP";
    static final String ENV_SKIP_KEYWORD_CALL = "SKIP_KEYWORD_CALL";
    static final String ENV_SKIP_KEYWORD_CALL_PATTERN = "SKIP_KEYWORD_CALL_PATTERN";
    static final String ENV_SKIP_SECTIONS = "SKIP_SECTIONS";
    static final String ENV_VARIABLES_UP_TO_COLUMN = "VARIABLES_UP_TO_COLUMN";
    static final String ENV_VARIABLES_MIN_WIDTH = "VARIABLES_MIN_WIDTH";
    static final String ENV_VARIABLES_FIXED_WIDTH = "VARIABLES_FIXED_WIDTH";
    static final String ENV_VARIABLES_SKIP_TYPES = "VARIABLES_SKIP_TYPES";
    static final String ENV_SETTINGS_UP_TO_COLUMN = "SETTINGS_UP_TO_COLUMN";
    static final String ENV_SETTINGS_ARGUMENT_INDENT = "SETTINGS_ARGUMENT_INDENT";
    static final String ENV_SETTINGS_MIN_WIDTH = "SETTINGS_MIN_WIDTH";
    static final String ENV_SETTINGS_FIXED_WIDTH = "SETTINGS_FIXED_WIDTH";
    static final String ENV_SELECT = "SELECT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_VERBOSE = "VERBOSE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        AlignmentConfig alignment = AlignmentConfig.parse(
                firstNonBlank(arguments.widths(), ENV_ALIGN_WIDTHS, ""),
                resolveAlignmentType(arguments),
                resolveOverflowPolicy(arguments),
                resolveInteger(arguments.compactOverflowLimit(), ENV_COMPACT_OVERFLOW_LIMIT, "compact_overflow_limit")
                        .orElse(AlignmentConfig.DEFAULT_COMPACT_OVERFLOW_LIMIT),
                resolveFlag(arguments.alignComments(), ENV_ALIGN_COMMENTS),
                resolveFlag(arguments.alignSettingsSeparately(), ENV_ALIGN_SETTINGS_SEPARATELY));

        int spaceCount = resolveInteger(arguments.spaceCount(), ENV_SPACE_COUNT, "space_count")
                .orElse(FormattingConfig.DEFAULT_SPACE_COUNT);
        int indentWidth = resolveInteger(arguments.indent(), ENV_INDENT, "indent").orElse(spaceCount);
        int lineLength = resolveInteger(arguments.lineLength(), ENV_LINE_LENGTH, "line_length")
                .orElse(FormattingConfig.DEFAULT_LINE_LENGTH);
        FormattingConfig formatting = FormattingConfig.withIndentWidth(spaceCount, indentWidth, lineLength);

        SkipConfig skip = SkipConfig.parse(
                firstNonBlank(arguments.skip(), ENV_SKIP, null),
                firstNonBlank(arguments.skipKeywordCall(), ENV_SKIP_KEYWORD_CALL, null),
                firstNonBlank(arguments.skipKeywordCallPattern(), ENV_SKIP_KEYWORD_CALL_PATTERN, null),
                firstNonBlank(arguments.skipSections(), ENV_SKIP_SECTIONS, null));

        VariablesAlignmentConfig variables = new VariablesAlignmentConfig(
                resolveInteger(arguments.variablesUpToColumn(), ENV_VARIABLES_UP_TO_COLUMN, "up_to_column")
                        .orElse(VariablesAlignmentConfig.DEFAULT_UP_TO_COLUMN),
                toOptionalInt(resolveInteger(arguments.variablesMinWidth(), ENV_VARIABLES_MIN_WIDTH, "min_width")),
                toOptionalInt(resolveInteger(arguments.variablesFixedWidth(), ENV_VARIABLES_FIXED_WIDTH, "fixed_width")),
                VariablesAlignmentConfig.parseSkipTypes(
                        firstNonBlank(arguments.variablesSkipTypes(), ENV_VARIABLES_SKIP_TYPES, null)));

        SettingsAlignmentConfig settings = new SettingsAlignmentConfig(
                resolveInteger(arguments.settingsUpToColumn(), ENV_SETTINGS_UP_TO_COLUMN, "up_to_column")
                        .orElse(SettingsAlignmentConfig.DEFAULT_UP_TO_COLUMN),
                resolveInteger(arguments.settingsArgumentIndent(), ENV_SETTINGS_ARGUMENT_INDENT, "argument_indent")
                        .orElse(SettingsAlignmentConfig.DEFAULT_ARGUMENT_INDENT),
                toOptionalInt(resolveInteger(arguments.settingsMinWidth(), ENV_SETTINGS_MIN_WIDTH, "min_width")),
                toOptionalInt(resolveInteger(arguments.settingsFixedWidth(), ENV_SETTINGS_FIXED_WIDTH, "fixed_width")));

        Set<AlignerType> aligners = parseAligners(firstNonBlank(arguments.select(), ENV_SELECT, null));

        return new Config(alignment, formatting, skip, variables, settings, aligners, resolveLogFormat(arguments),
                resolveFlag(arguments.verbose(), ENV_VERBOSE));
    }

    private String resolveAlignmentType(CliArguments arguments) {
        AlignmentType cliType = arguments.alignmentType();
        if (cliType != null) {
            return cliType.name();
        }
        return environmentReader.get(ENV_ALIGNMENT_TYPE).filter(ConfigLoader::isNotBlank).orElse(null);
    }

    private String resolveOverflowPolicy(CliArguments arguments) {
        OverflowPolicy cliPolicy = arguments.handleTooLong();
        if (cliPolicy != null) {
            return cliPolicy.name();
        }
        return environmentReader.get(ENV_HANDLE_TOO_LONG).filter(ConfigLoader::isNotBlank).orElse(null);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(boolean cliValue, String envKey) {
        if (cliValue) {
            return true;
        }
        return environmentReader.get(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private Optional<Integer> resolveInteger(Integer cliValue, String envKey, String parameter) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseInteger(value, parameter));
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static Set<AlignerType> parseAligners(String raw) {
        if (raw == null) {
            return AlignerType.all();
        }
        Set<AlignerType> aligners = EnumSet.noneOf(AlignerType.class);
        Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(AlignerType::from)
                .forEach(aligners::add);
        return aligners.isEmpty() ? AlignerType.all() : aligners;
    }

    private static int parseInteger(String raw, String parameter) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new InvalidParameterValueException(parameter, raw, "The value should be an integer.", ex);
        }
    }

    private static OptionalInt toOptionalInt(Optional<Integer> value) {
        return value.map(OptionalInt::of).orElse(OptionalInt.empty());
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
