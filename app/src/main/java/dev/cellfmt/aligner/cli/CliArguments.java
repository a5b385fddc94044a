package dev.cellfmt.aligner.cli;

import dev.cellfmt.aligner.config.AlignmentType;
import dev.cellfmt.aligner.config.LogFormat;
import dev.cellfmt.aligner.config.OverflowPolicy;
import picocli.CommandLine;

@CommandLine.Command(name = "column-aligner", mixinStandardHelpOptions = true, description = "Aligns test data cells into columns")
public class CliArguments {

    @CommandLine.Option(names = "--widths", description = "Comma separated column widths, 0 for uncapped columns", paramLabel = "WIDTHS")
    private String widths;

    @CommandLine.Option(names = "--alignment-type", description = "Alignment type: fixed or auto", converter = AlignmentTypeConverter.class)
    private AlignmentType alignmentType;

    @CommandLine.Option(names = "--handle-too-long", description = "Overflow handling: overflow, compact_overflow, ignore_line or ignore_rest", converter = OverflowPolicyConverter.class)
    private OverflowPolicy handleTooLong;

    @CommandLine.Option(names = "--compact-overflow-limit", description = "Misaligned columns tolerated by compact_overflow", paramLabel = "COUNT")
    private Integer compactOverflowLimit;

    @CommandLine.Option(names = "--align-comments", description = "Align comments together with the other cells")
    private boolean alignComments;

    @CommandLine.Option(names = "--align-settings-separately", description = "Measure settings in their own width table")
    private boolean alignSettingsSeparately;

    @CommandLine.Option(names = "--space-count", description = "Minimal separator width", paramLabel = "COUNT")
    private Integer spaceCount;

    @CommandLine.Option(names = "--indent", description = "Indentation width in spaces", paramLabel = "COUNT")
    private Integer indent;

    @CommandLine.Option(names = "--line-length", description = "Maximum line length used when splitting lines", paramLabel = "LENGTH")
    private Integer lineLength;

    @CommandLine.Option(names = "--skip", description = "Comma separated statement kinds to leave untouched", paramLabel = "KINDS")
    private String skip;

    @CommandLine.Option(names = "--skip-keyword-call", description = "Comma separated keyword names to leave untouched", paramLabel = "NAMES")
    private String skipKeywordCall;

    @CommandLine.Option(names = "--skip-keyword-call-pattern", description = "Comma separated keyword name patterns to leave untouched", paramLabel = "PATTERNS")
    private String skipKeywordCallPattern;

    @CommandLine.Option(names = "--skip-sections", description = "Comma separated section names to leave untouched", paramLabel = "SECTIONS")
    private String skipSections;

    @CommandLine.Option(names = "--variables-up-to-column", description = "Columns aligned in the variables section", paramLabel = "COUNT")
    private Integer variablesUpToColumn;

    @CommandLine.Option(names = "--variables-min-width", description = "Minimal column width in the variables section", paramLabel = "WIDTH")
    private Integer variablesMinWidth;

    @CommandLine.Option(names = "--variables-fixed-width", description = "Fixed column width in the variables section", paramLabel = "WIDTH")
    private Integer variablesFixedWidth;

    @CommandLine.Option(names = "--variables-skip-types", description = "Comma separated variable types to leave untouched: dict, list, scalar", paramLabel = "TYPES")
    private String variablesSkipTypes;

    @CommandLine.Option(names = "--settings-up-to-column", description = "Columns aligned in the settings section", paramLabel = "COUNT")
    private Integer settingsUpToColumn;

    @CommandLine.Option(names = "--settings-argument-indent", description = "Indentation of continued setting arguments", paramLabel = "COUNT")
    private Integer settingsArgumentIndent;

    @CommandLine.Option(names = "--settings-min-width", description = "Minimal column width in the settings section", paramLabel = "WIDTH")
    private Integer settingsMinWidth;

    @CommandLine.Option(names = "--settings-fixed-width", description = "Fixed column width in the settings section", paramLabel = "WIDTH")
    private Integer settingsFixedWidth;

    @CommandLine.Option(names = "--select", description = "Comma separated aligners to run", paramLabel = "ALIGNERS")
    private String select;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = "--verbose", description = "Log alignment decisions at debug level")
    private boolean verbose;

    public String widths() {
        return widths;
    }

    public AlignmentType alignmentType() {
        return alignmentType;
    }

    public OverflowPolicy handleTooLong() {
        return handleTooLong;
    }

    public Integer compactOverflowLimit() {
        return compactOverflowLimit;
    }

    public boolean alignComments() {
        return alignComments;
    }

    public boolean alignSettingsSeparately() {
        return alignSettingsSeparately;
    }

    public Integer spaceCount() {
        return spaceCount;
    }

    public Integer indent() {
        return indent;
    }

    public Integer lineLength() {
        return lineLength;
    }

    public String skip() {
        return skip;
    }

    public String skipKeywordCall() {
        return skipKeywordCall;
    }

    public String skipKeywordCallPattern() {
        return skipKeywordCallPattern;
    }

    public String skipSections() {
        return skipSections;
    }

    public Integer variablesUpToColumn() {
        return variablesUpToColumn;
    }

    public Integer variablesMinWidth() {
        return variablesMinWidth;
    }

    public Integer variablesFixedWidth() {
        return variablesFixedWidth;
    }

    public String variablesSkipTypes() {
        return variablesSkipTypes;
    }

    public Integer settingsUpToColumn() {
        return settingsUpToColumn;
    }

    public Integer settingsArgumentIndent() {
        return settingsArgumentIndent;
    }

    public Integer settingsMinWidth() {
        return settingsMinWidth;
    }

    public Integer settingsFixedWidth() {
        return settingsFixedWidth;
    }

    public String select() {
        return select;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
