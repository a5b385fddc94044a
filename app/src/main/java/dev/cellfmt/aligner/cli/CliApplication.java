package dev.cellfmt.aligner.cli;

import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.config.AlignmentConfig;
import dev.cellfmt.aligner.config.Config;
import dev.cellfmt.aligner.config.ConfigLoader;
import dev.cellfmt.aligner.config.FormattingConfig;
import dev.cellfmt.aligner.config.InvalidParameterValueException;
import dev.cellfmt.aligner.config.SettingsAlignmentConfig;
import dev.cellfmt.aligner.config.SkipConfig;
import dev.cellfmt.aligner.config.SystemEnvironmentReader;
import dev.cellfmt.aligner.config.VariablesAlignmentConfig;
import dev.cellfmt.aligner.logging.LoggingConfigurator;
import dev.cellfmt.aligner.section.SectionAligner;
import dev.cellfmt.aligner.section.SectionAlignmentService;
import dev.cellfmt.aligner.skip.Disablers;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser and configuration loader. Validates the alignment settings and
 * prints them in resolved form.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    private final ConfigLoader configLoader;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()),
                new PrintWriter(System.out, true),
                new PrintWriter(System.err, true));
    }

    CliApplication(ConfigLoader configLoader, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (InvalidParameterValueException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());

        SectionAlignmentService service = SectionAlignmentService.create(config, Disablers.none(), null);
        LOGGER.info("Configured aligners: {}", service.aligners().stream()
                .map(SectionAligner::name)
                .collect(Collectors.joining(", ")));
        describe(config).forEach(commandLine.getOut()::println);
        commandLine.getOut().flush();
        return 0;
    }

    static List<String> describe(Config config) {
        AlignmentConfig alignment = config.alignment();
        FormattingConfig formatting = config.formatting();
        SkipConfig skip = config.skip();
        VariablesAlignmentConfig variables = config.variables();
        SettingsAlignmentConfig settings = config.settings();
        List<String> lines = new ArrayList<>();
        lines.add("aligners=" + config.aligners().stream()
                .map(AlignerType::formatterName)
                .collect(Collectors.joining(",")));
        lines.add("widths=" + alignment.describeWidths());
        lines.add("alignment_type=" + alignment.alignmentType().name().toLowerCase(Locale.ROOT));
        lines.add("handle_too_long=" + alignment.overflowPolicy().configName());
        lines.add("compact_overflow_limit=" + alignment.compactOverflowLimit());
        lines.add("align_comments=" + alignment.alignComments());
        lines.add("align_settings_separately=" + alignment.alignSettingsSeparately());
        lines.add("space_count=" + formatting.spaceCount());
        lines.add("indent=" + formatting.indent().length());
        lines.add("line_length=" + formatting.lineLength());
        lines.add("skip=" + joinSorted(skip.options()));
        lines.add("skip_keyword_call=" + joinSorted(skip.keywordCalls()));
        lines.add("skip_keyword_call_pattern=" + joinSorted(skip.keywordCallPatterns()));
        lines.add("skip_sections=" + joinSorted(skip.sections()));
        lines.add("variables.up_to_column=" + variables.upToColumn());
        lines.add("variables.min_width=" + describe(variables.minWidth()));
        lines.add("variables.fixed_width=" + describe(variables.fixedWidth()));
        lines.add("variables.skip_types=" + variables.skipTypes().stream()
                .map(type -> type.name().toLowerCase(Locale.ROOT))
                .sorted()
                .collect(Collectors.joining(",")));
        lines.add("settings.up_to_column=" + settings.upToColumn());
        lines.add("settings.argument_indent=" + settings.argumentIndent());
        lines.add("settings.min_width=" + describe(settings.minWidth()));
        lines.add("settings.fixed_width=" + describe(settings.fixedWidth()));
        return lines;
    }

    private static String describe(OptionalInt value) {
        return value.isPresent() ? String.valueOf(value.getAsInt()) : "";
    }

    private static String joinSorted(Set<String> values) {
        return values.stream().sorted().collect(Collectors.joining(","));
    }
}
