package dev.cellfmt.aligner.config;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record Config(
        AlignmentConfig alignment,
        FormattingConfig formatting,
        SkipConfig skip,
        VariablesAlignmentConfig variables,
        SettingsAlignmentConfig settings,
        Set<AlignerType> aligners,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(alignment, "alignment");
        Objects.requireNonNull(formatting, "formatting");
        skip = skip == null ? SkipConfig.empty() : skip;
        variables = variables == null ? VariablesAlignmentConfig.defaults() : variables;
        settings = settings == null ? SettingsAlignmentConfig.defaults() : settings;
        aligners = aligners == null || aligners.isEmpty() ? AlignerType.all() : EnumSet.copyOf(aligners);
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    public static Config defaults() {
        return new Config(AlignmentConfig.defaults(), FormattingConfig.defaults(), SkipConfig.empty(),
                VariablesAlignmentConfig.defaults(), SettingsAlignmentConfig.defaults(), AlignerType.all(),
                LogFormat.TEXT, false);
    }

    public boolean isEnabled(AlignerType type) {
        return aligners.contains(type);
    }
}
