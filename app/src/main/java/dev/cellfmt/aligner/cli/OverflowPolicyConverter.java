package dev.cellfmt.aligner.cli;

import dev.cellfmt.aligner.config.OverflowPolicy;
import picocli.CommandLine;

/**
 * Parses overflow handling CLI options.
 */
public class OverflowPolicyConverter implements CommandLine.ITypeConverter<OverflowPolicy> {
    @Override
    public OverflowPolicy convert(String value) {
        return OverflowPolicy.from(value);
    }
}
