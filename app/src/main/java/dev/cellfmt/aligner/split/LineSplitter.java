package dev.cellfmt.aligner.split;

import dev.cellfmt.aligner.model.Statement;

/**
 * Restructures statements whose aligned form exceeds the configured
 * {@link dev.cellfmt.aligner.config.FormattingConfig#lineLength() line length}.
 */
public interface LineSplitter {

    /**
     * Whether the splitter puts every argument on its own line; only such splitters are asked to split aligned lines.
     */
    boolean splitsOnEveryArgument();

    Statement split(Statement statement);
}
