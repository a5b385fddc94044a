package dev.cellfmt.aligner.section;

import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.config.AlignmentConfig;
import dev.cellfmt.aligner.config.FormattingConfig;
import dev.cellfmt.aligner.model.SectionType;
import dev.cellfmt.aligner.skip.Disablers;
import dev.cellfmt.aligner.skip.Skip;
import dev.cellfmt.aligner.split.LineSplitter;
import java.util.Set;

/**
 * Aligns the keywords section; every keyword definition is a scope.
 */
public class KeywordsSectionAligner extends ScopedSectionAligner {

    public KeywordsSectionAligner(AlignmentConfig config, FormattingConfig formatting, Skip skip,
                                  Disablers disablers, LineSplitter splitter) {
        super(AlignerType.KEYWORDS, Set.of(SectionType.KEYWORDS), config, formatting, skip, disablers, splitter);
    }
}
