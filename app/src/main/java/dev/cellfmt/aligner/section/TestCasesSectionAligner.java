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
 * Aligns test case and task sections; every test or task definition is a scope.
 */
public class TestCasesSectionAligner extends ScopedSectionAligner {

    public TestCasesSectionAligner(AlignmentConfig config, FormattingConfig formatting, Skip skip,
                                   Disablers disablers, LineSplitter splitter) {
        super(AlignerType.TEST_CASES, Set.of(SectionType.TEST_CASES, SectionType.TASKS), config, formatting, skip,
                disablers, splitter);
    }
}
