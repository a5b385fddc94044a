package dev.cellfmt.aligner.section;

import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.config.Config;
import dev.cellfmt.aligner.model.Document;
import dev.cellfmt.aligner.skip.Disablers;
import dev.cellfmt.aligner.skip.Skip;
import dev.cellfmt.aligner.split.LineSplitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs the enabled section aligners over a document, one after another.
 */
public class SectionAlignmentService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectionAlignmentService.class);
    static final String MDC_ALIGNER = "aligner";

    private final List<SectionAligner> aligners;

    public SectionAlignmentService(List<? extends SectionAligner> aligners) {
        this.aligners = List.copyOf(Objects.requireNonNull(aligners, "aligners"));
    }

    /**
     * Creates the aligners enabled in the configuration, in the order settings, variables, test cases, keywords.
     *
     * @param splitter line splitter cooperating with the keyword call alignment, {@code null} when not used
     */
    public static SectionAlignmentService create(Config config, Disablers disablers, LineSplitter splitter) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(disablers, "disablers");
        Skip skip = new Skip(config.skip());
        List<SectionAligner> aligners = new ArrayList<>();
        if (config.isEnabled(AlignerType.SETTINGS)) {
            aligners.add(new SettingsSectionAligner(config.settings(), config.formatting(), skip, disablers));
        }
        if (config.isEnabled(AlignerType.VARIABLES)) {
            aligners.add(new VariablesSectionAligner(config.variables(), config.formatting(), skip, disablers));
        }
        if (config.isEnabled(AlignerType.TEST_CASES)) {
            aligners.add(new TestCasesSectionAligner(config.alignment(), config.formatting(), skip, disablers,
                    splitter));
        }
        if (config.isEnabled(AlignerType.KEYWORDS)) {
            aligners.add(new KeywordsSectionAligner(config.alignment(), config.formatting(), skip, disablers,
                    splitter));
        }
        return new SectionAlignmentService(aligners);
    }

    public List<SectionAligner> aligners() {
        return aligners;
    }

    public Document align(Document document) {
        Objects.requireNonNull(document, "document");
        Document current = document;
        for (SectionAligner aligner : aligners) {
            MDC.put(MDC_ALIGNER, aligner.name());
            try {
                LOGGER.debug("Running {}", aligner.name());
                current = aligner.align(current);
            } finally {
                MDC.remove(MDC_ALIGNER);
            }
        }
        return current;
    }
}
