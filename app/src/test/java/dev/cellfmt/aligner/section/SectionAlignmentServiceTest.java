package dev.cellfmt.aligner.section;

import static org.assertj.core.api.Assertions.assertThat;

import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.config.Config;
import dev.cellfmt.aligner.config.LogFormat;
import dev.cellfmt.aligner.model.Block;
import dev.cellfmt.aligner.model.BlockType;
import dev.cellfmt.aligner.model.Document;
import dev.cellfmt.aligner.model.Section;
import dev.cellfmt.aligner.model.SectionType;
import dev.cellfmt.aligner.model.StatementKind;
import dev.cellfmt.aligner.model.TestRows;
import dev.cellfmt.aligner.skip.Disablers;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class SectionAlignmentServiceTest {

    private final TestRows rows = new TestRows();

    @Test
    void createsEnabledAlignersInOrder() {
        SectionAlignmentService service = SectionAlignmentService.create(Config.defaults(), Disablers.none(), null);

        assertThat(service.aligners()).extracting(SectionAligner::type)
                .containsExactly(AlignerType.SETTINGS, AlignerType.VARIABLES, AlignerType.TEST_CASES,
                        AlignerType.KEYWORDS);
    }

    @Test
    void createsOnlySelectedAligners() {
        Config defaults = Config.defaults();
        Config config = new Config(defaults.alignment(), defaults.formatting(), defaults.skip(), defaults.variables(),
                defaults.settings(), EnumSet.of(AlignerType.KEYWORDS), LogFormat.TEXT, false);

        SectionAlignmentService service = SectionAlignmentService.create(config, Disablers.none(), null);

        assertThat(service.aligners()).extracting(SectionAligner::type).containsExactly(AlignerType.KEYWORDS);
    }

    @Test
    void runsAlignersWithTheirNameInDiagnosticContext() {
        List<String> seen = new ArrayList<>();
        SectionAligner first = new RecordingAligner(AlignerType.VARIABLES, seen);
        SectionAligner second = new RecordingAligner(AlignerType.KEYWORDS, seen);
        Document document = new Document(List.of());

        Document result = new SectionAlignmentService(List.of(first, second)).align(document);

        assertThat(result).isSameAs(document);
        assertThat(seen).containsExactly("AlignVariablesSection", "AlignKeywordsSection");
        assertThat(MDC.get(SectionAlignmentService.MDC_ALIGNER)).isNull();
    }

    @Test
    void alignsEverySectionOfADocument() {
        Section settings = new Section(SectionType.SETTINGS, rows.sectionHeader("*** Settings ***"),
                List.of(rows.statement(StatementKind.LIBRARY, "Library  Collections")));
        Section variables = new Section(SectionType.VARIABLES, rows.sectionHeader("*** Variables ***"),
                List.of(rows.statement(StatementKind.VARIABLE, "${A}  1")));
        Section tests = new Section(SectionType.TEST_CASES, rows.sectionHeader("*** Test Cases ***"),
                List.of(new Block(BlockType.TEST_CASE, rows.name("Case"), List.of(rows.call("  Log  x")))));
        Section keywords = new Section(SectionType.KEYWORDS, rows.sectionHeader("*** Keywords ***"),
                List.of(new Block(BlockType.KEYWORD, rows.name("Kw"), List.of(rows.call("  Log  y")))));
        Document document = new Document(List.of(settings, variables, tests, keywords));

        SectionAlignmentService.create(Config.defaults(), Disablers.none(), null).align(document);

        assertThat(document.render()).isEqualTo("*** Settings ***\n"
                + "Library" + " ".repeat(5) + "Collections\n"
                + "*** Variables ***\n"
                + "${A}    1\n"
                + "*** Test Cases ***\n"
                + "Case\n"
                + "    Log" + " ".repeat(21) + "x\n"
                + "*** Keywords ***\n"
                + "Kw\n"
                + "    Log" + " ".repeat(21) + "y\n");
    }

    private static final class RecordingAligner implements SectionAligner {

        private final AlignerType type;
        private final List<String> seen;

        RecordingAligner(AlignerType type, List<String> seen) {
            this.type = type;
            this.seen = seen;
        }

        @Override
        public AlignerType type() {
            return type;
        }

        @Override
        public Document align(Document document) {
            seen.add(MDC.get(SectionAlignmentService.MDC_ALIGNER));
            return document;
        }
    }
}
