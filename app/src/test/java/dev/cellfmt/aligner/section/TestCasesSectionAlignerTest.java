package dev.cellfmt.aligner.section;

import static org.assertj.core.api.Assertions.assertThat;

import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.config.AlignmentConfig;
import dev.cellfmt.aligner.config.AlignmentType;
import dev.cellfmt.aligner.config.FormattingConfig;
import dev.cellfmt.aligner.config.OverflowPolicy;
import dev.cellfmt.aligner.model.Block;
import dev.cellfmt.aligner.model.BlockType;
import dev.cellfmt.aligner.model.Cell;
import dev.cellfmt.aligner.model.Document;
import dev.cellfmt.aligner.model.Node;
import dev.cellfmt.aligner.model.Section;
import dev.cellfmt.aligner.model.SectionType;
import dev.cellfmt.aligner.model.Statement;
import dev.cellfmt.aligner.model.StatementKind;
import dev.cellfmt.aligner.model.TestRows;
import dev.cellfmt.aligner.skip.Disablers;
import dev.cellfmt.aligner.skip.Skip;
import dev.cellfmt.aligner.split.LineSplitter;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TestCasesSectionAlignerTest {

    private final TestRows rows = new TestRows();

    @Test
    void reportsItsFormatterName() {
        TestCasesSectionAligner aligner = aligner(AlignmentConfig.defaults());

        assertThat(aligner.type()).isEqualTo(AlignerType.TEST_CASES);
        assertThat(aligner.name()).isEqualTo("AlignTestCasesSection");
    }

    @Test
    void alignsTestCasesAndTasks() {
        Section tests = section(SectionType.TEST_CASES, "*** Test Cases ***",
                definition("Case", rows.call("    Log  x")));
        Section tasks = section(SectionType.TASKS, "*** Tasks ***",
                definition("Task", rows.call("  Log  y")));
        Document document = new Document(List.of(tests, tasks));

        aligner(AlignmentConfig.defaults()).align(document);

        assertThat(tests.render()).endsWith("    Log" + spaces(21) + "x\n");
        assertThat(tasks.render()).endsWith("    Log" + spaces(21) + "y\n");
    }

    @Test
    void alignsTemplateArgumentsToColumns() {
        Document document = document(section(SectionType.TEST_CASES, "*** Test Cases ***",
                definition("Templated",
                        rows.statement(StatementKind.TEMPLATE, "    [Template]  Check Value"),
                        rows.statement(StatementKind.TEMPLATE_ARGUMENTS, "    a  b  c"))));

        aligner(AlignmentConfig.defaults()).align(document);

        assertThat(document.render()).endsWith("    [Template]" + spaces(14) + "Check Value\n"
                + "    a" + spaces(23) + "b" + spaces(23) + "c\n");
    }

    @Test
    void alignsDocumentationLabelOnly() {
        Document document = document(section(SectionType.TEST_CASES, "*** Test Cases ***",
                definition("Documented",
                        rows.statement(StatementKind.DOCUMENTATION, "  [Documentation]  First  line", "  ...  Second"))));

        aligner(AlignmentConfig.defaults()).align(document);

        assertThat(document.render()).endsWith("    [Documentation]" + spaces(9) + "First  line\n"
                + "    ..." + spaces(21) + "Second\n");
    }

    @Test
    void settingsShareColumnsWithCallsUnlessAlignedSeparately() {
        AlignmentConfig shared = AlignmentConfig.defaults().withAlignmentType(AlignmentType.AUTO);
        AlignmentConfig separate = new AlignmentConfig(List.of(), AlignmentType.AUTO, OverflowPolicy.OVERFLOW, 2,
                false, true);
        Document sharedDocument = document(section(SectionType.TEST_CASES, "*** Test Cases ***",
                definition("Case", rows.statement(StatementKind.TAGS, "    [Tags]  smoke"), rows.call("    Log  x"))));
        Document separateDocument = document(section(SectionType.TEST_CASES, "*** Test Cases ***",
                definition("Case", rows.statement(StatementKind.TAGS, "    [Tags]  smoke"), rows.call("    Log  x"))));

        aligner(shared).align(sharedDocument);
        aligner(separate).align(separateDocument);

        assertThat(sharedDocument.render()).contains("    [Tags]" + spaces(6) + "smoke\n", "    Log" + spaces(9) + "x\n");
        assertThat(separateDocument.render())
                .contains("    [Tags]" + spaces(6) + "smoke\n", "    Log" + spaces(5) + "x\n");
    }

    @Test
    void everySettingKindAlignsFromTheSettingsTable() {
        AlignmentConfig separate = new AlignmentConfig(List.of(), AlignmentType.AUTO, OverflowPolicy.OVERFLOW, 2,
                false, true);
        Document document = document(section(SectionType.TEST_CASES, "*** Test Cases ***",
                definition("Case",
                        rows.statement(StatementKind.SETUP, "    [Setup]  Prepare"),
                        rows.statement(StatementKind.TIMEOUT, "    [Timeout]  1 min"),
                        rows.call("    Log  x"))));

        aligner(separate).align(document);

        assertThat(document.render()).contains(
                "    [Setup]" + spaces(9) + "Prepare\n",
                "    [Timeout]" + spaces(7) + "1 min\n",
                "    Log" + spaces(5) + "x\n");
    }

    @Test
    void splitsTooLongKeywordCalls() {
        SplittingByArgument splitter = new SplittingByArgument();
        TestCasesSectionAligner aligner = new TestCasesSectionAligner(AlignmentConfig.defaults(),
                new FormattingConfig(4, "    ", 40), Skip.none(), Disablers.none(), splitter);
        Document document = document(section(SectionType.TEST_CASES, "*** Test Cases ***",
                definition("Long",
                        rows.call("    Keyword With Long Name    argument_one    argument_two"),
                        rows.statement(StatementKind.TEMPLATE_ARGUMENTS,
                                "    first_template_argument    second_template_argument"))));

        aligner.align(document);

        assertThat(splitter.split).hasSize(1);
        assertThat(document.render()).contains("    Keyword With Long Name\n"
                + "    ..." + spaces(21) + "argument_one\n"
                + "    ..." + spaces(21) + "argument_two\n");
        assertThat(document.render())
                .contains("    first_template_argument" + spaces(25) + "second_template_argument\n");
    }

    private Document document(Section... sections) {
        return new Document(List.of(sections));
    }

    private Section section(SectionType type, String header, Node... body) {
        return new Section(type, rows.sectionHeader(header), List.of(body));
    }

    private Block definition(String name, Node... body) {
        return new Block(BlockType.TEST_CASE, rows.name(name), List.of(body));
    }

    private static TestCasesSectionAligner aligner(AlignmentConfig config) {
        return new TestCasesSectionAligner(config, FormattingConfig.defaults(), Skip.none(), Disablers.none(), null);
    }

    private static String spaces(int count) {
        return " ".repeat(count);
    }

    private static final class SplittingByArgument implements LineSplitter {

        private final List<Statement> split = new ArrayList<>();

        @Override
        public boolean splitsOnEveryArgument() {
            return true;
        }

        @Override
        public Statement split(Statement statement) {
            split.add(statement);
            List<Cell> data = statement.dataCells();
            String[] lines = new String[data.size()];
            lines[0] = "    " + data.get(0).text();
            for (int index = 1; index < data.size(); index++) {
                lines[index] = "    ...    " + data.get(index).text();
            }
            return new TestRows().statement(StatementKind.KEYWORD_CALL, lines);
        }
    }
}
