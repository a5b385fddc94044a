package dev.cellfmt.aligner.section;

import static org.assertj.core.api.Assertions.assertThat;

import dev.cellfmt.aligner.config.AlignmentConfig;
import dev.cellfmt.aligner.config.AlignmentType;
import dev.cellfmt.aligner.config.FormattingConfig;
import dev.cellfmt.aligner.config.SkipConfig;
import dev.cellfmt.aligner.model.Block;
import dev.cellfmt.aligner.model.BlockType;
import dev.cellfmt.aligner.model.Document;
import dev.cellfmt.aligner.model.Node;
import dev.cellfmt.aligner.model.Section;
import dev.cellfmt.aligner.model.SectionType;
import dev.cellfmt.aligner.model.Statement;
import dev.cellfmt.aligner.model.StatementKind;
import dev.cellfmt.aligner.model.TestRows;
import dev.cellfmt.aligner.skip.Disablers;
import dev.cellfmt.aligner.skip.LineRangeDisablers;
import dev.cellfmt.aligner.skip.Skip;
import java.util.List;
import org.junit.jupiter.api.Test;

class KeywordsSectionAlignerTest {

    private final TestRows rows = new TestRows();

    @Test
    void alignsKeywordBodyToFixedColumns() {
        Document document = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("My Keyword",
                        rows.call("  Log  hello    world"),
                        rows.call("    ${x}=    Set Variable  1")));

        aligner(AlignmentConfig.defaults()).align(document);

        assertThat(document.render()).isEqualTo("*** Keywords ***\n"
                + "My Keyword\n"
                + "    Log" + spaces(21) + "hello" + spaces(19) + "world\n"
                + "    ${x}=" + spaces(19) + "Set Variable" + spaces(12) + "1\n");
    }

    @Test
    void measuresEveryBlockAsItsOwnScope() {
        Statement header = rows.sectionHeader("*** Keywords ***");
        Statement name = rows.name("My Keyword");
        Statement log = rows.call("    Log    x");
        Statement extended = rows.call("    ExtendedLog    y");
        Statement forHeader = rows.statement(StatementKind.FOR_HEADER, "  FOR    ${i}    IN RANGE    3");
        Statement inner = rows.call("    VeryLongKeywordName    ${i}");
        Statement end = rows.statement(StatementKind.END, "END");
        Block loop = new Block(BlockType.FOR, forHeader, List.of(inner), end);
        Document document = keywords(header, new Block(BlockType.KEYWORD, name, List.of(log, extended, loop)));

        aligner(auto()).align(document);

        assertThat(document.render()).isEqualTo("*** Keywords ***\n"
                + "My Keyword\n"
                + "    Log" + spaces(13) + "x\n"
                + "    ExtendedLog" + spaces(5) + "y\n"
                + "    FOR    ${i}    IN RANGE    3\n"
                + "        VeryLongKeywordName" + spaces(5) + "${i}\n"
                + "    END\n");
    }

    @Test
    void autoAlignmentMatchesFixedAlignmentWithMeasuredWidths() {
        Document measured = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("Measured", rows.call("    Log    x    y"), rows.call("    ExtendedLog    y")));
        TestRows otherRows = new TestRows();
        Document configured = new Document(List.of(new Section(SectionType.KEYWORDS,
                otherRows.sectionHeader("*** Keywords ***"),
                List.of(new Block(BlockType.KEYWORD, otherRows.name("Measured"),
                        List.of(otherRows.call("    Log    x    y"), otherRows.call("    ExtendedLog    y")))))));

        aligner(auto()).align(measured);
        aligner(AlignmentConfig.defaults().withWidths(List.of(16, 8))).align(configured);

        assertThat(measured.render()).isEqualTo(configured.render());
        assertThat(measured.render()).contains("    Log" + spaces(13) + "x" + spaces(7) + "y\n");
    }

    @Test
    void keywordsAreMeasuredIndependently() {
        Document document = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("First", rows.call("    Log    x")),
                keyword("Second", rows.call("    ExtendedLog    x")));

        aligner(auto()).align(document);

        assertThat(document.render()).isEqualTo("*** Keywords ***\n"
                + "First\n"
                + "    Log" + spaces(5) + "x\n"
                + "Second\n"
                + "    ExtendedLog" + spaces(5) + "x\n");
    }

    @Test
    void alignsConditionalBranchesAndReindentsMarkers() {
        Statement header = rows.sectionHeader("*** Keywords ***");
        Statement name = rows.name("Branching");
        Statement ifHeader = rows.statement(StatementKind.IF_HEADER, "  IF    $flag");
        Statement ifBody = rows.call("  Log  yes");
        Statement elseHeader = rows.statement(StatementKind.ELSE_HEADER, "ELSE");
        Statement elseBody = rows.call("            Log    no");
        Statement end = rows.statement(StatementKind.END, "      END");
        Block branches = new Block(BlockType.IF, ifHeader, List.of(ifBody), end)
                .withNext(new Block(BlockType.ELSE, elseHeader, List.of(elseBody)));
        Document document = keywords(header, new Block(BlockType.KEYWORD, name, List.of(branches)));

        aligner(AlignmentConfig.defaults()).align(document);

        assertThat(document.render()).isEqualTo("*** Keywords ***\n"
                + "Branching\n"
                + "    IF    $flag\n"
                + "        Log" + spaces(21) + "yes\n"
                + "    ELSE\n"
                + "        Log" + spaces(21) + "no\n"
                + "    END\n");
    }

    @Test
    void leavesInlineConditionalsUntouched() {
        Statement inline = rows.statement(StatementKind.INLINE_IF_HEADER, "    IF    $flag    Log  yes");
        Document document = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("Inline", new Block(BlockType.IF, inline, List.of())));
        String before = document.render();

        aligner(AlignmentConfig.defaults()).align(document);

        assertThat(document.render()).isEqualTo(before);
    }

    @Test
    void leavesStatementsWithErrorsUntouched() {
        Statement broken = rows.statementWithErrors(StatementKind.KEYWORD_CALL, List.of("Invalid syntax"),
                "    Log  x");
        Document document = keywords(rows.sectionHeader("*** Keywords ***"), keyword("Broken", broken));

        aligner(AlignmentConfig.defaults()).align(document);

        assertThat(document.render()).endsWith("    Log  x\n");
    }

    @Test
    void skipsConfiguredKeywordCallsAndSettings() {
        Skip skip = new Skip(SkipConfig.parse("tags", "Should Be Equal", null, null));
        KeywordsSectionAligner aligner = new KeywordsSectionAligner(AlignmentConfig.defaults(),
                FormattingConfig.defaults(), skip, Disablers.none(), null);
        Document document = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("Skipping",
                        rows.statement(StatementKind.TAGS, "    [Tags]  smoke"),
                        rows.statement(StatementKind.ARGUMENTS, "    [Arguments]  ${a}"),
                        rows.call("    Should Be Equal  ${a}  1"),
                        rows.call("    Log  ${a}")));

        aligner.align(document);

        assertThat(document.render()).isEqualTo("*** Keywords ***\n"
                + "Skipping\n"
                + "    [Tags]  smoke\n"
                + "    [Arguments]" + spaces(13) + "${a}\n"
                + "    Should Be Equal  ${a}  1\n"
                + "    Log" + spaces(21) + "${a}\n");
    }

    @Test
    void keepsReturnValueSpacingWhenSkipped() {
        Skip skip = new Skip(SkipConfig.parse("return_values", null, null, null));
        KeywordsSectionAligner aligner = new KeywordsSectionAligner(AlignmentConfig.defaults(),
                FormattingConfig.defaults(), skip, Disablers.none(), null);
        Document document = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("Assigning", rows.call("    ${a}    ${b}=  Kw    arg")));

        aligner.align(document);

        assertThat(document.render()).endsWith("    ${a}    ${b}=" + spaces(11) + "Kw" + spaces(22) + "arg\n");
    }

    @Test
    void respectsDisabledLines() {
        Statement header = rows.sectionHeader("*** Keywords ***");
        Statement name = rows.name("Partly Disabled");
        Statement enabled = rows.call("    Log  one");
        Statement disabled = rows.call("    Log  two");
        LineRangeDisablers disablers = new LineRangeDisablers().disable("AlignKeywordsSection", 4, 4);
        KeywordsSectionAligner aligner = new KeywordsSectionAligner(AlignmentConfig.defaults(),
                FormattingConfig.defaults(), Skip.none(), disablers, null);
        Document document = keywords(header, new Block(BlockType.KEYWORD, name, List.of(enabled, disabled)));

        aligner.align(document);

        assertThat(document.render()).isEqualTo("*** Keywords ***\n"
                + "Partly Disabled\n"
                + "    Log" + spaces(21) + "one\n"
                + "    Log  two\n");
    }

    @Test
    void disabledStatementsDoNotWidenTheScope() {
        Statement header = rows.sectionHeader("*** Keywords ***");
        Statement name = rows.name("Measured");
        Statement enabled = rows.call("    Log    one");
        Statement disabled = rows.call("    VeryLongKeywordName    two");
        LineRangeDisablers disablers = new LineRangeDisablers().disable("AlignKeywordsSection", 4, 4);
        KeywordsSectionAligner aligner = new KeywordsSectionAligner(auto(), FormattingConfig.defaults(),
                Skip.none(), disablers, null);
        Document document = keywords(header, new Block(BlockType.KEYWORD, name, List.of(enabled, disabled)));

        aligner.align(document);

        assertThat(document.render()).contains("    Log" + spaces(5) + "one\n");
        assertThat(document.render()).contains("    VeryLongKeywordName    two\n");
    }

    @Test
    void leavesSectionAloneWhenDisabledOrSkipped() {
        Document disabledHeader = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("Any", rows.call("    Log  x")));
        Document skipped = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("Any", rows.call("    Log  x")));
        Document disabledFile = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("Any", rows.call("    Log  x")));

        new KeywordsSectionAligner(AlignmentConfig.defaults(), FormattingConfig.defaults(), Skip.none(),
                new LineRangeDisablers().disableHeader("AlignKeywordsSection", 1), null).align(disabledHeader);
        new KeywordsSectionAligner(AlignmentConfig.defaults(), FormattingConfig.defaults(),
                new Skip(SkipConfig.parse(null, null, null, "keywords")), Disablers.none(), null).align(skipped);
        new KeywordsSectionAligner(AlignmentConfig.defaults(), FormattingConfig.defaults(), Skip.none(),
                new LineRangeDisablers().disableFile(Disablers.ALL_FORMATTERS), null).align(disabledFile);

        assertThat(disabledHeader.render()).endsWith("    Log  x\n");
        assertThat(skipped.render()).endsWith("    Log  x\n");
        assertThat(disabledFile.render()).endsWith("    Log  x\n");
    }

    @Test
    void ignoresOtherSections() {
        Section tests = new Section(SectionType.TEST_CASES, rows.sectionHeader("*** Test Cases ***"),
                List.of(new Block(BlockType.TEST_CASE, rows.name("Case"), List.of(rows.call("    Log  x")))));
        Document document = new Document(List.of(tests));

        aligner(AlignmentConfig.defaults()).align(document);

        assertThat(document.render()).endsWith("    Log  x\n");
    }

    @Test
    void aligningTwiceIsStable() {
        Document document = keywords(rows.sectionHeader("*** Keywords ***"),
                keyword("Stable",
                        rows.statement(StatementKind.DOCUMENTATION, "  [Documentation]  Does things", "  ...  and more"),
                        rows.call("  ${result}=  Some Keyword With A Long Name  VeryLongArgumentValue  b  # note"),
                        rows.call("  Log Many  a", "  ...", "  ...  b")));
        KeywordsSectionAligner aligner = aligner(auto());

        aligner.align(document);
        String first = document.render();
        aligner.align(document);

        assertThat(document.render()).isEqualTo(first);
    }

    private Document keywords(Statement header, Node... definitions) {
        return new Document(List.of(new Section(SectionType.KEYWORDS, header, List.of(definitions))));
    }

    private Block keyword(String name, Node... body) {
        return new Block(BlockType.KEYWORD, rows.name(name), List.of(body));
    }

    private static KeywordsSectionAligner aligner(AlignmentConfig config) {
        return new KeywordsSectionAligner(config, FormattingConfig.defaults(), Skip.none(), Disablers.none(), null);
    }

    private static AlignmentConfig auto() {
        return AlignmentConfig.defaults().withAlignmentType(AlignmentType.AUTO);
    }

    private static String spaces(int count) {
        return " ".repeat(count);
    }
}
