package dev.cellfmt.aligner.skip;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import dev.cellfmt.aligner.config.InvalidParameterValueException;
import dev.cellfmt.aligner.config.SkipConfig;
import dev.cellfmt.aligner.model.StatementKind;
import dev.cellfmt.aligner.model.TestRows;
import org.junit.jupiter.api.Test;

class SkipTest {

    private final TestRows rows = new TestRows();

    @Test
    void nothingIsSkippedByDefault() {
        Skip skip = Skip.none();

        assertThat(skip.documentation()).isFalse();
        assertThat(skip.returnValues()).isFalse();
        assertThat(skip.keywordCall(rows.call("    Log    x"))).isFalse();
        assertThat(skip.setting("Tags")).isFalse();
        assertThat(skip.comment(rows.statement(StatementKind.COMMENT, "# note"))).isFalse();
        assertThat(skip.section("keywords")).isFalse();
    }

    @Test
    void matchesKeywordCallsIgnoringCaseSpacesAndUnderscores() {
        Skip skip = new Skip(SkipConfig.parse(null, "Should Be Equal, log_many", null, null));

        assertThat(skip.keywordCall(rows.call("    should_be_equal    a    b"))).isTrue();
        assertThat(skip.keywordCall(rows.call("    Log Many    a"))).isTrue();
        assertThat(skip.keywordCall(rows.call("    Log    a"))).isFalse();
    }

    @Test
    void keywordCallPatternsSearchAnywhereInTheName() {
        Skip skip = new Skip(SkipConfig.parse(null, null, "^Wait, Element", null));

        assertThat(skip.keywordCall(rows.call("    Wait Until Keyword Succeeds    1 min"))).isTrue();
        assertThat(skip.keywordCall(rows.call("    Click Element    id:ok"))).isTrue();
        assertThat(skip.keywordCall(rows.call("    Log    Wait"))).isFalse();
    }

    @Test
    void assignmentsAreNotPartOfTheKeywordName() {
        Skip skip = new Skip(SkipConfig.parse(null, "Get Value", null, null));

        assertThat(skip.keywordCall(rows.call("    ${value}=    Get Value    field"))).isTrue();
    }

    @Test
    void rejectsInvalidPattern() {
        Throwable thrown = catchThrowable(() -> new Skip(SkipConfig.parse(null, null, "Log(", null)));

        assertThat(thrown).isInstanceOf(InvalidParameterValueException.class);
        assertThat(thrown).hasMessageContaining("skip_keyword_call_pattern");
    }

    @Test
    void settingsOptionCoversEverySetting() {
        Skip skip = new Skip(SkipConfig.parse("settings", null, null, null));

        assertThat(skip.setting("Tags")).isTrue();
        assertThat(skip.setting("Return_Statement")).isTrue();
        assertThat(skip.setting(null)).isFalse();
    }

    @Test
    void individualSettingsAreSkippedByName() {
        Skip skip = new Skip(SkipConfig.parse("skip_tags, return_statement, documentation", null, null, null));

        assertThat(skip.setting("Tags")).isTrue();
        assertThat(skip.setting("Return_Statement")).isTrue();
        assertThat(skip.setting("Arguments")).isFalse();
        assertThat(skip.documentation()).isTrue();
    }

    @Test
    void blockCommentsOnlyCoverCommentsAtLineStart() {
        Skip skip = new Skip(SkipConfig.parse("block_comments", null, null, null));

        assertThat(skip.comment(rows.statement(StatementKind.COMMENT, "# block"))).isTrue();
        assertThat(skip.comment(rows.statement(StatementKind.COMMENT, "    # indented"))).isFalse();
        assertThat(new Skip(SkipConfig.parse("comments", null, null, null))
                .comment(rows.statement(StatementKind.COMMENT, "    # indented"))).isTrue();
    }

    @Test
    void sectionsAreSkippedByName() {
        Skip skip = new Skip(SkipConfig.parse(null, null, null, "keywords, testcases"));

        assertThat(skip.section("keywords")).isTrue();
        assertThat(skip.section("testcases")).isTrue();
        assertThat(skip.section("tasks")).isFalse();
    }
}
