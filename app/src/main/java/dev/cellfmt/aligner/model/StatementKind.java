package dev.cellfmt.aligner.model;

/**
 * Closed set of statement kinds produced by the parser.
 */
public enum StatementKind {
    KEYWORD_CALL(WidthPool.BODY, null),
    TEMPLATE_ARGUMENTS(WidthPool.BODY, "Template"),
    COMMENT(WidthPool.BODY, null),
    TAGS(WidthPool.SETTINGS, "Tags"),
    ARGUMENTS(WidthPool.SETTINGS, "Arguments"),
    SETUP(WidthPool.SETTINGS, "Setup"),
    TEARDOWN(WidthPool.SETTINGS, "Teardown"),
    TIMEOUT(WidthPool.SETTINGS, "Timeout"),
    RETURN_SETTING(WidthPool.SETTINGS, "Return_Statement"),
    RETURN_STATEMENT(WidthPool.SETTINGS, "Return_Statement"),
    TEMPLATE(WidthPool.SETTINGS, "Template"),
    DOCUMENTATION(WidthPool.SETTINGS, "Documentation"),
    SECTION_HEADER(WidthPool.NONE, null),
    DEFINITION_NAME(WidthPool.NONE, null),
    EMPTY_LINE(WidthPool.NONE, null),
    FOR_HEADER(WidthPool.NONE, null),
    WHILE_HEADER(WidthPool.NONE, null),
    IF_HEADER(WidthPool.NONE, null),
    INLINE_IF_HEADER(WidthPool.NONE, null),
    ELSE_IF_HEADER(WidthPool.NONE, null),
    ELSE_HEADER(WidthPool.NONE, null),
    TRY_HEADER(WidthPool.NONE, null),
    EXCEPT_HEADER(WidthPool.NONE, null),
    FINALLY_HEADER(WidthPool.NONE, null),
    END(WidthPool.NONE, null),
    VARIABLE(WidthPool.NONE, null),
    LIBRARY(WidthPool.NONE, null),
    RESOURCE(WidthPool.NONE, null),
    VARIABLES_IMPORT(WidthPool.NONE, null),
    SUITE_SETUP(WidthPool.NONE, null),
    SUITE_TEARDOWN(WidthPool.NONE, null),
    TEST_SETUP(WidthPool.NONE, null),
    TEST_TEARDOWN(WidthPool.NONE, null),
    SETTING(WidthPool.NONE, null);

    private final WidthPool pool;
    private final String settingName;

    StatementKind(WidthPool pool, String settingName) {
        this.pool = pool;
        this.settingName = settingName;
    }

    public WidthPool pool() {
        return pool;
    }

    /**
     * Name used when asking the skip configuration whether this kind of setting is excluded, or {@code null}.
     */
    public String settingName() {
        return settingName;
    }

    public boolean isSetting() {
        return pool == WidthPool.SETTINGS;
    }

    /**
     * Template-like statements only ever contribute their first column to the measured widths.
     */
    public int measuredColumnLimit() {
        return this == TEMPLATE ? 1 : 0;
    }
}
