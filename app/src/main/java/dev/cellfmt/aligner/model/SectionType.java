package dev.cellfmt.aligner.model;

/**
 * Top level sections of a document, with the name used by section skipping.
 */
public enum SectionType {
    SETTINGS("settings"),
    VARIABLES("variables"),
    TEST_CASES("testcases"),
    TASKS("tasks"),
    KEYWORDS("keywords"),
    COMMENTS("comments");

    private final String skipName;

    SectionType(String skipName) {
        this.skipName = skipName;
    }

    public String skipName() {
        return skipName;
    }
}
