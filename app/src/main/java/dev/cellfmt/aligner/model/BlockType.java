package dev.cellfmt.aligner.model;

/**
 * Kinds of nested blocks. Definitions open a scope inside a section, the others nest inside definitions.
 */
public enum BlockType {
    TEST_CASE,
    KEYWORD,
    FOR,
    WHILE,
    IF,
    ELSE_IF,
    ELSE,
    TRY,
    EXCEPT,
    TRY_ELSE,
    FINALLY;

    public boolean isDefinition() {
        return this == TEST_CASE || this == KEYWORD;
    }
}
