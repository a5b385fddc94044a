package dev.cellfmt.aligner.model;

/**
 * Classification of individual cells within a line.
 */
public enum CellType {
    SEPARATOR,
    DATA,
    KEYWORD,
    ASSIGNMENT,
    VARIABLE,
    COMMENT,
    CONTINUATION,
    END_OF_LINE;

    public boolean isSeparator() {
        return this == SEPARATOR;
    }

    /**
     * Data cells are the ones that occupy a column: everything except whitespace, comments and line ends.
     */
    public boolean isData() {
        return this != SEPARATOR && this != COMMENT && this != END_OF_LINE;
    }
}
