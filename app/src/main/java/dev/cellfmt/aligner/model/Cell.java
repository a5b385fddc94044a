package dev.cellfmt.aligner.model;

import java.util.Objects;

/**
 * Minimal lexical unit of a line. The type is fixed, the text is rewritten in place by the aligners.
 */
public final class Cell {

    private final CellType type;
    private String text;

    public Cell(CellType type, String text) {
        this.type = Objects.requireNonNull(type, "type");
        this.text = Objects.requireNonNull(text, "text");
    }

    public static Cell separator(int width) {
        return new Cell(CellType.SEPARATOR, " ".repeat(Math.max(0, width)));
    }

    public static Cell separator(String whitespace) {
        return new Cell(CellType.SEPARATOR, whitespace);
    }

    public CellType type() {
        return type;
    }

    public boolean is(CellType candidate) {
        return type == candidate;
    }

    public String text() {
        return text;
    }

    public void setText(String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    /**
     * Drops spaces and tabs in front of the text, keeping the line break of line end cells.
     */
    public void stripLeadingWhitespace() {
        int index = 0;
        while (index < text.length() && (text.charAt(index) == ' ' || text.charAt(index) == '\t')) {
            index++;
        }
        text = text.substring(index);
    }

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return type + "(" + text.replace("\n", "\\n") + ")";
    }
}
