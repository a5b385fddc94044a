package dev.cellfmt.aligner.skip;

/**
 * Inclusive range of source lines excluded from formatting.
 */
public record DisabledRange(int startLine, int endLine) {

    public DisabledRange {
        if (startLine < 1 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid disabled range " + startLine + "-" + endLine);
        }
    }

    public boolean covers(int fromLine, int toLine) {
        return startLine <= fromLine && endLine >= toLine;
    }
}
