package dev.cellfmt.aligner.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One physical line of a statement. By convention the last two cells are the final data cell and the line end.
 */
public record Line(List<Cell> cells) {

    public Line {
        cells = List.copyOf(Objects.requireNonNull(cells, "cells"));
    }

    public List<Cell> withoutSeparators() {
        return cells.stream()
                .filter(cell -> !cell.type().isSeparator())
                .collect(Collectors.toList());
    }

    public List<Cell> dataCells() {
        return cells.stream()
                .filter(cell -> cell.type().isData())
                .collect(Collectors.toList());
    }

    public boolean contains(CellType type) {
        return cells.stream().anyMatch(cell -> cell.is(type));
    }

    /**
     * Whether the line holds anything besides whitespace and the line end.
     */
    public boolean hasContent() {
        return cells.stream().anyMatch(cell -> !cell.type().isSeparator() && !cell.is(CellType.END_OF_LINE));
    }

    /**
     * Whether the cells, separators excluded, are a continuation marker followed by an empty value.
     */
    public static boolean isBlankContinuation(List<Cell> cells) {
        return cells.size() == 3
                && cells.get(0).is(CellType.CONTINUATION)
                && cells.get(1).type().isData()
                && cells.get(1).text().isEmpty()
                && cells.get(2).is(CellType.END_OF_LINE);
    }

    public int length() {
        return cells.stream().mapToInt(Cell::length).sum();
    }

    public String render() {
        StringBuilder builder = new StringBuilder();
        cells.forEach(cell -> builder.append(cell.text()));
        return builder.toString();
    }
}
