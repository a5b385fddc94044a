package dev.cellfmt.aligner.section;

import dev.cellfmt.aligner.align.WidthTable;
import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.config.FormattingConfig;
import dev.cellfmt.aligner.config.VariablesAlignmentConfig;
import dev.cellfmt.aligner.model.Cell;
import dev.cellfmt.aligner.model.Document;
import dev.cellfmt.aligner.model.Node;
import dev.cellfmt.aligner.model.Section;
import dev.cellfmt.aligner.model.SectionType;
import dev.cellfmt.aligner.model.Statement;
import dev.cellfmt.aligner.model.StatementKind;
import dev.cellfmt.aligner.skip.Disablers;
import dev.cellfmt.aligner.skip.Skip;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns variable table rows: the leading columns are padded to the longest cell of the column, the remaining
 * values are separated by the minimal separator.
 */
public class VariablesSectionAligner implements SectionAligner {

    private static final Logger LOGGER = LoggerFactory.getLogger(VariablesSectionAligner.class);

    private final VariablesAlignmentConfig config;
    private final FormattingConfig formatting;
    private final Skip skip;
    private final Disablers disablers;

    public VariablesSectionAligner(VariablesAlignmentConfig config, FormattingConfig formatting, Skip skip,
                                   Disablers disablers) {
        this.config = Objects.requireNonNull(config, "config");
        this.formatting = Objects.requireNonNull(formatting, "formatting");
        this.skip = Objects.requireNonNull(skip, "skip");
        this.disablers = Objects.requireNonNull(disablers, "disablers");
    }

    @Override
    public AlignerType type() {
        return AlignerType.VARIABLES;
    }

    @Override
    public Document align(Document document) {
        if (disablers.isDisabledInFile(name())) {
            return document;
        }
        for (Section section : document.sections()) {
            if (section.type() == SectionType.VARIABLES && !isSkipped(section)) {
                alignSection(section);
            }
        }
        return document;
    }

    private boolean isSkipped(Section section) {
        return disablers.isNodeDisabled(name(), section)
                || section.header().map(header -> disablers.isHeaderDisabled(name(), header.startLine())).orElse(false)
                || skip.section(section.type().skipName());
    }

    private void alignSection(Section section) {
        List<Node> nodes = new ArrayList<>();
        List<Statement> rows = new ArrayList<>();
        Map<Statement, List<List<Cell>>> cellsByRow = new HashMap<>();
        for (Node node : section.body()) {
            if (!(node instanceof Statement statement) || disablers.isNodeDisabled(name(), node)) {
                nodes.add(node);
            } else if (statement.kind() == StatementKind.EMPTY_LINE || statement.kind() == StatementKind.COMMENT) {
                nodes.add(TableRows.leftAlign(statement));
            } else if (!statement.hasErrors() && shouldAlign(statement)) {
                cellsByRow.put(statement, TableRows.cellsByLine(statement));
                rows.add(statement);
                nodes.add(statement);
            } else {
                nodes.add(statement);
            }
        }
        if (rows.isEmpty()) {
            return;
        }
        Map<Integer, Integer> lookUp = createLookUp(rows.stream().map(cellsByRow::get).toList());
        LOGGER.debug("Aligning {} variables with column widths {}", rows.size(), lookUp);
        List<Node> aligned = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (node instanceof Statement statement && cellsByRow.containsKey(statement)) {
                aligned.add(alignRow(statement, cellsByRow.get(statement), lookUp));
            } else {
                aligned.add(node);
            }
        }
        section.setBody(aligned);
    }

    private boolean shouldAlign(Statement statement) {
        Optional<String> name = statement.variableName().filter(value -> !value.isEmpty());
        return name.isEmpty() || !config.skips(name.get().charAt(0));
    }

    private Statement alignRow(Statement statement, List<List<Cell>> lines, Map<Integer, Integer> lookUp) {
        List<Cell> cells = new ArrayList<>();
        for (List<Cell> line : lines) {
            int upTo = config.upToColumn() == 0 ? line.size() - 2 : config.upToColumn() - 1;
            TableRows.appendRow(line, cells, (column, cell) -> separator(column, upTo, cell, lookUp));
        }
        return statement.withCells(cells);
    }

    private int separator(int column, int upTo, Cell cell, Map<Integer, Integer> lookUp) {
        if (column < upTo) {
            if (config.fixedWidth().isPresent() && config.fixedWidth().getAsInt() > 0) {
                return Math.max(config.fixedWidth().getAsInt() - cell.length(), formatting.spaceCount());
            }
            return lookUp.getOrDefault(column, cell.length() + formatting.spaceCount()) - cell.length();
        }
        return formatting.spaceCount();
    }

    private Map<Integer, Integer> createLookUp(List<List<List<Cell>>> rows) {
        Map<Integer, Integer> longest = new HashMap<>();
        for (List<List<Cell>> row : rows) {
            for (List<Cell> line : row) {
                int upTo = config.upToColumn() == 0 ? line.size() : Math.min(line.size(), config.upToColumn() - 1);
                for (int column = 0; column < upTo; column++) {
                    longest.merge(column, line.get(column).length(), Math::max);
                }
            }
        }
        Map<Integer, Integer> lookUp = new HashMap<>();
        longest.forEach((column, length) -> {
            int width = length + formatting.spaceCount();
            if (config.minWidth().isPresent() && config.minWidth().getAsInt() > 0) {
                width = Math.max(width, config.minWidth().getAsInt());
            }
            lookUp.put(column, WidthTable.roundToFour(width));
        });
        return lookUp;
    }
}
