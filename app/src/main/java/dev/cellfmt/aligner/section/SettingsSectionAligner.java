package dev.cellfmt.aligner.section;

import dev.cellfmt.aligner.align.WidthTable;
import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.config.FormattingConfig;
import dev.cellfmt.aligner.config.SettingsAlignmentConfig;
import dev.cellfmt.aligner.model.Cell;
import dev.cellfmt.aligner.model.CellType;
import dev.cellfmt.aligner.model.Document;
import dev.cellfmt.aligner.model.Node;
import dev.cellfmt.aligner.model.Section;
import dev.cellfmt.aligner.model.SectionType;
import dev.cellfmt.aligner.model.Statement;
import dev.cellfmt.aligner.model.StatementKind;
import dev.cellfmt.aligner.skip.Disablers;
import dev.cellfmt.aligner.skip.Skip;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns setting table rows. Continued arguments of setups, teardowns and imports are indented relative to
 * the setting value.
 */
public class SettingsSectionAligner implements SectionAligner {

    private static final Logger LOGGER = LoggerFactory.getLogger(SettingsSectionAligner.class);

    private static final Set<StatementKind> KINDS_WITH_ARGUMENTS = EnumSet.of(StatementKind.SUITE_SETUP,
            StatementKind.SUITE_TEARDOWN, StatementKind.TEST_SETUP, StatementKind.TEST_TEARDOWN,
            StatementKind.LIBRARY, StatementKind.VARIABLES_IMPORT);
    private static final Set<String> LIBRARY_ALIAS_MARKERS = Set.of("AS", "WITH NAME");
    private static final int SEPARATOR_STEP = 4;

    private final SettingsAlignmentConfig config;
    private final FormattingConfig formatting;
    private final Skip skip;
    private final Disablers disablers;

    public SettingsSectionAligner(SettingsAlignmentConfig config, FormattingConfig formatting, Skip skip,
                                  Disablers disablers) {
        this.config = Objects.requireNonNull(config, "config");
        this.formatting = Objects.requireNonNull(formatting, "formatting");
        this.skip = Objects.requireNonNull(skip, "skip");
        this.disablers = Objects.requireNonNull(disablers, "disablers");
    }

    @Override
    public AlignerType type() {
        return AlignerType.SETTINGS;
    }

    @Override
    public Document align(Document document) {
        if (disablers.isDisabledInFile(name())) {
            return document;
        }
        for (Section section : document.sections()) {
            if (section.type() == SectionType.SETTINGS && !isSkipped(section)) {
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
            if (!(node instanceof Statement statement) || disablers.isNodeDisabled(name(), node)
                    || isSkippedDocumentation(statement)) {
                nodes.add(node);
            } else if (statement.kind() == StatementKind.EMPTY_LINE || statement.kind() == StatementKind.COMMENT) {
                nodes.add(TableRows.leftAlign(statement));
            } else if (statement.hasErrors()) {
                nodes.add(statement);
            } else {
                cellsByRow.put(statement, TableRows.cellsByLine(statement));
                rows.add(statement);
                nodes.add(statement);
            }
        }
        if (rows.isEmpty()) {
            return;
        }
        Map<Integer, Integer> lookUp = createLookUp(rows, cellsByRow);
        LOGGER.debug("Aligning {} settings with column widths {}", rows.size(), lookUp);
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

    private boolean isSkippedDocumentation(Statement statement) {
        return statement.kind() == StatementKind.DOCUMENTATION && skip.documentation();
    }

    private Statement alignRow(Statement statement, List<List<Cell>> lines, Map<Integer, Integer> lookUp) {
        boolean library = statement.kind() == StatementKind.LIBRARY;
        boolean indentArguments = KINDS_WITH_ARGUMENTS.contains(statement.kind());
        List<Cell> cells = new ArrayList<>();
        for (List<Cell> line : lines) {
            boolean indentLine = indentArguments && line.get(0).is(CellType.CONTINUATION);
            if (indentLine && library) {
                indentLine = line.stream().noneMatch(cell -> LIBRARY_ALIAS_MARKERS.contains(cell.text()));
            }
            boolean indented = indentLine;
            int upTo = config.upToColumn() == 0 ? line.size() - 2 : config.upToColumn() - 1;
            TableRows.appendRow(line, cells, (column, cell) -> separator(column, upTo, indented, cell, lookUp));
        }
        return statement.withCells(cells);
    }

    private int separator(int column, int upTo, boolean indentArgument, Cell cell, Map<Integer, Integer> lookUp) {
        int spaceCount = formatting.spaceCount();
        if (column >= upTo) {
            return spaceCount;
        }
        if (config.fixedWidth().isPresent() && config.fixedWidth().getAsInt() > 0) {
            return Math.max(config.fixedWidth().getAsInt() - cell.length(), spaceCount);
        }
        Integer width = lookUp.get(column);
        if (width == null) {
            return spaceCount;
        }
        int argumentIndent = indentArgument ? config.argumentIndent() : 0;
        if (indentArgument && column != 0) {
            return Math.max(width - cell.length() - argumentIndent + SEPARATOR_STEP, spaceCount);
        }
        return width - cell.length() + argumentIndent + SEPARATOR_STEP;
    }

    private Map<Integer, Integer> createLookUp(List<Statement> rows, Map<Statement, List<List<Cell>>> cellsByRow) {
        Map<Integer, Integer> longest = new HashMap<>();
        for (Statement row : rows) {
            boolean documentation = row.kind() == StatementKind.DOCUMENTATION;
            for (List<Cell> line : cellsByRow.get(row)) {
                int upTo;
                if (documentation) {
                    upTo = 1;
                } else if (config.upToColumn() != 0) {
                    upTo = config.upToColumn() - 1;
                } else {
                    upTo = line.size();
                }
                for (int column = 0; column < Math.min(upTo, line.size()); column++) {
                    longest.merge(column, line.get(column).length(), Math::max);
                }
            }
        }
        Map<Integer, Integer> lookUp = new HashMap<>();
        longest.forEach((column, length) -> {
            int width = length;
            if (config.minWidth().isPresent() && config.minWidth().getAsInt() > 0) {
                width = Math.max(width, config.minWidth().getAsInt() - SEPARATOR_STEP);
            }
            lookUp.put(column, WidthTable.roundToFour(width));
        });
        return lookUp;
    }
}
