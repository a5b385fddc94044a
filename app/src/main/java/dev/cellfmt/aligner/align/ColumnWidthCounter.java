package dev.cellfmt.aligner.align;

import dev.cellfmt.aligner.config.AlignmentConfig;
import dev.cellfmt.aligner.config.OverflowPolicy;
import dev.cellfmt.aligner.model.Cell;
import dev.cellfmt.aligner.model.CellType;
import dev.cellfmt.aligner.model.Line;
import dev.cellfmt.aligner.model.Statement;
import dev.cellfmt.aligner.model.StatementKind;
import dev.cellfmt.aligner.model.WidthPool;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Measures the direct statements of one scope and computes its width tables.
 * Only used when widths are derived from content.
 */
public final class ColumnWidthCounter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColumnWidthCounter.class);

    private final WidthTable caps;
    private final OverflowPolicy overflowPolicy;
    private final int minSeparator;
    private final boolean alignComments;
    private final boolean alignSettingsSeparately;
    private final boolean skipDocumentation;

    public ColumnWidthCounter(AlignmentConfig config, int minSeparator, boolean skipDocumentation) {
        Objects.requireNonNull(config, "config");
        this.caps = WidthTable.of(config.widths());
        this.overflowPolicy = config.overflowPolicy();
        this.minSeparator = minSeparator;
        this.alignComments = config.alignComments();
        this.alignSettingsSeparately = config.alignSettingsSeparately();
        this.skipDocumentation = skipDocumentation;
    }

    /**
     * @param statements direct statements of the scope, nested blocks excluded
     * @param disabled   statements the formatter may not touch; they do not contribute
     */
    public ScopeWidths count(List<Statement> statements, Predicate<Statement> disabled) {
        Map<Integer, List<Integer>> body = new HashMap<>();
        Map<Integer, List<Integer>> settings = new HashMap<>();
        for (Statement statement : statements) {
            if (statement.hasErrors() || disabled.test(statement)) {
                continue;
            }
            StatementKind kind = statement.kind();
            if (kind.pool() == WidthPool.NONE || (kind == StatementKind.COMMENT && !alignComments)) {
                continue;
            }
            if (kind == StatementKind.DOCUMENTATION) {
                measureDocumentation(statement, settings);
            } else {
                measure(statement, kind.isSetting() ? settings : body, kind.measuredColumnLimit(),
                        kind == StatementKind.COMMENT);
            }
        }
        ScopeWidths widths = calculate(body, settings);
        LOGGER.debug("Measured {} statements: body widths {}, settings widths {}", statements.size(),
                widths.body(), widths.settings());
        return widths;
    }

    private void measure(Statement statement, Map<Integer, List<Integer>> pool, int upTo, boolean withComments) {
        for (Line line : statement.lines()) {
            List<Cell> cells = line.cells().stream()
                    .filter(cell -> cell.type().isData() || (withComments && cell.is(CellType.COMMENT)))
                    .toList();
            Map<Integer, Integer> lineWidths = new LinkedHashMap<>();
            for (int column = 0; column < cells.size(); column++) {
                if (upTo > 0 && column == upTo) {
                    break;
                }
                int cap = caps.width(column);
                int natural = WidthTable.roundToFour(cells.get(column).length() + minSeparator);
                if (cap == 0 || natural <= cap) {
                    lineWidths.put(column, natural);
                } else {
                    if (overflowPolicy == OverflowPolicy.IGNORE_LINE) {
                        lineWidths.clear();
                    }
                    break;
                }
            }
            lineWidths.forEach((column, width) -> pool.computeIfAbsent(column, key -> new ArrayList<>()).add(width));
        }
    }

    private void measureDocumentation(Statement statement, Map<Integer, List<Integer>> settings) {
        if (skipDocumentation) {
            return;
        }
        List<Cell> data = statement.dataCells();
        if (data.isEmpty()) {
            return;
        }
        int labelWidth = WidthTable.roundToFour(data.get(0).length() + minSeparator);
        settings.computeIfAbsent(0, key -> new ArrayList<>()).add(labelWidth);
    }

    private ScopeWidths calculate(Map<Integer, List<Integer>> body, Map<Integer, List<Integer>> settings) {
        if (!alignSettingsSeparately) {
            settings.forEach((column, widths) -> body.computeIfAbsent(column, key -> new ArrayList<>()).addAll(widths));
        }
        Map<Integer, Integer> bodyWidths = new HashMap<>();
        for (int column = 0; column < caps.widths().size(); column++) {
            bodyWidths.put(column, caps.widths().get(column));
        }
        bodyWidths.putAll(columnMaxima(body));
        WidthTable bodyTable = toTable(bodyWidths);
        if (!alignSettingsSeparately) {
            return ScopeWidths.shared(bodyTable);
        }
        return new ScopeWidths(bodyTable, toTable(columnMaxima(settings)));
    }

    private Map<Integer, Integer> columnMaxima(Map<Integer, List<Integer>> raw) {
        Map<Integer, Integer> maxima = new HashMap<>();
        raw.forEach((column, widths) -> {
            int cap = caps.width(column);
            if (cap == 0) {
                maxima.put(column, widths.stream().mapToInt(Integer::intValue).max().orElse(cap));
            } else {
                maxima.put(column, widths.stream()
                        .mapToInt(Integer::intValue)
                        .filter(width -> width <= cap)
                        .max()
                        .orElse(cap));
            }
        });
        return maxima;
    }

    private WidthTable toTable(Map<Integer, Integer> widths) {
        if (widths.isEmpty()) {
            return WidthTable.EMPTY;
        }
        int columns = widths.keySet().stream().mapToInt(Integer::intValue).max().orElse(-1) + 1;
        List<Integer> table = new ArrayList<>(columns);
        for (int column = 0; column < columns; column++) {
            table.add(widths.getOrDefault(column, caps.width(column)));
        }
        return WidthTable.of(table);
    }
}
