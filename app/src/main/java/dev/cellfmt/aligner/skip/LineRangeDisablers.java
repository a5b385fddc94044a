package dev.cellfmt.aligner.skip;

import dev.cellfmt.aligner.model.Node;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Disablers backed by explicit line ranges, registered per formatter or for all formatters at once.
 * A node is disabled only when a single range covers it entirely.
 */
public final class LineRangeDisablers implements Disablers {

    private final Map<String, List<DisabledRange>> ranges = new HashMap<>();
    private final Map<String, Set<Integer>> disabledHeaders = new HashMap<>();
    private final Set<String> disabledFiles = new HashSet<>();

    /**
     * Restricts formatting to {@code startLine..endLine}; every line outside is disabled for all formatters.
     */
    public static LineRangeDisablers limitedTo(int startLine, int endLine, int fileEnd) {
        LineRangeDisablers disablers = new LineRangeDisablers();
        if (startLine > 1) {
            disablers.disable(ALL_FORMATTERS, 1, startLine - 1);
        }
        if (endLine < fileEnd) {
            disablers.disable(ALL_FORMATTERS, endLine + 1, fileEnd);
        }
        return disablers;
    }

    public LineRangeDisablers disable(String formatterName, int startLine, int endLine) {
        Objects.requireNonNull(formatterName, "formatterName");
        ranges.computeIfAbsent(formatterName, key -> new ArrayList<>()).add(new DisabledRange(startLine, endLine));
        return this;
    }

    public LineRangeDisablers disableHeader(String formatterName, int line) {
        Objects.requireNonNull(formatterName, "formatterName");
        disabledHeaders.computeIfAbsent(formatterName, key -> new HashSet<>()).add(line);
        return this;
    }

    public LineRangeDisablers disableFile(String formatterName) {
        disabledFiles.add(Objects.requireNonNull(formatterName, "formatterName"));
        return this;
    }

    @Override
    public boolean isNodeDisabled(String formatterName, Node node) {
        if (node == null) {
            return false;
        }
        if (isDisabledInFile(formatterName)) {
            return true;
        }
        int start = node.startLine();
        int end = Math.max(node.startLine(), node.endLine());
        return coveredBy(ALL_FORMATTERS, start, end) || coveredBy(formatterName, start, end);
    }

    @Override
    public boolean isHeaderDisabled(String formatterName, int line) {
        return disabledHeaders.getOrDefault(ALL_FORMATTERS, Set.of()).contains(line)
                || disabledHeaders.getOrDefault(formatterName, Set.of()).contains(line);
    }

    @Override
    public boolean isDisabledInFile(String formatterName) {
        return disabledFiles.contains(ALL_FORMATTERS) || disabledFiles.contains(formatterName);
    }

    private boolean coveredBy(String formatterName, int start, int end) {
        return ranges.getOrDefault(formatterName, List.of()).stream().anyMatch(range -> range.covers(start, end));
    }
}
