package dev.cellfmt.aligner.skip;

import dev.cellfmt.aligner.model.Node;

/**
 * Decides, line range by line range, whether a formatter may touch a node.
 */
public interface Disablers {

    String ALL_FORMATTERS = "all";

    boolean isNodeDisabled(String formatterName, Node node);

    boolean isHeaderDisabled(String formatterName, int line);

    boolean isDisabledInFile(String formatterName);

    static Disablers none() {
        return new Disablers() {
            @Override
            public boolean isNodeDisabled(String formatterName, Node node) {
                return false;
            }

            @Override
            public boolean isHeaderDisabled(String formatterName, int line) {
                return false;
            }

            @Override
            public boolean isDisabledInFile(String formatterName) {
                return false;
            }
        };
    }
}
