package dev.cellfmt.aligner.model;

/**
 * Element of the parsed document tree.
 */
public interface Node {

    int startLine();

    int endLine();

    String render();
}
