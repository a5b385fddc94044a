package dev.cellfmt.aligner.model;

/**
 * Width accounting pool a statement contributes to when column widths are measured.
 */
public enum WidthPool {
    BODY,
    SETTINGS,
    NONE
}
