package dev.cellfmt.aligner.section;

import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.model.Document;

/**
 * Aligns the sections of a document it is responsible for, leaving every other section untouched.
 */
public interface SectionAligner {

    AlignerType type();

    /**
     * Name used to look up disablers for this aligner.
     */
    default String name() {
        return type().formatterName();
    }

    Document align(Document document);
}
