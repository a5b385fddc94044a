package dev.cellfmt.aligner.model;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed document.
 */
public final class Document implements Node {

    private final List<Section> sections;

    public Document(List<Section> sections) {
        this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    }

    public List<Section> sections() {
        return sections;
    }

    @Override
    public int startLine() {
        return 1;
    }

    @Override
    public int endLine() {
        return sections.isEmpty() ? 1 : sections.get(sections.size() - 1).endLine();
    }

    @Override
    public String render() {
        StringBuilder builder = new StringBuilder();
        sections.forEach(section -> builder.append(section.render()));
        return builder.toString();
    }
}
