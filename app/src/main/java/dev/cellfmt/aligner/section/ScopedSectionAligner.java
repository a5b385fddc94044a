package dev.cellfmt.aligner.section;

import dev.cellfmt.aligner.align.AlignmentContext;
import dev.cellfmt.aligner.align.AlignmentEngine;
import dev.cellfmt.aligner.align.ColumnWidthCounter;
import dev.cellfmt.aligner.align.ScopeWidths;
import dev.cellfmt.aligner.align.WidthTable;
import dev.cellfmt.aligner.config.AlignerType;
import dev.cellfmt.aligner.config.AlignmentConfig;
import dev.cellfmt.aligner.config.FormattingConfig;
import dev.cellfmt.aligner.model.Block;
import dev.cellfmt.aligner.model.Document;
import dev.cellfmt.aligner.model.Node;
import dev.cellfmt.aligner.model.Section;
import dev.cellfmt.aligner.model.SectionType;
import dev.cellfmt.aligner.model.Statement;
import dev.cellfmt.aligner.model.StatementKind;
import dev.cellfmt.aligner.model.WidthPool;
import dev.cellfmt.aligner.skip.Disablers;
import dev.cellfmt.aligner.skip.Skip;
import dev.cellfmt.aligner.split.LineSplitter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns keyword calls and settings of test and keyword definitions into columns.
 *
 * <p>Every definition, loop body and conditional or exception handling branch is a scope of its own. With auto
 * alignment the widths of a scope are measured from its direct statements before any of them is rewritten;
 * with fixed alignment all scopes share the configured widths.
 */
public abstract class ScopedSectionAligner implements SectionAligner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScopedSectionAligner.class);

    private final AlignerType type;
    private final Set<SectionType> sectionTypes;
    private final AlignmentConfig config;
    private final Skip skip;
    private final Disablers disablers;
    private final AlignmentEngine engine;
    private final ColumnWidthCounter counter;
    private final ScopeWidths fixedWidths;

    protected ScopedSectionAligner(AlignerType type, Set<SectionType> sectionTypes, AlignmentConfig config,
                                   FormattingConfig formatting, Skip skip, Disablers disablers,
                                   LineSplitter splitter) {
        this.type = Objects.requireNonNull(type, "type");
        this.sectionTypes = EnumSet.copyOf(sectionTypes);
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(formatting, "formatting");
        this.skip = Objects.requireNonNull(skip, "skip");
        this.disablers = Objects.requireNonNull(disablers, "disablers");
        this.engine = new AlignmentEngine(config, formatting, skip.returnValues(), splitter);
        this.counter = new ColumnWidthCounter(config, formatting.spaceCount(), skip.documentation());
        this.fixedWidths = ScopeWidths.shared(WidthTable.of(config.widths()));
    }

    @Override
    public AlignerType type() {
        return type;
    }

    @Override
    public Document align(Document document) {
        if (disablers.isDisabledInFile(name())) {
            LOGGER.debug("{} is disabled for the whole document", name());
            return document;
        }
        List<Section> sections = new ArrayList<>();
        for (Section section : document.sections()) {
            if (handles(section)) {
                sections.add(section);
            }
        }
        if (sections.isEmpty()) {
            return document;
        }
        List<Statement> rootStatements = new ArrayList<>();
        sections.forEach(section -> rootStatements.addAll(section.directStatements()));
        AlignmentContext root = AlignmentContext.root(widthsFor(rootStatements));
        for (Section section : sections) {
            section.setBody(alignNodes(section.body(), root));
        }
        return document;
    }

    private boolean handles(Section section) {
        if (!sectionTypes.contains(section.type())) {
            return false;
        }
        if (disablers.isNodeDisabled(name(), section)) {
            return false;
        }
        if (section.header().isPresent() && disablers.isHeaderDisabled(name(), section.header().get().startLine())) {
            return false;
        }
        return !skip.section(section.type().skipName());
    }

    private List<Node> alignNodes(List<Node> nodes, AlignmentContext context) {
        List<Node> aligned = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            if (node instanceof Statement statement) {
                aligned.add(alignStatement(statement, context));
            } else if (node instanceof Block block) {
                aligned.add(alignBlock(block, context));
            } else {
                aligned.add(node);
            }
        }
        return aligned;
    }

    private Block alignBlock(Block block, AlignmentContext context) {
        if (disablers.isNodeDisabled(name(), block)) {
            return block;
        }
        if (block.type().isDefinition()) {
            AlignmentContext scope = context.enter(widthsFor(block.directStatements()));
            block.setBody(alignNodes(block.body(), scope));
            return block;
        }
        if (block.isInline()) {
            return block;
        }
        for (Block branch = block; branch != null; branch = branch.next().orElse(null)) {
            branch.setHeader(reindent(branch.header(), context.depth()));
            AlignmentContext scope = context.enter(widthsFor(branch.directStatements()));
            branch.setBody(alignNodes(branch.body(), scope));
        }
        block.end().ifPresent(end -> block.setEnd(reindent(end, context.depth())));
        return block;
    }

    private Statement reindent(Statement marker, int depth) {
        if (marker.hasErrors() || disablers.isNodeDisabled(name(), marker)) {
            return marker;
        }
        return engine.reindent(marker, depth);
    }

    private Statement alignStatement(Statement statement, AlignmentContext context) {
        if (statement.hasErrors()) {
            LOGGER.debug("Leaving statement at line {} untouched: {}", statement.startLine(), statement.errors());
            return statement;
        }
        if (disablers.isNodeDisabled(name(), statement)) {
            return statement;
        }
        StatementKind kind = statement.kind();
        if (kind == StatementKind.KEYWORD_CALL) {
            return skip.keywordCall(statement)
                    ? statement
                    : engine.align(statement, context, false, engine.splitter().isPresent(), true);
        }
        if (kind == StatementKind.COMMENT) {
            return skip.comment(statement) ? statement : engine.align(statement, context, false, false, false);
        }
        if (kind == StatementKind.DOCUMENTATION) {
            return skip.documentation() ? statement : engine.alignDocumentation(statement, context);
        }
        if (kind.pool() == WidthPool.NONE || skip.setting(kind.settingName())) {
            return statement;
        }
        return engine.align(statement, context, kind.isSetting(), false, false);
    }

    private ScopeWidths widthsFor(List<Statement> statements) {
        if (config.isFixed()) {
            return fixedWidths;
        }
        return counter.count(statements, statement -> disablers.isNodeDisabled(name(), statement));
    }
}
