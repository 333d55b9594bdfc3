/*
 * PDF-LegalStruct - Legal hierarchy reconstruction for scanned policy PDFs
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.legalstruct.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import net.boyechko.pdf.legalstruct.document.ContentBlock;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.hierarchy.Level;
import net.boyechko.pdf.legalstruct.hierarchy.Markers;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.issues.IssueLocation;
import net.boyechko.pdf.legalstruct.issues.IssueSeverity;
import net.boyechko.pdf.legalstruct.issues.IssueType;
import net.boyechko.pdf.legalstruct.parse.ParseContext.SpecialMode;
import net.boyechko.pdf.legalstruct.parse.SectionDetector.DocumentSection;
import net.boyechko.pdf.legalstruct.parse.SpecialBlockDetector.SpecialBlock;
import net.boyechko.pdf.legalstruct.parse.StructuralMatcher.MatchResult;
import net.boyechko.pdf.legalstruct.reference.ReferenceExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the node tree of one section from its blocks, in reading order.
 *
 * <p>Each block is handled in one of four ways:
 *
 * <ol>
 *   <li>A global special header ([별표1], ※ 용어의 정의, 비고, 【법규1】) resets the context and opens
 *       a special node under the section. Following blocks are appended to it until the next
 *       Article-or-higher heading.
 *   <li>While an inline annotation is open, blocks are appended to it until the next structural
 *       line, or until the box it started in ends.
 *   <li>A structural line creates a node under the nearest open ancestor of a lower level.
 *   <li>Anything else is prose and continues the deepest open node.
 * </ol>
 *
 * <p>Articles never hold text directly: text after an article heading goes to its paragraph
 * ①, which is created on demand and flagged {@code auto_generated}.
 *
 * <p>One builder is used per document. Issues and statistics accumulate across its sections.
 */
public class HierarchyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyBuilder.class);

    static final String IMPLICIT_PARAGRAPH_TITLE = "(자동생성)";

    private final StructuralMatcher matcher;
    private final SpecialBlockDetector specialDetector;
    private final ReferenceExtractor extractor;
    private final int titlePreviewLength;

    private final IssueList issues = new IssueList();
    private final ParseStatistics statistics = new ParseStatistics();

    public HierarchyBuilder(ReferenceExtractor extractor) {
        this(
                new StructuralMatcher(),
                new SpecialBlockDetector(),
                extractor,
                StructuralMatcher.DEFAULT_TITLE_PREVIEW);
    }

    public HierarchyBuilder(
            StructuralMatcher matcher,
            SpecialBlockDetector specialDetector,
            ReferenceExtractor extractor,
            int titlePreviewLength) {
        this.matcher = matcher;
        this.specialDetector = specialDetector;
        this.extractor = extractor;
        this.titlePreviewLength = titlePreviewLength;
    }

    public IssueList getIssues() {
        return issues;
    }

    public ParseStatistics getStatistics() {
        return statistics;
    }

    /** Builds the tree of {@code section}. The returned node is not yet attached to a root. */
    public HierarchyNode build(DocumentSection section) {
        HierarchyNode sectionNode = new HierarchyNode(section.id(), NodeType.SECTION);
        sectionNode.setTitle(section.title());
        sectionNode.setPage(section.page());
        specialDetector
                .detect(section.title())
                .filter(block -> SpecialBlockDetector.LAW_CITATION.equals(block.specialType()))
                .ifPresent(block -> putLawMetadata(sectionNode, block));
        statistics.record(NodeType.SECTION);

        ParseContext ctx = new ParseContext(sectionNode);
        for (ContentBlock block : section.blocks()) {
            String text = block.text().strip();
            if (!text.isEmpty()) {
                process(ctx, block, text);
            }
        }
        logger.debug(
                "Built section '{}' from {} blocks ({} top-level nodes)",
                section.id(),
                section.blocks().size(),
                sectionNode.getChildren().size());
        return sectionNode;
    }

    private void process(ParseContext ctx, ContentBlock block, String text) {
        Optional<SpecialBlock> header = specialDetector.detect(text);
        if (header.isPresent()) {
            openGlobalSpecial(ctx, block, text, header.get());
            return;
        }

        Optional<MatchResult> match = matcher.match(text);
        if (ctx.specialMode() != SpecialMode.NONE) {
            if (specialContinues(ctx, block, match)) {
                appendToSpecial(ctx, text);
                return;
            }
            ctx.exitSpecial();
        }

        if (match.isEmpty()) {
            addProse(ctx, block, text);
        } else if (match.get().isSpecial()) {
            openInlineSpecial(ctx, block, text, match.get());
        } else {
            addStructural(ctx, block, text, match.get());
        }
    }

    private static boolean specialContinues(
            ParseContext ctx, ContentBlock block, Optional<MatchResult> match) {
        return switch (ctx.specialMode()) {
            case GLOBAL -> !match.map(MatchResult::isArticleOrHigher).orElse(false);
            case INLINE -> ctx.isBoxBound()
                    ? block.insideBox() && Objects.equals(block.boxId(), ctx.boxId())
                    : match.isEmpty();
            case NONE -> false;
        };
    }

    private void openGlobalSpecial(
            ParseContext ctx, ContentBlock block, String text, SpecialBlock header) {
        ctx.resetAll();
        HierarchyNode section = ctx.section();
        HierarchyNode node =
                new HierarchyNode(uniqueChildId(section, header.marker()), NodeType.SPECIAL);
        node.setMarker(header.marker());
        node.setTitle(header.title());
        node.setContent(text);
        node.setPage(block.page());
        node.putMetadata(HierarchyNode.SPECIAL_TYPE, header.specialType());
        node.putMetadata(HierarchyNode.GLOBAL, true);
        node.putMetadata(HierarchyNode.BOX_BOUND, false);
        putLawMetadata(node, header);
        attachReferences(ctx, node, text);
        recordAmendments(node, text);

        section.addChild(node);
        statistics.record(NodeType.SPECIAL);
        ctx.enterSpecial(SpecialMode.GLOBAL, node, false, null);
    }

    private void openInlineSpecial(
            ParseContext ctx, ContentBlock block, String text, MatchResult result) {
        HierarchyNode parent = ctx.parentForAnnotation();
        HierarchyNode node =
                new HierarchyNode(uniqueChildId(parent, result.marker()), NodeType.SPECIAL);
        node.setMarker(result.marker());
        node.setTitle(result.title());
        node.setContent(text);
        node.setPage(block.page());
        node.putMetadata(HierarchyNode.SPECIAL_TYPE, result.title());
        node.putMetadata(HierarchyNode.INLINE, true);
        node.putMetadata(HierarchyNode.BOX_BOUND, block.insideBox());
        if (block.insideBox() && block.boxId() != null) {
            node.putMetadata(HierarchyNode.BOX_ID, block.boxId());
        }
        attachReferences(ctx, node, text);
        recordAmendments(node, text);

        parent.addChild(node);
        statistics.record(NodeType.SPECIAL);
        ctx.enterSpecial(SpecialMode.INLINE, node, block.insideBox(), block.boxId());
    }

    private void appendToSpecial(ParseContext ctx, String text) {
        HierarchyNode node = ctx.specialNode();
        node.appendContent(text);
        attachReferences(ctx, node, text);
        recordAmendments(node, text);
    }

    private void addStructural(
            ParseContext ctx, ContentBlock block, String text, MatchResult result) {
        Level level = result.structuralLevel();
        Integer number = result.number();
        int previous = ctx.lastNumber(level);
        boolean sequential = true;

        switch (level) {
            case PART, CHAPTER, CLAUSE_GROUP, SUBDIVISION, ARTICLE, PARAGRAPH -> {
                ctx.resetBelow(level);
                ctx.zeroCountersBelow(level);
            }
            case ITEM, SUBITEM -> {
                // Out-of-sequence numbers are kept, but nested counters survive them.
                sequential = ctx.isSequential(level, number);
                if (sequential) {
                    ctx.resetBelow(level);
                    ctx.zeroCountersBelow(level);
                }
            }
            case SUBSUBITEM -> {
                if (number == 1) {
                    ctx.resetBelow(level);
                }
            }
            default -> {}
        }

        if (level.isDeeperThan(Level.PARAGRAPH) && ctx.needsImplicitParagraph()) {
            openImplicitParagraph(ctx, block.page(), "");
        }

        HierarchyNode parent = ctx.parentFor(level);
        HierarchyNode node =
                new HierarchyNode(uniqueChildId(parent, result.marker()), result.type());
        boolean articleWithBody = result.type() == NodeType.ARTICLE && !result.body().isEmpty();
        node.setNumber(number);
        node.setBranch(result.branch());
        node.setMarker(result.marker());
        node.setTitle(result.title());
        node.setContent(articleWithBody ? result.title() : text);
        node.setPage(block.page());
        if (result.caption() != null) {
            node.putMetadata(HierarchyNode.CAPTION, result.caption());
        }

        parent.addChild(node);
        ctx.openLevel(level, node);
        if (number != null) {
            ctx.recordNumber(level, number);
        }
        statistics.record(result.type());
        if (!sequential) {
            flagSequenceGap(node, previous);
        }

        if (result.type() == NodeType.ARTICLE) {
            // "제5조" declares the article; only the caption can cite anything.
            attachReferences(ctx, node, result.caption());
            recordAmendments(node, result.title());
            if (articleWithBody) {
                openImplicitParagraph(ctx, block.page(), result.body());
            }
        } else {
            attachReferences(ctx, node, text);
            recordAmendments(node, text);
        }
    }

    private void addProse(ParseContext ctx, ContentBlock block, String text) {
        if (ctx.needsImplicitParagraph()) {
            openImplicitParagraph(ctx, block.page(), text);
            return;
        }
        HierarchyNode target = ctx.deepest();
        target.appendContent(text);
        attachReferences(ctx, target, text);
        recordAmendments(target, text);
    }

    /** Opens paragraph ① of the current article, seeded with {@code text} (possibly empty). */
    private void openImplicitParagraph(ParseContext ctx, int page, String text) {
        HierarchyNode article = ctx.currentArticle();
        String marker = Markers.circled(1);
        HierarchyNode paragraph =
                new HierarchyNode(uniqueChildId(article, marker), NodeType.PARAGRAPH);
        paragraph.setNumber(1);
        paragraph.setMarker(marker);
        paragraph.setTitle(text.isEmpty() ? IMPLICIT_PARAGRAPH_TITLE : preview(text));
        paragraph.setContent(text);
        paragraph.setPage(page);
        paragraph.putMetadata(HierarchyNode.AUTO_GENERATED, true);

        article.addChild(paragraph);
        ctx.openLevel(Level.PARAGRAPH, paragraph);
        ctx.recordNumber(Level.PARAGRAPH, 1);
        statistics.recordImplicitParagraph();
        attachReferences(ctx, paragraph, text);
        recordAmendments(paragraph, text);
    }

    private void flagSequenceGap(HierarchyNode node, int previous) {
        node.putMetadata(HierarchyNode.SEQUENCE_ANOMALY, true);
        String message =
                String.format(
                        "Non-sequential %s %s after number %d",
                        node.getType().jsonName(), node.getMarker(), previous);
        logger.warn("{} ({})", message, node.getId());
        issues.add(
                new Issue(
                        IssueType.SEQUENCE_GAP,
                        IssueSeverity.WARNING,
                        new IssueLocation(node.getPage(), node.getId()),
                        message));
    }

    private void attachReferences(ParseContext ctx, HierarchyNode node, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        node.addReferences(
                extractor.extract(
                        text, node.getId(), ctx.currentArticleNumber(), ctx.currentArticleBranch()));
    }

    private static void recordAmendments(HierarchyNode node, String text) {
        List<String> dates = AmendmentNotes.dates(text);
        if (dates.isEmpty()) {
            return;
        }
        List<String> all = new ArrayList<>();
        if (node.getMetadata(HierarchyNode.AMENDMENTS) instanceof List<?> existing) {
            existing.forEach(date -> all.add(String.valueOf(date)));
        }
        all.addAll(dates);
        node.putMetadata(HierarchyNode.AMENDMENTS, all);
    }

    private static void putLawMetadata(HierarchyNode node, SpecialBlock header) {
        if (header.lawNumber() != null) {
            node.putMetadata(HierarchyNode.LAW_NUMBER, header.lawNumber());
        }
        if (header.lawName() != null) {
            node.putMetadata(HierarchyNode.LAW_NAME, header.lawName());
        }
    }

    /** Returns parent.id + "." + marker, suffixed "#2", "#3"... if a sibling already has it. */
    static String uniqueChildId(HierarchyNode parent, String marker) {
        String base = parent.getId() + "." + marker;
        String id = base;
        int occurrence = 2;
        while (parent.hasChildWithId(id)) {
            id = base + "#" + occurrence++;
        }
        return id;
    }

    private String preview(String text) {
        return text.length() <= titlePreviewLength ? text : text.substring(0, titlePreviewLength);
    }
}
