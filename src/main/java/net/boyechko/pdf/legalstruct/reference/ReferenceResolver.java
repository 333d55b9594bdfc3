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
package net.boyechko.pdf.legalstruct.reference;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.hierarchy.Markers;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps internal citations to node ids once every section has been built.
 *
 * <p>A citation resolves only inside its own section. The resolved id is the cited article's id
 * followed by the paragraph glyph, "N." for the item and "X." for the subitem, joined with "." the
 * same way node ids are. Paragraph numbers above 20 have no glyph and become "제N항".
 */
public final class ReferenceResolver {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

    private ReferenceResolver() {}

    private record ArticleKey(String sectionId, int article, Integer branch) {}

    /**
     * Resolves the internal references of every node under {@code root}.
     *
     * @return the number of references resolved
     */
    public static int resolve(HierarchyNode root) {
        List<HierarchyNode> sections =
                root.getType() == NodeType.SECTION ? List.of(root) : root.getChildren();

        Map<ArticleKey, String> articles = new HashMap<>();
        for (HierarchyNode section : sections) {
            indexArticles(section.getId(), section, articles);
        }

        int resolved = 0;
        int unresolved = 0;
        for (HierarchyNode section : sections) {
            int[] counts = resolveUnder(section.getId(), section, articles);
            resolved += counts[0];
            unresolved += counts[1];
        }
        logger.debug("Resolved {} internal references, {} unresolved", resolved, unresolved);
        return resolved;
    }

    private static void indexArticles(
            String sectionId, HierarchyNode node, Map<ArticleKey, String> articles) {
        if (node.getType() == NodeType.ARTICLE && node.getNumber() != null) {
            // First heading wins when OCR repeats one.
            articles.putIfAbsent(
                    new ArticleKey(sectionId, node.getNumber(), node.getBranch()), node.getId());
        }
        for (HierarchyNode child : node.getChildren()) {
            indexArticles(sectionId, child, articles);
        }
    }

    private static int[] resolveUnder(
            String sectionId, HierarchyNode node, Map<ArticleKey, String> articles) {
        int[] counts = new int[2];
        for (Reference ref : node.getReferences()) {
            if (!ref.isInternal() || ref.targetArticle() == null) {
                continue;
            }
            String articleId =
                    articles.get(
                            new ArticleKey(
                                    sectionId, ref.targetArticle(), ref.targetArticleBranch()));
            if (articleId == null) {
                counts[1]++;
                continue;
            }
            ref.resolveTo(composeTargetId(articleId, ref));
            counts[0]++;
        }
        for (HierarchyNode child : node.getChildren()) {
            int[] childCounts = resolveUnder(sectionId, child, articles);
            counts[0] += childCounts[0];
            counts[1] += childCounts[1];
        }
        return counts;
    }

    static String composeTargetId(String articleId, Reference ref) {
        StringBuilder id = new StringBuilder(articleId);
        Integer paragraph = ref.targetParagraph();
        if (paragraph != null) {
            String glyph = Markers.circled(paragraph);
            id.append('.').append(glyph != null ? glyph : "제" + paragraph + "항");
        }
        if (ref.targetItem() != null) {
            id.append('.').append(ref.targetItem()).append('.');
        }
        if (ref.targetSubitem() != null) {
            String letter = Markers.subitemLetter(ref.targetSubitem());
            id.append('.').append(letter != null ? letter : ref.targetSubitem()).append('.');
        }
        return id.toString();
    }
}
