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

import java.util.Arrays;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.hierarchy.Level;

/**
 * Mutable state of one section's parse: the open node at each level, the last number seen at each
 * level, and the special-block mode.
 *
 * <p>The section node always occupies {@link Level#SECTION}. All other changes go through the
 * named transitions below.
 */
final class ParseContext {

    enum SpecialMode {
        NONE,
        /** Appendix, glossary and similar blocks; ends at the next Article-or-higher heading. */
        GLOBAL,
        /** Bracketed annotations; end at the next structural line or when the box ends. */
        INLINE
    }

    private static final int LEVELS = Level.values().length;

    private final HierarchyNode section;
    private final HierarchyNode[] open = new HierarchyNode[LEVELS];
    private final int[] lastNumbers = new int[LEVELS];

    private SpecialMode specialMode = SpecialMode.NONE;
    private HierarchyNode specialNode;
    private boolean boxBound;
    private Integer boxId;

    ParseContext(HierarchyNode section) {
        this.section = section;
        open[Level.SECTION.depth()] = section;
    }

    HierarchyNode section() {
        return section;
    }

    HierarchyNode current(Level level) {
        return open[level.depth()];
    }

    /**
     * Makes {@code node} the open node at {@code level}. Deeper levels stay open; callers close
     * them with {@link #resetBelow} where the numbering calls for it.
     */
    void openLevel(Level level, HierarchyNode node) {
        open[level.depth()] = node;
    }

    /** Closes every open node deeper than {@code level}. */
    void resetBelow(Level level) {
        Arrays.fill(open, level.depth() + 1, LEVELS, null);
    }

    /** Forgets the last numbers of every level deeper than {@code level}. */
    void zeroCountersBelow(Level level) {
        Arrays.fill(lastNumbers, level.depth() + 1, LEVELS, 0);
    }

    /** Back to a fresh section: nothing open below it, no counters, no special block. */
    void resetAll() {
        resetBelow(Level.SECTION);
        Arrays.fill(lastNumbers, 0);
        exitSpecial();
    }

    int lastNumber(Level level) {
        return lastNumbers[level.depth()];
    }

    void recordNumber(Level level, int number) {
        lastNumbers[level.depth()] = number;
    }

    /** True if {@code number} continues the sequence at {@code level}: it is 1 or last + 1. */
    boolean isSequential(Level level, int number) {
        return number == 1 || number == lastNumber(level) + 1;
    }

    HierarchyNode currentArticle() {
        return current(Level.ARTICLE);
    }

    Integer currentArticleNumber() {
        HierarchyNode article = currentArticle();
        return article != null ? article.getNumber() : null;
    }

    Integer currentArticleBranch() {
        HierarchyNode article = currentArticle();
        return article != null ? article.getBranch() : null;
    }

    boolean needsImplicitParagraph() {
        return currentArticle() != null && current(Level.PARAGRAPH) == null;
    }

    /** Deepest open node; the section itself when nothing else is open. */
    HierarchyNode deepest() {
        return open[deepestDepth()];
    }

    /** Nearest open node at a level strictly above {@code level}, falling back to the section. */
    HierarchyNode parentFor(Level level) {
        for (int depth = level.depth() - 1; depth > Level.SECTION.depth(); depth--) {
            if (open[depth] != null) {
                return open[depth];
            }
        }
        return section;
    }

    /** Parent for an inline annotation: the parent of the deepest open node. */
    HierarchyNode parentForAnnotation() {
        int deepest = deepestDepth();
        if (deepest == Level.SECTION.depth()) {
            return section;
        }
        return parentFor(Level.ofDepth(deepest));
    }

    private int deepestDepth() {
        for (int depth = LEVELS - 1; depth > Level.SECTION.depth(); depth--) {
            if (open[depth] != null) {
                return depth;
            }
        }
        return Level.SECTION.depth();
    }

    void enterSpecial(SpecialMode mode, HierarchyNode node, boolean boxBound, Integer boxId) {
        this.specialMode = mode;
        this.specialNode = node;
        this.boxBound = boxBound;
        this.boxId = boxId;
    }

    void exitSpecial() {
        enterSpecial(SpecialMode.NONE, null, false, null);
    }

    SpecialMode specialMode() {
        return specialMode;
    }

    HierarchyNode specialNode() {
        return specialNode;
    }

    boolean isBoxBound() {
        return boxBound;
    }

    Integer boxId() {
        return boxId;
    }
}
