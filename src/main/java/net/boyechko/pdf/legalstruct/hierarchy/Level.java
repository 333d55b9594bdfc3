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
package net.boyechko.pdf.legalstruct.hierarchy;

/**
 * Nesting levels of a legal document, from the section scope down to dash items.
 *
 * <p>The ordinal is the serialized {@code level} value: SECTION is 0, ARTICLE is 5, DASH is 10.
 */
public enum Level {
    SECTION,
    /** 편 */
    PART,
    /** 장 */
    CHAPTER,
    /** 절 */
    CLAUSE_GROUP,
    /** 관 */
    SUBDIVISION,
    /** 조 */
    ARTICLE,
    /** 항 */
    PARAGRAPH,
    /** 호 */
    ITEM,
    /** 목 */
    SUBITEM,
    /** 세목 */
    SUBSUBITEM,
    DASH;

    public int depth() {
        return ordinal();
    }

    public boolean isDeeperThan(Level other) {
        return depth() > other.depth();
    }

    /** True for Part, Chapter, Clause-group, Subdivision and Article. */
    public boolean isArticleOrHigher() {
        return depth() >= PART.depth() && depth() <= ARTICLE.depth();
    }

    public static Level ofDepth(int depth) {
        Level[] levels = values();
        if (depth < 0 || depth >= levels.length) {
            throw new IllegalArgumentException("No level at depth " + depth);
        }
        return levels[depth];
    }
}
