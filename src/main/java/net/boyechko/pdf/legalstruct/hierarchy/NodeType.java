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

/** Kinds of node in a parsed legal document. */
public enum NodeType {
    DOCUMENT("document", "문서", null),
    SECTION("section", "섹션", Level.SECTION),
    PART("part", "편", Level.PART),
    CHAPTER("chapter", "장", Level.CHAPTER),
    CLAUSE_GROUP("clause_group", "절", Level.CLAUSE_GROUP),
    SUBDIVISION("subdivision", "관", Level.SUBDIVISION),
    ARTICLE("article", "조", Level.ARTICLE),
    PARAGRAPH("paragraph", "항", Level.PARAGRAPH),
    ITEM("item", "호", Level.ITEM),
    SUBITEM("subitem", "목", Level.SUBITEM),
    SUBSUBITEM("subsubitem", "세목", Level.SUBSUBITEM),
    DASH("dash", "대시", Level.DASH),
    SPECIAL("special", "특수", null);

    /** Serialized level of nodes that sit outside the numbered hierarchy. */
    public static final int UNLEVELED = -1;

    private final String jsonName;
    private final String label;
    private final Level structuralLevel;

    NodeType(String jsonName, String label, Level structuralLevel) {
        this.jsonName = jsonName;
        this.label = label;
        this.structuralLevel = structuralLevel;
    }

    public String jsonName() {
        return jsonName;
    }

    /** Korean name of the unit, e.g. "조" for an article. */
    public String label() {
        return label;
    }

    /** Returns the hierarchy level, or null for Document and Special nodes. */
    public Level structuralLevel() {
        return structuralLevel;
    }

    public int level() {
        return structuralLevel != null ? structuralLevel.depth() : UNLEVELED;
    }

    public static NodeType fromJsonName(String jsonName) {
        for (NodeType type : values()) {
            if (type.jsonName.equals(jsonName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + jsonName);
    }
}
