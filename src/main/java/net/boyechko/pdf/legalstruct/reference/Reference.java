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

import java.util.Objects;

/**
 * A citation found in the text of a node.
 *
 * <p>All fields are fixed at extraction time except {@link #resolvedId()}, which is filled once by
 * {@link ReferenceResolver} for internal citations whose target article exists.
 */
public final class Reference {
    private final ReferenceType type;
    private final String sourceId;
    private final String targetLaw; // external only
    private final Integer targetArticle;
    private final Integer targetArticleBranch;
    private final Integer targetParagraph;
    private final Integer targetItem;
    private final Integer targetSubitem;
    private final String rawText;

    private String resolvedId;

    public Reference(
            ReferenceType type,
            String sourceId,
            String targetLaw,
            Integer targetArticle,
            Integer targetArticleBranch,
            Integer targetParagraph,
            Integer targetItem,
            Integer targetSubitem,
            String rawText) {
        this.type = Objects.requireNonNull(type, "type");
        this.sourceId = sourceId;
        this.targetLaw = targetLaw;
        this.targetArticle = targetArticle;
        this.targetArticleBranch = targetArticleBranch;
        this.targetParagraph = targetParagraph;
        this.targetItem = targetItem;
        this.targetSubitem = targetSubitem;
        this.rawText = rawText;
    }

    public static Reference internal(
            String sourceId,
            Integer article,
            Integer branch,
            Integer paragraph,
            Integer item,
            Integer subitem,
            String rawText) {
        return new Reference(
                ReferenceType.INTERNAL,
                sourceId,
                null,
                article,
                branch,
                paragraph,
                item,
                subitem,
                rawText);
    }

    public static Reference external(
            String sourceId,
            String law,
            Integer article,
            Integer branch,
            Integer paragraph,
            Integer item,
            String rawText) {
        return new Reference(
                ReferenceType.EXTERNAL, sourceId, law, article, branch, paragraph, item, null, rawText);
    }

    public ReferenceType type() {
        return type;
    }

    public boolean isInternal() {
        return type == ReferenceType.INTERNAL;
    }

    public String sourceId() {
        return sourceId;
    }

    public String targetLaw() {
        return targetLaw;
    }

    public Integer targetArticle() {
        return targetArticle;
    }

    public Integer targetArticleBranch() {
        return targetArticleBranch;
    }

    public Integer targetParagraph() {
        return targetParagraph;
    }

    public Integer targetItem() {
        return targetItem;
    }

    public Integer targetSubitem() {
        return targetSubitem;
    }

    public String rawText() {
        return rawText;
    }

    /** Returns the id of the cited node, or null if unresolved. */
    public String resolvedId() {
        return resolvedId;
    }

    public boolean isResolved() {
        return resolvedId != null;
    }

    public void resolveTo(String nodeId) {
        this.resolvedId = nodeId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Reference other)) return false;
        return type == other.type
                && Objects.equals(sourceId, other.sourceId)
                && Objects.equals(targetLaw, other.targetLaw)
                && Objects.equals(targetArticle, other.targetArticle)
                && Objects.equals(targetArticleBranch, other.targetArticleBranch)
                && Objects.equals(targetParagraph, other.targetParagraph)
                && Objects.equals(targetItem, other.targetItem)
                && Objects.equals(targetSubitem, other.targetSubitem)
                && Objects.equals(rawText, other.rawText)
                && Objects.equals(resolvedId, other.resolvedId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
                type,
                sourceId,
                targetLaw,
                targetArticle,
                targetArticleBranch,
                targetParagraph,
                targetItem,
                targetSubitem,
                rawText,
                resolvedId);
    }

    @Override
    public String toString() {
        return type.jsonName() + "(" + rawText + (resolvedId != null ? " -> " + resolvedId : "") + ")";
    }
}
