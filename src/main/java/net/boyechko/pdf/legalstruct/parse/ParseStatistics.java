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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;

/** Counts of nodes created while parsing one document. */
public final class ParseStatistics {
    private final Map<NodeType, Integer> counts = new EnumMap<>(NodeType.class);
    private int implicitParagraphs;

    void record(NodeType type) {
        counts.merge(type, 1, Integer::sum);
    }

    /** Records an implicit paragraph; it also counts as a paragraph. */
    void recordImplicitParagraph() {
        record(NodeType.PARAGRAPH);
        implicitParagraphs++;
    }

    public int count(NodeType type) {
        return counts.getOrDefault(type, 0);
    }

    public int implicitParagraphs() {
        return implicitParagraphs;
    }

    public int total() {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Counts by node type, in hierarchy order, for types that occurred. */
    public Map<NodeType, Integer> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        counts.forEach(
                (type, count) -> {
                    if (sb.length() > 0) sb.append(", ");
                    sb.append(type.label()).append(' ').append(count);
                });
        if (implicitParagraphs > 0) {
            sb.append(" (").append(implicitParagraphs).append(" implicit 항)");
        }
        return sb.toString();
    }
}
