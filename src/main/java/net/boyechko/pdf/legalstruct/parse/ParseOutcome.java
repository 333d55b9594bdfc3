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

import java.util.List;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.reference.Reference;

/**
 * Result of parsing one document.
 *
 * @param root Document node; its children are the sections.
 * @param references Every reference in the tree, in document order.
 * @param issues Sequence anomalies, unresolved citations and structure problems.
 * @param statistics Node counts by type.
 */
public record ParseOutcome(
        HierarchyNode root,
        List<Reference> references,
        IssueList issues,
        ParseStatistics statistics) {

    public int resolvedReferenceCount() {
        return (int) references.stream().filter(Reference::isResolved).count();
    }
}
