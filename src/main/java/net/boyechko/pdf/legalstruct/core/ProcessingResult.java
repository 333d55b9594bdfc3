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
package net.boyechko.pdf.legalstruct.core;

import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.parse.ParseStatistics;
import net.boyechko.pdf.legalstruct.reference.Reference;

/**
 * Summary of the processing of one document.
 *
 * @param root The Document node holding every section.
 * @param references Every reference in the tree, in document order.
 * @param issues Anomalies found while parsing and checking the tree.
 * @param statistics Node counts by type.
 * @param hierarchyFile Where the tree was written, or null if nothing was written.
 * @param referencesFile Where the flat reference list was written, or null.
 */
public record ProcessingResult(
        HierarchyNode root,
        List<Reference> references,
        IssueList issues,
        ParseStatistics statistics,
        Path hierarchyFile,
        Path referencesFile) {

    public boolean wroteOutput() {
        return hierarchyFile != null;
    }

    public long resolvedReferenceCount() {
        return references.stream().filter(Reference::isResolved).count();
    }
}
