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
package net.boyechko.pdf.legalstruct.visitors;

import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.issues.IssueLocation;
import net.boyechko.pdf.legalstruct.issues.IssueSeverity;
import net.boyechko.pdf.legalstruct.issues.IssueType;
import net.boyechko.pdf.legalstruct.reference.Reference;
import net.boyechko.pdf.legalstruct.validation.HierarchyVisitor;
import net.boyechko.pdf.legalstruct.validation.VisitorContext;

/** Reports internal citations whose article does not exist in the citing section. */
public class UnresolvedReferenceVisitor implements HierarchyVisitor {

    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Unresolved Reference Visitor";
    }

    @Override
    public String description() {
        return "Internal citations should point at an article of the same section";
    }

    @Override
    public boolean enterNode(VisitorContext ctx) {
        HierarchyNode node = ctx.node();
        for (Reference ref : node.getReferences()) {
            if (ref.isInternal() && !ref.isResolved()) {
                issues.add(
                        new Issue(
                                IssueType.UNRESOLVED_REFERENCE,
                                IssueSeverity.INFO,
                                new IssueLocation(node.getPage(), node.getId()),
                                "No article found for \"" + ref.rawText() + "\""));
            }
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
