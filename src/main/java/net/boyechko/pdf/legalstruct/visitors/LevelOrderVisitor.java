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
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.issues.IssueLocation;
import net.boyechko.pdf.legalstruct.issues.IssueSeverity;
import net.boyechko.pdf.legalstruct.issues.IssueType;
import net.boyechko.pdf.legalstruct.validation.HierarchyVisitor;
import net.boyechko.pdf.legalstruct.validation.VisitorContext;

/**
 * Detects nodes that are not nested deeper than their parent, e.g. an Article under an Item.
 * Sections and special nodes may sit at any depth and are not checked.
 */
public class LevelOrderVisitor implements HierarchyVisitor {

    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Level Order Visitor";
    }

    @Override
    public String description() {
        return "Every node should be at a deeper level than its parent";
    }

    @Override
    public boolean enterNode(VisitorContext ctx) {
        HierarchyNode node = ctx.node();
        HierarchyNode parent = ctx.parent();
        if (parent == null || ctx.hasType(NodeType.SECTION) || ctx.hasType(NodeType.SPECIAL)) {
            return true;
        }
        if (parent.getLevel() >= 0 && node.getLevel() <= parent.getLevel()) {
            issues.add(
                    new Issue(
                            IssueType.LEVEL_ORDER,
                            IssueSeverity.WARNING,
                            new IssueLocation(node.getPage(), node.getId()),
                            String.format(
                                    "%s at level %d is nested in %s at level %d",
                                    node.getType().jsonName(),
                                    node.getLevel(),
                                    parent.getType().jsonName(),
                                    parent.getLevel())));
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
