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
package net.boyechko.pdf.legalstruct.validation;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Walks a parsed hierarchy once, invoking multiple visitors at each node. */
public class HierarchyWalker {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyWalker.class);

    private final List<HierarchyVisitor> visitors = new ArrayList<>();
    private int globalIndex;

    public HierarchyWalker addVisitor(HierarchyVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public IssueList walk(HierarchyNode root) {
        globalIndex = 0;
        for (HierarchyVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        walkNode(root, null, "", 0);

        IssueList allIssues = new IssueList();
        for (HierarchyVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }
        return allIssues;
    }

    private void walkNode(HierarchyNode node, HierarchyNode parent, String parentPath, int depth) {
        globalIndex++;
        VisitorContext ctx = VisitorContext.of(node, parent, parentPath, depth, globalIndex);

        // Call enterNode on all visitors; track if any want to skip children
        boolean continueToChildren = true;
        for (HierarchyVisitor visitor : visitors) {
            try {
                if (!visitor.enterNode(ctx)) {
                    continueToChildren = false;
                }
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} at {}: {}", visitor.name(), ctx.path(), e.getMessage());
            }
        }

        if (continueToChildren) {
            for (HierarchyNode child : node.getChildren()) {
                walkNode(child, node, ctx.path(), depth + 1);
            }
        }

        for (HierarchyVisitor visitor : visitors) {
            try {
                visitor.leaveNode(ctx);
            } catch (Exception e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }
    }
}
