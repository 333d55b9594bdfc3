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

import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;

/**
 * Immutable context passed to visitors during traversal.
 *
 * @param node The node being visited.
 * @param parent Its parent, or null for the traversal root.
 * @param path Types and markers from the root down to the node, e.g. "/section/article[제2조]".
 * @param depth Depth in the tree (0 = traversal root).
 * @param globalIndex Index in traversal order (1-based).
 */
public record VisitorContext(
        HierarchyNode node, HierarchyNode parent, String path, int depth, int globalIndex) {

    static VisitorContext of(
            HierarchyNode node,
            HierarchyNode parent,
            String parentPath,
            int depth,
            int globalIndex) {
        String step = node.getType().jsonName();
        if (!node.getMarker().isEmpty()) {
            step += "[" + node.getMarker() + "]";
        }
        return new VisitorContext(node, parent, parentPath + "/" + step, depth, globalIndex);
    }

    public NodeType type() {
        return node.getType();
    }

    public boolean hasType(NodeType type) {
        return node.getType() == type;
    }
}
