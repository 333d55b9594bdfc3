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

import net.boyechko.pdf.legalstruct.issues.IssueList;

/** Visitor interface for traversal of a parsed hierarchy. */
public interface HierarchyVisitor {

    String name();

    String description();

    /** Returns false to skip the children of the current node. */
    default boolean enterNode(VisitorContext ctx) {
        return true;
    }

    default void leaveNode(VisitorContext ctx) {}

    default void beforeTraversal() {}

    default void afterTraversal() {}

    IssueList getIssues();
}
