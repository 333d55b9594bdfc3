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

import java.util.function.Consumer;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.validation.HierarchyVisitor;
import net.boyechko.pdf.legalstruct.validation.VisitorContext;

/** Outputs a tabular listing of the parsed hierarchy during traversal. */
public class TreeOutputVisitor implements HierarchyVisitor {

    private static final String INDENT = "  ";
    private static final int INDEX_WIDTH = 5;
    private static final int ELEMENT_NAME_WIDTH = 36;
    private static final int PAGE_NUM_WIDTH = 8;
    private static final int TITLE_WIDTH = 40;

    private static final String ROW_FORMAT =
            String.format(
                    "%%-%ds %%-%ds %%-%ds %%s%%n", INDEX_WIDTH, ELEMENT_NAME_WIDTH, PAGE_NUM_WIDTH);

    private final Consumer<String> output;
    private boolean headerPrinted = false;

    public TreeOutputVisitor(Consumer<String> output) {
        this.output = output;
    }

    @Override
    public String name() {
        return "Hierarchy Tree Output";
    }

    @Override
    public String description() {
        return "Outputs a tabular listing of the parsed hierarchy during traversal";
    }

    @Override
    public void beforeTraversal() {
        printHeader();
    }

    @Override
    public boolean enterNode(VisitorContext ctx) {
        if (!headerPrinted) {
            printHeader();
        }
        printNode(ctx);
        return true;
    }

    @Override
    public IssueList getIssues() {
        return new IssueList();
    }

    private void printHeader() {
        if (headerPrinted) return;
        headerPrinted = true;

        output.accept(String.format(ROW_FORMAT, "Index", "Node", "Page", "Title"));
        output.accept(
                String.format(
                        ROW_FORMAT,
                        "-".repeat(INDEX_WIDTH),
                        "-".repeat(ELEMENT_NAME_WIDTH),
                        "-".repeat(PAGE_NUM_WIDTH),
                        "-".repeat(TITLE_WIDTH)));
    }

    private void printNode(VisitorContext ctx) {
        HierarchyNode node = ctx.node();
        String paddedIndex = String.format("%" + INDEX_WIDTH + "d", ctx.globalIndex());
        String nodeName = INDENT.repeat(ctx.depth()) + "- " + node.getType().jsonName();
        if (!node.getMarker().isEmpty()) {
            nodeName += " " + node.getMarker();
        }
        // Pages are 0-based internally.
        String pageString = ctx.parent() == null ? "" : "(p. " + (node.getPage() + 1) + ")";

        String title = node.getTitle().replace('\n', ' ');
        if (title.length() > TITLE_WIDTH) {
            title = title.substring(0, TITLE_WIDTH - 3) + "...";
        }

        output.accept(String.format(ROW_FORMAT, paddedIndex, nodeName, pageString, title));
    }
}
