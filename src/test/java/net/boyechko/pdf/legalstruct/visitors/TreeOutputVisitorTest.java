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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;
import net.boyechko.pdf.legalstruct.validation.HierarchyWalker;
import org.junit.jupiter.api.Test;

class TreeOutputVisitorTest {

    @Test
    void printsHeaderThenOneRowPerNode() {
        HierarchyNode section = new HierarchyNode("S", NodeType.SECTION);
        section.setTitle("보통약관");
        HierarchyNode article = new HierarchyNode("S.제1조", NodeType.ARTICLE);
        article.setMarker("제1조");
        article.setTitle("제1조(목적)\n이 약관은");
        article.setPage(1);
        section.addChild(article);

        List<String> lines = new ArrayList<>();
        new HierarchyWalker().addVisitor(new TreeOutputVisitor(lines::add)).walk(section);

        assertEquals(4, lines.size());
        assertTrue(lines.get(0).startsWith("Index"));
        assertTrue(lines.get(1).startsWith("-----"));
        assertTrue(lines.get(2).contains("- section"));
        assertFalse(lines.get(2).contains("(p."));
        assertTrue(lines.get(3).contains("  - article 제1조"));
        assertTrue(lines.get(3).contains("(p. 2)"));
        assertTrue(lines.get(3).contains("제1조(목적) 이 약관은"));
    }

    @Test
    void longTitlesAreTruncated() {
        HierarchyNode section = new HierarchyNode("S", NodeType.SECTION);
        section.setTitle("가".repeat(60));

        List<String> lines = new ArrayList<>();
        new HierarchyWalker().addVisitor(new TreeOutputVisitor(lines::add)).walk(section);

        assertTrue(lines.get(2).strip().endsWith("가".repeat(37) + "..."));
    }
}
