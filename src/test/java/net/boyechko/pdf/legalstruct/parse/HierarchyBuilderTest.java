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

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.legalstruct.document.ContentBlock;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyTree;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueType;
import net.boyechko.pdf.legalstruct.parse.SectionDetector.DocumentSection;
import net.boyechko.pdf.legalstruct.reference.Reference;
import net.boyechko.pdf.legalstruct.reference.ReferenceExtractor;
import net.boyechko.pdf.legalstruct.reference.ReferenceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/** Tests for HierarchyBuilder. */
class HierarchyBuilderTest {
    private HierarchyBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new HierarchyBuilder(new ReferenceExtractor(Set.of()));
    }

    private HierarchyNode build(String... lines) {
        List<ContentBlock> blocks =
                Arrays.stream(lines).map(line -> ContentBlock.of(0, line)).toList();
        return build(blocks);
    }

    private HierarchyNode build(List<ContentBlock> blocks) {
        return builder.build(new DocumentSection("S", "S", 0, blocks));
    }

    private static HierarchyNode node(HierarchyNode section, String path) {
        return HierarchyTree.find(section, path)
                .orElseThrow(() -> new AssertionError("No node at " + path));
    }

    private static List<HierarchyNode> allNodes(HierarchyNode root) {
        List<HierarchyNode> nodes = new ArrayList<>();
        collect(root, nodes);
        return nodes;
    }

    private static void collect(HierarchyNode node, List<HierarchyNode> out) {
        out.add(node);
        node.getChildren().forEach(child -> collect(child, out));
    }

    @Test
    void articleBodyGoesToImplicitParagraph() {
        HierarchyNode section = build("제1조(목적) 이 약관은 보험금의 지급을 정합니다.");

        HierarchyNode article = node(section, "제1조");
        assertEquals("S.제1조", article.getId());
        assertEquals("제1조(목적)", article.getContent());
        assertEquals("목적", article.getMetadata(HierarchyNode.CAPTION));

        assertEquals(1, article.getChildren().size());
        HierarchyNode paragraph = article.getChildren().get(0);
        assertEquals("S.제1조.①", paragraph.getId());
        assertEquals(NodeType.PARAGRAPH, paragraph.getType());
        assertEquals(1, paragraph.getNumber());
        assertTrue(paragraph.isAutoGenerated());
        assertEquals("이 약관은 보험금의 지급을 정합니다.", paragraph.getContent());
        assertEquals(1, builder.getStatistics().implicitParagraphs());
    }

    @Test
    void itemsUnderArticleGetAnEmptyImplicitParagraph() {
        HierarchyNode section = build("제2조(정의)", "1. 보험금이란 지급액을 말합니다.", "2. 계약자란 사람을 말합니다.");

        HierarchyNode article = node(section, "제2조");
        assertEquals(1, article.getChildren().size());
        HierarchyNode paragraph = article.getChildren().get(0);
        assertTrue(paragraph.isAutoGenerated());
        assertEquals("", paragraph.getContent());
        assertEquals(HierarchyBuilder.IMPLICIT_PARAGRAPH_TITLE, paragraph.getTitle());
        assertEquals(
                List.of("S.제2조.①.1.", "S.제2조.①.2."),
                paragraph.getChildren().stream().map(HierarchyNode::getId).toList());
    }

    @Test
    void explicitParagraphsNestItemsAndSubitems() {
        HierarchyNode section =
                build("제3조(지급)", "① 첫째 항입니다.", "② 둘째 항입니다.", "1. 첫째 호", "가. 첫째 목");

        HierarchyNode subitem = node(section, "제3조.②.1.가");
        assertEquals("S.제3조.②.1..가.", subitem.getId());
        assertEquals(NodeType.SUBITEM, subitem.getType());
        assertEquals(0, builder.getStatistics().implicitParagraphs());
        assertEquals(2, node(section, "제3조").getChildren().size());
        assertTrue(builder.getIssues().isEmpty());
    }

    @Test
    void nonSequentialItemIsFlaggedButKept() {
        HierarchyNode section = build("제1조(목적)", "1. 가", "2. 나", "4. 라");

        HierarchyNode item = node(section, "제1조.4");
        assertTrue(item.hasFlag(HierarchyNode.SEQUENCE_ANOMALY));
        assertFalse(node(section, "제1조.2").hasFlag(HierarchyNode.SEQUENCE_ANOMALY));

        assertEquals(1, builder.getIssues().size());
        Issue issue = builder.getIssues().get(0);
        assertEquals(IssueType.SEQUENCE_GAP, issue.type());
        assertEquals("Non-sequential item 4. after number 2", issue.message());
        assertEquals(item.getId(), issue.where().nodeId());
    }

    @Test
    void nestedCountersSurviveNonSequentialItem() {
        HierarchyNode section = build("제1조(목적)", "1. a", "2. b", "가. c", "4. d", "나. e");

        HierarchyNode subitem = node(section, "제1조.4.나");
        assertFalse(subitem.hasFlag(HierarchyNode.SEQUENCE_ANOMALY));
        assertEquals(1, builder.getIssues().ofType(IssueType.SEQUENCE_GAP).size());
    }

    @Test
    void proseAfterNonSequentialItemContinuesTheOpenSubitem() {
        HierarchyNode section = build("제1조(목적)", "1. a", "가. x", "3. b", "계속");

        assertEquals("가. x\n계속", node(section, "제1조.1.가").getContent());
        assertEquals("3. b", node(section, "제1조.3").getContent());
        assertTrue(node(section, "제1조.3").hasFlag(HierarchyNode.SEQUENCE_ANOMALY));
    }

    @Test
    void laterSubsubitemLeavesDashOpen() {
        HierarchyNode section =
                build("제1조(목적)", "1. a", "가. b", "(ⅰ) p", "- d", "(ⅱ) q", "계속");

        HierarchyNode first = node(section, "제1조.1.가.(ⅰ)");
        HierarchyNode dash = first.getChildren().get(0);
        assertEquals(NodeType.DASH, dash.getType());
        assertEquals("- d\n계속", dash.getContent());
        assertEquals("(ⅱ) q", node(section, "제1조.1.가.(ⅱ)").getContent());
    }

    @Test
    void firstSubsubitemClosesTheDashBelowIt() {
        HierarchyNode section =
                build("제1조(목적)", "1. a", "가. b", "(ⅰ) p", "- d", "나. c", "(ⅰ) r", "계속");

        assertEquals("- d", node(section, "제1조.1.가.(ⅰ)").getChildren().get(0).getContent());
        assertEquals("(ⅰ) r\n계속", node(section, "제1조.1.나.(ⅰ)").getContent());
    }

    @Test
    void newArticleRestartsItemNumbering() {
        HierarchyNode section = build("제1조(가)", "1. x", "2. y", "제2조(나)", "1. z");

        assertTrue(builder.getIssues().isEmpty());
        assertEquals("S.제2조.①.1.", node(section, "제2조.1").getId());
    }

    @Test
    void proseContinuesTheDeepestOpenNode() {
        HierarchyNode section = build("제1조(목적) 이 약관은", "계속되는 문장입니다.", "1. 항목", "항목의 둘째 줄");

        assertEquals("이 약관은\n계속되는 문장입니다.", node(section, "제1조.①").getContent());
        assertEquals("1. 항목\n항목의 둘째 줄", node(section, "제1조.1").getContent());
    }

    @Test
    void proseBeforeAnyStructureStaysOnTheSection() {
        HierarchyNode section = build("이 약관은 다음과 같습니다.", "제1조(목적)");
        assertEquals("이 약관은 다음과 같습니다.", section.getContent());
        assertEquals(1, section.getChildren().size());
    }

    @Test
    void globalSpecialAbsorbsItemsUntilNextArticle() {
        HierarchyNode section =
                build(
                        "제1조(목적) 본문",
                        "[별표1] 장해분류표",
                        "1. 눈의 장해",
                        "2. 귀의 장해",
                        "제2조(지급) 회사는 지급합니다.");

        List<HierarchyNode> children = section.getChildren();
        assertEquals(
                List.of("S.제1조", "S.[별표1]", "S.제2조"),
                children.stream().map(HierarchyNode::getId).toList());

        HierarchyNode appendix = children.get(1);
        assertEquals(NodeType.SPECIAL, appendix.getType());
        assertEquals(-1, appendix.getLevel());
        assertEquals("appendix", appendix.getMetadata(HierarchyNode.SPECIAL_TYPE));
        assertTrue(appendix.hasFlag(HierarchyNode.GLOBAL));
        assertEquals("[별표1] 장해분류표\n1. 눈의 장해\n2. 귀의 장해", appendix.getContent());
        assertTrue(HierarchyTree.allOfType(section, NodeType.ITEM).isEmpty());
    }

    @Test
    void boxBoundAnnotationEndsWithItsBox() {
        HierarchyNode section =
                build(
                        List.of(
                                ContentBlock.of(0, "제1조(목적) 본문"),
                                ContentBlock.inBox(0, "【유의사항】", 7),
                                ContentBlock.inBox(0, "1. 박스 안 항목", 7),
                                ContentBlock.of(0, "1. 박스 밖 항목")));

        HierarchyNode article = node(section, "제1조");
        HierarchyNode note = article.getChildren().get(1);
        assertEquals("S.제1조.유의사항", note.getId());
        assertTrue(note.hasFlag(HierarchyNode.INLINE));
        assertTrue(note.hasFlag(HierarchyNode.BOX_BOUND));
        assertEquals(7, note.getMetadata(HierarchyNode.BOX_ID));
        assertEquals("【유의사항】\n1. 박스 안 항목", note.getContent());

        List<HierarchyNode> items = HierarchyTree.allOfType(section, NodeType.ITEM);
        assertEquals(1, items.size());
        assertEquals("S.제1조.①.1.", items.get(0).getId());
    }

    @Test
    void unboundAnnotationEndsAtNextStructuralLine() {
        HierarchyNode section =
                build("제1조(목적) 본문", "<개정 2020. 1. 1.>", "추가 설명입니다.", "② 다음 항입니다.");

        HierarchyNode article = node(section, "제1조");
        HierarchyNode note = article.getChildren().get(1);
        assertEquals(NodeType.SPECIAL, note.getType());
        assertFalse(note.hasFlag(HierarchyNode.BOX_BOUND));
        assertEquals("<개정 2020. 1. 1.>\n추가 설명입니다.", note.getContent());
        assertEquals(List.of("2020. 1. 1"), note.getMetadata(HierarchyNode.AMENDMENTS));
        assertEquals("S.제1조.②", article.getChildren().get(2).getId());
    }

    @Test
    void referencesAreExtractedWithArticleContext() {
        HierarchyNode section = build("제1조(목적) 제2조에 따라 보상합니다.", "제3조(지급)", "① 회사는 제2항에 따라 지급합니다.");

        List<Reference> fromBody = node(section, "제1조.①").getReferences();
        assertEquals(1, fromBody.size());
        assertEquals(2, fromBody.get(0).targetArticle());
        assertEquals("S.제1조.①", fromBody.get(0).sourceId());

        List<Reference> paragraphOnly = node(section, "제3조.①").getReferences();
        assertEquals(1, paragraphOnly.size());
        assertEquals(3, paragraphOnly.get(0).targetArticle());
        assertEquals(2, paragraphOnly.get(0).targetParagraph());
    }

    @Test
    void citationLineInsideParagraphCreatesNoArticle() {
        HierarchyNode section =
                build("제1조(목적)", "① 회사는 손해를 보상합니다.", "제5조제1항에 따라 보상한다");

        assertTrue(HierarchyTree.find(section, "제5조").isEmpty());
        assertEquals(1, HierarchyTree.allOfType(section, NodeType.ARTICLE).size());

        HierarchyNode paragraph = node(section, "제1조.①");
        assertEquals("① 회사는 손해를 보상합니다.\n제5조제1항에 따라 보상한다", paragraph.getContent());
        List<Reference> refs = paragraph.getReferences();
        assertEquals(1, refs.size());
        assertEquals(ReferenceType.INTERNAL, refs.get(0).type());
        assertEquals(5, refs.get(0).targetArticle());
        assertEquals(1, refs.get(0).targetParagraph());
    }

    @Test
    void conjunctionSentenceBecomesBareArticle() {
        // Known limitation of the reference guard.
        HierarchyNode section = build("제1조(목적) 본문", "제5조 및 제6조에 따라 보상합니다.");
        HierarchyNode article = node(section, "제5조");
        assertEquals(NodeType.ARTICLE, article.getType());
        assertEquals("및 제6조에 따라 보상합니다.", article.getMetadata(HierarchyNode.CAPTION));
    }

    @Test
    void repeatedMarkersGetDistinctIds() {
        HierarchyNode section = build("제1조(가)", "제1조(나)");
        assertEquals(
                List.of("S.제1조", "S.제1조#2"),
                section.getChildren().stream().map(HierarchyNode::getId).toList());
    }

    @Test
    void lawCitationSectionCarriesLawMetadata() {
        HierarchyNode section =
                builder.build(
                        new DocumentSection(
                                "【법규1】 상법",
                                "【법규1】 상법",
                                4,
                                List.of(ContentBlock.of(4, "제638조(보험계약의 의의)"))));
        assertEquals(1, section.getMetadata(HierarchyNode.LAW_NUMBER));
        assertEquals("상법", section.getMetadata(HierarchyNode.LAW_NAME));
        assertEquals(4, section.getPage());
    }

    @Test
    void subsubitemsAndDashesNestBelowSubitems() {
        HierarchyNode section = build("제1조(목적)", "1. x", "가. y", "(ⅰ) z", "- w");

        HierarchyNode subsubitem = node(section, "제1조.1.가.(ⅰ)");
        assertEquals(1, subsubitem.getChildren().size());
        HierarchyNode dash = subsubitem.getChildren().get(0);
        assertEquals(NodeType.DASH, dash.getType());
        assertEquals("S.제1조.①.1..가..(ⅰ).-", dash.getId());
    }

    @Test
    void itemsOutsideArticlesHangOffTheSection() {
        HierarchyNode section = build("1. 첫째", "2. 둘째");
        assertEquals(
                List.of("S.1.", "S.2."),
                section.getChildren().stream().map(HierarchyNode::getId).toList());
        assertEquals(0, builder.getStatistics().implicitParagraphs());
    }

    @Test
    void structuralChildrenAreAlwaysDeeperThanParents() {
        HierarchyNode section =
                build(
                        "제1장 총칙",
                        "제1조(목적) 본문",
                        "1. 항목",
                        "가. 목",
                        "제2절 보상",
                        "제2조(보상)",
                        "① 첫째",
                        "- 대시",
                        "【참고】",
                        "2. 항목",
                        "제2장 보칙",
                        "나. 목");

        for (HierarchyNode parent : allNodes(section)) {
            for (HierarchyNode child : parent.getChildren()) {
                if (child.getType() == NodeType.SPECIAL || parent.getType() == NodeType.SPECIAL) {
                    continue;
                }
                assertTrue(
                        child.getLevel() > parent.getLevel(),
                        child.getId() + " is not deeper than " + parent.getId());
                assertTrue(child.getId().startsWith(parent.getId() + "."), child.getId());
            }
        }
    }

    @Test
    void statisticsCountNodesByType() {
        build("제1장 총칙", "제1조(목적) 본문", "제2조(정의)", "1. 가", "2. 나");

        ParseStatistics stats = builder.getStatistics();
        assertEquals(1, stats.count(NodeType.SECTION));
        assertEquals(1, stats.count(NodeType.CHAPTER));
        assertEquals(2, stats.count(NodeType.ARTICLE));
        assertEquals(2, stats.count(NodeType.PARAGRAPH));
        assertEquals(2, stats.count(NodeType.ITEM));
        assertEquals(2, stats.implicitParagraphs());
    }
}
