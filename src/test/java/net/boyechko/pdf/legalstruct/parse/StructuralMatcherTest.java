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

import net.boyechko.pdf.legalstruct.hierarchy.NodeType;
import net.boyechko.pdf.legalstruct.parse.StructuralMatcher.MatchResult;
import org.junit.jupiter.api.Test;

/** Tests for StructuralMatcher. */
class StructuralMatcherTest {
    private final StructuralMatcher matcher = new StructuralMatcher();

    private MatchResult matchOf(String text) {
        return matcher.match(text).orElseThrow(() -> new AssertionError("No match: " + text));
    }

    @Test
    void chapterWithTitle() {
        MatchResult result = matchOf("제1장 총칙");
        assertEquals(NodeType.CHAPTER, result.type());
        assertEquals(2, result.level());
        assertEquals(1, result.number());
        assertEquals("제1장", result.marker());
        assertEquals("총칙", result.title());
    }

    @Test
    void bracketsAroundWholeTitleAreStripped() {
        assertEquals("총칙", matchOf("제1장 [총칙]").title());
        assertEquals("보험금의 지급", matchOf("제2절 (보험금의 지급)").title());
    }

    @Test
    void partClauseGroupAndSubdivision() {
        assertEquals(NodeType.PART, matchOf("제2편 화재보험").type());
        assertEquals(NodeType.CLAUSE_GROUP, matchOf("제3절 통칙").type());
        assertEquals(NodeType.SUBDIVISION, matchOf("제1관 목적").type());
    }

    @Test
    void branchedArticleSplitsHeadingFromBody() {
        MatchResult result = matchOf("제3조의2(보험금의 지급) 회사는 보험금을 지급합니다.");
        assertEquals(NodeType.ARTICLE, result.type());
        assertEquals(5, result.level());
        assertEquals(3, result.number());
        assertEquals(2, result.branch());
        assertEquals("제3조의2", result.marker());
        assertEquals("제3조의2(보험금의 지급)", result.title());
        assertEquals("회사는 보험금을 지급합니다.", result.body());
        assertEquals("보험금의 지급", result.caption());
    }

    @Test
    void squareBracketCaptionWithoutBody() {
        MatchResult result = matchOf("제5조[정의]");
        assertEquals("제5조", result.marker());
        assertNull(result.branch());
        assertEquals("", result.body());
        assertEquals("정의", result.caption());
    }

    @Test
    void spacedArticleMarkerIsNormalized() {
        MatchResult result = matchOf("제 3 조 (목적)");
        assertEquals("제3조", result.marker());
        assertEquals("목적", result.caption());
    }

    @Test
    void referenceSentencesAreNotHeadings() {
        assertTrue(matcher.match("제5조에 따라 회사는 보상합니다.").isEmpty());
        assertTrue(matcher.match("제5조제1항의 규정을 적용합니다.").isEmpty());
        assertTrue(matcher.match("제5조의2에 따라 지급합니다.").isEmpty());
    }

    @Test
    void headingGluedToItsTitleIsNotAReference() {
        MatchResult subdivision = matchOf("제2관의료비 보장");
        assertEquals(NodeType.SUBDIVISION, subdivision.type());
        assertEquals("제2관", subdivision.marker());
        assertEquals("의료비 보장", subdivision.title());
    }

    @Test
    void conjunctionOfArticlesIsReadAsBareArticle() {
        // Known limitation: "및" is not in the reference guard.
        MatchResult result = matchOf("제5조 및 제6조에 따라 보상합니다.");
        assertEquals(NodeType.ARTICLE, result.type());
        assertEquals(5, result.number());
        assertEquals("및 제6조에 따라 보상합니다.", result.caption());
    }

    @Test
    void paragraphItemSubitemSubsubitemAndDash() {
        MatchResult paragraph = matchOf("② 회사는 다음과 같이 보상합니다.");
        assertEquals(NodeType.PARAGRAPH, paragraph.type());
        assertEquals(2, paragraph.number());
        assertEquals("②", paragraph.marker());

        MatchResult item = matchOf("3. 보험금의 청구");
        assertEquals(NodeType.ITEM, item.type());
        assertEquals(3, item.number());
        assertEquals("3.", item.marker());
        assertEquals("보험금의 청구", item.title());

        MatchResult subitem = matchOf("나. 상해");
        assertEquals(NodeType.SUBITEM, subitem.type());
        assertEquals(2, subitem.number());
        assertEquals("나.", subitem.marker());

        MatchResult subsubitem = matchOf("(ⅱ) 입원");
        assertEquals(NodeType.SUBSUBITEM, subsubitem.type());
        assertEquals(2, subsubitem.number());
        assertEquals("(ⅱ)", subsubitem.marker());
        assertEquals(3, matchOf("(iii) 수술").number());

        MatchResult dash = matchOf("- 통원");
        assertEquals(NodeType.DASH, dash.type());
        assertNull(dash.number());
        assertEquals("-", dash.marker());
    }

    @Test
    void decimalNumbersAreProse() {
        assertTrue(matcher.match("3.5% 인상된 금액").isEmpty());
        assertTrue(matcher.match("회사는 보험금을 지급합니다.").isEmpty());
        assertTrue(matcher.match("   ").isEmpty());
        assertTrue(matcher.match(null).isEmpty());
    }

    @Test
    void wrappedFragmentsAreSpecial() {
        MatchResult corner = matchOf("【보험금 지급】");
        assertTrue(corner.isSpecial());
        assertEquals(-1, corner.level());
        assertEquals("보험금 지급", corner.marker());

        MatchResult angle = matchOf("<개정 2020. 1. 1.>");
        assertTrue(angle.isSpecial());
        assertEquals("개정 2020. 1. 1.", angle.title());
    }

    @Test
    void titlePreviewIsTruncated() {
        StructuralMatcher shortPreview = new StructuralMatcher(5);
        assertEquals(
                "가나다라마", shortPreview.match("1. 가나다라마바사").orElseThrow().title());
    }

    @Test
    void articleOrHigherClassification() {
        assertTrue(matchOf("제2편 총칙").isArticleOrHigher());
        assertTrue(matchOf("제7조(면책)").isArticleOrHigher());
        assertFalse(matchOf("① 회사는").isArticleOrHigher());
        assertFalse(matchOf("【유의사항】").isArticleOrHigher());
    }

    @Test
    void structuralMarkerIgnoresReferenceGuard() {
        assertTrue(matcher.isStructuralMarker("1. 보험금"));
        assertFalse(matcher.isStructuralMarker("【유의사항】"));
        assertFalse(matcher.isStructuralMarker("주택화재 보통약관"));
    }
}
