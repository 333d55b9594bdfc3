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

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.pdf.legalstruct.hierarchy.Level;
import net.boyechko.pdf.legalstruct.hierarchy.Markers;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;

/**
 * Classifies one text fragment as a structural marker.
 *
 * <p>Rules are tried in a fixed order and the first hit wins:
 *
 * <ol>
 *   <li>Reference sentence: "제5조에 따라…", "제5조제1항의…" mention a unit rather than declare it;
 *       no match.
 *   <li>Special annotation: the whole fragment wrapped in 【…】 or &lt;…&gt;.
 *   <li>Part, Chapter, Clause-group, Subdivision: "제N편 title" and so on.
 *   <li>Article: "제N조[title]body", "제N조(title)body", bare "제N조 rest"; each with optional 의M.
 *   <li>Paragraph ①…⑳, Item "N. ", Subitem "가. ", Subsubitem "(ⅰ)", Dash "- ".
 * </ol>
 */
public class StructuralMatcher {
    public static final int DEFAULT_TITLE_PREVIEW = 50;

    /**
     * Result of a successful match.
     *
     * @param type Kind of node declared by the fragment.
     * @param level Serialized level; -1 for specials.
     * @param number Sequence number, or null for specials and dash items.
     * @param branch The M of "제N조의M" or "제N장의M", else null.
     * @param marker Marker used in node ids, e.g. "제5조의2", "①", "3.", "가.".
     * @param title Heading or preview text.
     * @param body Text glued onto an article heading; empty for every other type.
     * @param caption Bracketed article caption, e.g. "정의"; null when absent.
     */
    public record MatchResult(
            NodeType type,
            int level,
            Integer number,
            Integer branch,
            String marker,
            String title,
            String body,
            String caption) {

        public boolean isSpecial() {
            return type == NodeType.SPECIAL;
        }

        /** True for a Part, Chapter, Clause-group, Subdivision or Article heading. */
        public boolean isArticleOrHigher() {
            Level structural = structuralLevel();
            return structural != null && structural.isArticleOrHigher();
        }

        public Level structuralLevel() {
            return type.structuralLevel();
        }
    }

    private static final String BRANCH = "(?:\\s*의\\s*(\\d{1,9}))?";

    // Article citations only; a glued heading such as "제2관의료비" stays a heading.
    // Possessive so that the branch 의M is never re-read as the particle 의.
    private static final Pattern REFERENCE_SENTENCE =
            Pattern.compile(
                    "^제\\s*\\d+\\s*조(?:\\s*의\\s*\\d+)?+(?:\\s*\\([^)]*\\))?+"
                            + "(?:\\s*(?:및\\s*)?제\\s*\\d+\\s*[항호](?:\\s*["
                            + Markers.SUBITEM_LETTERS
                            + "]\\s*목)?)*+"
                            + "(?:의(?!\\s*\\d)|에\\s*따라|에\\s*의하여|에\\s*해당|에\\s*관한|에\\s*대하여"
                            + "|에서|으로|부터|에|를|와|과)");

    private static final Pattern SPECIAL_CORNER = Pattern.compile("^【([^】]+)】$");
    private static final Pattern SPECIAL_ANGLE = Pattern.compile("^<([^<>]+)>$");

    private static final Pattern PART =
            Pattern.compile("^제\\s*(\\d{1,9})\\s*편\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern CHAPTER =
            Pattern.compile("^제\\s*(\\d{1,9})\\s*장" + BRANCH + "\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern CLAUSE_GROUP =
            Pattern.compile("^제\\s*(\\d{1,9})\\s*절\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern SUBDIVISION =
            Pattern.compile("^제\\s*(\\d{1,9})\\s*관\\s*(.*)$", Pattern.DOTALL);

    private static final Pattern ARTICLE_BRACKETED =
            Pattern.compile(
                    "^제\\s*(\\d{1,9})\\s*조" + BRANCH + "\\s*\\[([^\\]]*)\\](.*)$",
                    Pattern.DOTALL);
    private static final Pattern ARTICLE_PARENTHESIZED =
            Pattern.compile(
                    "^제\\s*(\\d{1,9})\\s*조" + BRANCH + "\\s*[(（]([^)）]*)[)）](.*)$",
                    Pattern.DOTALL);
    private static final Pattern ARTICLE_BARE =
            Pattern.compile(
                    "^제\\s*(\\d{1,9})\\s*조(?:\\s*의\\s*(\\d{1,9}))?+(?:\\s+(.*))?$",
                    Pattern.DOTALL);

    private static final Pattern PARAGRAPH =
            Pattern.compile("^([" + Markers.CIRCLED_NUMERALS + "])\\s*(.*)$", Pattern.DOTALL);
    private static final Pattern ITEM =
            Pattern.compile("^(\\d{1,9})\\.\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern SUBITEM =
            Pattern.compile("^([" + Markers.SUBITEM_LETTERS + "])\\.\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern SUBSUBITEM =
            Pattern.compile(
                    "^([(（]\\s*(ⅹ|ⅸ|ⅷ|ⅶ|ⅵ|ⅴ|ⅳ|ⅲ|ⅱ|ⅰ|viii|vii|iii|vi|iv|ix|ii|v|x|i)\\s*[)）])\\s*(.+)$",
                    Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    private static final Pattern DASH = Pattern.compile("^[-－‐–—―]\\s+(.+)$", Pattern.DOTALL);

    private final int titlePreviewLength;

    public StructuralMatcher() {
        this(DEFAULT_TITLE_PREVIEW);
    }

    public StructuralMatcher(int titlePreviewLength) {
        this.titlePreviewLength = titlePreviewLength;
    }

    /** Classifies {@code text}; empty when it is prose or a reference sentence. */
    public Optional<MatchResult> match(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty() || REFERENCE_SENTENCE.matcher(trimmed).lookingAt()) {
            return Optional.empty();
        }
        MatchResult special = matchSpecial(trimmed);
        if (special != null) {
            return Optional.of(special);
        }
        return Optional.ofNullable(matchHierarchy(trimmed));
    }

    /**
     * True if {@code text} has the shape of a Part through Dash marker, ignoring the reference
     * sentence guard and special annotations.
     */
    public boolean isStructuralMarker(String text) {
        return text != null && matchHierarchy(text.strip()) != null;
    }

    private MatchResult matchSpecial(String text) {
        Matcher m = SPECIAL_CORNER.matcher(text);
        if (!m.matches()) {
            m = SPECIAL_ANGLE.matcher(text);
            if (!m.matches()) {
                return null;
            }
        }
        String inner = m.group(1).strip();
        return new MatchResult(
                NodeType.SPECIAL, NodeType.UNLEVELED, null, null, inner, inner, "", null);
    }

    private MatchResult matchHierarchy(String text) {
        if (text.isEmpty()) {
            return null;
        }
        Matcher m;
        if ((m = PART.matcher(text)).matches()) {
            return numbered(NodeType.PART, m.group(1), null, "편", m.group(2));
        }
        if ((m = CHAPTER.matcher(text)).matches()) {
            return numbered(NodeType.CHAPTER, m.group(1), m.group(2), "장", m.group(3));
        }
        if ((m = CLAUSE_GROUP.matcher(text)).matches()) {
            return numbered(NodeType.CLAUSE_GROUP, m.group(1), null, "절", m.group(2));
        }
        if ((m = SUBDIVISION.matcher(text)).matches()) {
            return numbered(NodeType.SUBDIVISION, m.group(1), null, "관", m.group(2));
        }
        MatchResult article = matchArticle(text);
        if (article != null) {
            return article;
        }
        if ((m = PARAGRAPH.matcher(text)).matches()) {
            String glyph = m.group(1);
            return new MatchResult(
                    NodeType.PARAGRAPH,
                    Level.PARAGRAPH.depth(),
                    Markers.circledValue(glyph.charAt(0)),
                    null,
                    glyph,
                    preview(m.group(2)),
                    "",
                    null);
        }
        if ((m = ITEM.matcher(text)).matches()) {
            return new MatchResult(
                    NodeType.ITEM,
                    Level.ITEM.depth(),
                    Integer.valueOf(m.group(1)),
                    null,
                    m.group(1) + ".",
                    preview(m.group(2)),
                    "",
                    null);
        }
        if ((m = SUBITEM.matcher(text)).matches()) {
            String letter = m.group(1);
            return new MatchResult(
                    NodeType.SUBITEM,
                    Level.SUBITEM.depth(),
                    Markers.subitemValue(letter.charAt(0)),
                    null,
                    letter + ".",
                    preview(m.group(2)),
                    "",
                    null);
        }
        if ((m = SUBSUBITEM.matcher(text)).matches()) {
            return new MatchResult(
                    NodeType.SUBSUBITEM,
                    Level.SUBSUBITEM.depth(),
                    Markers.romanValue(m.group(2)),
                    null,
                    m.group(1).replaceAll("\\s+", ""),
                    preview(m.group(3)),
                    "",
                    null);
        }
        if ((m = DASH.matcher(text)).matches()) {
            return new MatchResult(
                    NodeType.DASH, Level.DASH.depth(), null, null, "-", preview(m.group(1)), "", null);
        }
        return null;
    }

    private MatchResult matchArticle(String text) {
        Matcher m = ARTICLE_BRACKETED.matcher(text);
        if (!m.matches()) {
            m = ARTICLE_PARENTHESIZED.matcher(text);
        }
        if (m.matches()) {
            String body = m.group(4).strip();
            String heading = text.substring(0, m.start(4)).strip();
            return article(m.group(1), m.group(2), heading, body, m.group(3).strip());
        }
        m = ARTICLE_BARE.matcher(text);
        if (m.matches()) {
            String rest = m.group(3) != null ? m.group(3).strip() : "";
            return article(m.group(1), m.group(2), text, "", rest.isEmpty() ? null : rest);
        }
        return null;
    }

    private static MatchResult article(
            String number, String branch, String title, String body, String caption) {
        Integer branchNumber = branch != null ? Integer.valueOf(branch) : null;
        String marker = "제" + Integer.parseInt(number) + "조";
        if (branchNumber != null) {
            marker += "의" + branchNumber;
        }
        return new MatchResult(
                NodeType.ARTICLE,
                Level.ARTICLE.depth(),
                Integer.valueOf(number),
                branchNumber,
                marker,
                title,
                body,
                caption);
    }

    private static MatchResult numbered(
            NodeType type, String number, String branch, String unit, String rest) {
        Integer branchNumber = branch != null ? Integer.valueOf(branch) : null;
        String marker = "제" + Integer.parseInt(number) + unit;
        if (branchNumber != null) {
            marker += "의" + branchNumber;
        }
        return new MatchResult(
                type,
                type.level(),
                Integer.valueOf(number),
                branchNumber,
                marker,
                unwrap(rest.strip()),
                "",
                null);
    }

    /** Strips one pair of brackets around a whole title, as in "제1장 [총칙]". */
    private static String unwrap(String title) {
        if (title.length() >= 2) {
            char first = title.charAt(0);
            char last = title.charAt(title.length() - 1);
            if ((first == '(' && last == ')')
                    || (first == '[' && last == ']')
                    || (first == '【' && last == '】')) {
                return title.substring(1, title.length() - 1).strip();
            }
        }
        return title;
    }

    private String preview(String text) {
        String stripped = text.strip();
        return stripped.length() <= titlePreviewLength
                ? stripped
                : stripped.substring(0, titlePreviewLength);
    }
}
