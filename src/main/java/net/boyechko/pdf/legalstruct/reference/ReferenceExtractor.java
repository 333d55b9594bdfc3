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
package net.boyechko.pdf.legalstruct.reference;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import net.boyechko.pdf.legalstruct.hierarchy.Markers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds legal citations in a text fragment.
 *
 * <p>Three passes run over every fragment and their results are concatenated:
 *
 * <ol>
 *   <li>External: a statute name followed by 제N조 (의M) (제P항) (제Q호). Names quoted in 「」 are
 *       always recognized; otherwise the names harvested from the document are used, or any Hangul
 *       word ending in 법/령/규정/규칙 when none were harvested.
 *   <li>Internal: 제N조 (의M) (caption) (제P항) (제Q호) (X목), unless it overlaps an external match.
 *   <li>Paragraph-only: 제P항 (제Q호) with no 제N조 shortly before it, read as a paragraph of the
 *       current article. Only emitted when a current article is known.
 * </ol>
 *
 * <p>Nothing is dropped for being unresolvable; that is left to {@link ReferenceResolver}.
 */
public class ReferenceExtractor {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceExtractor.class);

    public static final int DEFAULT_LOOKBEHIND = 20;
    public static final List<String> DEFAULT_SELF_MARKERS = List.of("약관");

    private static final String ARTICLE_TAIL =
            "제\\s*(\\d{1,9})\\s*조(?:\\s*의\\s*(\\d{1,9}))?"
                    + "(?:\\s*제\\s*(\\d{1,9})\\s*항)?(?:\\s*제\\s*(\\d{1,9})\\s*호)?";

    private static final Pattern BRACKETED_EXTERNAL =
            Pattern.compile("「\\s*([^」]+?)\\s*」\\s*" + ARTICLE_TAIL);
    private static final Pattern GENERIC_EXTERNAL =
            Pattern.compile("(?<![가-힣])([가-힣]+(?:법|령|규정|규칙))\\s*" + ARTICLE_TAIL);
    private static final Pattern INTERNAL =
            Pattern.compile(
                    "제\\s*(\\d{1,9})\\s*조(?:\\s*의\\s*(\\d{1,9}))?(?:\\s*\\([^)]*\\))?"
                            + "(?:\\s*제\\s*(\\d{1,9})\\s*항)?(?:\\s*제\\s*(\\d{1,9})\\s*호)?"
                            + "(?:\\s*(["
                            + Markers.SUBITEM_LETTERS
                            + "])\\s*목)?");
    private static final Pattern PARAGRAPH_ONLY =
            Pattern.compile("제\\s*(\\d{1,9})\\s*항(?:\\s*제\\s*(\\d{1,9})\\s*호)?");
    private static final Pattern ARTICLE_MENTION = Pattern.compile("제\\s*\\d+\\s*조");

    // Words the generic pattern picks up that do not name a statute.
    private static final Set<String> GENERIC_WORDS = Set.of("법", "법령", "규정", "규칙", "법규", "방법");

    private final Pattern externalPattern;
    private final String documentName;
    private final List<String> selfReferenceMarkers;
    private final int lookbehind;

    private record Span(int start, int end) {
        boolean overlaps(int otherStart, int otherEnd) {
            return start < otherEnd && otherStart < end;
        }

        boolean contains(int position) {
            return start <= position && position < end;
        }
    }

    public ReferenceExtractor(Set<String> lawNames) {
        this(lawNames, null, DEFAULT_SELF_MARKERS, DEFAULT_LOOKBEHIND);
    }

    /**
     * @param lawNames Statute names harvested from the document; may be empty.
     * @param documentName Name of the document itself, or null. Citations naming it are not
     *     external.
     * @param selfReferenceMarkers Substrings that mark a cited name as the document itself.
     * @param lookbehind How far before a bare 제P항 to look for a 제N조.
     */
    public ReferenceExtractor(
            Set<String> lawNames,
            String documentName,
            Collection<String> selfReferenceMarkers,
            int lookbehind) {
        this.externalPattern = compileExternalPattern(lawNames);
        this.documentName = documentName == null || documentName.isBlank() ? null : documentName;
        this.selfReferenceMarkers = List.copyOf(selfReferenceMarkers);
        this.lookbehind = lookbehind;
    }

    private static Pattern compileExternalPattern(Set<String> lawNames) {
        if (lawNames == null || lawNames.isEmpty()) {
            return GENERIC_EXTERNAL;
        }
        // Longest first so that "상법시행령" wins over "상법".
        String alternation =
                lawNames.stream()
                        .sorted(Comparator.comparingInt(String::length).reversed())
                        .map(Pattern::quote)
                        .collect(Collectors.joining("|"));
        return Pattern.compile("(?<![가-힣])(" + alternation + ")\\s*" + ARTICLE_TAIL);
    }

    public List<Reference> extract(String text, String sourceId, Integer currentArticle) {
        return extract(text, sourceId, currentArticle, null);
    }

    /**
     * Extracts every citation in {@code text}. Never throws: on an unexpected failure the problem is
     * logged and an empty list is returned.
     *
     * @param currentArticle Number of the article the text belongs to, or null outside articles.
     * @param currentArticleBranch Branch of that article (the M of 제N조의M), or null.
     */
    public List<Reference> extract(
            String text, String sourceId, Integer currentArticle, Integer currentArticleBranch) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        try {
            List<Reference> refs = new ArrayList<>();
            List<Span> externalSpans = new ArrayList<>();
            findExternal(BRACKETED_EXTERNAL, text, sourceId, refs, externalSpans);
            findExternal(externalPattern, text, sourceId, refs, externalSpans);

            List<Span> claimedSpans = new ArrayList<>(externalSpans);
            findInternal(text, sourceId, externalSpans, refs, claimedSpans);

            if (currentArticle != null) {
                findParagraphOnly(
                        text, sourceId, currentArticle, currentArticleBranch, claimedSpans, refs);
            }
            return refs;
        } catch (RuntimeException e) {
            logger.warn("Reference extraction failed for {}: {}", sourceId, e.getMessage());
            return List.of();
        }
    }

    private void findExternal(
            Pattern pattern,
            String text,
            String sourceId,
            List<Reference> refs,
            List<Span> externalSpans) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            if (overlapsAny(externalSpans, m.start(), m.end())) {
                continue;
            }
            String law = m.group(1).strip();
            if (isSelfReference(law) || GENERIC_WORDS.contains(law)) {
                continue;
            }
            refs.add(
                    Reference.external(
                            sourceId,
                            law,
                            parseInt(m.group(2)),
                            parseInt(m.group(3)),
                            parseInt(m.group(4)),
                            parseInt(m.group(5)),
                            m.group().strip()));
            externalSpans.add(new Span(m.start(), m.end()));
        }
    }

    private void findInternal(
            String text,
            String sourceId,
            List<Span> externalSpans,
            List<Reference> refs,
            List<Span> claimedSpans) {
        Matcher m = INTERNAL.matcher(text);
        while (m.find()) {
            if (overlapsAny(externalSpans, m.start(), m.end())) {
                continue;
            }
            Integer subitem = null;
            if (m.group(5) != null) {
                subitem = Markers.subitemValue(m.group(5).charAt(0));
            }
            refs.add(
                    Reference.internal(
                            sourceId,
                            parseInt(m.group(1)),
                            parseInt(m.group(2)),
                            parseInt(m.group(3)),
                            parseInt(m.group(4)),
                            subitem,
                            m.group().strip()));
            claimedSpans.add(new Span(m.start(), m.end()));
        }
    }

    private void findParagraphOnly(
            String text,
            String sourceId,
            int currentArticle,
            Integer currentArticleBranch,
            List<Span> claimedSpans,
            List<Reference> refs) {
        Matcher m = PARAGRAPH_ONLY.matcher(text);
        while (m.find()) {
            int start = m.start();
            if (claimedSpans.stream().anyMatch(span -> span.contains(start))) {
                continue;
            }
            String before = text.substring(Math.max(0, start - lookbehind), start);
            if (ARTICLE_MENTION.matcher(before).find()) {
                continue;
            }
            refs.add(
                    Reference.internal(
                            sourceId,
                            currentArticle,
                            currentArticleBranch,
                            parseInt(m.group(1)),
                            parseInt(m.group(2)),
                            null,
                            m.group().strip()));
        }
    }

    private boolean isSelfReference(String law) {
        if (documentName != null && law.contains(documentName)) {
            return true;
        }
        return selfReferenceMarkers.stream().anyMatch(law::contains);
    }

    private static boolean overlapsAny(List<Span> spans, int start, int end) {
        return spans.stream().anyMatch(span -> span.overlaps(start, end));
    }

    private static Integer parseInt(String digits) {
        return digits != null ? Integer.valueOf(digits) : null;
    }
}
