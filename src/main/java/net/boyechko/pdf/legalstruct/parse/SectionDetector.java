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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import net.boyechko.pdf.legalstruct.document.ContentBlock;
import net.boyechko.pdf.legalstruct.reference.LawNameHarvester;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits the block stream into top-level sections (the main policy, each rider, each quoted
 * statute). A section starts at a title-shaped line and runs to the next one.
 *
 * <p>A line is a title when it is short, is not a structural marker, has one of the title shapes
 * below, and does not read like a sentence.
 */
public class SectionDetector {
    private static final Logger logger = LoggerFactory.getLogger(SectionDetector.class);

    public static final int DEFAULT_MAX_TITLE_LENGTH = 80;
    public static final String DEFAULT_SECTION_NAME = "본문";

    private static final List<Pattern> TITLE_PATTERNS =
            List.of(
                    // 주택화재 보통약관, 도난위험 특별약관
                    Pattern.compile("^[가-힣A-Za-z0-9\\s()]+\\s*(?:보통약관|특별약관|추가약관)\\s*$"),
                    // 화재 특별약관(갱신형)
                    Pattern.compile(
                            "^[가-힣A-Za-z0-9\\s]+\\s*(?:보통약관|특별약관|추가약관)\\s*[(（][^)）]*[)）]\\s*$"),
                    Pattern.compile("^[\\[【]법규\\s*\\d*[\\]】]"),
                    // 분쟁조정 안내, 민원처리 절차
                    Pattern.compile(
                            "^[가-힣\\s·]*(?:분쟁|민원)[가-힣\\s·]*(?:안내|절차|제도|유의사항)\\s*$"),
                    // 보험금 청구/지급 안내
                    Pattern.compile("^[가-힣][가-힣0-9\\s]*(?:/[가-힣0-9\\s]+)+$"));

    private static final List<Pattern> SENTENCE_PATTERNS =
            List.of(
                    Pattern.compile("^이\\s"),
                    Pattern.compile("^본\\s"),
                    Pattern.compile("^회사는\\s"),
                    Pattern.compile("^보통약관에서\\s"),
                    Pattern.compile("^상기"),
                    Pattern.compile("(?:합니다|않습니다|됩니다|입니다|바꿉니다)\\.?\\s*$"));

    /**
     * A contiguous run of blocks under one title.
     *
     * @param id Unique id of the section; the title, with "#n" added when it repeats.
     * @param title Title as printed.
     * @param page Page of the title line.
     * @param blocks Blocks of the section, title line excluded.
     */
    public record DocumentSection(String id, String title, int page, List<ContentBlock> blocks) {
        public DocumentSection {
            blocks = List.copyOf(blocks);
        }
    }

    private final StructuralMatcher matcher;
    private final int maxTitleLength;
    private final String defaultSectionName;

    public SectionDetector(StructuralMatcher matcher) {
        this(matcher, DEFAULT_MAX_TITLE_LENGTH, DEFAULT_SECTION_NAME);
    }

    public SectionDetector(StructuralMatcher matcher, int maxTitleLength, String defaultSectionName) {
        this.matcher = matcher;
        this.maxTitleLength = maxTitleLength;
        this.defaultSectionName = defaultSectionName;
    }

    public List<DocumentSection> detect(List<ContentBlock> blocks) {
        List<Integer> titleIndexes = new ArrayList<>();
        for (int i = 0; i < blocks.size(); i++) {
            if (isSectionTitle(blocks.get(i).text())) {
                titleIndexes.add(i);
            }
        }

        if (titleIndexes.isEmpty()) {
            int page = blocks.isEmpty() ? 0 : blocks.get(0).page();
            logger.debug("No section titles found; using '{}'", defaultSectionName);
            return List.of(new DocumentSection(defaultSectionName, defaultSectionName, page, blocks));
        }

        List<DocumentSection> sections = new ArrayList<>();
        Map<String, Integer> seenTitles = new HashMap<>();
        for (int s = 0; s < titleIndexes.size(); s++) {
            int titleIndex = titleIndexes.get(s);
            int end = s + 1 < titleIndexes.size() ? titleIndexes.get(s + 1) : blocks.size();
            ContentBlock titleBlock = blocks.get(titleIndex);
            String title = titleBlock.text().strip();

            List<ContentBlock> sectionBlocks = new ArrayList<>();
            if (s == 0) {
                // Lines before the first title belong to the first section.
                sectionBlocks.addAll(blocks.subList(0, titleIndex));
            }
            sectionBlocks.addAll(blocks.subList(titleIndex + 1, end));

            int occurrence = seenTitles.merge(title, 1, Integer::sum);
            String id = occurrence == 1 ? title : title + "#" + occurrence;
            sections.add(new DocumentSection(id, title, titleBlock.page(), sectionBlocks));
        }
        logger.debug("Detected {} sections", sections.size());
        return sections;
    }

    /** True if {@code text} reads as the title of a policy, rider or statute. */
    public boolean isSectionTitle(String text) {
        if (text == null) {
            return false;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty() || trimmed.length() > maxTitleLength) {
            return false;
        }
        if (matcher.isStructuralMarker(trimmed)) {
            return false;
        }
        if (SENTENCE_PATTERNS.stream().anyMatch(p -> p.matcher(trimmed).find())) {
            return false;
        }
        return LawNameHarvester.looksLikeLawName(trimmed)
                || TITLE_PATTERNS.stream().anyMatch(p -> p.matcher(trimmed).lookingAt());
    }
}
