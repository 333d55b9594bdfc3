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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the names of statutes a document quotes, so that citations of those statutes can be
 * told apart from citations of the document's own articles.
 *
 * <p>A name is harvested from a law header line ("【법규1】 민법") or from a line that consists only
 * of a statute name ending in 법, 령, 규정 or 규칙.
 */
public final class LawNameHarvester {
    private static final Logger logger = LoggerFactory.getLogger(LawNameHarvester.class);

    private static final int MAX_NAME_LENGTH = 40;

    private static final Pattern LAW_HEADER = Pattern.compile("^[\\[【]법규\\s*\\d*[\\]】]\\s*(.*)$");
    private static final Pattern BARE_LAW_NAME =
            Pattern.compile("^[가-힣][가-힣\\s]*(?:법|령|규정|규칙)$");

    // Common nouns that end like a statute name.
    private static final List<String> NON_LAW_SUFFIXES = List.of("방법", "요령");
    private static final Set<String> GENERIC_WORDS = Set.of("법령", "규정", "규칙", "법규");

    private LawNameHarvester() {}

    public static Set<String> harvest(List<String> fragments) {
        Set<String> names = new LinkedHashSet<>();
        for (String fragment : fragments) {
            if (fragment == null) continue;
            String text = fragment.strip();
            Matcher header = LAW_HEADER.matcher(text);
            if (header.matches()) {
                String name = header.group(1).strip();
                if (!name.isEmpty() && name.length() <= MAX_NAME_LENGTH) {
                    names.add(name);
                }
            } else if (looksLikeLawName(text)) {
                names.add(text);
            }
        }
        if (!names.isEmpty()) {
            logger.debug("Harvested {} law names: {}", names.size(), names);
        }
        return names;
    }

    /** True if the whole of {@code text} reads as a statute name, e.g. "개인정보 보호법". */
    public static boolean looksLikeLawName(String text) {
        if (text == null || text.length() > MAX_NAME_LENGTH) {
            return false;
        }
        if (!BARE_LAW_NAME.matcher(text).matches() || GENERIC_WORDS.contains(text)) {
            return false;
        }
        return NON_LAW_SUFFIXES.stream().noneMatch(text::endsWith);
    }
}
