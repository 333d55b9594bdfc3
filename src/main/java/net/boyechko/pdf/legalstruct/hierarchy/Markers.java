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
package net.boyechko.pdf.legalstruct.hierarchy;

import java.util.List;
import java.util.Locale;

/**
 * Numbering glyphs used by Korean statutes and policy terms.
 *
 * <p>Paragraphs are numbered with circled numerals ①…⑳, subitems with the fixed Hangul sequence
 * 가나다…하, and subsubitems with Roman numerals i…x.
 */
public final class Markers {
    private Markers() {}

    public static final String CIRCLED_NUMERALS = "①②③④⑤⑥⑦⑧⑨⑩⑪⑫⑬⑭⑮⑯⑰⑱⑲⑳";
    public static final String SUBITEM_LETTERS = "가나다라마바사아자차카타파하";

    private static final List<String> ROMAN_NUMERALS =
            List.of("i", "ii", "iii", "iv", "v", "vi", "vii", "viii", "ix", "x");
    private static final String ROMAN_GLYPHS = "ⅰⅱⅲⅳⅴⅵⅶⅷⅸⅹ";

    /** Returns the circled numeral for 1..20, or null when out of range. */
    public static String circled(int number) {
        if (number < 1 || number > CIRCLED_NUMERALS.length()) {
            return null;
        }
        return String.valueOf(CIRCLED_NUMERALS.charAt(number - 1));
    }

    /** Returns the 1-based value of a circled numeral, or 0 if {@code glyph} is not one. */
    public static int circledValue(char glyph) {
        return CIRCLED_NUMERALS.indexOf(glyph) + 1;
    }

    /** Returns the subitem letter for 1..14, or null when out of range. */
    public static String subitemLetter(int number) {
        if (number < 1 || number > SUBITEM_LETTERS.length()) {
            return null;
        }
        return String.valueOf(SUBITEM_LETTERS.charAt(number - 1));
    }

    /** Returns the 1-based position of a subitem letter, or 0 if {@code letter} is not one. */
    public static int subitemValue(char letter) {
        return SUBITEM_LETTERS.indexOf(letter) + 1;
    }

    /**
     * Returns the value 1..10 of a Roman numeral written either as ASCII letters or as one Unicode
     * Roman numeral glyph, in either case. Returns 0 for anything else.
     */
    public static int romanValue(String numeral) {
        if (numeral == null) {
            return 0;
        }
        String lower = numeral.trim().toLowerCase(Locale.ROOT);
        if (lower.length() == 1) {
            int glyphIndex = ROMAN_GLYPHS.indexOf(lower.charAt(0));
            if (glyphIndex >= 0) {
                return glyphIndex + 1;
            }
        }
        return ROMAN_NUMERALS.indexOf(lower) + 1;
    }
}
