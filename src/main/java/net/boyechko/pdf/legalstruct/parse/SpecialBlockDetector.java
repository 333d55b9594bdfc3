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

/**
 * Recognizes headers of blocks that stand outside the article hierarchy: appendix tables
 * ([별표1]), attached forms ([별지1]), glossaries (※ 용어의 정의), notes (비고) and law citations
 * (【법규1】 민법).
 *
 * <p>Such a header resets the whole parse context; everything up to the next Article-or-higher
 * heading belongs to the block.
 */
public class SpecialBlockDetector {
    public static final String APPENDIX = "appendix";
    public static final String ATTACHMENT = "attachment";
    public static final String GLOSSARY = "glossary";
    public static final String NOTE = "note";
    public static final String LAW_CITATION = "law_citation";

    private static final Pattern APPENDIX_HEADER = Pattern.compile("^[\\[【]별표\\s*(\\d{0,9})[\\]】]");
    private static final Pattern ATTACHMENT_HEADER =
            Pattern.compile("^[\\[【]별지\\s*(\\d{0,9})[\\]】]");
    private static final Pattern GLOSSARY_HEADER = Pattern.compile("^※\\s*용어");
    private static final Pattern NOTE_HEADER = Pattern.compile("^비고\\s*(?:$|\\d)");
    private static final Pattern LAW_HEADER =
            Pattern.compile("^[\\[【]법규\\s*(\\d{0,9})[\\]】]\\s*(.*)$", Pattern.DOTALL);

    /**
     * A recognized header.
     *
     * @param specialType One of {@link #APPENDIX}, {@link #ATTACHMENT}, {@link #GLOSSARY}, {@link
     *     #NOTE}, {@link #LAW_CITATION}.
     * @param marker Normalized marker used in node ids, e.g. "[별표1]".
     * @param title Preview of the header line.
     * @param lawNumber N of 【법규N】, or null.
     * @param lawName Statute name following 【법규N】, or null.
     */
    public record SpecialBlock(
            String specialType, String marker, String title, Integer lawNumber, String lawName) {}

    private final int titlePreviewLength;

    public SpecialBlockDetector() {
        this(StructuralMatcher.DEFAULT_TITLE_PREVIEW);
    }

    public SpecialBlockDetector(int titlePreviewLength) {
        this.titlePreviewLength = titlePreviewLength;
    }

    public Optional<SpecialBlock> detect(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.strip();
        String title = preview(trimmed);

        Matcher m = APPENDIX_HEADER.matcher(trimmed);
        if (m.lookingAt()) {
            return Optional.of(
                    new SpecialBlock(APPENDIX, "[별표" + m.group(1) + "]", title, null, null));
        }
        m = ATTACHMENT_HEADER.matcher(trimmed);
        if (m.lookingAt()) {
            return Optional.of(
                    new SpecialBlock(ATTACHMENT, "[별지" + m.group(1) + "]", title, null, null));
        }
        if (GLOSSARY_HEADER.matcher(trimmed).lookingAt()) {
            return Optional.of(new SpecialBlock(GLOSSARY, "※용어정의", title, null, null));
        }
        if (NOTE_HEADER.matcher(trimmed).lookingAt()) {
            return Optional.of(new SpecialBlock(NOTE, "비고", title, null, null));
        }
        m = LAW_HEADER.matcher(trimmed);
        if (m.matches()) {
            Integer number = m.group(1).isEmpty() ? null : Integer.valueOf(m.group(1));
            String name = m.group(2).strip();
            return Optional.of(
                    new SpecialBlock(
                            LAW_CITATION,
                            "【법규" + m.group(1) + "】",
                            title,
                            number,
                            name.isEmpty() ? null : name));
        }
        return Optional.empty();
    }

    private String preview(String text) {
        return text.length() <= titlePreviewLength ? text : text.substring(0, titlePreviewLength);
    }
}
