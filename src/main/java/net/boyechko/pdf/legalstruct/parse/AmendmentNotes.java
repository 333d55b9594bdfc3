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
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Reads amendment notes such as "&lt;개정 2018. 3. 20., 2019. 1. 15.&gt;". */
public final class AmendmentNotes {
    private static final Pattern NOTE = Pattern.compile("<\\s*개정\\s*([\\d\\s.,]+)>");
    private static final Pattern DATE = Pattern.compile("\\d{4}\\.\\s*\\d{1,2}\\.\\s*\\d{1,2}\\.?");

    private AmendmentNotes() {}

    /** Returns the amendment dates in {@code text} in order of appearance, without a final dot. */
    public static List<String> dates(String text) {
        List<String> dates = new ArrayList<>();
        if (text == null || text.indexOf('<') < 0) {
            return dates;
        }
        Matcher note = NOTE.matcher(text);
        while (note.find()) {
            Matcher date = DATE.matcher(note.group(1));
            while (date.find()) {
                String value = date.group();
                if (value.endsWith(".")) {
                    value = value.substring(0, value.length() - 1);
                }
                dates.add(value);
            }
        }
        return dates;
    }
}
