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

import java.util.List;
import org.junit.jupiter.api.Test;

class AmendmentNotesTest {

    @Test
    void collectsEveryDateOfEveryNote() {
        assertEquals(
                List.of("2019. 4. 1", "2021. 12. 30", "2023.1.5"),
                AmendmentNotes.dates(
                        "회사는 지급합니다. <개정 2019. 4. 1., 2021. 12. 30.> 단서 <개정 2023.1.5>"));
    }

    @Test
    void otherNotesAreIgnored() {
        assertTrue(AmendmentNotes.dates("<신설 2020. 1. 1.>").isEmpty());
        assertTrue(AmendmentNotes.dates("개정 2020. 1. 1.").isEmpty());
        assertTrue(AmendmentNotes.dates(null).isEmpty());
    }
}
