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
package net.boyechko.pdf.legalstruct.document;

import java.util.List;

/** Supplies the ordered content blocks of one document. */
public interface BlockSource {

    /**
     * Loads every block, ordered by page and by position within the page.
     *
     * @throws BlockSourceException if the source is missing or unreadable
     */
    List<ContentBlock> load() throws BlockSourceException;

    /** Short description for log messages, e.g. the input path. */
    String describe();
}
