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

/**
 * One text fragment of the source document, in reading order.
 *
 * @param page Page index, 0-based.
 * @param text Final text of the block; never null, possibly empty.
 * @param insideBox True if the block lies inside a detected bordered box.
 * @param boxId Id of that box, or null. Only meaningful when {@code insideBox} is true.
 */
public record ContentBlock(int page, String text, boolean insideBox, Integer boxId) {
    public ContentBlock {
        text = text != null ? text : "";
        page = Math.max(page, 0);
    }

    /** A plain block outside any box. */
    public static ContentBlock of(int page, String text) {
        return new ContentBlock(page, text, false, null);
    }

    /** A block inside the box with the given id. */
    public static ContentBlock inBox(int page, String text, int boxId) {
        return new ContentBlock(page, text, true, boxId);
    }
}
