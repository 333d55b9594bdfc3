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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/** Picks the block source that matches an input path. */
public final class BlockSources {
    private BlockSources() {}

    /**
     * Returns a {@link LayoutResultsBlockSource} for a directory and a {@link
     * PdfTextLayerBlockSource} for a {@code .pdf} file.
     *
     * @throws BlockSourceException for anything else
     */
    public static BlockSource forPath(Path input, String password) throws BlockSourceException {
        if (input == null || !Files.exists(input)) {
            throw new BlockSourceException("Input not found", input);
        }
        if (Files.isDirectory(input)) {
            return new LayoutResultsBlockSource(input);
        }
        String name = input.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".pdf")) {
            return new PdfTextLayerBlockSource(input, password);
        }
        throw new BlockSourceException(
                "Input must be a layout results directory or a PDF file", input);
    }
}
