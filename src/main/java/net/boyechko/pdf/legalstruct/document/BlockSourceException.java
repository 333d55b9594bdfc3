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

import java.nio.file.Path;

/** Thrown when the blocks of a document cannot be loaded. Parsing cannot start without them. */
public class BlockSourceException extends Exception {
    private final Path path;

    public BlockSourceException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public BlockSourceException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /** Returns the file or directory that could not be read. */
    public Path getPath() {
        return path;
    }
}
