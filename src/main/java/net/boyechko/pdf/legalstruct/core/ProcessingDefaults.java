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
package net.boyechko.pdf.legalstruct.core;

import java.nio.file.Path;

public final class ProcessingDefaults {
    public static final String OUTPUT_DIR_SUFFIX = "_hierarchy";

    private ProcessingDefaults() {}

    /**
     * Returns {@code <parent>/<base>_hierarchy} for an input file or layout results directory,
     * where base is the file name without its extension.
     */
    public static Path defaultOutputDirectory(Path input) {
        Path absolute = input.toAbsolutePath().normalize();
        String name = absolute.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        Path parent = absolute.getParent();
        String dirName = base + OUTPUT_DIR_SUFFIX;
        return parent != null ? parent.resolve(dirName) : Path.of(dirName);
    }
}
