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

import org.slf4j.event.Level;

/**
 * How much the command line prints while parsing, from {@link #QUIET} (errors and the final
 * status) to {@link #DEBUG} (everything, including debug logs). Each level also fixes the
 * threshold for application log output.
 */
public enum VerbosityLevel {
    QUIET(Level.ERROR),
    /** Phase boxes and the summary. */
    NORMAL(Level.WARN),
    /** Adds node statistics and each individual issue. */
    VERBOSE(Level.INFO),
    DEBUG(Level.DEBUG);

    private final Level logThreshold;

    VerbosityLevel(Level logThreshold) {
        this.logThreshold = logThreshold;
    }

    /** Lowest log level that reaches the console at this verbosity. */
    public Level logThreshold() {
        return logThreshold;
    }

    /** True if output meant for {@code required} is shown at this verbosity. */
    public boolean shouldShow(VerbosityLevel required) {
        return compareTo(required) >= 0;
    }
}
