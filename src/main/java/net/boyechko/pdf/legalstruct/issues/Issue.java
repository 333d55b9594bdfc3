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
package net.boyechko.pdf.legalstruct.issues;

/** Represents a problem found while parsing a legal document. */
public final class Issue {
    private final IssueType type;
    private final IssueSeverity severity;
    private final IssueLocation where;
    private final String message;

    public Issue(IssueType type, IssueSeverity sev, String message) {
        this(type, sev, new IssueLocation(), message);
    }

    public Issue(IssueType type, IssueSeverity sev, IssueLocation where, String message) {
        this.type = type;
        this.severity = sev;
        this.where = where != null ? where : new IssueLocation();
        this.message = message;
    }

    public IssueType type() {
        return type;
    }

    public IssueSeverity severity() {
        return severity;
    }

    public IssueLocation where() {
        return where;
    }

    public String message() {
        return message;
    }

    @Override
    public String toString() {
        String location = where.toString();
        return severity + " " + type + ": " + message + (location.isEmpty() ? "" : " " + location);
    }
}
