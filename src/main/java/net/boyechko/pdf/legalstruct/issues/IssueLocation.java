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

/** Location of a problem: the source page and the id of the node involved. */
public final class IssueLocation {
    private final Integer page; // 0-based; null if document-level
    private final String nodeId; // may be null if not applicable

    public IssueLocation() {
        this(null, null);
    }

    public IssueLocation(String nodeId) {
        this(null, nodeId);
    }

    public IssueLocation(Integer page, String nodeId) {
        this.page = page;
        this.nodeId = nodeId;
    }

    public Integer page() {
        return page;
    }

    public String nodeId() {
        return nodeId;
    }

    @Override
    public String toString() {
        String output = "";
        if (page != null) {
            output += "(p. " + (page + 1) + ")";
        }
        if (nodeId != null) {
            output += " (" + nodeId + ")";
        }
        return output.trim();
    }
}
