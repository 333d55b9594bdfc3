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
package net.boyechko.pdf.legalstruct.hierarchy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import net.boyechko.pdf.legalstruct.reference.Reference;

/**
 * One node of the parsed document tree.
 *
 * <p>A node owns its children and the references found in its text. The {@code id} is the
 * dot-delimited path of markers from the section down to this node, assigned once when the node
 * is attached. After its section has been parsed a node only changes by content or reference
 * appends.
 */
public final class HierarchyNode {
    public static final String ROOT_ID = "root";

    /** Metadata keys written by the parser. */
    public static final String AUTO_GENERATED = "auto_generated";

    public static final String SEQUENCE_ANOMALY = "sequence_anomaly";
    public static final String SPECIAL_TYPE = "special_type";
    public static final String GLOBAL = "global";
    public static final String INLINE = "inline";
    public static final String BOX_BOUND = "box_bound";
    public static final String BOX_ID = "box_id";
    public static final String LAW_NUMBER = "law_number";
    public static final String LAW_NAME = "law_name";
    public static final String AMENDMENTS = "amendments";
    public static final String CAPTION = "caption";

    private final String id;
    private final NodeType type;
    private final int level;
    private Integer number;
    private Integer branch;
    private String marker = "";
    private String title = "";
    private String content = "";
    private int page;

    private final List<HierarchyNode> children = new ArrayList<>();
    private final List<Reference> references = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();

    public HierarchyNode(String id, NodeType type) {
        this(id, type, type.level());
    }

    public HierarchyNode(String id, NodeType type, int level) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.level = level;
    }

    /** Creates the Document node that holds every section. */
    public static HierarchyNode documentRoot() {
        return new HierarchyNode(ROOT_ID, NodeType.DOCUMENT);
    }

    public String getId() {
        return id;
    }

    public NodeType getType() {
        return type;
    }

    public int getLevel() {
        return level;
    }

    public Integer getNumber() {
        return number;
    }

    public void setNumber(Integer number) {
        this.number = number;
    }

    /** Returns the M of "제N조의M", or null when the unit is not a branch. */
    public Integer getBranch() {
        return branch;
    }

    public void setBranch(Integer branch) {
        this.branch = branch;
    }

    public String getMarker() {
        return marker;
    }

    public void setMarker(String marker) {
        this.marker = marker != null ? marker : "";
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title != null ? title : "";
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content != null ? content : "";
    }

    /** Appends a continuation line, joining with a newline when content already exists. */
    public void appendContent(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        content = content.isEmpty() ? text : content + "\n" + text;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    public List<HierarchyNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public void addChild(HierarchyNode child) {
        children.add(Objects.requireNonNull(child, "child"));
    }

    public boolean hasChildWithId(String childId) {
        for (HierarchyNode child : children) {
            if (child.id.equals(childId)) {
                return true;
            }
        }
        return false;
    }

    public List<Reference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public void addReferences(Collection<Reference> refs) {
        references.addAll(refs);
    }

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
    }

    public Object getMetadata(String key) {
        return metadata.get(key);
    }

    public boolean hasFlag(String key) {
        return Boolean.TRUE.equals(metadata.get(key));
    }

    public boolean isAutoGenerated() {
        return hasFlag(AUTO_GENERATED);
    }

    /** Returns the structural level of this node, or null for Document and Special nodes. */
    public Level structuralLevel() {
        return type.structuralLevel();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HierarchyNode other)) return false;
        return level == other.level
                && page == other.page
                && id.equals(other.id)
                && type == other.type
                && Objects.equals(number, other.number)
                && Objects.equals(branch, other.branch)
                && marker.equals(other.marker)
                && title.equals(other.title)
                && content.equals(other.content)
                && children.equals(other.children)
                && references.equals(other.references)
                && metadata.equals(other.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type, level, number, branch, marker, title, page);
    }

    @Override
    public String toString() {
        return type.jsonName() + "[" + id + "]";
    }
}
