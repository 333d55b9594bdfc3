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
package net.boyechko.pdf.legalstruct.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;
import net.boyechko.pdf.legalstruct.reference.Reference;
import net.boyechko.pdf.legalstruct.reference.ReferenceType;

/**
 * Reads and writes the two output artifacts: the node tree and the flat reference list.
 *
 * <p>Every field is written, absent values as {@code null}, so that reading a file back gives a
 * tree equal to the one written.
 */
public final class HierarchyJson {
    public static final String HIERARCHY_FILE = "document_hierarchy.json";
    public static final String REFERENCES_FILE = "document_hierarchy_references.json";

    private static final ObjectMapper JSON_MAPPER =
            new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private HierarchyJson() {}

    public static String toJson(HierarchyNode node) throws IOException {
        return JSON_MAPPER.writeValueAsString(nodeToJson(node));
    }

    public static void write(HierarchyNode node, Path file) throws IOException {
        createParent(file);
        JSON_MAPPER.writeValue(file.toFile(), nodeToJson(node));
    }

    public static HierarchyNode fromJson(String json) throws IOException {
        return nodeFromJson(JSON_MAPPER.readTree(json));
    }

    public static HierarchyNode read(Path file) throws IOException {
        return nodeFromJson(JSON_MAPPER.readTree(file.toFile()));
    }

    /** Writes {@code {"references": [...]}}. */
    public static void writeReferences(List<Reference> refs, Path file) throws IOException {
        createParent(file);
        ObjectNode root = JSON_MAPPER.createObjectNode();
        ArrayNode array = root.putArray("references");
        for (Reference ref : refs) {
            array.add(referenceToJson(ref));
        }
        JSON_MAPPER.writeValue(file.toFile(), root);
    }

    public static List<Reference> readReferences(Path file) throws IOException {
        JsonNode root = JSON_MAPPER.readTree(file.toFile());
        JsonNode array = root != null ? root.get("references") : null;
        if (array == null || !array.isArray()) {
            throw new IOException("No references array in " + file);
        }
        List<Reference> refs = new ArrayList<>();
        for (JsonNode item : array) {
            refs.add(referenceFromJson(item));
        }
        return refs;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static ObjectNode nodeToJson(HierarchyNode node) {
        ObjectNode json = JSON_MAPPER.createObjectNode();
        json.put("id", node.getId());
        json.put("type", node.getType().jsonName());
        json.put("level", node.getLevel());
        json.put("number", node.getNumber());
        json.put("branch", node.getBranch());
        json.put("marker", node.getMarker());
        json.put("title", node.getTitle());
        json.put("content", node.getContent());
        json.put("page", node.getPage());

        ArrayNode children = json.putArray("children");
        for (HierarchyNode child : node.getChildren()) {
            children.add(nodeToJson(child));
        }
        ArrayNode references = json.putArray("references");
        for (Reference ref : node.getReferences()) {
            references.add(referenceToJson(ref));
        }
        ObjectNode metadata = json.putObject("metadata");
        for (Map.Entry<String, Object> entry : node.getMetadata().entrySet()) {
            metadata.set(entry.getKey(), JSON_MAPPER.valueToTree(entry.getValue()));
        }
        return json;
    }

    private static ObjectNode referenceToJson(Reference ref) {
        ObjectNode json = JSON_MAPPER.createObjectNode();
        json.put("ref_type", ref.type().jsonName());
        json.put("source_id", ref.sourceId());
        json.put("target_law", ref.targetLaw());
        json.put("target_jo", ref.targetArticle());
        json.put("target_jo_branch", ref.targetArticleBranch());
        json.put("target_hang", ref.targetParagraph());
        json.put("target_ho", ref.targetItem());
        json.put("target_mok", ref.targetSubitem());
        json.put("raw_text", ref.rawText());
        json.put("resolved_id", ref.resolvedId());
        return json;
    }

    private static HierarchyNode nodeFromJson(JsonNode json) throws IOException {
        if (json == null
                || !json.isObject()
                || !json.hasNonNull("id")
                || !json.hasNonNull("type")) {
            throw new IOException("Not a hierarchy node: " + abbreviate(json));
        }
        NodeType type;
        try {
            type = NodeType.fromJsonName(json.get("type").asText());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        HierarchyNode node =
                new HierarchyNode(
                        json.get("id").asText(), type, json.path("level").asInt(type.level()));
        node.setNumber(intOrNull(json, "number"));
        node.setBranch(intOrNull(json, "branch"));
        node.setMarker(textOrNull(json, "marker"));
        node.setTitle(textOrNull(json, "title"));
        node.setContent(textOrNull(json, "content"));
        node.setPage(json.path("page").asInt(0));

        for (JsonNode child : json.path("children")) {
            node.addChild(nodeFromJson(child));
        }
        List<Reference> refs = new ArrayList<>();
        for (JsonNode ref : json.path("references")) {
            refs.add(referenceFromJson(ref));
        }
        node.addReferences(refs);

        JsonNode metadata = json.path("metadata");
        Iterator<Map.Entry<String, JsonNode>> fields = metadata.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            node.putMetadata(
                    field.getKey(), JSON_MAPPER.treeToValue(field.getValue(), Object.class));
        }
        return node;
    }

    private static Reference referenceFromJson(JsonNode json) throws IOException {
        if (json == null || !json.isObject() || !json.hasNonNull("ref_type")) {
            throw new IOException("Not a reference: " + abbreviate(json));
        }
        ReferenceType type;
        try {
            type = ReferenceType.fromJsonName(json.get("ref_type").asText());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }
        Reference ref =
                new Reference(
                        type,
                        textOrNull(json, "source_id"),
                        textOrNull(json, "target_law"),
                        intOrNull(json, "target_jo"),
                        intOrNull(json, "target_jo_branch"),
                        intOrNull(json, "target_hang"),
                        intOrNull(json, "target_ho"),
                        intOrNull(json, "target_mok"),
                        textOrNull(json, "raw_text"));
        String resolvedId = textOrNull(json, "resolved_id");
        if (resolvedId != null) {
            ref.resolveTo(resolvedId);
        }
        return ref;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : null;
    }

    private static String abbreviate(JsonNode json) {
        String text = String.valueOf(json);
        return text.length() <= 60 ? text : text.substring(0, 60) + "...";
    }
}
