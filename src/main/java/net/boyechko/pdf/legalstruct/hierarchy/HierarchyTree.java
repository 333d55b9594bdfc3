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
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.pdf.legalstruct.reference.Reference;

/** Navigation helpers for a parsed hierarchy. */
public final class HierarchyTree {
    private HierarchyTree() {}

    private static final Pattern UNIT_STEP =
            Pattern.compile("^제\\s*(\\d{1,9})\\s*([편장절관조])(?:\\s*의\\s*(\\d{1,9}))?$");
    private static final Pattern ITEM_STEP = Pattern.compile("^\\d{1,9}$");
    private static final int TREE_TITLE_LENGTH = 35;

    /** What one step of a lookup path selects: a node type, a number and an optional branch. */
    private record Step(NodeType type, int number, Integer branch) {
        boolean matches(HierarchyNode node) {
            return node.getType() == type
                    && node.getNumber() != null
                    && node.getNumber() == number
                    && Objects.equals(node.getBranch(), branch);
        }
    }

    /**
     * Finds a descendant of {@code start} by a dot-separated path of markers, e.g. "제2조",
     * "제2조.②", "제2조.1.가" or "제1장.제3조의2.①.1.가.(ⅰ)".
     *
     * <p>Paragraphs may be left out of the path: "제2조.1" finds item 1 whether it sits directly
     * under the article or under one of its paragraphs.
     */
    public static Optional<HierarchyNode> find(HierarchyNode start, String path) {
        if (start == null || path == null) {
            return Optional.empty();
        }
        HierarchyNode current = start;
        for (String part : path.split("\\.")) {
            if (part.isBlank()) {
                continue;
            }
            Step step = parseStep(part.strip());
            if (step == null) {
                return Optional.empty();
            }
            HierarchyNode next = findChild(current, step);
            if (next == null) {
                return Optional.empty();
            }
            current = next;
        }
        return Optional.of(current);
    }

    private static HierarchyNode findChild(HierarchyNode parent, Step step) {
        for (HierarchyNode child : parent.getChildren()) {
            if (step.matches(child)) {
                return child;
            }
        }
        if (step.type() == NodeType.PARAGRAPH) {
            return null;
        }
        for (HierarchyNode child : parent.getChildren()) {
            if (child.getType() == NodeType.PARAGRAPH) {
                for (HierarchyNode grandchild : child.getChildren()) {
                    if (step.matches(grandchild)) {
                        return grandchild;
                    }
                }
            }
        }
        return null;
    }

    private static Step parseStep(String part) {
        Matcher m = UNIT_STEP.matcher(part);
        if (m.matches()) {
            NodeType type =
                    switch (m.group(2)) {
                        case "편" -> NodeType.PART;
                        case "장" -> NodeType.CHAPTER;
                        case "절" -> NodeType.CLAUSE_GROUP;
                        case "관" -> NodeType.SUBDIVISION;
                        default -> NodeType.ARTICLE;
                    };
            Integer branch = m.group(3) != null ? Integer.valueOf(m.group(3)) : null;
            return new Step(type, Integer.parseInt(m.group(1)), branch);
        }
        if (part.length() == 1 && Markers.circledValue(part.charAt(0)) > 0) {
            return new Step(NodeType.PARAGRAPH, Markers.circledValue(part.charAt(0)), null);
        }
        if (ITEM_STEP.matcher(part).matches()) {
            return new Step(NodeType.ITEM, Integer.parseInt(part), null);
        }
        if (part.length() == 1 && Markers.subitemValue(part.charAt(0)) > 0) {
            return new Step(NodeType.SUBITEM, Markers.subitemValue(part.charAt(0)), null);
        }
        int roman = Markers.romanValue(part.replaceAll("[()（）]", ""));
        if (roman > 0) {
            return new Step(NodeType.SUBSUBITEM, roman, null);
        }
        return null;
    }

    /** Returns every node of {@code type} under and including {@code root}, in document order. */
    public static List<HierarchyNode> allOfType(HierarchyNode root, NodeType type) {
        List<HierarchyNode> result = new ArrayList<>();
        collectOfType(root, type, result);
        return result;
    }

    private static void collectOfType(HierarchyNode node, NodeType type, List<HierarchyNode> out) {
        if (node.getType() == type) {
            out.add(node);
        }
        for (HierarchyNode child : node.getChildren()) {
            collectOfType(child, type, out);
        }
    }

    /** Returns the content of {@code node} and all its descendants, newline-joined. */
    public static String fullText(HierarchyNode node) {
        List<String> texts = new ArrayList<>();
        collectText(node, texts);
        return String.join("\n", texts);
    }

    private static void collectText(HierarchyNode node, List<String> out) {
        if (!node.getContent().isEmpty()) {
            out.add(node.getContent());
        }
        for (HierarchyNode child : node.getChildren()) {
            collectText(child, out);
        }
    }

    /** Returns every reference under {@code root}, depth first in document order. */
    public static List<Reference> collectReferences(HierarchyNode root) {
        List<Reference> refs = new ArrayList<>();
        collectReferences(root, refs);
        return refs;
    }

    private static void collectReferences(HierarchyNode node, List<Reference> out) {
        out.addAll(node.getReferences());
        for (HierarchyNode child : node.getChildren()) {
            collectReferences(child, out);
        }
    }

    /**
     * Renders the tree one node per line as "│   │   ├── [marker] title", down to {@code
     * maxDepth} levels below {@code root}.
     */
    public static String toIndentedTreeString(HierarchyNode root, int maxDepth) {
        StringBuilder sb = new StringBuilder();
        appendTree(root, 0, maxDepth, sb);
        return sb.toString();
    }

    private static void appendTree(HierarchyNode node, int depth, int maxDepth, StringBuilder sb) {
        if (depth > maxDepth) {
            return;
        }
        String marker = node.getMarker().isEmpty() ? node.getType().jsonName() : node.getMarker();
        String title = node.getTitle();
        if (title.length() > TREE_TITLE_LENGTH) {
            title = title.substring(0, TREE_TITLE_LENGTH) + "...";
        }
        sb.append("│   ".repeat(depth))
                .append("├── [")
                .append(marker)
                .append("] ")
                .append(title)
                .append('\n');
        for (HierarchyNode child : node.getChildren()) {
            appendTree(child, depth + 1, maxDepth, sb);
        }
    }
}
