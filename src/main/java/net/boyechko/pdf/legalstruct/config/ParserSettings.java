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
package net.boyechko.pdf.legalstruct.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Tunable parameters of the parser, loaded from YAML.
 *
 * <p>Defaults live in the classpath resource {@value #DEFAULT_RESOURCE}. A user file passed with
 * {@code --config} only needs the keys it changes; absent keys keep their default.
 */
public final class ParserSettings {
    public static final String DEFAULT_RESOURCE = "/legalstruct-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(ParserSettings.class);

    // Field names match the YAML keys.
    public String document_name;
    public String default_section_name;
    public Integer max_section_title_length;
    public Integer paragraph_lookbehind;
    public Integer title_preview_length;
    public List<String> self_reference_markers;

    public ParserSettings() {}

    /** Returns the built-in defaults. */
    public static ParserSettings defaults() {
        return fromResource(DEFAULT_RESOURCE);
    }

    /**
     * Load settings from a classpath resource.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static ParserSettings fromResource(String resourcePath) {
        try (InputStream inputStream = ParserSettings.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            ParserSettings settings = load(inputStream, resourcePath);
            settings.validate(resourcePath);
            logger.debug("Loaded parser settings from resource {}", resourcePath);
            return settings;
        } catch (IOException e) {
            throw new RuntimeException("Failed to load parser settings from " + resourcePath, e);
        }
    }

    /** Loads the defaults and applies every key present in {@code file} on top of them. */
    public static ParserSettings withOverrides(Path file) {
        ParserSettings overrides;
        try (InputStream inputStream = Files.newInputStream(file)) {
            overrides = load(inputStream, file.toString());
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read settings file " + file, e);
        }
        ParserSettings merged = defaults().overriddenBy(overrides);
        merged.validate(file.toString());
        logger.info("Loaded parser settings from {}", file);
        return merged;
    }

    private static ParserSettings load(InputStream inputStream, String origin) {
        try {
            Yaml yaml = new Yaml(new Constructor(ParserSettings.class, new LoaderOptions()));
            ParserSettings settings = yaml.load(inputStream);
            // An empty document loads as null.
            return settings != null ? settings : new ParserSettings();
        } catch (YAMLException e) {
            throw new IllegalArgumentException(
                    "Invalid parser settings in " + origin + ": " + e.getMessage(), e);
        }
    }

    private ParserSettings overriddenBy(ParserSettings other) {
        ParserSettings merged = copy();
        if (other.document_name != null) merged.document_name = other.document_name;
        if (other.default_section_name != null)
            merged.default_section_name = other.default_section_name;
        if (other.max_section_title_length != null)
            merged.max_section_title_length = other.max_section_title_length;
        if (other.paragraph_lookbehind != null)
            merged.paragraph_lookbehind = other.paragraph_lookbehind;
        if (other.title_preview_length != null)
            merged.title_preview_length = other.title_preview_length;
        if (other.self_reference_markers != null)
            merged.self_reference_markers = new ArrayList<>(other.self_reference_markers);
        return merged;
    }

    /** Returns a copy naming the document being parsed. A blank name clears it. */
    public ParserSettings withDocumentName(String documentName) {
        ParserSettings copy = copy();
        copy.document_name = documentName == null || documentName.isBlank() ? null : documentName;
        return copy;
    }

    private ParserSettings copy() {
        ParserSettings copy = new ParserSettings();
        copy.document_name = document_name;
        copy.default_section_name = default_section_name;
        copy.max_section_title_length = max_section_title_length;
        copy.paragraph_lookbehind = paragraph_lookbehind;
        copy.title_preview_length = title_preview_length;
        copy.self_reference_markers =
                self_reference_markers != null ? new ArrayList<>(self_reference_markers) : null;
        return copy;
    }

    private void validate(String origin) {
        List<String> problems = new ArrayList<>();
        if (default_section_name == null || default_section_name.isBlank()) {
            problems.add("default_section_name must not be empty");
        }
        requirePositive(max_section_title_length, "max_section_title_length", problems);
        requirePositive(paragraph_lookbehind, "paragraph_lookbehind", problems);
        requirePositive(title_preview_length, "title_preview_length", problems);
        if (self_reference_markers == null) {
            problems.add("self_reference_markers must be a list");
        }
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException(
                    "Invalid parser settings in " + origin + ": " + String.join("; ", problems));
        }
    }

    private static void requirePositive(Integer value, String key, List<String> problems) {
        if (value == null || value <= 0) {
            problems.add(key + " must be a positive integer");
        }
    }

    public String getDocumentName() {
        return document_name;
    }

    public String getDefaultSectionName() {
        return default_section_name;
    }

    public int getMaxSectionTitleLength() {
        return max_section_title_length;
    }

    public int getParagraphLookbehind() {
        return paragraph_lookbehind;
    }

    public int getTitlePreviewLength() {
        return title_preview_length;
    }

    public List<String> getSelfReferenceMarkers() {
        return List.copyOf(self_reference_markers);
    }
}
