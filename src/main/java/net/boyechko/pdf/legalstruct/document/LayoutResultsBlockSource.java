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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the per-page results written by the layout/OCR stage: a directory of {@code
 * page_*_res.json} files, each holding {@code page_index} and a {@code parsing_res_list} of blocks.
 *
 * <p>Pages are ordered numerically by {@code page_index}; blocks keep their order within a page.
 * Missing fields take safe defaults (empty text, page 0, outside any box).
 */
public class LayoutResultsBlockSource implements BlockSource {
    private static final Logger logger = LoggerFactory.getLogger(LayoutResultsBlockSource.class);

    public static final String FILE_GLOB = "page_*_res.json";
    private static final Pattern FILE_PAGE_NUMBER = Pattern.compile("page_(\\d{1,9})_res\\.json");

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private final Path directory;

    public LayoutResultsBlockSource(Path directory) {
        this.directory = directory;
    }

    private record PageResult(int pageIndex, String fileName, List<ContentBlock> blocks) {}

    @Override
    public List<ContentBlock> load() throws BlockSourceException {
        if (directory == null || !Files.isDirectory(directory)) {
            throw new BlockSourceException("Layout results directory not found", directory);
        }

        List<PageResult> pages = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, FILE_GLOB)) {
            for (Path file : files) {
                pages.add(readPage(file));
            }
        } catch (IOException e) {
            throw new BlockSourceException(
                    "Cannot list layout results: " + e.getMessage(), directory, e);
        }

        if (pages.isEmpty()) {
            throw new BlockSourceException("No " + FILE_GLOB + " files found", directory);
        }

        pages.sort(
                Comparator.comparingInt(PageResult::pageIndex)
                        .thenComparing(PageResult::fileName));

        List<ContentBlock> blocks = new ArrayList<>();
        for (PageResult page : pages) {
            blocks.addAll(page.blocks());
        }
        logger.info("Loaded {} blocks from {} pages in {}", blocks.size(), pages.size(), directory);
        return blocks;
    }

    @Override
    public String describe() {
        return "layout results in " + directory;
    }

    private PageResult readPage(Path file) throws BlockSourceException {
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new BlockSourceException("Cannot read " + file.getFileName(), file, e);
        }
        String fileName = file.getFileName().toString();
        if (root == null || !root.isObject()) {
            logger.warn("{} is not a JSON object; treating it as an empty page", fileName);
            return new PageResult(pageFromFileName(fileName), fileName, List.of());
        }

        JsonNode pageNode = root.get("page_index");
        int pageIndex =
                pageNode != null && pageNode.canConvertToInt()
                        ? pageNode.asInt()
                        : pageFromFileName(fileName);

        List<ContentBlock> blocks = new ArrayList<>();
        JsonNode list = root.get("parsing_res_list");
        if (list == null || !list.isArray()) {
            logger.warn("{} has no parsing_res_list", fileName);
            return new PageResult(pageIndex, fileName, blocks);
        }
        for (JsonNode item : list) {
            if (!item.isObject()) {
                logger.warn("Skipping non-object block in {}", fileName);
                continue;
            }
            blocks.add(
                    new ContentBlock(
                            pageIndex,
                            textOf(item, "block_content"),
                            item.path("inside_box").asBoolean(false),
                            intOrNull(item, "box_id")));
        }
        logger.debug("Read {} blocks from {}", blocks.size(), fileName);
        return new PageResult(pageIndex, fileName, blocks);
    }

    private static String textOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText();
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : null;
    }

    private static int pageFromFileName(String fileName) {
        Matcher m = FILE_PAGE_NUMBER.matcher(fileName);
        return m.matches() ? Integer.parseInt(m.group(1)) : 0;
    }
}
