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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Tests for LayoutResultsBlockSource. */
class LayoutResultsBlockSourceTest {

    @TempDir Path tempDir;

    private void writePage(String fileName, String json) throws IOException {
        Files.writeString(tempDir.resolve(fileName), json);
    }

    @Test
    void pagesAreOrderedNumerically() throws Exception {
        writePage(
                "page_10_res.json",
                "{\"page_index\": 10, \"parsing_res_list\": [{\"block_content\": \"제3조\"}]}");
        writePage(
                "page_2_res.json",
                "{\"page_index\": 2, \"parsing_res_list\": ["
                        + "{\"block_content\": \"제1조\"}, {\"block_content\": \"제2조\"}]}");

        List<ContentBlock> blocks = new LayoutResultsBlockSource(tempDir).load();

        assertEquals(
                List.of("제1조", "제2조", "제3조"),
                blocks.stream().map(ContentBlock::text).toList());
        assertEquals(2, blocks.get(0).page());
        assertEquals(10, blocks.get(2).page());
    }

    @Test
    void readsBoxFieldsAndDefaults() throws Exception {
        writePage(
                "page_0_res.json",
                "{\"page_index\": 0, \"parsing_res_list\": ["
                        + "{\"block_content\": \"【법규1】 상법\", \"inside_box\": true, \"box_id\": 4},"
                        + "{\"block_label\": \"text\"},"
                        + "\"junk\"]}");

        List<ContentBlock> blocks = new LayoutResultsBlockSource(tempDir).load();

        assertEquals(2, blocks.size());
        assertEquals(ContentBlock.inBox(0, "【법규1】 상법", 4), blocks.get(0));
        assertEquals(ContentBlock.of(0, ""), blocks.get(1));
    }

    @Test
    void pageNumberFallsBackToFileName() throws Exception {
        writePage("page_7_res.json", "{\"parsing_res_list\": [{\"block_content\": \"x\"}]}");

        List<ContentBlock> blocks = new LayoutResultsBlockSource(tempDir).load();

        assertEquals(7, blocks.get(0).page());
    }

    @Test
    void overlongPageNumberInFileNameFallsBackToZero() throws Exception {
        writePage(
                "page_99999999999_res.json", "{\"parsing_res_list\": [{\"block_content\": \"x\"}]}");

        List<ContentBlock> blocks = new LayoutResultsBlockSource(tempDir).load();

        assertEquals(1, blocks.size());
        assertEquals(0, blocks.get(0).page());
    }

    @Test
    void nonObjectFileIsAnEmptyPage() throws Exception {
        writePage("page_0_res.json", "[1, 2]");
        writePage("page_1_res.json", "{\"page_index\": 1, \"parsing_res_list\": []}");

        assertTrue(new LayoutResultsBlockSource(tempDir).load().isEmpty());
    }

    @Test
    void otherFilesAreIgnored() throws Exception {
        writePage("page_0_res.json", "{\"parsing_res_list\": [{\"block_content\": \"a\"}]}");
        writePage("summary.json", "not json at all");

        assertEquals(1, new LayoutResultsBlockSource(tempDir).load().size());
    }

    @Test
    void missingDirectoryThrows() {
        BlockSourceException e =
                assertThrows(
                        BlockSourceException.class,
                        () -> new LayoutResultsBlockSource(tempDir.resolve("absent")).load());
        assertEquals(tempDir.resolve("absent"), e.getPath());
    }

    @Test
    void directoryWithoutPageFilesThrows() {
        assertThrows(BlockSourceException.class, () -> new LayoutResultsBlockSource(tempDir).load());
    }

    @Test
    void malformedJsonThrows() throws IOException {
        writePage("page_0_res.json", "{\"page_index\": ");

        BlockSourceException e =
                assertThrows(
                        BlockSourceException.class,
                        () -> new LayoutResultsBlockSource(tempDir).load());
        assertEquals(tempDir.resolve("page_0_res.json"), e.getPath());
    }
}
