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

import com.itextpdf.commons.exceptions.ITextException;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.ReaderProperties;
import com.itextpdf.kernel.pdf.canvas.parser.PdfTextExtractor;
import com.itextpdf.kernel.pdf.canvas.parser.listener.LocationTextExtractionStrategy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the text layer of a born-digital PDF, one block per non-blank line.
 *
 * <p>No box detection happens here, so every block is outside any box. Scanned PDFs without a text
 * layer must go through the layout/OCR stage and be read with {@link LayoutResultsBlockSource}.
 */
public class PdfTextLayerBlockSource implements BlockSource {
    private static final Logger logger = LoggerFactory.getLogger(PdfTextLayerBlockSource.class);

    private final Path pdfPath;
    private final ReaderProperties readerProps;

    public PdfTextLayerBlockSource(Path pdfPath, String password) {
        this.pdfPath = pdfPath;
        this.readerProps = new ReaderProperties();
        if (password != null) {
            this.readerProps.setPassword(password.getBytes(StandardCharsets.UTF_8));
        }
    }

    public PdfTextLayerBlockSource(Path pdfPath) {
        this(pdfPath, null);
    }

    @Override
    public List<ContentBlock> load() throws BlockSourceException {
        if (pdfPath == null || !Files.isRegularFile(pdfPath)) {
            throw new BlockSourceException("PDF file not found", pdfPath);
        }

        List<ContentBlock> blocks = new ArrayList<>();
        try (PdfDocument pdfDoc =
                new PdfDocument(new PdfReader(pdfPath.toString(), readerProps))) {
            for (int i = 1; i <= pdfDoc.getNumberOfPages(); i++) {
                String text =
                        PdfTextExtractor.getTextFromPage(
                                pdfDoc.getPage(i), new LocationTextExtractionStrategy());
                int before = blocks.size();
                for (String line : text.split("\\R")) {
                    String trimmed = line.strip();
                    if (!trimmed.isEmpty()) {
                        blocks.add(ContentBlock.of(i - 1, trimmed));
                    }
                }
                logger.debug("Page {}: {} lines", i, blocks.size() - before);
            }
        } catch (IOException | ITextException e) {
            throw new BlockSourceException("Cannot read PDF: " + e.getMessage(), pdfPath, e);
        }

        if (blocks.isEmpty()) {
            throw new BlockSourceException(
                    "PDF has no extractable text layer; run it through OCR first", pdfPath);
        }
        logger.info("Extracted {} lines from {}", blocks.size(), pdfPath.getFileName());
        return blocks;
    }

    @Override
    public String describe() {
        return "text layer of " + pdfPath;
    }
}
