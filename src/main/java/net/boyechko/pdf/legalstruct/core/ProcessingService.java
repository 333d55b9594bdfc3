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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import net.boyechko.pdf.legalstruct.config.ParserSettings;
import net.boyechko.pdf.legalstruct.document.BlockSource;
import net.boyechko.pdf.legalstruct.document.BlockSourceException;
import net.boyechko.pdf.legalstruct.document.ContentBlock;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.io.HierarchyJson;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.issues.IssueType;
import net.boyechko.pdf.legalstruct.parse.LegalDocumentParser;
import net.boyechko.pdf.legalstruct.parse.ParseOutcome;
import net.boyechko.pdf.legalstruct.validation.HierarchyWalker;
import net.boyechko.pdf.legalstruct.visitors.TreeOutputVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates loading, parsing and writing of one document. */
public class ProcessingService {
    private static final Logger logger = LoggerFactory.getLogger(ProcessingService.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final BlockSource source;
    private final ProcessingListener listener;
    private final ParserSettings settings;
    private final Path outputDirectory;
    private final boolean printTree;

    public static class ProcessingServiceBuilder {
        private BlockSource source;
        private ProcessingListener listener;
        private ParserSettings settings;
        private Path outputDirectory;
        private boolean printTree;

        public ProcessingServiceBuilder withBlockSource(BlockSource source) {
            this.source = source;
            return this;
        }

        public ProcessingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public ProcessingServiceBuilder withSettings(ParserSettings settings) {
            this.settings = settings;
            return this;
        }

        /** Directory for the JSON output; when unset nothing is written. */
        public ProcessingServiceBuilder withOutputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public ProcessingServiceBuilder withPrintTree(boolean printTree) {
            this.printTree = printTree;
            return this;
        }

        public ProcessingService build() {
            if (source == null) {
                throw new IllegalStateException(
                        "BlockSource must be provided via withBlockSource(...) before building ProcessingService");
            }
            if (listener == null) {
                throw new IllegalStateException(
                        "ProcessingListener must be provided via withListener(...) before building ProcessingService");
            }
            return new ProcessingService(this);
        }
    }

    private ProcessingService(ProcessingServiceBuilder builder) {
        this.source = builder.source;
        this.listener = builder.listener;
        this.settings = builder.settings != null ? builder.settings : ParserSettings.defaults();
        this.outputDirectory = builder.outputDirectory;
        this.printTree = builder.printTree;
    }

    /**
     * Loads the blocks, rebuilds the hierarchy and writes it out.
     *
     * @throws BlockSourceException if the input cannot be read
     * @throws IOException if the output cannot be written
     */
    public ProcessingResult process() throws BlockSourceException, IOException {
        listener.onPhaseStart("Loading blocks");
        List<ContentBlock> blocks = source.load();
        if (blocks.isEmpty()) {
            listener.onError("No text blocks found in " + source.describe());
        } else {
            listener.onSuccess("Loaded " + blocks.size() + " blocks from " + source.describe());
        }

        listener.onPhaseStart("Parsing hierarchy");
        ParseOutcome outcome = new LegalDocumentParser(settings).parse(blocks);
        HierarchyNode root = outcome.root();
        listener.onSuccess(
                "Found "
                        + root.getChildren().size()
                        + " section(s), "
                        + outcome.statistics().total()
                        + " structural node(s)");
        listener.onSuccess(
                "Resolved "
                        + outcome.resolvedReferenceCount()
                        + " of "
                        + outcome.references().size()
                        + " reference(s)");
        listener.onStatistics(outcome.statistics());

        listener.onPhaseStart("Checking structure");
        IssueList issues = outcome.issues();
        if (issues.isEmpty()) {
            listener.onSuccess("No issues found");
        } else {
            reportIssuesGrouped(issues);
        }
        if (printTree) {
            new HierarchyWalker()
                    .addVisitor(new TreeOutputVisitor(listener::onVerboseOutput))
                    .walk(root);
        }

        Path hierarchyFile = null;
        Path referencesFile = null;
        if (outputDirectory != null) {
            listener.onPhaseStart("Writing output");
            Files.createDirectories(outputDirectory);
            hierarchyFile = outputDirectory.resolve(HierarchyJson.HIERARCHY_FILE);
            referencesFile = outputDirectory.resolve(HierarchyJson.REFERENCES_FILE);
            HierarchyJson.write(root, hierarchyFile);
            HierarchyJson.writeReferences(outcome.references(), referencesFile);
            logger.debug("Wrote {} and {}", hierarchyFile, referencesFile);
            listener.onSuccess("Wrote " + hierarchyFile.getFileName());
            listener.onSuccess("Wrote " + referencesFile.getFileName());
        }

        listener.onSummary(issues);

        return new ProcessingResult(
                root,
                outcome.references(),
                issues,
                outcome.statistics(),
                hierarchyFile,
                referencesFile);
    }

    // == Reporting helpers ============================================

    private void reportIssuesGrouped(IssueList issues) {
        Map<IssueType, List<Issue>> grouped =
                issues.stream()
                        .collect(
                                Collectors.groupingBy(
                                        Issue::type, LinkedHashMap::new, Collectors.toList()));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupIssues = entry.getValue();

            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onWarning(issue);
                }
            }
        }
    }
}
