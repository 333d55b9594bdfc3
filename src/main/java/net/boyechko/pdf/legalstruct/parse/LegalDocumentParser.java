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
package net.boyechko.pdf.legalstruct.parse;

import java.util.List;
import java.util.Set;
import net.boyechko.pdf.legalstruct.config.ParserSettings;
import net.boyechko.pdf.legalstruct.document.ContentBlock;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyNode;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyTree;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.parse.SectionDetector.DocumentSection;
import net.boyechko.pdf.legalstruct.reference.LawNameHarvester;
import net.boyechko.pdf.legalstruct.reference.Reference;
import net.boyechko.pdf.legalstruct.reference.ReferenceExtractor;
import net.boyechko.pdf.legalstruct.reference.ReferenceResolver;
import net.boyechko.pdf.legalstruct.validation.HierarchyWalker;
import net.boyechko.pdf.legalstruct.visitors.LevelOrderVisitor;
import net.boyechko.pdf.legalstruct.visitors.UnresolvedReferenceVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the ordered blocks of one document into a hierarchy.
 *
 * <p>The parser holds only settings; every call builds its own matcher state, so one instance may
 * be shared between threads.
 */
public class LegalDocumentParser {
    private static final Logger logger = LoggerFactory.getLogger(LegalDocumentParser.class);

    private final ParserSettings settings;

    public LegalDocumentParser() {
        this(ParserSettings.defaults());
    }

    public LegalDocumentParser(ParserSettings settings) {
        this.settings = settings;
    }

    public ParseOutcome parse(List<ContentBlock> blocks) {
        Set<String> lawNames =
                LawNameHarvester.harvest(blocks.stream().map(ContentBlock::text).toList());
        ReferenceExtractor extractor =
                new ReferenceExtractor(
                        lawNames,
                        settings.getDocumentName(),
                        settings.getSelfReferenceMarkers(),
                        settings.getParagraphLookbehind());
        StructuralMatcher matcher = new StructuralMatcher(settings.getTitlePreviewLength());
        SectionDetector sectionDetector =
                new SectionDetector(
                        matcher,
                        settings.getMaxSectionTitleLength(),
                        settings.getDefaultSectionName());
        HierarchyBuilder builder =
                new HierarchyBuilder(
                        matcher,
                        new SpecialBlockDetector(settings.getTitlePreviewLength()),
                        extractor,
                        settings.getTitlePreviewLength());

        HierarchyNode root = HierarchyNode.documentRoot();
        List<DocumentSection> sections = sectionDetector.detect(blocks);
        for (DocumentSection section : sections) {
            root.addChild(builder.build(section));
        }

        int resolved = ReferenceResolver.resolve(root);
        List<Reference> references = HierarchyTree.collectReferences(root);

        IssueList issues = new IssueList(builder.getIssues());
        issues.addAll(
                new HierarchyWalker()
                        .addVisitor(new LevelOrderVisitor())
                        .addVisitor(new UnresolvedReferenceVisitor())
                        .walk(root));

        logger.info(
                "Parsed {} blocks into {} sections; {} of {} references resolved",
                blocks.size(),
                sections.size(),
                resolved,
                references.size());
        return new ParseOutcome(root, references, issues, builder.getStatistics());
    }
}
