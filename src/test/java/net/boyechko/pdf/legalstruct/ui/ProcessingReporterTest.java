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
package net.boyechko.pdf.legalstruct.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import net.boyechko.pdf.legalstruct.core.VerbosityLevel;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.issues.IssueLocation;
import net.boyechko.pdf.legalstruct.issues.IssueSeverity;
import net.boyechko.pdf.legalstruct.issues.IssueType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

public class ProcessingReporterTest {

    @Test
    void groupSummaryNamesPages() {
        assertEquals(
                "3 items or subitems numbered out of sequence (page 4)",
                ProcessingReporter.buildGroupSummary(
                        IssueType.SEQUENCE_GAP.groupLabel(), 3, new TreeSet<>(Set.of(4))));
        assertEquals(
                "4 x (pages 1-3)",
                ProcessingReporter.buildGroupSummary("x", 4, new TreeSet<>(Set.of(1, 2, 3))));
        assertEquals(
                "2 x (pages 1, 5)",
                ProcessingReporter.buildGroupSummary("x", 2, new TreeSet<>(Set.of(5, 1))));
        assertEquals("2 x", ProcessingReporter.buildGroupSummary("x", 2, new TreeSet<>()));
    }

    @Test
    void consecutivePagesCollapseIntoRuns() {
        assertEquals(
                "1-3, 7, 9-10",
                ProcessingReporter.pageRuns(new TreeSet<>(Set.of(1, 2, 3, 7, 9, 10))));
    }

    @Test
    void hangulCountsAsTwoColumns() {
        assertEquals(5, ProcessingReporter.displayWidth("abcde"));
        assertEquals(5, ProcessingReporter.displayWidth("제1조"));
        assertEquals(2, ProcessingReporter.displayWidth("①"));
    }

    @Test
    void wordWrapBreaksAtSpacesByDisplayWidth() {
        assertEquals(List.of(), ProcessingReporter.wordWrap("", 10));
        assertEquals(List.of("short"), ProcessingReporter.wordWrap("short", 10));
        assertEquals(
                List.of("제1조 제2조", "제3조"), ProcessingReporter.wordWrap("제1조 제2조 제3조", 11));
        assertEquals(
                List.of("제1조", "제2조", "제3조"), ProcessingReporter.wordWrap("제1조 제2조 제3조", 8));
        assertEquals(
                List.of("a", "보험금지급사유", "b"), ProcessingReporter.wordWrap("a 보험금지급사유 b", 6));
    }

    @Test
    void phasesAreBoxed() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ProcessingReporter reporter =
                new ProcessingReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), VerbosityLevel.NORMAL);

        reporter.onPhaseStart("Parsing hierarchy");
        reporter.onSuccess("Found 2 section(s)");
        reporter.onSummary(new IssueList());

        String rendered = normalize(buffer);
        assertTrue(rendered.startsWith("┌─ Parsing hierarchy "), rendered);
        assertTrue(rendered.contains("│ ✓ Found 2 section(s)\n"), rendered);
        assertTrue(rendered.contains("┌─ Summary "), rendered);
        assertTrue(rendered.contains("No parse anomalies found"), rendered);
        assertTrue(rendered.endsWith("└─╯\n"), rendered);
    }

    @Test
    void quietShowsOnlyErrors() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ProcessingReporter reporter =
                new ProcessingReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), VerbosityLevel.QUIET);

        reporter.onPhaseStart("Loading blocks");
        reporter.onSuccess("Loaded 10 blocks");
        reporter.onError("No text blocks found");
        reporter.onSummary(new IssueList());

        String rendered = normalize(buffer);
        assertFalse(rendered.contains("Loading blocks"));
        assertFalse(rendered.contains("Loaded 10 blocks"));
        assertTrue(rendered.contains("No text blocks found"));
    }

    @Test
    void summaryListsIssuesNeedingReview() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ProcessingReporter reporter =
                new ProcessingReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), VerbosityLevel.NORMAL);
        IssueList issues = new IssueList();
        issues.add(issue(IssueType.SEQUENCE_GAP, IssueSeverity.WARNING, 2, "Non-sequential item 3."));
        issues.add(issue(IssueType.UNRESOLVED_REFERENCE, IssueSeverity.INFO, 2, "No article"));

        reporter.onSummary(issues);

        String rendered = normalize(buffer);
        assertTrue(rendered.contains("Issues detected: 2"), rendered);
        assertTrue(rendered.contains("Needs manual review"), rendered);
        assertTrue(rendered.contains("Non-sequential item 3. (p. 3)"), rendered);
        assertFalse(rendered.contains("No article (p. 3)"), rendered);
    }

    @Test
    @Tag("visual")
    void rendersVisualTranscript() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        ProcessingReporter reporter =
                new ProcessingReporter(new PrintStream(buffer, true, StandardCharsets.UTF_8), VerbosityLevel.VERBOSE);

        IssueList summaryIssues = new IssueList();
        reporter.onPhaseStart("Loading blocks");
        reporter.onSuccess("Loaded 412 blocks from layout results in output/policy");

        reporter.onPhaseStart("Parsing hierarchy");
        reporter.onSuccess("Found 3 section(s), 188 structural node(s)");
        reporter.onSuccess("Resolved 41 of 47 reference(s)");

        reporter.onPhaseStart("Checking structure");
        IssueList gaps = new IssueList();
        gaps.add(issue(IssueType.SEQUENCE_GAP, IssueSeverity.WARNING, 4, "Non-sequential item 3."));
        gaps.add(issue(IssueType.SEQUENCE_GAP, IssueSeverity.WARNING, 5, "Non-sequential item 7."));
        gaps.add(issue(IssueType.SEQUENCE_GAP, IssueSeverity.WARNING, 6, "Non-sequential subitem 라."));
        reporter.onIssueGroup(IssueType.SEQUENCE_GAP.groupLabel(), gaps);
        Issue unresolved =
                issue(
                        IssueType.UNRESOLVED_REFERENCE,
                        IssueSeverity.INFO,
                        9,
                        "No article found for \"제31조\"");
        reporter.onWarning(unresolved);
        summaryIssues.addAll(gaps);
        summaryIssues.add(unresolved);

        reporter.onPhaseStart("Writing output");
        reporter.onSuccess("Wrote document_hierarchy.json");
        reporter.onSummary(summaryIssues);
        reporter.onSuccess("Output saved to output/policy_hierarchy");

        String rendered = normalize(buffer);

        System.out.println("--- Visual Transcript Preview ---");
        System.out.print(rendered);
        System.out.println("--- End Preview ---");
    }

    private Issue issue(IssueType type, IssueSeverity severity, Integer page, String message) {
        return new Issue(type, severity, new IssueLocation(page, null), message);
    }

    private String normalize(ByteArrayOutputStream buffer) {
        return buffer.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }
}
