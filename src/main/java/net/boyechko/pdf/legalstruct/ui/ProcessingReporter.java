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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import net.boyechko.pdf.legalstruct.core.ProcessingListener;
import net.boyechko.pdf.legalstruct.core.VerbosityLevel;
import net.boyechko.pdf.legalstruct.hierarchy.NodeType;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.issues.IssueSeverity;
import net.boyechko.pdf.legalstruct.issues.IssueType;
import net.boyechko.pdf.legalstruct.parse.ParseStatistics;
import org.slf4j.LoggerFactory;

/**
 * Console listener that draws each phase as a box and ends with a summary of the parsed tree.
 *
 * <p>Log events of the parser packages are captured while a box is open and printed inside it
 * when the box closes, so warnings appear next to the phase that raised them.
 */
public class ProcessingReporter implements ProcessingListener {
    private static final String APP_LOGGER = "net.boyechko.pdf.legalstruct";

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "️✗";
    private static final String INFO = "○";
    private static final String SUBSECTION_MARK = "🞙︎";

    private static final String GUTTER = "│ ";
    private static final int BOX_WIDTH = 68;
    // Terminal columns, not chars: Hangul syllables take two.
    private static final int TEXT_COLUMNS = 80;

    private final PrintStream out;
    private final VerbosityLevel verbosity;
    private final ListAppender<ILoggingEvent> capturedLogs = new ListAppender<>();

    private boolean boxOpen;
    private boolean hasSubsection;
    private ParseStatistics statistics;

    public ProcessingReporter(PrintStream out, VerbosityLevel verbosity) {
        this.out = out;
        this.verbosity = verbosity;
        capturedLogs.start();
        ((Logger) LoggerFactory.getLogger(APP_LOGGER)).addAppender(capturedLogs);
    }

    public boolean shouldShow(VerbosityLevel level) {
        return verbosity.shouldShow(level);
    }

    // == Listener events ==============================================

    @Override
    public void onPhaseStart(String phaseName) {
        if (!shouldShow(VerbosityLevel.NORMAL)) return;
        closeBox();
        openBox(phaseName);
    }

    @Override
    public void onSubsection(String header) {
        if (!shouldShow(VerbosityLevel.NORMAL)) return;
        if (hasSubsection) {
            blankLine();
        }
        line(header, SUBSECTION_MARK, VerbosityLevel.NORMAL);
        hasSubsection = true;
    }

    @Override
    public void onSuccess(String message) {
        line(message, SUCCESS, VerbosityLevel.NORMAL);
    }

    @Override
    public void onError(String message) {
        line(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onInfo(String message) {
        line(message, INFO, VerbosityLevel.NORMAL);
    }

    @Override
    public void onWarning(Issue issue) {
        line(describe(issue), iconFor(issue.severity()), VerbosityLevel.NORMAL);
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        if (issues.isEmpty()) return;
        line(
                buildGroupSummary(groupLabel, issues.size(), displayPages(issues)),
                iconFor(highestSeverity(issues)),
                VerbosityLevel.NORMAL);
        for (Issue issue : issues) {
            line("  " + describe(issue), iconFor(issue.severity()), VerbosityLevel.VERBOSE);
        }
    }

    @Override
    public void onStatistics(ParseStatistics statistics) {
        this.statistics = statistics;
        line(statistics.toString(), INFO, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onVerboseOutput(String message) {
        out.print(message);
    }

    @Override
    public void onSummary(IssueList allIssues) {
        if (!shouldShow(VerbosityLevel.NORMAL)) return;
        closeBox();
        openBox("Summary");

        if (statistics != null) {
            line("Structural nodes: " + statistics.total(), INFO, VerbosityLevel.NORMAL);
            line(countsByUnit(statistics), INFO, VerbosityLevel.VERBOSE);
            if (statistics.implicitParagraphs() > 0) {
                line(
                        "Implicit paragraphs: " + statistics.implicitParagraphs(),
                        INFO,
                        VerbosityLevel.NORMAL);
            }
        }

        if (allIssues.isEmpty()) {
            line("No parse anomalies found", SUCCESS, VerbosityLevel.NORMAL);
        } else {
            line("Issues detected: " + allIssues.size(), INFO, VerbosityLevel.NORMAL);
            countsByType(allIssues)
                    .forEach(
                            (type, count) ->
                                    line(
                                            "  " + count + " " + type.groupLabel(),
                                            INFO,
                                            VerbosityLevel.VERBOSE));
            IssueList needsReview = allIssues.atLeast(IssueSeverity.WARNING);
            if (!needsReview.isEmpty()) {
                blankLine();
                onSubsection("Needs manual review");
                for (Issue issue : needsReview) {
                    line(describe(issue), iconFor(issue.severity()), VerbosityLevel.NORMAL);
                }
            }
        }
        closeBox();
    }

    // == Formatting ===================================================

    /** "3 items or subitems numbered out of sequence (pages 2-4, 9)" */
    static String buildGroupSummary(String groupLabel, int count, SortedSet<Integer> pages) {
        String summary = count + " " + groupLabel;
        if (pages.isEmpty()) {
            return summary;
        }
        return summary + (pages.size() == 1 ? " (page " : " (pages ") + pageRuns(pages) + ")";
    }

    /** Joins consecutive pages into runs: [1, 2, 3, 7] becomes "1-3, 7". */
    static String pageRuns(SortedSet<Integer> pages) {
        List<String> runs = new ArrayList<>();
        Iterator<Integer> it = pages.iterator();
        int start = it.next();
        int end = start;
        while (it.hasNext()) {
            int page = it.next();
            if (page == end + 1) {
                end = page;
                continue;
            }
            runs.add(start == end ? String.valueOf(start) : start + "-" + end);
            start = end = page;
        }
        runs.add(start == end ? String.valueOf(start) : start + "-" + end);
        return String.join(", ", runs);
    }

    /**
     * Breaks {@code text} at spaces so that no line is wider than {@code columns} terminal
     * columns. A single word wider than that gets a line of its own.
     */
    static List<String> wordWrap(String text, int columns) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        StringBuilder current = new StringBuilder();
        int width = 0;
        for (String word : text.split(" ")) {
            int wordWidth = displayWidth(word);
            if (current.length() > 0 && width + 1 + wordWidth > columns) {
                lines.add(current.toString());
                current.setLength(0);
                width = 0;
            }
            if (current.length() > 0) {
                current.append(' ');
                width++;
            }
            current.append(word);
            width += wordWidth;
        }
        lines.add(current.toString());
        return lines;
    }

    /** Columns taken by {@code text} in a terminal; Hangul and CJK characters count double. */
    static int displayWidth(String text) {
        int width = 0;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            width += isWide(cp) ? 2 : 1;
            i += Character.charCount(cp);
        }
        return width;
    }

    private static boolean isWide(int cp) {
        Character.UnicodeScript script = Character.UnicodeScript.of(cp);
        return script == Character.UnicodeScript.HANGUL
                || script == Character.UnicodeScript.HAN
                || (cp >= 0x2460 && cp <= 0x24FF) // circled numerals
                || (cp >= 0x3000 && cp <= 0x303F) // CJK punctuation, 「」【】
                || (cp >= 0xFF00 && cp <= 0xFF60);
    }

    private static String describe(Issue issue) {
        String location = issue.where().toString();
        return location.isEmpty() ? issue.message() : issue.message() + " " + location;
    }

    private static String iconFor(IssueSeverity severity) {
        return switch (severity) {
            case INFO -> INFO;
            case WARNING -> WARNING;
            case ERROR, FATAL -> ERROR;
        };
    }

    private static IssueSeverity highestSeverity(List<Issue> issues) {
        IssueSeverity highest = IssueSeverity.INFO;
        for (Issue issue : issues) {
            if (issue.severity().compareTo(highest) > 0) {
                highest = issue.severity();
            }
        }
        return highest;
    }

    // Issue pages are 0-based.
    private static SortedSet<Integer> displayPages(List<Issue> issues) {
        return issues.stream()
                .map(issue -> issue.where().page())
                .filter(Objects::nonNull)
                .map(page -> page + 1)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private static String countsByUnit(ParseStatistics statistics) {
        return statistics.asMap().entrySet().stream()
                .filter(entry -> entry.getKey() != NodeType.SECTION)
                .map(entry -> entry.getKey().label() + " " + entry.getValue())
                .collect(Collectors.joining(" · "));
    }

    private static Map<IssueType, Integer> countsByType(IssueList issues) {
        Map<IssueType, Integer> counts = new EnumMap<>(IssueType.class);
        for (Issue issue : issues) {
            counts.merge(issue.type(), 1, Integer::sum);
        }
        return counts;
    }

    // == Box drawing ==================================================

    private void openBox(String title) {
        int rule = Math.max(0, BOX_WIDTH - displayWidth(title) - 1);
        out.println("┌─ " + title + " " + "─".repeat(rule) + "─╮");
        out.println("│");
        boxOpen = true;
    }

    private void closeBox() {
        if (!boxOpen) return;
        printCapturedLogs();
        out.println("│");
        out.println("└─╯");
        boxOpen = false;
        hasSubsection = false;
    }

    private void printCapturedLogs() {
        if (capturedLogs.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(capturedLogs.list);
        capturedLogs.list.clear();
        blankLine();
        for (ILoggingEvent event : events) {
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            line(
                    "[" + event.getLevel() + "] " + event.getLoggerName() + ": "
                            + event.getFormattedMessage(),
                    icon,
                    VerbosityLevel.NORMAL);
        }
    }

    private void line(String message, String icon, VerbosityLevel level) {
        if (!shouldShow(level)) return;
        List<String> wrapped = wordWrap(message, TEXT_COLUMNS);
        if (wrapped.isEmpty()) {
            out.println(GUTTER + icon);
            return;
        }
        out.println(GUTTER + icon + " " + wrapped.get(0));
        for (String rest : wrapped.subList(1, wrapped.size())) {
            out.println(GUTTER + "  " + rest);
        }
    }

    private void blankLine() {
        out.println("│");
    }
}
