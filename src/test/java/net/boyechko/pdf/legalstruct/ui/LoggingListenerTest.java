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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.issues.IssueLocation;
import net.boyechko.pdf.legalstruct.issues.IssueSeverity;
import net.boyechko.pdf.legalstruct.issues.IssueType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

class LoggingListenerTest {
    private Logger processingLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attachAppender() {
        processingLogger =
                (Logger) LoggerFactory.getLogger("net.boyechko.pdf.legalstruct.processing");
        appender = new ListAppender<>();
        appender.start();
        processingLogger.addAppender(appender);
    }

    @AfterEach
    void detachAppender() {
        processingLogger.detachAppender(appender);
    }

    private List<String> messages() {
        return appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    }

    @Test
    void issuesAreLoggedAtTheirSeverity() {
        LoggingListener listener = LoggingListener.withConsoleOutput();

        listener.onWarning(
                new Issue(
                        IssueType.SEQUENCE_GAP,
                        IssueSeverity.WARNING,
                        new IssueLocation(0, "S.제1조.①.3."),
                        "Non-sequential item 3. after number 1"));

        ILoggingEvent event = appender.list.get(0);
        assertEquals(Level.WARN, event.getLevel());
        assertEquals(
                "ISSUE SEQUENCE_GAP: Non-sequential item 3. after number 1 (p. 1) (S.제1조.①.3.)",
                event.getFormattedMessage());
    }

    @Test
    void phaseIsKeptInMdcUntilSummary() {
        LoggingListener listener = new LoggingListener();

        listener.onPhaseStart("Checking structure");
        assertEquals("Checking structure", MDC.get(LoggingListener.PHASE_KEY));

        listener.onSummary(new IssueList());
        assertNull(MDC.get(LoggingListener.PHASE_KEY));
    }

    @Test
    void groupedIssuesAreLoggedOneByOne() {
        LoggingListener listener = new LoggingListener();
        List<Issue> gaps =
                List.of(
                        new Issue(IssueType.SEQUENCE_GAP, IssueSeverity.WARNING, "item 3."),
                        new Issue(IssueType.SEQUENCE_GAP, IssueSeverity.WARNING, "item 5."),
                        new Issue(IssueType.SEQUENCE_GAP, IssueSeverity.WARNING, "item 9."));

        listener.onIssueGroup(IssueType.SEQUENCE_GAP.groupLabel(), gaps);

        assertEquals(4, appender.list.size());
        assertEquals(
                "GROUP items or subitems numbered out of sequence x3",
                appender.list.get(0).getFormattedMessage());
        assertEquals("  ISSUE SEQUENCE_GAP: item 9.", appender.list.get(3).getFormattedMessage());
    }

    @Test
    void phasesAndSummaryAreLogged() {
        LoggingListener listener = new LoggingListener();
        IssueList issues = new IssueList();
        issues.add(new Issue(IssueType.UNRESOLVED_REFERENCE, IssueSeverity.INFO, "No article"));
        issues.add(new Issue(IssueType.LEVEL_ORDER, IssueSeverity.WARNING, "nested"));

        listener.onPhaseStart("Parsing hierarchy");
        listener.onSuccess("Found 1 section(s)");
        listener.onSummary(issues);

        assertNull(MDC.get(LoggingListener.PHASE_KEY));
        assertEquals(
                List.of(
                        "PHASE Parsing hierarchy",
                        "OK Found 1 section(s)",
                        "SUMMARY detected=2 needs_review=1"),
                messages());
    }
}
