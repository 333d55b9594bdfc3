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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.List;
import net.boyechko.pdf.legalstruct.core.ProcessingListener;
import net.boyechko.pdf.legalstruct.issues.Issue;
import net.boyechko.pdf.legalstruct.issues.IssueList;
import net.boyechko.pdf.legalstruct.issues.IssueSeverity;
import net.boyechko.pdf.legalstruct.parse.ParseStatistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

/**
 * Listener for batch runs: every event becomes one log line, and the current phase is kept in the
 * {@value #PHASE_KEY} MDC entry so parser log lines can be attributed to it.
 */
public class LoggingListener implements ProcessingListener {
    public static final String PHASE_KEY = "phase";
    public static final String LOGGER_NAME = "net.boyechko.pdf.legalstruct.processing";

    private static final String CONSOLE_APPENDER_NAME = "LEGALSTRUCT_CONSOLE";
    private static final String CONSOLE_PATTERN = "%-5level [%X{phase:-main}] %logger{0} - %msg%n";

    private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    /**
     * Creates a listener whose lines go to stdout. Other loggers keep their configured appenders;
     * the listener's own logger stops propagating so its lines are not printed twice.
     */
    public static LoggingListener withConsoleOutput() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger target = ctx.getLogger(LOGGER_NAME);
        if (target.getAppender(CONSOLE_APPENDER_NAME) == null) {
            PatternLayoutEncoder encoder = new PatternLayoutEncoder();
            encoder.setContext(ctx);
            encoder.setPattern(CONSOLE_PATTERN);
            encoder.start();

            ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
            console.setName(CONSOLE_APPENDER_NAME);
            console.setContext(ctx);
            console.setEncoder(encoder);
            console.start();
            target.addAppender(console);
            target.setAdditive(false);
        }
        return new LoggingListener();
    }

    @Override
    public void onPhaseStart(String phaseName) {
        MDC.put(PHASE_KEY, phaseName);
        logger.info("PHASE {}", phaseName);
    }

    @Override
    public void onSuccess(String message) {
        logger.info("OK {}", message);
    }

    @Override
    public void onError(String message) {
        logger.error("FAILED {}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onWarning(Issue issue) {
        logger.atLevel(levelFor(issue.severity())).log("ISSUE {}", describe(issue));
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        logger.warn("GROUP {} x{}", groupLabel, issues.size());
        for (Issue issue : issues) {
            logger.atLevel(levelFor(issue.severity())).log("  ISSUE {}", describe(issue));
        }
    }

    @Override
    public void onStatistics(ParseStatistics statistics) {
        logger.info(
                "NODES total={} implicit_paragraphs={} [{}]",
                statistics.total(),
                statistics.implicitParagraphs(),
                statistics);
    }

    @Override
    public void onVerboseOutput(String message) {
        logger.debug("{}", message.stripTrailing());
    }

    @Override
    public void onSummary(IssueList allIssues) {
        MDC.remove(PHASE_KEY);
        logger.info(
                "SUMMARY detected={} needs_review={}",
                allIssues.size(),
                allIssues.atLeast(IssueSeverity.WARNING).size());
    }

    private static String describe(Issue issue) {
        String location = issue.where().toString();
        return issue.type() + ": " + issue.message() + (location.isEmpty() ? "" : " " + location);
    }

    private static Level levelFor(IssueSeverity severity) {
        return switch (severity) {
            case INFO -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR, FATAL -> Level.ERROR;
        };
    }
}
