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
package net.boyechko.pdf.legalstruct.ui.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import net.boyechko.pdf.legalstruct.config.ParserSettings;
import net.boyechko.pdf.legalstruct.core.ProcessingDefaults;
import net.boyechko.pdf.legalstruct.core.ProcessingListener;
import net.boyechko.pdf.legalstruct.core.ProcessingResult;
import net.boyechko.pdf.legalstruct.core.ProcessingService;
import net.boyechko.pdf.legalstruct.core.VerbosityLevel;
import net.boyechko.pdf.legalstruct.document.BlockSource;
import net.boyechko.pdf.legalstruct.document.BlockSourceException;
import net.boyechko.pdf.legalstruct.document.BlockSources;
import net.boyechko.pdf.legalstruct.hierarchy.HierarchyTree;
import net.boyechko.pdf.legalstruct.parse.LegalDocumentParser;
import net.boyechko.pdf.legalstruct.parse.ParseOutcome;
import net.boyechko.pdf.legalstruct.ui.LoggingListener;
import net.boyechko.pdf.legalstruct.ui.ProcessingReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LegalStructCLI {
    private static final int DUMP_TREE_MAX_DEPTH = 10;

    private static Logger logger;

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputDirectory,
            String password,
            String documentName,
            Path settingsFile,
            VerbosityLevel verbosity,
            boolean printTree,
            boolean dumpTree,
            boolean logOutput) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (!dumpTree && outputDirectory == null) {
                throw new IllegalArgumentException("Output directory is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments and resolves derived paths. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputDirectory;
        String password;
        String documentName;
        Path settingsFile;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        boolean printTree;
        boolean dumpTree;
        boolean logOutput;

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            if (settingsFile != null && !Files.isRegularFile(settingsFile)) {
                throw new CLIException("Settings file not found: " + settingsFile);
            }
            if (outputDirectory == null && !dumpTree) {
                outputDirectory = ProcessingDefaults.defaultOutputDirectory(inputPath);
            } else if (outputDirectory != null && Files.isRegularFile(outputDirectory)) {
                throw new CLIException("Output path is a file, not a directory: " + outputDirectory);
            }

            return new CLIConfig(
                    inputPath,
                    outputDirectory,
                    password,
                    documentName,
                    settingsFile,
                    verbosity,
                    printTree,
                    dumpTree,
                    logOutput);
        }
    }

    public static void main(String[] args) {
        try {
            if (isHelpRequested(args)) {
                System.out.println(usageMessage());
                return;
            }
            CLIConfig config = parseArguments(args);
            configureLogging(config);
            logger().info(
                            "Starting processing of {} with verbosity level {}",
                            config.inputPath(),
                            config.verbosity());
            processFile(config);
        } catch (CLIException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder();

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--doc-name=")) {
                b.documentName = args[i].substring("--doc-name=".length());
            } else if (args[i].startsWith("--config=")) {
                b.settingsFile = Paths.get(args[i].substring("--config=".length()));
            } else {
                switch (args[i]) {
                    case "-p", "--password" -> {
                        if (i + 1 < args.length) {
                            b.password = args[++i];
                        } else {
                            throw new CLIException("Password not specified after -p");
                        }
                    }
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    case "-t", "--print-tree" -> b.printTree = true;
                    case "--dump-tree" -> b.dumpTree = true;
                    case "--log-output" -> b.logOutput = true;
                    default -> {
                        if (args[i].startsWith("-") && args[i].length() > 1) {
                            throw new CLIException("Unknown option: " + args[i]);
                        }
                        if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else if (b.outputDirectory == null) {
                            b.outputDirectory = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple input files specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static void configureLogging(CLIConfig config) {
        Level level = Level.toLevel(config.verbosity().logThreshold().name());
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
        if (config.logOutput() && config.verbosity() == VerbosityLevel.NORMAL) {
            // Progress lines are logged at INFO.
            ctx.getLogger(LoggingListener.LOGGER_NAME).setLevel(Level.INFO);
        }
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(LegalStructCLI.class);
        }
        return logger;
    }

    static ParserSettings loadSettings(CLIConfig config) throws CLIException {
        ParserSettings settings;
        try {
            settings =
                    config.settingsFile() != null
                            ? ParserSettings.withOverrides(config.settingsFile())
                            : ParserSettings.defaults();
        } catch (IllegalArgumentException e) {
            throw new CLIException(e.getMessage());
        }
        if (config.documentName() != null) {
            settings = settings.withDocumentName(config.documentName());
        }
        return settings;
    }

    private static void processFile(CLIConfig config) throws CLIException {
        ParserSettings settings = loadSettings(config);
        try {
            BlockSource source = BlockSources.forPath(config.inputPath(), config.password());
            if (config.dumpTree()) {
                dumpTree(source, settings);
                return;
            }

            ProcessingListener listener =
                    config.logOutput()
                            ? LoggingListener.withConsoleOutput()
                            : new ProcessingReporter(System.out, config.verbosity());
            ProcessingService service =
                    new ProcessingService.ProcessingServiceBuilder()
                            .withBlockSource(source)
                            .withListener(listener)
                            .withSettings(settings)
                            .withOutputDirectory(config.outputDirectory())
                            .withPrintTree(config.printTree())
                            .build();

            ProcessingResult result = service.process();
            if (result.wroteOutput()) {
                listener.onSuccess("Output saved to " + config.outputDirectory());
            }
        } catch (BlockSourceException e) {
            logger().debug("Block source failure", e);
            throw new CLIException(
                    e.getPath() != null ? e.getMessage() + ": " + e.getPath() : e.getMessage());
        } catch (IOException e) {
            System.err.println("✗ Processing failed due to an exception:");
            System.err.println();
            e.printStackTrace();
            System.exit(1);
        }
    }

    /** Prints the parsed tree to the console without writing any files. */
    private static void dumpTree(BlockSource source, ParserSettings settings)
            throws BlockSourceException {
        ParseOutcome outcome = new LegalDocumentParser(settings).parse(source.load());
        System.out.print(HierarchyTree.toIndentedTreeString(outcome.root(), DUMP_TREE_MAX_DEPTH));
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    private static String usageMessage() {
        return "Usage: java LegalStructCLI [-q|-v|-vv] [-t] [--dump-tree] [--log-output] [--doc-name=NAME] [--config=FILE] [-p password] <input> [<outputdir>]\n"
                + "  <input>           Layout results directory (page_*_res.json) or a PDF with a text layer\n"
                + "  <outputdir>       Where to write the JSON files (default: <input>_hierarchy)\n"
                + "  -h, --help        Show this help message\n"
                + "  -q, --quiet       Only show errors and final status\n"
                + "  -v, --verbose     Show detailed processing information\n"
                + "  -vv, --debug      Show all debug information\n"
                + "  -t, --print-tree  Print the parsed hierarchy during processing\n"
                + "  --dump-tree       Print the parsed hierarchy and exit without writing files\n"
                + "  --log-output      Report progress as log lines instead of boxed output\n"
                + "  --doc-name=NAME   Name of the document, so citations of it are not external\n"
                + "  --config=FILE     YAML file overriding the parser settings\n"
                + "  -p, --password    Password for encrypted PDFs\n"
                + "Examples:\n"
                + "  java LegalStructCLI -v layout_results/\n"
                + "  java LegalStructCLI --doc-name=자동차보험 -t policy.pdf out/\n"
                + "  java LegalStructCLI --dump-tree policy.pdf";
    }
}
