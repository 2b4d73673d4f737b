package com.raditha.checkcode.cli;

import com.raditha.checkcode.analyzer.ProgressListener;
import com.raditha.checkcode.analyzer.ProjectAnalyzer;
import com.raditha.checkcode.config.AnalysisConfig;
import com.raditha.checkcode.config.AnalysisSettings;
import com.raditha.checkcode.discovery.SourceFileCollector;
import com.raditha.checkcode.extraction.SourceParseException;
import com.raditha.checkcode.model.DirectoryNode;
import com.raditha.checkcode.report.ReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command-line interface for check-code.
 * <p>
 * Usage:
 * java -jar check-code.jar [options] &lt;file-or-directory&gt;...
 * <p>
 * Configuration priority: CLI arguments > checkcode.yml > defaults
 */
@Command(name = "check-code", mixinStandardHelpOptions = true, version = "check-code v1.0.0",
        description = "Static analyser producing a JSON tree of a Java codebase with per-method metrics "
                + "and near-duplicate detection.")
public class CheckCodeCLI implements Callable<Integer> {

    private static final Logger logger = LoggerFactory.getLogger(CheckCodeCLI.class);

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "PATH", description = "Input file(s) or directories to analyse recursively")
    private List<String> paths = new ArrayList<>();

    @Option(names = { "-o", "--output" }, description = "Path to output JSON file (default: ${DEFAULT-VALUE})",
            paramLabel = "<path>", defaultValue = "result.json")
    private String output;

    @Option(names = "--dry-run", description = "Show the list of files that would be analysed and exit")
    private boolean dryRun = false;

    @Option(names = "--duplication", negatable = true,
            description = "Compute code duplication metrics (default: enabled, or as configured)")
    private Boolean duplication;

    @Option(names = "--config-file", description = "Use custom configuration file", paramLabel = "<path>")
    private String configFile;

    @Option(names = "--threads", description = "Worker threads for duplicate matching (default: 1)", paramLabel = "<n>")
    private Integer threads;

    @Option(names = "--no-progress", description = "Do not draw progress bars")
    private boolean noProgress = false;

    /**
     * Picocli call method - executes the main logic.
     *
     * @return exit code (0 for success, non-zero for errors)
     */
    @Override
    public Integer call() throws Exception {
        validateConfiguration();

        AnalysisConfig config = AnalysisSettings.loadConfig(
                configFile != null ? Path.of(configFile) : null,
                duplication,
                threads);

        List<Path> files = new SourceFileCollector(config).collect(paths);
        PrintWriter out = spec.commandLine().getOut();

        if (dryRun) {
            out.printf("Planned analysis (%d file(s)):%n", files.size());
            for (Path file : files) {
                out.println("   " + file);
            }
            out.flush();
            return 0;
        }

        if (files.isEmpty()) {
            logger.warn("No source files found under {}", paths);
        }

        ProgressListener progress = noProgress
                ? ProgressListener.NONE
                : new ConsoleProgressBar(spec.commandLine().getErr());
        DirectoryNode root = new ProjectAnalyzer(config, progress).analyze(files);

        Path outputPath = Path.of(output);
        new ReportWriter().write(root, outputPath);
        out.println("→ JSON written to " + outputPath);
        out.flush();
        return 0;
    }

    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the exit-code mapping used by {@link #main(String[])}.
     */
    static CommandLine createCommandLine() {
        CommandLine cmd = new CommandLine(new CheckCodeCLI());

        // a repeated switch keeps its last value, so --duplication --no-duplication disables matching
        cmd.setOverwrittenOptionsAllowed(true);

        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            int exitCode = exitCodeFor(ex);
            PrintWriter err = commandLine.getErr();
            switch (exitCode) {
                case 5 -> err.println("Parse error: " + ex.getMessage());
                case 2 -> err.println("Configuration error: " + ex.getMessage());
                case 3 -> err.println("I/O error: " + ex.getMessage());
                case 4 -> err.println("Process interrupted: " + ex.getMessage());
                default -> {
                    err.println("Error: " + ex.getMessage());
                    ex.printStackTrace(err);
                }
            }
            return exitCode;
        });

        cmd.setParameterExceptionHandler((ex, args1) -> {
            CommandLine.Help.ColorScheme colorScheme = CommandLine.Help.defaultColorScheme(CommandLine.Help.Ansi.AUTO);
            cmd.getErr().println(colorScheme.errorText(ex.getMessage()));
            CommandLine.UnmatchedArgumentException.printSuggestions(ex, cmd.getErr());
            cmd.getErr().print(cmd.getUsageMessage(colorScheme));
            return 2;
        });

        return cmd;
    }

    /**
     * Exit code for an exception escaping {@link #call()}.
     */
    static int exitCodeFor(Exception ex) {
        if (ex instanceof SourceParseException) {
            return 5;
        } else if (ex instanceof IllegalArgumentException) {
            return 2;
        } else if (ex instanceof IOException || ex instanceof UncheckedIOException) {
            return 3;
        } else if (ex instanceof InterruptedException) {
            return 4;
        }
        return 1;
    }

    /**
     * Validate CLI configuration before execution.
     *
     * @throws IllegalArgumentException if configuration is invalid
     */
    private void validateConfiguration() {
        if (threads != null && threads < 1) {
            throw new IllegalArgumentException("Threads must be positive, got: " + threads);
        }

        if (configFile != null && !Files.isRegularFile(Path.of(configFile))) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        Path outputPath = Path.of(output);
        if (Files.isDirectory(outputPath)) {
            throw new IllegalArgumentException("Output path is a directory: " + output);
        }
    }
}
