package io.flowlint;

import io.flowlint.fix.EditConflictException;
import io.flowlint.fix.FixApplier;
import io.flowlint.model.FileReport;
import io.flowlint.model.LintReport;
import io.flowlint.model.Severity;
import io.flowlint.report.ConsoleReporter;
import io.flowlint.report.JsonReporter;
import io.flowlint.report.Reporter;
import io.flowlint.rules.Inspector;
import io.flowlint.rules.Rule;
import io.flowlint.rules.RuleRegistry;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;

/**
 * CLI entry point for the flow-lint tool.
 */
@Command(
        name = "flow-lint",
        mixinStandardHelpOptions = true,
        version = "flow-lint 1.0.0",
        description = "Finds redundant 'this.' qualifiers and functions that never return in C# sources.",
        footer = {
                "",
                "Supported input: top-level classes, structs and interfaces with fields, methods,",
                "properties and events; all statements including goto case/default; calls, member",
                "and element access, assignments, operators, 'new T(...)', lambdas and anonymous",
                "methods. Files using nested types, casts, 'is'/'as', '?.', generic method calls,",
                "interpolated strings, array initializers or expression-bodied members are",
                "reported as parse errors.",
                "",
                "Examples:",
                "  flow-lint src/",
                "  flow-lint Foo.cs Bar.cs --output-format json --output-file report.json",
                "  flow-lint src/ --rules RedundantThisQualifier --fix"
        }
)
public class FlowLintCli implements Callable<Integer> {

    private static final String SOURCE_EXTENSION = ".cs";
    private static final int MAX_FIX_ROUNDS = 16;

    @Parameters(
            arity = "1..*",
            description = "Source files or directories to analyze (directories are searched for *.cs files)"
    )
    private List<Path> inputs;

    @Option(
            names = {"-c", "--config"},
            description = "Path to configuration YAML file (defaults to ./flow-lint.yaml if present)"
    )
    private Path configFile;

    @Option(
            names = {"-o", "--output-format"},
            description = "Output format: console (default), json",
            defaultValue = "console"
    )
    private OutputFormat outputFormat;

    @Option(
            names = {"-f", "--output-file"},
            description = "Output file path (defaults to stdout)"
    )
    private Path outputFile;

    @Option(
            names = {"-r", "--rules"},
            description = "Rules to run, by name or alias (default: all enabled rules)",
            split = ","
    )
    private List<String> ruleNames;

    @Option(
            names = {"--fix"},
            description = "Apply all available fixes in place before reporting"
    )
    private boolean fix;

    @Option(
            names = {"--fail-on"},
            description = "Exit with non-zero code if issues at this level or higher: error, warning, suggestion, hint"
    )
    private String failOnLevel;

    @Option(
            names = {"-t", "--threads"},
            description = "Number of files analyzed in parallel (default: from config, else number of CPUs)"
    )
    private Integer threads;

    @Option(
            names = {"--no-color"},
            description = "Disable ANSI colors in console output"
    )
    private boolean noColor;

    @Option(
            names = {"-v", "--verbose"},
            description = "Enable verbose output"
    )
    private boolean verbose;

    public enum OutputFormat {
        console,
        json
    }

    @Override
    public Integer call() {
        try {
            LintConfig config = loadConfig();

            Severity failLevel;
            try {
                failLevel = failOnLevel != null ? Severity.parse(failOnLevel) : config.getFailOn();
            } catch (IllegalArgumentException e) {
                System.err.println("Error: Invalid value for --fail-on: " + failOnLevel);
                System.err.println("Valid values: error, warning, suggestion, hint");
                return 1;
            }

            if (threads != null && threads < 1) {
                System.err.println("Error: --threads must be positive");
                return 1;
            }

            RuleRegistry registry = RuleRegistry.createDefault();
            List<Rule> rules;
            try {
                rules = ruleNames != null && !ruleNames.isEmpty()
                        ? registry.select(ruleNames)
                        : registry.enabled(config);
            } catch (IllegalArgumentException e) {
                System.err.println("Error: " + e.getMessage());
                System.err.println("Available rules: " + String.join(", ",
                        registry.allRules().stream().map(Rule::name).toList()));
                return 1;
            }
            log("Rules: " + String.join(", ", rules.stream().map(Rule::name).toList()));

            List<Path> files = collectFiles();
            if (files.isEmpty()) {
                System.err.println("Error: No " + SOURCE_EXTENSION + " files found");
                return 1;
            }
            log("Analyzing " + files.size() + " file(s)...");

            int workerCount = threads != null ? threads : config.getThreads();
            Inspector inspector = new Inspector(rules, config.getSeverityOverrides(), workerCount);

            if (fix) {
                for (Path file : files) {
                    fixFile(inspector, file);
                }
            }

            LintReport report = inspector.inspectAll(files);
            writeReport(report, createReporter());

            if (report.hasIssuesAtLeast(failLevel)) {
                if (outputFormat == OutputFormat.console) {
                    System.err.println("Failing due to issues at " + failLevel.label() + " level or higher.");
                }
                return 2;
            }
            return 0;

        } catch (IOException e) {
            System.err.println("Error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        } catch (Exception e) {
            System.err.println("Unexpected error: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private LintConfig loadConfig() throws IOException {
        LintConfig defaultConfig = LintConfig.loadDefault();

        if (configFile != null) {
            if (!Files.exists(configFile)) {
                throw new IOException("Config file does not exist: " + configFile);
            }
            log("Loading configuration from: " + configFile);
            return defaultConfig.merge(LintConfig.load(configFile));
        }

        Path localConfig = Path.of(LintConfig.FILE_NAME);
        if (Files.exists(localConfig)) {
            log("Loading configuration from: " + localConfig);
            return defaultConfig.merge(LintConfig.load(localConfig));
        }

        return defaultConfig;
    }

    private List<Path> collectFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        for (Path input : inputs) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = Files.walk(input)) {
                    walk.filter(Files::isRegularFile)
                            .filter(path -> path.getFileName().toString().endsWith(SOURCE_EXTENSION))
                            .sorted()
                            .forEach(files::add);
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                throw new IOException("No such file or directory: " + input);
            }
        }
        return files;
    }

    /**
     * Applies fixes one sibling group at a time, re-parsing between groups since every
     * applied batch invalidates the offsets of the remaining fixes.
     */
    private void fixFile(Inspector inspector, Path file) throws IOException {
        String original = Files.readString(file, StandardCharsets.UTF_8);
        String text = original;

        for (int round = 0; round < MAX_FIX_ROUNDS; round++) {
            FileReport report = inspector.inspectFile(file.toString(), text);
            if (report.failed()) {
                log("  Skipping fixes for " + file + ": " + report.error());
                break;
            }
            List<String> keys = FixApplier.siblingKeys(report.issues());
            if (keys.isEmpty()) {
                break;
            }
            try {
                text = FixApplier.applySiblings(report.issues(), keys.get(0), text);
            } catch (EditConflictException e) {
                System.err.println("Warning: Could not fix " + file + ": " + e.getMessage());
                break;
            }
        }

        if (!text.equals(original)) {
            Files.writeString(file, text, StandardCharsets.UTF_8);
            log("  Fixed " + file);
        }
    }

    private Reporter createReporter() {
        return switch (outputFormat) {
            case console -> new ConsoleReporter(!noColor);
            case json -> new JsonReporter(true);
        };
    }

    private void writeReport(LintReport report, Reporter reporter) throws IOException {
        if (outputFile != null) {
            reporter.write(report, outputFile);
            if (outputFormat == OutputFormat.console) {
                System.out.println("Report written to: " + outputFile);
            }
        } else {
            PrintWriter out = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            reporter.write(report, out);
            out.flush();
        }
    }

    private void log(String message) {
        if (verbose && outputFormat != OutputFormat.json) {
            System.out.println(message);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FlowLintCli()).execute(args);
        System.exit(exitCode);
    }
}
