package io.flowlint.report;

import io.flowlint.model.FileReport;
import io.flowlint.model.Issue;
import io.flowlint.model.LintReport;
import io.flowlint.model.Severity;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Formats lint results for console output with ANSI colors, grouped per file.
 */
public class ConsoleReporter implements Reporter {

    // ANSI color codes
    private static final String RESET = "\u001B[0m";
    private static final String BOLD = "\u001B[1m";
    private static final String RED = "\u001B[31m";
    private static final String YELLOW = "\u001B[33m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";

    private final boolean useColors;

    public ConsoleReporter() {
        this(true);
    }

    public ConsoleReporter(boolean useColors) {
        this.useColors = useColors;
    }

    @Override
    public String format() {
        return "console";
    }

    @Override
    public void write(LintReport report, Writer writer) throws IOException {
        PrintWriter out = new PrintWriter(writer);

        for (FileReport file : report.files()) {
            printFile(out, file);
        }
        printSummary(out, report);
        out.flush();
    }

    private void printFile(PrintWriter out, FileReport file) {
        if (file.failed()) {
            out.println(bold(file.file()));
            out.println("  " + color(RED, "error") + "  " + file.error());
            out.println();
            return;
        }
        if (file.issues().isEmpty()) {
            return;
        }
        out.println(bold(file.file()));
        for (Issue issue : file.issues()) {
            out.printf("  %-8s %-10s %s %s%n",
                    issue.location(),
                    severityLabel(issue.severity()),
                    issue.message(),
                    color(CYAN, "[" + issue.ruleName() + "]"));
        }
        out.println();
    }

    private void printSummary(PrintWriter out, LintReport report) {
        out.println(line('-', 70));
        int total = report.totalIssues();
        String stats = String.format(Locale.ROOT, "%d file(s) | %d issue(s) | %d rule(s) | %.1fs",
                report.files().size(),
                total,
                report.rules().size(),
                report.duration() == null ? 0.0 : report.duration().toMillis() / 1000.0);
        out.println(stats);

        if (total > 0) {
            Map<String, Long> byRule = new TreeMap<>(report.issueCountsByRule());
            byRule.forEach((rule, count) -> out.println("  " + rule + ": " + count));
        }
        long failed = report.failedFiles();
        if (failed > 0) {
            out.println(color(RED, failed + " file(s) could not be analyzed."));
        } else if (total == 0) {
            out.println(color(GREEN, "No issues found."));
        }
        out.println();
    }

    private String severityLabel(Severity severity) {
        String padded = String.format("%-10s", severity.label());
        return switch (severity) {
            case ERROR -> color(RED, padded);
            case WARNING -> color(YELLOW, padded);
            case SUGGESTION, HINT -> padded;
        };
    }

    private String color(String color, String text) {
        if (!useColors) return text;
        return color + text + RESET;
    }

    private String bold(String text) {
        if (!useColors) return text;
        return BOLD + text + RESET;
    }

    private String line(char c, int length) {
        return String.valueOf(c).repeat(length);
    }
}
