package io.flowlint.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Complete lint run report containing all file reports and metadata.
 *
 * @param startTime When the run started
 * @param duration  How long the run took
 * @param files     Per-file results, in input order
 * @param rules     Names of the rules that ran
 */
public record LintReport(
        Instant startTime,
        Duration duration,
        List<FileReport> files,
        List<String> rules
) {
    public LintReport {
        files = files == null ? List.of() : List.copyOf(files);
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    public List<Issue> allIssues() {
        return files.stream()
                .flatMap(file -> file.issues().stream())
                .toList();
    }

    public int totalIssues() {
        return files.stream().mapToInt(file -> file.issues().size()).sum();
    }

    public long failedFiles() {
        return files.stream().filter(FileReport::failed).count();
    }

    /**
     * Returns true if there are any issues at or above the given severity.
     */
    public boolean hasIssuesAtLeast(Severity threshold) {
        return allIssues().stream()
                .anyMatch(issue -> issue.severity().isAtLeast(threshold));
    }

    /**
     * Returns count of issues by rule name.
     */
    public Map<String, Long> issueCountsByRule() {
        return allIssues().stream()
                .collect(Collectors.groupingBy(Issue::ruleName, Collectors.counting()));
    }

    public Map<Severity, Long> issueCountsBySeverity() {
        return allIssues().stream()
                .collect(Collectors.groupingBy(Issue::severity, Collectors.counting()));
    }
}
