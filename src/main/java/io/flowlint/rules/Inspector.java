package io.flowlint.rules;

import io.flowlint.model.FileReport;
import io.flowlint.model.Issue;
import io.flowlint.model.LintReport;
import io.flowlint.model.Severity;
import io.flowlint.parse.ParseException;
import io.flowlint.parse.Parser;
import io.flowlint.semantic.AnalysisException;
import io.flowlint.semantic.ScopeResolver;
import io.flowlint.semantic.SymbolResolver;
import io.flowlint.syntax.SyntaxTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs rules over files and collects their issues.
 * <p>
 * Each file is analyzed on its own, with its own tree, resolver and suppression regions.
 * {@link #inspectAll(List)} spreads files over a fixed pool of workers; a failure in one
 * file is recorded in that file's report and does not affect the others.
 */
public class Inspector {

    private static final Logger log = LoggerFactory.getLogger(Inspector.class);

    private static final Comparator<Issue> BY_POSITION = Comparator
            .comparingInt((Issue issue) -> issue.span().start())
            .thenComparingInt(issue -> issue.span().end())
            .thenComparing(Issue::ruleName);

    private final List<Rule> rules;
    private final Map<String, Severity> severityOverrides;
    private final int threads;

    /**
     * @param rules             rules to run, in order
     * @param severityOverrides severity per lower-cased rule name, replacing the rule's own
     * @param threads           number of worker threads used by {@link #inspectAll(List)}
     */
    public Inspector(List<Rule> rules, Map<String, Severity> severityOverrides, int threads) {
        if (rules == null) {
            throw new IllegalArgumentException("rules cannot be null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be positive, got " + threads);
        }
        this.rules = List.copyOf(rules);
        this.severityOverrides = severityOverrides == null ? Map.of() : Map.copyOf(severityOverrides);
        this.threads = threads;
    }

    public Inspector(List<Rule> rules) {
        this(rules, Map.of(), 1);
    }

    /**
     * Runs one rule over a tree and drops the issues inside suppression regions for the
     * rule. Issues are ordered by position.
     *
     * @throws AnalysisException if the resolver does not belong to the tree
     */
    public static List<Issue> run(Rule rule, SyntaxTree tree, SymbolResolver resolver) {
        return run(rule, new AnalysisContext(tree, resolver));
    }

    static List<Issue> run(Rule rule, AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        for (Issue issue : rule.inspect(context)) {
            if (context.isSuppressed(rule, issue.span().start())) {
                log.trace("Suppressed {} at {}", rule.name(), issue.location());
            } else {
                issues.add(issue);
            }
        }
        issues.sort(BY_POSITION);
        return issues;
    }

    /**
     * Runs all rules over an already parsed tree.
     *
     * @throws AnalysisException if the resolver does not belong to the tree
     */
    public List<Issue> inspect(SyntaxTree tree, SymbolResolver resolver) {
        AnalysisContext context = new AnalysisContext(tree, resolver);
        List<Issue> issues = new ArrayList<>();
        for (Rule rule : rules) {
            Severity override = severityOverrides.get(rule.name().toLowerCase(Locale.ROOT));
            for (Issue issue : run(rule, context)) {
                issues.add(override == null ? issue : issue.withSeverity(override));
            }
        }
        issues.sort(BY_POSITION);
        return issues;
    }

    /**
     * Parses and inspects source text. Parse and analysis failures become a failed report.
     */
    public FileReport inspectFile(String file, String text) {
        log.debug("Inspecting {}", file);
        try {
            SyntaxTree tree = Parser.parse(text);
            List<Issue> issues = inspect(tree, new ScopeResolver(tree));
            log.debug("{}: {} issue(s)", file, issues.size());
            return FileReport.success(file, issues);
        } catch (ParseException e) {
            log.debug("{}: parse error at {}:{}", file, e.line(), e.column());
            return FileReport.failure(file, "Parse error: " + e.getMessage());
        } catch (AnalysisException e) {
            log.error("Analysis of {} failed", file, e);
            return FileReport.failure(file, "Analysis failed: " + e.getMessage());
        }
    }

    public FileReport inspectFile(Path file) {
        try {
            return inspectFile(file.toString(), Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("Cannot read {}", file, e);
            return FileReport.failure(file.toString(), "Cannot read file: " + e.getMessage());
        }
    }

    /**
     * Inspects files concurrently. Reports are returned in input order.
     */
    public LintReport inspectAll(List<Path> files) {
        Instant start = Instant.now();
        List<FileReport> reports = new ArrayList<>(files.size());

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, Math.max(1, files.size())));
        try {
            List<Callable<FileReport>> tasks = new ArrayList<>();
            for (Path file : files) {
                tasks.add(() -> inspectFile(file));
            }
            List<Future<FileReport>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                reports.add(collect(futures.get(i), files.get(i)));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while inspecting files", e);
        } finally {
            executor.shutdownNow();
        }

        Duration duration = Duration.between(start, Instant.now());
        log.debug("Inspected {} file(s) in {} ms", files.size(), duration.toMillis());
        return new LintReport(start, duration, reports, rules.stream().map(Rule::name).toList());
    }

    private static FileReport collect(Future<FileReport> future, Path file) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Inspection of {} failed", file, e.getCause());
            return FileReport.failure(file.toString(), "Inspection failed: " + e.getCause());
        }
    }

    public List<Rule> rules() {
        return rules;
    }
}
