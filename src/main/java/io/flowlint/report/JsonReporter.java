package io.flowlint.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.flowlint.model.FileReport;
import io.flowlint.model.Fix;
import io.flowlint.model.Issue;
import io.flowlint.model.LintReport;
import io.flowlint.model.Severity;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Formats lint results as JSON for machine processing.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // the caller owns the writer, which may wrap stdout
        m.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(LintReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, toJsonReport(report));
    }

    private JsonReport toJsonReport(LintReport report) {
        Map<Severity, Long> bySeverity = report.issueCountsBySeverity();
        return new JsonReport(
                new JsonReport.Metadata(
                        report.startTime(),
                        report.duration() == null ? 0 : report.duration().toMillis(),
                        report.rules()
                ),
                new JsonReport.Summary(
                        report.files().size(),
                        report.failedFiles(),
                        bySeverity.getOrDefault(Severity.ERROR, 0L),
                        bySeverity.getOrDefault(Severity.WARNING, 0L),
                        bySeverity.getOrDefault(Severity.SUGGESTION, 0L),
                        bySeverity.getOrDefault(Severity.HINT, 0L),
                        report.totalIssues()
                ),
                report.files().stream()
                        .map(this::toJsonFile)
                        .toList()
        );
    }

    private JsonReport.File toJsonFile(FileReport file) {
        return new JsonReport.File(
                file.file(),
                file.error(),
                file.failed() ? null : file.issues().stream().map(this::toJsonIssue).toList()
        );
    }

    private JsonReport.Issue toJsonIssue(Issue issue) {
        return new JsonReport.Issue(
                issue.ruleName(),
                issue.severity().name(),
                issue.message(),
                issue.line() > 0 ? issue.line() : null,
                issue.column() > 0 ? issue.column() : null,
                issue.span().start(),
                issue.span().end(),
                issue.fixes().isEmpty() ? null : issue.fixes().stream()
                        .map(Fix::title)
                        .toList()
        );
    }

    /**
     * JSON structure for the report.
     */
    public record JsonReport(
            Metadata metadata,
            Summary summary,
            List<File> files
    ) {
        public record Metadata(
                Instant startTime,
                long durationMs,
                List<String> rules
        ) {}

        public record Summary(
                int files,
                long failedFiles,
                long error,
                long warning,
                long suggestion,
                long hint,
                int total
        ) {}

        public record File(
                String path,
                String error,
                List<Issue> issues
        ) {}

        public record Issue(
                String rule,
                String severity,
                String message,
                Integer line,
                Integer column,
                int start,
                int end,
                List<String> fixes
        ) {}
    }
}
