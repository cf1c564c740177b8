package io.flowlint.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowlint.model.FileReport;
import io.flowlint.model.LintReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReporterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void write_producesMetadataSummaryAndFiles() throws IOException {
        LintReport report = new LintReport(Instant.parse("2024-05-01T10:15:30Z"), Duration.ofMillis(42), List.of(
                FileReport.success("A.cs", List.of(ConsoleReporterTest.thisIssue())),
                FileReport.failure("Broken.cs", "Cannot read file: Broken.cs")
        ), List.of("RedundantThisQualifier"));

        JsonNode root = mapper.readTree(new JsonReporter().toString(report));

        assertThat(root.at("/metadata/startTime").asText()).isEqualTo("2024-05-01T10:15:30Z");
        assertThat(root.at("/metadata/durationMs").asLong()).isEqualTo(42);
        assertThat(root.at("/metadata/rules/0").asText()).isEqualTo("RedundantThisQualifier");

        assertThat(root.at("/summary/files").asInt()).isEqualTo(2);
        assertThat(root.at("/summary/failedFiles").asInt()).isEqualTo(1);
        assertThat(root.at("/summary/hint").asInt()).isEqualTo(1);
        assertThat(root.at("/summary/warning").asInt()).isZero();
        assertThat(root.at("/summary/total").asInt()).isEqualTo(1);

        JsonNode issue = root.at("/files/0/issues/0");
        assertThat(issue.get("rule").asText()).isEqualTo("RedundantThisQualifier");
        assertThat(issue.get("severity").asText()).isEqualTo("HINT");
        assertThat(issue.get("line").asInt()).isEqualTo(3);
        assertThat(issue.get("column").asInt()).isEqualTo(14);
        assertThat(issue.get("end").asInt() - issue.get("start").asInt()).isEqualTo(5);
        assertThat(issue.at("/fixes/0").asText()).isEqualTo("Remove 'this.'");
        assertThat(root.at("/files/0").has("error")).isFalse();

        JsonNode failed = root.at("/files/1");
        assertThat(failed.get("error").asText()).isEqualTo("Cannot read file: Broken.cs");
        assertThat(failed.has("issues")).isFalse();
    }

    @Test
    void write_toFile() throws IOException {
        Path out = tempDir.resolve("report.json");
        LintReport report = new LintReport(Instant.now(), Duration.ZERO,
                List.of(FileReport.success("A.cs", List.of())), List.of());

        new JsonReporter(false).write(report, out);

        JsonNode root = mapper.readTree(Files.readString(out));
        assertThat(root.at("/summary/total").asInt()).isZero();
        assertThat(root.at("/files/0/issues").isArray()).isTrue();
        assertThat(Files.readString(out)).doesNotContain("\n");
    }
}
