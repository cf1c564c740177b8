package io.flowlint;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class FlowLintCliTest {

    private static final String NEVER_RETURNS = "class C { void M() { while (true) { } } }";
    private static final String CLEAN = "class C { int a; int M(int a) { return this.a + a; } }";
    private static final String REDUNDANT_THIS = "class C { int a; void M() { this.a = 1; this.a = 2; } }";

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void neverReturningMethod_failsWithExitCodeTwo() throws IOException {
        Path source = write("Loop.cs", NEVER_RETURNS);
        Path report = tempDir.resolve("report.json");

        int exitCode = run(source.toString(), "-o", "json", "-f", report.toString());

        assertThat(exitCode).isEqualTo(2);
        JsonNode root = mapper.readTree(Files.readString(report));
        assertThat(root.at("/files/0/issues/0/rule").asText()).isEqualTo("FunctionNeverReturns");
        assertThat(root.at("/files/0/issues/0/message").asText())
                .isEqualTo("Method never reaches its end or a 'return' statement.");
    }

    @Test
    void cleanSource_succeeds() throws IOException {
        Path source = write("Clean.cs", CLEAN);
        Path report = tempDir.resolve("report.json");

        int exitCode = run(source.toString(), "-o", "json", "-f", report.toString());

        assertThat(exitCode).isZero();
        assertThat(mapper.readTree(Files.readString(report)).at("/summary/total").asInt()).isZero();
    }

    @Test
    void failOnHint_failsForRedundantQualifier() throws IOException {
        Path source = write("This.cs", REDUNDANT_THIS);

        int exitCode = run(source.toString(), "--fail-on", "hint", "--no-color",
                "-f", tempDir.resolve("report.txt").toString());

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void fix_rewritesSourceInPlace() throws IOException {
        Path source = write("This.cs", REDUNDANT_THIS);
        Path report = tempDir.resolve("report.json");

        int exitCode = run(source.toString(), "--fix", "-o", "json", "-f", report.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(source)).isEqualTo("class C { int a; void M() { a = 1; a = 2; } }");
        assertThat(mapper.readTree(Files.readString(report)).at("/summary/total").asInt()).isZero();
    }

    @Test
    void rulesOption_restrictsTheRun() throws IOException {
        Path source = write("Loop.cs", NEVER_RETURNS);

        int exitCode = run(source.toString(), "-r", "RedundantThis", "-o", "json",
                "-f", tempDir.resolve("report.json").toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void configFile_disablesRules() throws IOException {
        Path source = write("Loop.cs", NEVER_RETURNS);
        Path config = write("config.yaml", "disabledRules: [FunctionNeverReturns]\n");

        int exitCode = run(source.toString(), "-c", config.toString(), "-o", "json",
                "-f", tempDir.resolve("report.json").toString());

        assertThat(exitCode).isZero();
    }

    @Test
    void directoryInput_collectsSourceFiles() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("src/nested"));
        Files.writeString(dir.resolve("Loop.cs"), NEVER_RETURNS);
        Files.writeString(dir.resolve("notes.txt"), "not a source file");
        Path report = tempDir.resolve("report.json");

        int exitCode = run(tempDir.resolve("src").toString(), "-o", "json", "-f", report.toString());

        assertThat(exitCode).isEqualTo(2);
        JsonNode root = mapper.readTree(Files.readString(report));
        assertThat(root.at("/summary/files").asInt()).isEqualTo(1);
        assertThat(root.at("/files/0/path").asText()).endsWith("Loop.cs");
    }

    @Test
    void parseErrors_areReportedPerFile() throws IOException {
        Path broken = write("Broken.cs", "class C { void M() { return } }");
        Path clean = write("Clean.cs", CLEAN);
        Path report = tempDir.resolve("report.json");

        int exitCode = run(broken.toString(), clean.toString(), "-o", "json", "-f", report.toString());

        assertThat(exitCode).isZero();
        JsonNode root = mapper.readTree(Files.readString(report));
        assertThat(root.at("/summary/failedFiles").asInt()).isEqualTo(1);
        assertThat(root.at("/files/0/error").asText()).startsWith("Parse error: Unexpected '}'");
    }

    @Test
    void invalidArguments_exitWithOne() throws IOException {
        Path source = write("Clean.cs", CLEAN);

        assertThat(run(source.toString(), "-r", "NoSuchRule")).isEqualTo(1);
        assertThat(run(source.toString(), "--fail-on", "fatal")).isEqualTo(1);
        assertThat(run(source.toString(), "--threads", "0")).isEqualTo(1);
        assertThat(run(tempDir.resolve("missing.cs").toString())).isEqualTo(1);
        assertThat(run(tempDir.toString(), "-c", tempDir.resolve("missing.yaml").toString())).isEqualTo(1);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }

    private static int run(String... args) {
        return new CommandLine(new FlowLintCli()).execute(args);
    }
}
