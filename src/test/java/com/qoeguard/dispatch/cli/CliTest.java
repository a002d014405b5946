package com.qoeguard.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qoeguard.core.config.QoeGuardProperties;
import com.qoeguard.core.engine.BatchValidator;
import com.qoeguard.core.engine.ValidationEngine;
import com.qoeguard.core.engine.ValidationService;
import com.qoeguard.core.features.CriticalityConfig;
import com.qoeguard.core.json.JsonDocumentReader;
import com.qoeguard.core.model.GateDecision;
import com.qoeguard.core.policy.PolicyConfig;
import com.qoeguard.core.report.ReportFormatter;
import com.qoeguard.core.scoring.LogisticRiskScorer;
import com.qoeguard.core.scoring.WeightConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the qoe-guard CLI command structure.
 * These tests exercise picocli directly without a Spring context,
 * wiring real pipeline objects through a custom factory.
 */
class CliTest {

    private record CliResult(int exitCode, String output, String errors) {}

    private static final String BASELINE =
            "{'playback':{'url':'https://cdn/a.m3u8','bitrate':8000,'drm':'widevine','codec':'h264','cdn':'c1'}}";
    private static final String TYPE_ONLY =
            "{'playback':{'url':'https://cdn/a.m3u8','bitrate':'8000','drm':'widevine','codec':'h264','cdn':'c1'}}";
    private static final String BROKEN =
            "{'playback':{'url':'https://cdn/a.m3u8','bitrate':'8000'}}";

    @TempDir
    Path dir;

    private final ObjectMapper mapper = new ObjectMapper();

    private Path baseline;
    private Path typeOnly;
    private Path broken;

    @BeforeEach
    void writeFixtures() throws IOException {
        baseline = write("baseline.json", BASELINE);
        typeOnly = write("type-only.json", TYPE_ONLY);
        broken = write("broken.json", BROKEN);
    }

    private Path write(String name, String singleQuotedJson) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, singleQuotedJson.replace('\'', '"'));
        return file;
    }

    /**
     * Custom picocli IFactory that provides real collaborators for commands.
     */
    private CommandLine.IFactory createFactory() {
        ValidationEngine engine = new ValidationEngine(new LogisticRiskScorer(),
                CriticalityConfig.defaults(), WeightConfig.defaults(), PolicyConfig.defaults());
        ValidationService service = new ValidationService(engine, null);
        JsonDocumentReader reader = new JsonDocumentReader(mapper);
        ReportFormatter formatter = new ReportFormatter(mapper);
        BatchValidator batchValidator = new BatchValidator(service, new QoeGuardProperties(), null);

        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(service, reader, formatter);
                }
                if (cls == BatchCommand.class) {
                    return (K) new BatchCommand(batchValidator, service, reader, formatter);
                }
                if (cls == PolicyCommand.class) {
                    return (K) new PolicyCommand(service, formatter);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(new PrintStream(out, true));
        System.setErr(new PrintStream(err, true));
        try {
            CommandLine commandLine = new CommandLine(new QoeGuardCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            return new CliResult(exitCode, out.toString(), err.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    @Nested
    @DisplayName("Top-level command")
    class TopLevel {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("validate"));
            assertTrue(result.output().contains("batch"));
            assertTrue(result.output().contains("policy"));
            assertTrue(result.output().contains("3 = ERROR"));
        }

        @Test
        @DisplayName("--version shows version")
        void version() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("qoe-guard 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints banner and usage")
        void noSubcommand() {
            CliResult result = execute();
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("QOE-GUARD v0.1.0"));
            assertTrue(result.output().contains("Usage: qoe-guard"));
        }
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("identical documents exit 0")
        void pass() {
            CliResult result = execute("validate", "-b", baseline.toString(), "-c", baseline.toString());
            assertEquals(ExitCodes.PASS, result.exitCode(), result.errors());
            assertTrue(result.output().contains("Decision:   PASS"));
        }

        @Test
        @DisplayName("WARN exits 1, or 2 with --fail-on-warn")
        void warn() {
            CliResult result = execute("validate", "-b", baseline.toString(), "-c", typeOnly.toString(),
                    "--warn-threshold", "0.25");
            assertEquals(ExitCodes.WARN, result.exitCode(), result.errors());

            CliResult strict = execute("validate", "-b", baseline.toString(), "-c", typeOnly.toString(),
                    "--warn-threshold", "0.25", "--fail-on-warn");
            assertEquals(ExitCodes.FAIL, strict.exitCode());
        }

        @Test
        @DisplayName("override failure exits 2")
        void fail() {
            CliResult result = execute("validate", "-b", baseline.toString(), "-c", broken.toString(),
                    "--name", "playback");
            assertEquals(ExitCodes.FAIL, result.exitCode(), result.errors());
            assertTrue(result.output().contains("Override:   critical-type-changes"));
            assertTrue(result.output().contains("FAIL playback"));
        }

        @Test
        @DisplayName("--format json writes only the JSON report")
        void json() throws Exception {
            CliResult result = execute("validate", "-b", baseline.toString(), "-c", broken.toString(),
                    "--format", "json");
            JsonNode report = mapper.readTree(result.output());
            assertEquals("FAIL", report.get("decision").asText());
            assertEquals("broken.json", report.get("name").asText());
        }

        @Test
        @DisplayName("--format github writes workflow annotations")
        void github() {
            CliResult result = execute("validate", "-b", baseline.toString(), "-c", broken.toString(),
                    "-f", "github");
            assertTrue(result.output().startsWith("::error "), result.output());
        }

        @Test
        @DisplayName("--preset strict changes thresholds")
        void preset() {
            CliResult result = execute("validate", "-b", baseline.toString(), "-c", typeOnly.toString(),
                    "--preset", "strict", "--scorer", "tree");
            // tree scorer puts a critical type change at 0.70, above strict fail at 0.60
            assertEquals(ExitCodes.FAIL, result.exitCode(), result.errors());
        }

        @Test
        @DisplayName("missing file exits 3")
        void missingFile() {
            CliResult result = execute("validate", "-b", baseline.toString(),
                    "-c", dir.resolve("nope.json").toString());
            assertEquals(ExitCodes.ERROR, result.exitCode());
            assertTrue(result.errors().contains("File not found"), result.errors());
        }

        @Test
        @DisplayName("malformed JSON exits 3")
        void malformed() throws IOException {
            Path bad = dir.resolve("bad.json");
            Files.writeString(bad, "{\"playback\":");
            assertEquals(ExitCodes.ERROR, execute("validate", "-b", baseline.toString(), "-c", bad.toString()).exitCode());
        }

        @Test
        @DisplayName("out-of-range numbers are scored, not rejected")
        void hugeNumber() throws IOException {
            Path huge = write("huge.json", BASELINE.replace("8000", "1e400"));
            CliResult result = execute("validate", "-b", baseline.toString(), "-c", huge.toString());
            assertNotEquals(ExitCodes.ERROR, result.exitCode(), result.errors());
            assertTrue(result.output().contains("Decision:"), result.output());
        }

        @Test
        @DisplayName("bad options exit 3")
        void badOptions() {
            assertEquals(ExitCodes.ERROR, execute("validate", "-b", baseline.toString()).exitCode());
            assertEquals(ExitCodes.ERROR, execute("validate", "-b", baseline.toString(),
                    "-c", baseline.toString(), "--preset", "lenient").exitCode());
            assertEquals(ExitCodes.ERROR, execute("validate", "-b", baseline.toString(),
                    "-c", baseline.toString(), "--warn-threshold", "0.9").exitCode());
            assertEquals(ExitCodes.ERROR, execute("validate", "-b", baseline.toString(),
                    "-c", baseline.toString(), "--format", "xml").exitCode());
        }
    }

    @Nested
    @DisplayName("batch")
    class Batch {

        @Test
        @DisplayName("exits with the worst outcome")
        void worstOutcome() throws IOException {
            Path manifest = write("manifest.json", "{'comparisons':["
                    + "{'name':'same','baseline':'baseline.json','candidate':'baseline.json'},"
                    + "{'name':'typed','baseline':'baseline.json','candidate':'type-only.json'},"
                    + "{'name':'broken','baseline':'baseline.json','candidate':'broken.json'}]}");

            CliResult result = execute("batch", manifest.toString(), "--parallel", "2");

            assertEquals(ExitCodes.FAIL, result.exitCode(), result.errors());
            assertTrue(result.output().contains("PASS 2, WARN 0, FAIL 1. Worst outcome: FAIL"), result.output());
        }

        @Test
        @DisplayName("a plain array manifest is accepted and reported as JSON")
        void arrayManifest() throws Exception {
            Path manifest = write("list.json",
                    "[{'baseline':'baseline.json','candidate':'type-only.json'}]");

            CliResult result = execute("batch", manifest.toString(), "--format", "json");

            assertEquals(ExitCodes.PASS, result.exitCode(), result.errors());
            JsonNode report = mapper.readTree(result.output());
            assertEquals(GateDecision.PASS.name(), report.get("decision").asText());
            assertEquals("type-only.json", report.get("results").get(0).get("name").asText());
        }

        @Test
        @DisplayName("manifest errors exit 3")
        void badManifest() throws IOException {
            Path missingField = write("missing.json", "[{'baseline':'baseline.json'}]");
            assertEquals(ExitCodes.ERROR, execute("batch", missingField.toString()).exitCode());

            Path notList = write("object.json", "{'items':[]}");
            assertEquals(ExitCodes.ERROR, execute("batch", notList.toString()).exitCode());

            Path manifest = write("ok.json", "[{'baseline':'baseline.json','candidate':'baseline.json'}]");
            assertEquals(ExitCodes.ERROR, execute("batch", manifest.toString(), "--parallel", "0").exitCode());
        }
    }

    @Nested
    @DisplayName("policy")
    class Policy {

        @Test
        @DisplayName("prints the effective policy")
        void effectivePolicy() {
            CliResult result = execute("policy", "--preset", "strict");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Policy:     strict"));
            assertTrue(result.output().contains("critical-removals"));
            assertTrue(result.output().contains("$.playback"));
        }
    }

    @Test
    @DisplayName("exit codes map decisions")
    void exitCodes() {
        assertEquals(0, ExitCodes.forDecision(GateDecision.PASS, true));
        assertEquals(1, ExitCodes.forDecision(GateDecision.WARN, false));
        assertEquals(2, ExitCodes.forDecision(GateDecision.WARN, true));
        assertEquals(2, ExitCodes.forDecision(GateDecision.FAIL, false));
    }
}
