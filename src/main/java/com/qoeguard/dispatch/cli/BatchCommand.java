package com.qoeguard.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.engine.BatchReport;
import com.qoeguard.core.engine.BatchValidator;
import com.qoeguard.core.engine.ComparisonRequest;
import com.qoeguard.core.engine.ValidationEngine;
import com.qoeguard.core.engine.ValidationService;
import com.qoeguard.core.json.JsonDocumentReader;
import com.qoeguard.core.json.JsonInputException;
import com.qoeguard.core.report.ReportFormatter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: qoe-guard batch &lt;manifest.json&gt;
 * <p>
 * The manifest is either an array or an object with a {@code comparisons} array. Each entry
 * names a {@code baseline} and {@code candidate} file, resolved against the manifest's
 * directory, and an optional {@code name}. Exits with the worst outcome across the batch.
 */
@Command(name = "batch", mixinStandardHelpOptions = true,
        description = "Validate many baseline/candidate pairs listed in a manifest",
        exitCodeOnInvalidInput = ExitCodes.ERROR,
        exitCodeOnExecutionException = ExitCodes.ERROR)
@Component
public class BatchCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Manifest JSON file")
    private Path manifest;

    @Option(names = {"--parallel", "-p"}, description = "Maximum concurrent comparisons")
    private Integer parallel;

    @Option(names = {"--format", "-f"}, defaultValue = "summary",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format;

    @Option(names = "--fail-on-warn", description = "Exit with the FAIL code when the worst outcome is WARN")
    private boolean failOnWarn;

    @Mixin
    private EngineOptions engineOptions = new EngineOptions();

    private final BatchValidator batchValidator;
    private final ValidationService validationService;
    private final JsonDocumentReader reader;
    private final ReportFormatter formatter;

    public BatchCommand(BatchValidator batchValidator, ValidationService validationService,
                        JsonDocumentReader reader, ReportFormatter formatter) {
        this.batchValidator = batchValidator;
        this.validationService = validationService;
        this.reader = reader;
        this.formatter = formatter;
    }

    @Override
    public Integer call() {
        ValidationEngine engine;
        List<ComparisonRequest> requests;
        int parallelism = parallel != null ? parallel : batchValidator.defaultParallelism();
        try {
            if (parallelism < 1) {
                throw new ConfigurationException("--parallel must be at least 1, got " + parallelism);
            }
            engine = engineOptions.apply(validationService.engine());
            requests = loadManifest(manifest);
        } catch (ConfigurationException | JsonInputException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.ERROR;
        }

        BatchReport report;
        try {
            report = batchValidator.run(requests, engine, parallelism);
        } catch (IllegalStateException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.ERROR;
        }

        switch (format) {
            case json -> System.out.println(formatter.batchJson(report));
            case github -> System.out.print(formatter.batchGithub(report));
            default -> {
                ConsoleOutput.printBanner();
                System.out.print(formatter.batchSummary(report));
            }
        }
        return ExitCodes.forDecision(report.worstOutcome(), failOnWarn);
    }

    List<ComparisonRequest> loadManifest(Path file) {
        JsonNode root = reader.readTree(file);
        JsonNode entries = root.isArray() ? root : root.path("comparisons");
        if (!entries.isArray()) {
            throw new JsonInputException("Manifest " + file + " must be an array or contain a 'comparisons' array");
        }
        Path dir = file.toAbsolutePath().getParent();
        List<ComparisonRequest> requests = new ArrayList<>();
        int index = 0;
        for (JsonNode entry : entries) {
            String baselineFile = requiredText(entry, "baseline", file, index);
            String candidateFile = requiredText(entry, "candidate", file, index);
            String entryName = entry.hasNonNull("name") ? entry.get("name").asText() : candidateFile;
            requests.add(new ComparisonRequest(entryName,
                    reader.read(dir.resolve(baselineFile)),
                    reader.read(dir.resolve(candidateFile))));
            index++;
        }
        return requests;
    }

    private static String requiredText(JsonNode entry, String field, Path file, int index) {
        JsonNode value = entry.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new JsonInputException("Manifest " + file + " entry " + index + " is missing '" + field + "'");
        }
        return value.asText();
    }
}
