package com.qoeguard.dispatch.cli;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.engine.ComparisonRequest;
import com.qoeguard.core.engine.ValidationEngine;
import com.qoeguard.core.engine.ValidationService;
import com.qoeguard.core.json.JsonDocumentReader;
import com.qoeguard.core.json.JsonInputException;
import com.qoeguard.core.json.JsonValue;
import com.qoeguard.core.model.ValidationResult;
import com.qoeguard.core.report.ReportFormatter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: qoe-guard validate --baseline &lt;file&gt; --candidate &lt;file&gt;
 * <p>
 * Compares one candidate response against its baseline and exits with the gate outcome.
 */
@Command(name = "validate", mixinStandardHelpOptions = true,
        description = "Compare a candidate response against its baseline",
        exitCodeOnInvalidInput = ExitCodes.ERROR,
        exitCodeOnExecutionException = ExitCodes.ERROR)
@Component
public class ValidateCommand implements Callable<Integer> {

    @Option(names = {"--baseline", "-b"}, required = true, description = "Baseline JSON file")
    private Path baseline;

    @Option(names = {"--candidate", "-c"}, required = true, description = "Candidate JSON file")
    private Path candidate;

    @Option(names = {"--name", "-n"}, description = "Comparison name (defaults to the candidate file name)")
    private String name;

    @Option(names = {"--format", "-f"}, defaultValue = "summary",
            description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private OutputFormat format;

    @Option(names = "--fail-on-warn", description = "Exit with the FAIL code when the outcome is WARN")
    private boolean failOnWarn;

    @Mixin
    private EngineOptions engineOptions = new EngineOptions();

    private final ValidationService validationService;
    private final JsonDocumentReader reader;
    private final ReportFormatter formatter;

    public ValidateCommand(ValidationService validationService, JsonDocumentReader reader,
                           ReportFormatter formatter) {
        this.validationService = validationService;
        this.reader = reader;
        this.formatter = formatter;
    }

    @Override
    public Integer call() {
        ValidationEngine engine;
        JsonValue baselineDoc;
        JsonValue candidateDoc;
        try {
            engine = engineOptions.apply(validationService.engine());
            baselineDoc = reader.read(baseline);
            candidateDoc = reader.read(candidate);
        } catch (ConfigurationException | JsonInputException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.ERROR;
        }

        String comparison = name != null ? name : String.valueOf(candidate.getFileName());
        ValidationResult result = validationService.validate(
                new ComparisonRequest(comparison, baselineDoc, candidateDoc), engine);

        switch (format) {
            case json -> System.out.println(formatter.json(result));
            case github -> System.out.print(formatter.github(result));
            default -> {
                ConsoleOutput.printBanner();
                System.out.print(formatter.summary(result));
                System.out.println();
                ConsoleOutput.decision(result.name(), result.outcome(), result.decision().riskScore());
            }
        }
        return ExitCodes.forDecision(result.outcome(), failOnWarn);
    }
}
