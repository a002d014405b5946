package com.qoeguard.dispatch.cli;

import com.qoeguard.core.config.ConfigurationException;
import com.qoeguard.core.engine.ValidationEngine;
import com.qoeguard.core.engine.ValidationService;
import com.qoeguard.core.report.ReportFormatter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: qoe-guard policy
 * <p>
 * Prints the effective thresholds, override rules, weights and critical paths.
 */
@Command(name = "policy", mixinStandardHelpOptions = true,
        description = "Show the effective gating policy",
        exitCodeOnInvalidInput = ExitCodes.ERROR,
        exitCodeOnExecutionException = ExitCodes.ERROR)
@Component
public class PolicyCommand implements Callable<Integer> {

    @Mixin
    private EngineOptions engineOptions = new EngineOptions();

    private final ValidationService validationService;
    private final ReportFormatter formatter;

    public PolicyCommand(ValidationService validationService, ReportFormatter formatter) {
        this.validationService = validationService;
        this.formatter = formatter;
    }

    @Override
    public Integer call() {
        ValidationEngine engine;
        try {
            engine = engineOptions.apply(validationService.engine());
        } catch (ConfigurationException e) {
            ConsoleOutput.error(e.getMessage());
            return ExitCodes.ERROR;
        }
        ConsoleOutput.printBanner();
        System.out.print(formatter.policySummary(engine));
        return ExitCodes.PASS;
    }
}
