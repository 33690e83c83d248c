package com.specgate.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.specgate.core.config.SpecgateProperties;
import com.specgate.core.document.Mappers;
import com.specgate.core.engine.ValidationEngine;
import com.specgate.core.engine.ValidationRun;
import com.specgate.core.model.ValidationMode;
import com.specgate.core.model.ValidationReport;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: specgate validate &lt;instance-dir&gt;
 * <p>
 * Validates every document of a workflow instance and records the run in its
 * state record. Exits 0 when valid, 1 when invalid, 2 on usage or I/O failures.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a workflow instance")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Workflow instance directory")
    private Path instanceDir;

    @Option(names = {"--strict", "-s"}, description = "Fail on any finding, not only HIGH ones")
    private boolean strict;

    @Option(names = "--json", description = "Print the error report as JSON")
    private boolean json;

    @Option(names = "--fix", description = "Apply automatic fixes, then re-validate")
    private boolean fix;

    @Option(names = {"--verbose", "-v"}, description = "Also list LOW findings and up-to-date files")
    private boolean verbose;

    private final ValidationEngine engine;
    private final SpecgateProperties properties;

    public ValidateCommand(ValidationEngine engine, SpecgateProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ValidationMode mode = strict || properties.isStrict() ? ValidationMode.STRICT : ValidationMode.NORMAL;

        ValidationRun run;
        try {
            run = engine.validate(instanceDir, mode, fix);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return SpecgateCommand.EXIT_FAILURE;
        }
        ValidationReport report = run.report();

        if (json) {
            try {
                System.out.println(Mappers.json().writeValueAsString(report));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot serialize report: " + e.getOriginalMessage());
                return SpecgateCommand.EXIT_FAILURE;
            }
            return exitCode(report);
        }

        ConsoleOutput.printBanner();
        ConsoleOutput.info("Validating " + instanceDir + " (" + mode.value() + " mode)");
        if (run.fix() != null) {
            ConsoleOutput.fixSummary(run.fix());
        }

        System.out.println();
        int hidden = 0;
        for (ValidationReport.Entry entry : report.errors()) {
            if (verbose || !"LOW".equals(entry.severity())) {
                ConsoleOutput.finding(entry);
            } else {
                hidden++;
            }
        }
        if (hidden > 0) {
            ConsoleOutput.info(hidden + " low-severity findings hidden (use --verbose)");
        }

        System.out.println();
        ConsoleOutput.counts(report.counts());
        if (!report.staleFiles().isEmpty()) {
            ConsoleOutput.warn("Changed since last validation: " + String.join(", ", report.staleFiles()));
        }
        if (verbose && run.staleness() != null && !run.staleness().upToDate().isEmpty()) {
            ConsoleOutput.info("Up to date: " + String.join(", ", run.staleness().upToDate()));
        }

        if (report.valid()) {
            ConsoleOutput.success("Validation passed");
        } else {
            ConsoleOutput.error("Validation failed");
        }
        return exitCode(report);
    }

    private static int exitCode(ValidationReport report) {
        return report.valid() ? SpecgateCommand.EXIT_VALID : SpecgateCommand.EXIT_INVALID;
    }
}
