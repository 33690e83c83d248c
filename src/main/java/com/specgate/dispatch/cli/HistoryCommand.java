package com.specgate.dispatch.cli;

import com.specgate.core.engine.ValidationEngine;
import com.specgate.core.state.StateException;
import com.specgate.core.state.ValidationEntry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CLI command: specgate history &lt;instance-dir&gt;
 * <p>
 * Lists the validation history recorded for a workflow instance as a table:
 * Timestamp | Step | Mode | Result | High/Medium/Low.
 */
@Command(name = "history", mixinStandardHelpOptions = true, description = "List recorded validations")
@Component
public class HistoryCommand implements Runnable {

    @Parameters(index = "0", description = "Workflow instance directory")
    private Path instanceDir;

    @Option(names = {"--step"}, description = "Only show entries for this step")
    private String step;

    @Option(names = {"--limit", "-n"}, description = "Number of results", defaultValue = "10")
    private int limit;

    private final ValidationEngine engine;

    public HistoryCommand(ValidationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (!Files.isDirectory(instanceDir)) {
            ConsoleOutput.error("Not a workflow instance directory: " + instanceDir);
            return;
        }

        List<ValidationEntry> entries;
        try {
            entries = engine.openTracker(instanceDir).state().getValidations().stream()
                    .filter(v -> step == null || step.equals(v.step()))
                    .toList();
        } catch (StateException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        if (entries.isEmpty()) {
            ConsoleOutput.info("No validations recorded.");
            return;
        }

        // Apply limit, keeping the most recent entries
        List<ValidationEntry> display = entries.size() > limit
                ? entries.subList(entries.size() - limit, entries.size())
                : entries;

        ConsoleOutput.info("Validations (" + display.size() + " of " + entries.size() + "):");
        System.out.println();
        System.out.printf("  %-24s %-20s %-8s %-9s %s%n", "TIMESTAMP", "STEP", "MODE", "RESULT", "H/M/L");
        System.out.println("  " + "-".repeat(76));

        for (ValidationEntry entry : display) {
            String mode = entry.mode() != null ? entry.mode().value() : "-";
            String result = "-";
            String counts = "-";
            if (entry.result() != null) {
                result = entry.result().verdict() != null ? entry.result().verdict()
                        : entry.result().valid() ? "valid" : "invalid";
                counts = entry.result().high() + "/" + entry.result().medium() + "/" + entry.result().low();
            }
            System.out.printf("  %-24s %-20s %-8s %-9s %s%n",
                    entry.timestamp() != null ? entry.timestamp().toString() : "-",
                    entry.step(), mode, result, counts);
        }
    }
}
