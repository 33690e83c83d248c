package com.specgate.dispatch.cli;

import com.specgate.core.engine.ValidationEngine;
import com.specgate.core.state.StalenessReport;
import com.specgate.core.state.StateException;
import com.specgate.core.state.StateTracker;
import com.specgate.core.state.Telemetry;
import com.specgate.core.state.WorkflowState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI command: specgate status &lt;instance-dir&gt;
 * <p>
 * Shows the phase of a workflow instance, the staleness of its tracked files
 * and its most recent validation.
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "Show workflow instance status")
@Component
public class StatusCommand implements Runnable {

    @Parameters(index = "0", description = "Workflow instance directory")
    private Path instanceDir;

    private final ValidationEngine engine;

    public StatusCommand(ValidationEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (!Files.isDirectory(instanceDir)) {
            ConsoleOutput.error("Not a workflow instance directory: " + instanceDir);
            return;
        }

        StateTracker tracker;
        try {
            tracker = engine.openTracker(instanceDir);
        } catch (StateException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        WorkflowState state = tracker.state();

        System.out.println();
        System.out.println("CHANGE " + state.getChangeId());
        ConsoleOutput.info("Phase: " + state.getPhase().value() + " | Iteration: " + state.getIteration());
        if (state.getLastAction() != null) {
            ConsoleOutput.info("Last action: " + state.getLastAction());
        }

        // Tracked files table
        StalenessReport staleness = tracker.checkStaleness();
        if (staleness.totalFiles() > 0) {
            System.out.println();
            System.out.printf("  %-40s %s%n", "FILE", "STATE");
            System.out.println("  " + "-".repeat(56));
            staleness.staleFiles().forEach(f -> System.out.printf("  %-40s %s%n", truncate(f, 40), "stale"));
            staleness.missingChecksums().forEach(f -> System.out.printf("  %-40s %s%n", truncate(f, 40), "never validated"));
            staleness.upToDate().forEach(f -> System.out.printf("  %-40s %s%n", truncate(f, 40), "up to date"));
        }

        System.out.println();
        if (staleness.isFresh()) {
            ConsoleOutput.success("All tracked files validated and unchanged");
        } else if (staleness.hasStale()) {
            ConsoleOutput.error(staleness.staleFiles().size() + " file(s) changed since last validation");
        } else {
            ConsoleOutput.info(staleness.missingChecksums().size() + " file(s) never validated");
        }

        tracker.lastValidation(ValidationEngine.STEP).ifPresent(v ->
                ConsoleOutput.info(String.format("Last %s: %s (high %d, medium %d, low %d) at %s",
                        v.step(), v.result().valid() ? "valid" : "invalid",
                        v.result().high(), v.result().medium(), v.result().low(), v.timestamp())));

        Telemetry telemetry = state.getTelemetry();
        if (telemetry != null && !telemetry.getCalls().isEmpty()) {
            ConsoleOutput.info(String.format("Usage: %d calls, %d tokens in, %d tokens out, $%.4f",
                    telemetry.getCalls().size(), telemetry.getTotalTokensIn(),
                    telemetry.getTotalTokensOut(), telemetry.getTotalCostUsd()));
        }
    }

    private static String truncate(String s, int max) {
        if (s == null || s.isEmpty()) return "-";
        return s.length() <= max ? s : "..." + s.substring(s.length() - max + 3);
    }
}
