package com.specgate.core.metrics;

import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for validation runs.
 */
@Service
public class ValidationMetrics {

    private final MeterRegistry registry;

    public ValidationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String step, long ms, boolean valid) {
        Timer.builder("specgate.validation.duration")
                .tag("step", step)
                .register(registry)
                .record(Duration.ofMillis(ms));

        Counter.builder("specgate.validation.runs")
                .tag("step", step)
                .tag("result", valid ? "valid" : "invalid")
                .register(registry)
                .increment();
    }

    /**
     * Counts findings by severity and category.
     */
    public void recordErrors(ValidationResult result) {
        for (ValidationError error : result.errors()) {
            Counter.builder("specgate.validation.errors")
                    .description("Validation findings by severity and category")
                    .tag("severity", error.severity().name())
                    .tag("category", error.category().name())
                    .register(registry)
                    .increment();
        }
    }

    public void recordFilesValidated(int count) {
        DistributionSummary.builder("specgate.validation.files")
                .description("Documents validated per run")
                .register(registry)
                .record(count);
    }

    public void recordFixes(int errorsFixed, int filesModified) {
        Counter.builder("specgate.fix.errors_fixed")
                .register(registry)
                .increment(errorsFixed);
        Counter.builder("specgate.fix.files_modified")
                .register(registry)
                .increment(filesModified);
    }

    public void recordStaleFiles(int count) {
        DistributionSummary.builder("specgate.state.stale_files")
                .description("Stale tracked files found at validation time")
                .register(registry)
                .record(count);
    }
}
