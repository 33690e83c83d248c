package com.specgate.core.metrics;

import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.Severity;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ValidationMetricsTest {

    private SimpleMeterRegistry registry;
    private ValidationMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ValidationMetrics(registry);
    }

    @Test
    void recordRunTagsStepAndResult() {
        metrics.recordRun("validate-proposal", 120, true);
        metrics.recordRun("validate-proposal", 80, false);

        assertEquals(1.0, registry.get("specgate.validation.runs").tag("result", "valid").counter().count());
        assertEquals(1.0, registry.get("specgate.validation.runs").tag("result", "invalid").counter().count());
        assertEquals(2, registry.get("specgate.validation.duration").tag("step", "validate-proposal").timer().count());
    }

    @Test
    void recordErrorsBySeverityAndCategory() {
        var result = new ValidationResult()
                .add(ValidationError.of("a", Path.of("a.md"), null, Severity.HIGH, ErrorCategory.MISSING_HEADING))
                .add(ValidationError.of("b", Path.of("a.md"), null, Severity.HIGH, ErrorCategory.MISSING_HEADING))
                .add(ValidationError.of("c", Path.of("b.md"), null, Severity.LOW, ErrorCategory.INCONSISTENCY));

        metrics.recordErrors(result);

        assertEquals(2.0, registry.get("specgate.validation.errors")
                .tags("severity", "HIGH", "category", "MISSING_HEADING").counter().count());
        assertEquals(1.0, registry.get("specgate.validation.errors")
                .tags("severity", "LOW", "category", "INCONSISTENCY").counter().count());
    }

    @Test
    void recordFixesAndStaleness() {
        metrics.recordFixes(3, 2);
        metrics.recordStaleFiles(4);
        metrics.recordFilesValidated(5);

        assertEquals(3.0, registry.get("specgate.fix.errors_fixed").counter().count());
        assertEquals(2.0, registry.get("specgate.fix.files_modified").counter().count());
        assertEquals(4.0, registry.get("specgate.state.stale_files").summary().totalAmount());
        assertEquals(5.0, registry.get("specgate.validation.files").summary().totalAmount());
    }
}
