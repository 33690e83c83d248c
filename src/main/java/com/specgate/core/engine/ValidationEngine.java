package com.specgate.core.engine;

import com.specgate.core.config.RulesFactory;
import com.specgate.core.config.SpecgateProperties;
import com.specgate.core.document.InstanceLayout;
import com.specgate.core.fix.AutoFixer;
import com.specgate.core.fix.FixResult;
import com.specgate.core.logging.MdcContext;
import com.specgate.core.metrics.ValidationMetrics;
import com.specgate.core.model.DocumentKind;
import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.Severity;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationMode;
import com.specgate.core.model.ValidationReport;
import com.specgate.core.model.ValidationResult;
import com.specgate.core.state.StalenessReport;
import com.specgate.core.state.StateException;
import com.specgate.core.state.StateTracker;
import com.specgate.core.validator.ConsistencyValidator;
import com.specgate.core.validator.FormatValidator;
import com.specgate.core.validator.SchemaValidator;
import com.specgate.core.validator.SemanticValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Validates a whole workflow instance: proposal, tasks, every spec, then the
 * cross-document checks, and records the run in the instance's state record.
 * <p>
 * Files are validated sequentially in a fixed order (proposal, tasks, specs
 * sorted by path, consistency) so the error order is deterministic.
 */
@Service
public class ValidationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValidationEngine.class);

    public static final String STEP = "validate-proposal";

    private final SpecgateProperties properties;
    private final RulesFactory rulesFactory;
    private final ValidationMetrics metrics;
    private final Clock clock;

    public ValidationEngine(SpecgateProperties properties, RulesFactory rulesFactory, ValidationMetrics metrics) {
        this(properties, rulesFactory, metrics, Clock.systemUTC());
    }

    ValidationEngine(SpecgateProperties properties, RulesFactory rulesFactory,
                     ValidationMetrics metrics, Clock clock) {
        this.properties = properties;
        this.rulesFactory = rulesFactory;
        this.metrics = metrics;
        this.clock = clock;
    }

    public ValidationRun validate(Path instanceDir, ValidationMode mode) {
        return validate(instanceDir, mode, false);
    }

    /**
     * @param fix when true, fixable errors are repaired and the instance is validated again
     * @throws IllegalArgumentException when {@code instanceDir} is not a directory
     */
    public ValidationRun validate(Path instanceDir, ValidationMode mode, boolean fix) {
        if (!Files.isDirectory(instanceDir)) {
            throw new IllegalArgumentException("Not a workflow instance directory: " + instanceDir);
        }
        var layout = new InstanceLayout(instanceDir);
        MdcContext.setStep(layout.instanceId(), STEP);
        long start = System.currentTimeMillis();
        try {
            log.info("Validating {} in {} mode", layout.instanceId(), mode);
            ValidationResult result = collect(layout);

            FixResult fixResult = null;
            if (fix) {
                fixResult = new AutoFixer(instanceDir).fix(result.fixableErrors());
                metrics.recordFixes(fixResult.errorsFixed(), fixResult.filesModified());
                if (fixResult.changedAnything()) {
                    log.info("Fixed {} errors in {} files, re-validating",
                            fixResult.errorsFixed(), fixResult.filesModified());
                    result = collect(layout);
                }
            }

            StalenessReport staleness = record(layout, mode, result);
            ValidationReport report = ValidationReport.from(result, mode,
                    staleness != null ? staleness.staleFiles() : List.of(), instanceDir);

            metrics.recordErrors(result);
            metrics.recordRun(STEP, System.currentTimeMillis() - start, report.valid());
            log.info("Validation of {} finished: valid={}, high={}, medium={}, low={}",
                    layout.instanceId(), report.valid(), report.counts().high(),
                    report.counts().medium(), report.counts().low());
            return new ValidationRun(result, report, staleness, fixResult, mode);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs every validator over the instance without touching the state record.
     */
    public ValidationResult collect(InstanceLayout layout) {
        var result = new ValidationResult();
        var schemaValidator = new SchemaValidator(schemasDir());
        int files = 0;

        for (DocumentKind kind : List.of(DocumentKind.PROPOSAL, DocumentKind.TASKS)) {
            Path file = kind == DocumentKind.PROPOSAL ? layout.proposal() : layout.tasks();
            if (!Files.exists(file)) continue;
            MdcContext.setFile(layout.relative(file));
            result.merge(schemaValidator.validate(file));
            result.merge(new FormatValidator(rulesFactory.rulesFor(kind)).validate(file));
            files++;
        }

        var specRules = rulesFactory.rulesFor(DocumentKind.SPEC);
        var formatValidator = new FormatValidator(specRules);
        var semanticValidator = new SemanticValidator(specRules.severities());
        List<Path> specs = layout.specFiles();
        for (Path spec : specs) {
            MdcContext.setFile(layout.relative(spec));
            result.merge(schemaValidator.validate(spec));
            result.merge(formatValidator.validate(spec));
            result.merge(semanticValidator.validate(spec));
            files++;
        }
        MdcContext.clearFile();

        result.merge(semanticValidator.crossFileDuplicates(specs));
        result.merge(new ConsistencyValidator(layout.root()).validate());
        metrics.recordFilesValidated(files);
        return result;
    }

    private StalenessReport record(InstanceLayout layout, ValidationMode mode, ValidationResult result) {
        StateTracker tracker;
        try {
            tracker = openTracker(layout.root());
        } catch (StateException e) {
            log.error("Cannot load state record for {}", layout.instanceId(), e);
            result.add(stateError(layout, e));
            return null;
        }

        StalenessReport staleness = tracker.checkStaleness();
        metrics.recordStaleFiles(staleness.staleFiles().size());
        if (staleness.hasStale()) {
            log.info("Stale files since last validation: {}", staleness.staleFiles());
        }

        tracker.recordValidation(STEP, mode, result);
        if (result.count(Severity.HIGH) == 0) {
            tracker.updateAllChecksums();
            tracker.setLastAction(STEP);
        }
        try {
            tracker.save();
        } catch (StateException e) {
            log.error("Cannot save state record for {}", layout.instanceId(), e);
            result.add(stateError(layout, e));
        }
        return staleness;
    }

    private ValidationError stateError(InstanceLayout layout, StateException e) {
        return ValidationError.of(e.getMessage(), layout.root().resolve(properties.getStateFileName()),
                null, Severity.HIGH, ErrorCategory.INVALID_STRUCTURE);
    }

    public StateTracker openTracker(Path instanceDir) {
        return StateTracker.load(instanceDir, properties.getStateFileName(), clock);
    }

    private Path schemasDir() {
        String dir = properties.getSchemasDir();
        return dir == null || dir.isBlank() ? null : Path.of(dir);
    }
}
