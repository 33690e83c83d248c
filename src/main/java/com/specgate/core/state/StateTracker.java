package com.specgate.core.state;

import com.specgate.core.document.Checksums;
import com.specgate.core.document.InstanceLayout;
import com.specgate.core.document.Mappers;
import com.specgate.core.model.Severity;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationMode;
import com.specgate.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Handle on the persisted state record of one workflow instance: content
 * checksums, validation history and usage telemetry.
 * <p>
 * Not thread-safe. Callers serialize access per instance; separate instances
 * are fully independent.
 */
public class StateTracker {

    private static final Logger log = LoggerFactory.getLogger(StateTracker.class);

    public static final String DEFAULT_FILE_NAME = "STATE.yaml";
    public static final String RULES_VERSION = "2.0";
    public static final String CHALLENGE_STEP = "validate-challenge";

    /** Workflow documents tracked besides {@code specs/**}{@code /*.md}. */
    public static final List<String> TRACKED_FILES = List.of(
            "proposal.md",
            "tasks.md",
            "CHALLENGE.md",
            "IMPLEMENTATION.md",
            "VERIFICATION.md");

    private final InstanceLayout layout;
    private final Path stateFile;
    private final Clock clock;
    private final WorkflowState state;
    private boolean dirty;

    private StateTracker(InstanceLayout layout, Path stateFile, Clock clock, WorkflowState state, boolean dirty) {
        this.layout = layout;
        this.stateFile = stateFile;
        this.clock = clock;
        this.state = state;
        this.dirty = dirty;
    }

    public static StateTracker load(Path instanceDir) {
        return load(instanceDir, DEFAULT_FILE_NAME, Clock.systemUTC());
    }

    /**
     * Reads the persisted record, or creates a default one (phase proposed,
     * iteration 1) when none exists yet.
     *
     * @throws StateException when an existing record cannot be read or parsed
     */
    public static StateTracker load(Path instanceDir, String fileName, Clock clock) {
        var layout = new InstanceLayout(instanceDir);
        Path stateFile = instanceDir.resolve(fileName);
        if (!Files.exists(stateFile)) {
            log.debug("No state record at {}, starting fresh", stateFile);
            return new StateTracker(layout, stateFile, clock,
                    WorkflowState.initial(layout.instanceId(), clock.instant()), true);
        }
        try {
            WorkflowState state = Mappers.yaml().readValue(stateFile.toFile(), WorkflowState.class);
            if (state == null) {
                throw new StateException("State record is empty: " + stateFile);
            }
            return new StateTracker(layout, stateFile, clock, state, false);
        } catch (IOException e) {
            throw new StateException("Failed to read state record " + stateFile + ": " + e.getMessage(), e);
        }
    }

    /**
     * Writes the whole record, refreshing {@code updated_at}. A no-op when
     * nothing changed since the last load or save.
     *
     * @return true if the record was written
     */
    public boolean save() {
        if (!dirty) {
            return false;
        }
        state.setUpdatedAt(clock.instant());
        Path tmp = stateFile.resolveSibling(stateFile.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, Mappers.yaml().writeValueAsString(state), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, stateFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateException("Failed to write state record " + stateFile, e);
        }
        dirty = false;
        log.debug("Saved state record {}", stateFile);
        return true;
    }

    public WorkflowState state() { return state; }
    public Path instanceDir() { return layout.root(); }
    public Path stateFile() { return stateFile; }
    public boolean isDirty() { return dirty; }

    // ── Phase management ──

    public StatePhase phase() {
        return state.getPhase();
    }

    public void setPhase(StatePhase phase) {
        state.setPhase(phase);
        dirty = true;
    }

    public void incrementIteration() {
        state.setIteration(state.getIteration() + 1);
        dirty = true;
    }

    public void setLastAction(String action) {
        state.setLastAction(action);
        dirty = true;
    }

    /**
     * Moves the phase according to a challenge verdict: APPROVED to challenged,
     * NEEDS_REVISION back to proposed with the iteration bumped, REJECTED to rejected.
     */
    public void applyChallengeVerdict(String verdict) {
        String v = verdict == null ? "" : verdict.trim().toUpperCase(Locale.ROOT);
        switch (v) {
            case "APPROVED" -> setPhase(StatePhase.CHALLENGED);
            case "NEEDS_REVISION" -> {
                setPhase(StatePhase.PROPOSED);
                incrementIteration();
            }
            case "REJECTED" -> setPhase(StatePhase.REJECTED);
            default -> throw new IllegalArgumentException("Unknown challenge verdict: " + verdict);
        }
    }

    // ── Checksums ──

    /**
     * Stores the current checksum of a file relative to the instance directory,
     * or removes its entry when the file no longer exists.
     */
    public void updateChecksum(String name) {
        Path file = layout.root().resolve(name);
        if (!Files.isRegularFile(file)) {
            if (state.checksums().remove(name) != null) {
                dirty = true;
            }
            return;
        }
        state.checksums().put(name, new ChecksumEntry(currentHash(file, name), clock.instant()));
        dirty = true;
    }

    public void updateAllChecksums() {
        trackedFiles().forEach(this::updateChecksum);
    }

    /** True when there is no recorded checksum or it differs from current content. */
    public boolean isFileStale(String name) {
        Path file = layout.root().resolve(name);
        if (!Files.isRegularFile(file)) {
            return false;
        }
        ChecksumEntry entry = state.getChecksums().get(name);
        return entry == null || !entry.hash().equals(currentHash(file, name));
    }

    public StalenessReport checkStaleness() {
        var stale = new ArrayList<String>();
        var missing = new ArrayList<String>();
        var upToDate = new ArrayList<String>();
        for (String name : trackedFiles()) {
            if (!state.getChecksums().containsKey(name)) {
                missing.add(name);
            } else if (isFileStale(name)) {
                stale.add(name);
            } else {
                upToDate.add(name);
            }
        }
        return new StalenessReport(stale, missing, upToDate);
    }

    /** Existing tracked files, workflow documents first, then specs in sorted order. */
    public List<String> trackedFiles() {
        var names = new ArrayList<String>();
        for (String name : TRACKED_FILES) {
            if (Files.isRegularFile(layout.root().resolve(name))) {
                names.add(name);
            }
        }
        layout.specFiles().forEach(p -> names.add(layout.relative(p)));
        return names;
    }

    private static String currentHash(Path file, String name) {
        try {
            return Checksums.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new StateException("Failed to read " + name + " for checksum", e);
        }
    }

    // ── Validation history ──

    public void recordValidation(String step, ValidationMode mode, boolean valid,
                                 int high, int medium, int low,
                                 List<String> errors, List<String> warnings) {
        state.validations().add(new ValidationEntry(step, clock.instant(), RULES_VERSION, mode,
                new ValidationOutcome(valid, high, medium, low, null, null), errors, warnings));
        dirty = true;
    }

    /**
     * Records a validation run; HIGH findings go to {@code errors}, the rest to
     * {@code warnings}.
     */
    public void recordValidation(String step, ValidationMode mode, ValidationResult result) {
        List<String> errors = result.errors().stream()
                .filter(e -> e.severity() == Severity.HIGH)
                .map(ValidationError::format)
                .toList();
        List<String> warnings = result.errors().stream()
                .filter(e -> e.severity() != Severity.HIGH)
                .map(ValidationError::format)
                .toList();
        recordValidation(step, mode, result.isValid(mode),
                result.count(Severity.HIGH), result.count(Severity.MEDIUM), result.count(Severity.LOW),
                errors, warnings);
    }

    public void recordChallengeValidation(String verdict, int issuesParsed, int high, int medium, int low) {
        state.validations().add(new ValidationEntry(CHALLENGE_STEP, clock.instant(), RULES_VERSION,
                ValidationMode.NORMAL, new ValidationOutcome(true, high, medium, low, verdict, issuesParsed),
                List.of(), List.of()));
        dirty = true;
    }

    /** Most recent entry for a step, scanning from the end of the history. */
    public Optional<ValidationEntry> lastValidation(String step) {
        List<ValidationEntry> history = state.getValidations();
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).step().equals(step)) {
                return Optional.of(history.get(i));
            }
        }
        return Optional.empty();
    }

    public void clearValidations() {
        state.validations().clear();
        dirty = true;
    }

    // ── Telemetry ──

    /**
     * Appends one call to the usage ledger and updates the totals. Cost is only
     * computed when pricing is supplied.
     */
    public LlmCall recordLlmCall(String step, String model, Long tokensIn, Long tokensOut,
                                 Long durationMs, TokenPricing pricing) {
        Double cost = pricing != null ? pricing.costOf(tokensIn, tokensOut) : null;
        var call = new LlmCall(step, model, tokensIn, tokensOut, cost, durationMs, clock.instant());
        state.telemetry().add(call);
        dirty = true;
        return call;
    }
}
