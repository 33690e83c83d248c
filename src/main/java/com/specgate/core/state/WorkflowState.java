package com.specgate.core.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persisted record of one workflow instance. Mutated only through
 * {@link StateTracker}; loaded and saved as a whole.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowState {

    public static final String SCHEMA_VERSION = "2.0";

    @JsonProperty("change_id")
    private String changeId;

    @JsonProperty("schema_version")
    private String schemaVersion = SCHEMA_VERSION;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("phase")
    private StatePhase phase = StatePhase.PROPOSED;

    @JsonProperty("iteration")
    private int iteration = 1;

    @JsonProperty("last_action")
    private String lastAction;

    @JsonProperty("checksums")
    private Map<String, ChecksumEntry> checksums = new TreeMap<>();

    @JsonProperty("validations")
    private List<ValidationEntry> validations = new ArrayList<>();

    @JsonProperty("telemetry")
    private Telemetry telemetry;

    WorkflowState() {}

    static WorkflowState initial(String changeId, Instant now) {
        var state = new WorkflowState();
        state.changeId = changeId;
        state.createdAt = now;
        state.updatedAt = now;
        return state;
    }

    public String getChangeId() { return changeId; }
    public String getSchemaVersion() { return schemaVersion; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public StatePhase getPhase() { return phase; }
    public int getIteration() { return iteration; }
    public String getLastAction() { return lastAction; }
    public Map<String, ChecksumEntry> getChecksums() { return Collections.unmodifiableMap(checksums); }
    public List<ValidationEntry> getValidations() { return Collections.unmodifiableList(validations); }
    public Telemetry getTelemetry() { return telemetry; }

    void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
    void setPhase(StatePhase phase) { this.phase = phase; }
    void setIteration(int iteration) { this.iteration = iteration; }
    void setLastAction(String lastAction) { this.lastAction = lastAction; }

    Map<String, ChecksumEntry> checksums() {
        if (checksums == null) checksums = new TreeMap<>();
        return checksums;
    }

    List<ValidationEntry> validations() {
        if (validations == null) validations = new ArrayList<>();
        return validations;
    }

    Telemetry telemetry() {
        if (telemetry == null) telemetry = new Telemetry();
        return telemetry;
    }
}
