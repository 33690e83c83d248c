package com.specgate.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "specgate")
public class SpecgateProperties {

    private Validation validation = new Validation();
    private State state = new State();

    // -- Validation accessors (delegate to nested) --
    public boolean isStrict() { return validation.strict; }
    public String getSchemasDir() { return validation.schemasDir; }

    // -- State accessors (delegate to nested) --
    public String getStateFileName() { return state.fileName; }

    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }
    public State getState() { return state; }
    public void setState(State state) { this.state = state; }

    public static class Validation {
        private boolean strict = false;
        private String schemasDir;
        private Rules proposal = new Rules();
        private Rules tasks = new Rules();
        private Rules spec = new Rules();

        public boolean isStrict() { return strict; }
        public void setStrict(boolean strict) { this.strict = strict; }
        public String getSchemasDir() { return schemasDir; }
        public void setSchemasDir(String schemasDir) { this.schemasDir = schemasDir; }
        public Rules getProposal() { return proposal; }
        public void setProposal(Rules proposal) { this.proposal = proposal; }
        public Rules getTasks() { return tasks; }
        public void setTasks(Rules tasks) { this.tasks = tasks; }
        public Rules getSpec() { return spec; }
        public void setSpec(Rules spec) { this.spec = spec; }
    }

    /**
     * Per-kind rule overrides. A null field keeps the built-in preset's value.
     */
    public static class Rules {
        private String requirementPattern;
        private String scenarioPattern;
        private List<String> requiredHeadings;
        private Integer minScenarios;
        private Boolean requireWhenThen;
        private Map<String, String> severity = new LinkedHashMap<>();

        public String getRequirementPattern() { return requirementPattern; }
        public void setRequirementPattern(String requirementPattern) { this.requirementPattern = requirementPattern; }
        public String getScenarioPattern() { return scenarioPattern; }
        public void setScenarioPattern(String scenarioPattern) { this.scenarioPattern = scenarioPattern; }
        public List<String> getRequiredHeadings() { return requiredHeadings; }
        public void setRequiredHeadings(List<String> requiredHeadings) { this.requiredHeadings = requiredHeadings; }
        public Integer getMinScenarios() { return minScenarios; }
        public void setMinScenarios(Integer minScenarios) { this.minScenarios = minScenarios; }
        public Boolean getRequireWhenThen() { return requireWhenThen; }
        public void setRequireWhenThen(Boolean requireWhenThen) { this.requireWhenThen = requireWhenThen; }
        public Map<String, String> getSeverity() { return severity; }
        public void setSeverity(Map<String, String> severity) { this.severity = severity; }
    }

    public static class State {
        private String fileName = "STATE.yaml";

        public String getFileName() { return fileName; }
        public void setFileName(String fileName) { this.fileName = fileName; }
    }
}
