package com.specgate.core.model;

import java.util.List;

/**
 * Immutable rule set for one document kind.
 *
 * @param kind               document kind the rules apply to
 * @param requirementPattern regex a level-3 heading in the Requirements section must match,
 *                           empty to disable the check
 * @param scenarioPattern    regex a level-4 heading in the Acceptance Criteria section must match,
 *                           empty to disable the check
 * @param requiredHeadings   headings that must be present (case-insensitive, exact or prefix)
 * @param minScenarios       minimum scenario count
 * @param requireWhenThen    whether scenarios must carry WHEN and THEN markers
 * @param severities         category to severity lookup
 */
public record ValidationRules(
    DocumentKind kind,
    String requirementPattern,
    String scenarioPattern,
    List<String> requiredHeadings,
    int minScenarios,
    boolean requireWhenThen,
    SeverityMap severities
) {

    public static final String DEFAULT_REQUIREMENT_PATTERN = "^R\\d+: .+";
    public static final String DEFAULT_SCENARIO_PATTERN = "^Scenario: .+";

    public ValidationRules {
        requiredHeadings = requiredHeadings != null ? List.copyOf(requiredHeadings) : List.of();
        requirementPattern = requirementPattern != null ? requirementPattern : "";
        scenarioPattern = scenarioPattern != null ? scenarioPattern : "";
        severities = severities != null ? severities : SeverityMap.defaults();
    }

    public static ValidationRules forKind(DocumentKind kind) {
        return switch (kind) {
            case PROPOSAL, TASKS -> lenient(kind);
            case SPEC -> spec();
        };
    }

    /** Lenient preset: no required headings, no scenarios, no WHEN/THEN. */
    public static ValidationRules lenient(DocumentKind kind) {
        return new ValidationRules(kind, "", "", List.of(), 0, false, SeverityMap.defaults());
    }

    /** Strict preset used for capability specs. */
    public static ValidationRules spec() {
        return new ValidationRules(DocumentKind.SPEC,
                DEFAULT_REQUIREMENT_PATTERN,
                DEFAULT_SCENARIO_PATTERN,
                List.of("Overview", "Requirements", "Acceptance Criteria"),
                1, true, SeverityMap.defaults());
    }

    public Severity severityOf(ErrorCategory category) {
        return severities.severityOf(category);
    }
}
