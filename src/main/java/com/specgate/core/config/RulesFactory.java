package com.specgate.core.config;

import com.specgate.core.model.DocumentKind;
import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.Severity;
import com.specgate.core.model.ValidationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds immutable {@link ValidationRules} from the configured overrides on top
 * of the built-in preset for each document kind.
 */
@Component
public class RulesFactory {

    private static final Logger log = LoggerFactory.getLogger(RulesFactory.class);

    private final SpecgateProperties properties;

    public RulesFactory(SpecgateProperties properties) {
        this.properties = properties;
    }

    public ValidationRules rulesFor(DocumentKind kind) {
        ValidationRules preset = ValidationRules.forKind(kind);
        SpecgateProperties.Rules overrides = switch (kind) {
            case PROPOSAL -> properties.getValidation().getProposal();
            case TASKS -> properties.getValidation().getTasks();
            case SPEC -> properties.getValidation().getSpec();
        };
        if (overrides == null) {
            return preset;
        }
        return new ValidationRules(
                kind,
                firstNonNull(overrides.getRequirementPattern(), preset.requirementPattern()),
                firstNonNull(overrides.getScenarioPattern(), preset.scenarioPattern()),
                firstNonNull(overrides.getRequiredHeadings(), preset.requiredHeadings()),
                firstNonNull(overrides.getMinScenarios(), preset.minScenarios()),
                firstNonNull(overrides.getRequireWhenThen(), preset.requireWhenThen()),
                preset.severities().withOverrides(parseSeverities(kind, overrides.getSeverity())));
    }

    private static Map<ErrorCategory, Severity> parseSeverities(DocumentKind kind, Map<String, String> raw) {
        var parsed = new EnumMap<ErrorCategory, Severity>(ErrorCategory.class);
        if (raw == null) return parsed;
        raw.forEach((key, value) -> {
            try {
                parsed.put(ErrorCategory.valueOf(constantName(key)), Severity.valueOf(constantName(value)));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring severity override {}={} for {}: unknown category or severity", key, value, kind);
            }
        });
        return parsed;
    }

    private static String constantName(String s) {
        return s.trim()
                .replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .replace(' ', '_')
                .toUpperCase(Locale.ROOT);
    }

    private static <T> T firstNonNull(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
