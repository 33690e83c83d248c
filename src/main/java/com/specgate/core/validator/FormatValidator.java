package com.specgate.core.validator;

import com.specgate.core.document.BlockExtractor;
import com.specgate.core.document.Document;
import com.specgate.core.document.DocumentLoader;
import com.specgate.core.document.MarkdownEvent;
import com.specgate.core.document.MarkdownWalker;
import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.ScenarioBlock;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationResult;
import com.specgate.core.model.ValidationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Single-document structural checks: required headings, requirement and
 * scenario heading patterns, minimum scenario count and WHEN/THEN presence.
 * <p>
 * The whole event stream is scanned; no violation aborts the scan.
 */
public class FormatValidator {

    private static final Logger log = LoggerFactory.getLogger(FormatValidator.class);

    private final ValidationRules rules;
    private final Pattern requirementPattern;
    private final Pattern scenarioPattern;

    public FormatValidator(ValidationRules rules) {
        this.rules = rules;
        this.requirementPattern = Patterns.compileOrNull(rules.requirementPattern(), "requirement");
        this.scenarioPattern = Patterns.compileOrNull(rules.scenarioPattern(), "scenario");
    }

    public ValidationRules rules() {
        return rules;
    }

    public ValidationResult validate(Path file) {
        Document document;
        try {
            document = DocumentLoader.load(file);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return ValidationResult.empty().add(error("Failed to read file: " + e.getMessage(),
                    file, null, ErrorCategory.INVALID_STRUCTURE));
        }
        return validate(document);
    }

    public ValidationResult validate(Document document) {
        Path file = document.path();
        var result = new ValidationResult();
        if (document.isBlank()) {
            return result.add(error("File is empty", file, null, ErrorCategory.EMPTY_CONTENT));
        }

        List<MarkdownEvent> events = MarkdownWalker.walk(document);
        var headings = new ArrayList<String>();
        String section = null;

        for (MarkdownEvent event : events) {
            if (event.type() != MarkdownEvent.Type.HEADING) continue;
            String text = event.text();
            headings.add(text);
            if (event.level() <= 2) {
                section = event.level() == 2 ? BlockExtractor.sectionName(text) : null;
            } else if (event.level() == 3 && BlockExtractor.inSection(section, BlockExtractor.REQUIREMENTS_SECTION)) {
                checkRequirementHeading(text, file, event.line(), result);
            } else if (event.level() == 4 && !isScenarioHeading(text)
                    && (BlockExtractor.inSection(section, BlockExtractor.ACCEPTANCE_SECTION)
                        || BlockExtractor.inSection(section, BlockExtractor.REQUIREMENTS_SECTION))) {
                checkScenarioHeading(text, file, event.line(), result);
            }
        }

        checkRequiredHeadings(headings, file, result);

        List<ScenarioBlock> scenarios = BlockExtractor.sectionScenarios(events, this::isScenarioHeading);
        int scenarioCount = scenarios.size();
        boolean hasWhen = scenarios.stream().anyMatch(s -> !s.when().isEmpty());
        boolean hasThen = scenarios.stream().anyMatch(s -> !s.then().isEmpty());

        if (scenarioCount < rules.minScenarios()) {
            result.add(error(String.format("Found %d scenarios, but minimum %d required",
                    scenarioCount, rules.minScenarios()), file, null, ErrorCategory.MISSING_SCENARIO));
        }

        // Zero scenarios is already reported above; WHEN/THEN only applies to existing scenarios.
        if (rules.requireWhenThen() && scenarioCount > 0) {
            if (!hasWhen) {
                result.add(error("Missing **WHEN** clause in scenarios", file, null, ErrorCategory.MISSING_WHEN_THEN));
            }
            if (!hasThen) {
                result.add(error("Missing **THEN** clause in scenarios", file, null, ErrorCategory.MISSING_WHEN_THEN));
            }
        }

        log.debug("Format check of {} ({}): {} headings, {} scenarios, {} errors",
                file, rules.kind(), headings.size(), scenarioCount, result.size());
        return result;
    }

    private void checkRequirementHeading(String text, Path file, int line, ValidationResult result) {
        if (requirementPattern == null) return;
        if (!requirementPattern.matcher(text).find()) {
            result.add(error(String.format("Requirement heading '%s' doesn't match pattern '%s'",
                    text, rules.requirementPattern()), file, line, ErrorCategory.INVALID_REQUIREMENT_FORMAT));
        }
    }

    /** Whether a level-4 heading inside a scenario-bearing section counts as a scenario. */
    boolean isScenarioHeading(String text) {
        return scenarioPattern == null || scenarioPattern.matcher(text).find();
    }

    private void checkScenarioHeading(String text, Path file, int line, ValidationResult result) {
        // Level-4 headings under Requirements are only scenarios when they say so.
        if (text.toLowerCase(Locale.ROOT).startsWith("scenario")) {
            result.add(error(String.format("Scenario heading '%s' doesn't match pattern '%s'",
                    text, rules.scenarioPattern()), file, line, ErrorCategory.MISSING_SCENARIO));
        }
    }

    private void checkRequiredHeadings(List<String> headings, Path file, ValidationResult result) {
        for (String required : rules.requiredHeadings()) {
            String wanted = required.trim().toLowerCase(Locale.ROOT);
            boolean found = headings.stream()
                    .map(h -> h.trim().toLowerCase(Locale.ROOT))
                    .anyMatch(h -> h.equals(wanted) || h.startsWith(wanted));
            if (!found) {
                result.add(error("Missing required heading: " + required, file, null, ErrorCategory.MISSING_HEADING));
            }
        }
    }

    private ValidationError error(String message, Path file, Integer line, ErrorCategory category) {
        return ValidationError.of(message, file, line, rules.severityOf(category), category);
    }
}
