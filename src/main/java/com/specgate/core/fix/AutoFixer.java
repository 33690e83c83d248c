package com.specgate.core.fix;

import com.specgate.core.document.BlockExtractor;
import com.specgate.core.document.DocumentLoader;
import com.specgate.core.document.MarkdownWalker;
import com.specgate.core.model.ScenarioBlock;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationRules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mechanical repair of fixable errors by text insertion.
 * <p>
 * Every fix first checks whether the content already satisfies the rule
 * (headings case-insensitively, scenarios as the format check extracts them),
 * so running the fixer twice changes nothing the second time. Files are
 * written only when their content actually changed.
 */
public class AutoFixer {

    private static final Logger log = LoggerFactory.getLogger(AutoFixer.class);

    static final String MISSING_HEADING_PREFIX = "Missing required heading: ";

    static final String PLACEHOLDER_SCENARIO = """
            #### Scenario: Basic Usage
            - **WHEN** the feature is used
            - **THEN** it should work correctly
            """;

    private static final Pattern ACCEPTANCE_HEADING =
            Pattern.compile("(?im)^##[ \t]+Acceptance Criteria\\b[^\n]*$");
    private static final Pattern SCENARIO_HEADING = Pattern.compile(ValidationRules.DEFAULT_SCENARIO_PATTERN);

    private final Path baseDir;

    /**
     * @param baseDir directory relative error paths are resolved against
     */
    public AutoFixer(Path baseDir) {
        this.baseDir = baseDir;
    }

    public FixResult fix(List<ValidationError> errors) {
        int filesModified = 0;
        int errorsFixed = 0;
        int alreadySatisfied = 0;
        var unfixable = new ArrayList<ValidationError>();
        var details = new ArrayList<String>();

        Map<Path, List<ValidationError>> byFile = new LinkedHashMap<>();
        for (ValidationError error : errors) {
            byFile.computeIfAbsent(error.file(), f -> new ArrayList<>()).add(error);
        }

        for (var entry : byFile.entrySet()) {
            Path file = resolve(entry.getKey());
            List<ValidationError> fileErrors = entry.getValue();
            if (file == null || !Files.isRegularFile(file)) {
                unfixable.addAll(fileErrors);
                continue;
            }

            String original;
            try {
                original = DocumentLoader.normalize(Files.readString(file, StandardCharsets.UTF_8));
            } catch (IOException e) {
                log.warn("Cannot read {} for fixing: {}", file, e.getMessage());
                unfixable.addAll(fileErrors);
                continue;
            }

            String content = original;
            for (ValidationError error : fileErrors) {
                if (!error.isFixable()) {
                    unfixable.add(error);
                    continue;
                }
                Fix fix = apply(file, content, error);
                switch (fix.status()) {
                    case APPLIED -> {
                        content = fix.content();
                        errorsFixed++;
                        details.add(entry.getKey() + ": " + fix.detail());
                    }
                    case SATISFIED -> alreadySatisfied++;
                    case UNSUPPORTED -> unfixable.add(error);
                }
            }

            if (!content.equals(original)) {
                try {
                    Files.writeString(file, content, StandardCharsets.UTF_8);
                    filesModified++;
                    log.info("Auto-fixed {}", file);
                } catch (IOException e) {
                    log.error("Failed to write fixes to {}", file, e);
                    unfixable.addAll(fileErrors.stream().filter(ValidationError::isFixable).toList());
                }
            }
        }

        return new FixResult(filesModified, errorsFixed, alreadySatisfied, unfixable, details);
    }

    private Path resolve(Path file) {
        if (file == null) return null;
        return file.isAbsolute() || baseDir == null ? file : baseDir.resolve(file);
    }

    Fix apply(Path file, String content, ValidationError error) {
        return switch (error.category()) {
            case MISSING_HEADING -> fixMissingHeading(content, error.message());
            case MISSING_WHEN_THEN, MISSING_SCENARIO -> fixMissingScenario(file, content);
            default -> Fix.unsupported();
        };
    }

    // ── Missing heading ──

    private Fix fixMissingHeading(String content, String message) {
        if (!message.startsWith(MISSING_HEADING_PREFIX)) {
            return Fix.unsupported();
        }
        String heading = message.substring(MISSING_HEADING_PREFIX.length()).trim();
        if (heading.isEmpty()) {
            return Fix.unsupported();
        }
        if (hasHeading(content, heading)) {
            return Fix.satisfied();
        }
        String section = switch (heading.toLowerCase(Locale.ROOT)) {
            case "overview" -> "## Overview\n\n<!-- Brief description of this feature -->\n";
            case "requirements" -> "## Requirements\n\n### R1: Basic Requirement\nDescription of the requirement.\n";
            case "acceptance criteria" -> "## Acceptance Criteria\n\n" + PLACEHOLDER_SCENARIO;
            default -> "## " + heading + "\n\n<!-- Add content for this section -->\n";
        };
        return Fix.applied(append(content, section), "Added missing '## " + heading + "' heading");
    }

    static boolean hasHeading(String content, String heading) {
        Pattern p = Pattern.compile("(?im)^#{1,6}[ \t]+" + Pattern.quote(heading));
        return p.matcher(content).find();
    }

    // ── Missing scenario / WHEN-THEN ──

    private Fix fixMissingScenario(Path file, String content) {
        Matcher m = ACCEPTANCE_HEADING.matcher(content);
        if (!m.find()) {
            return Fix.applied(append(content, "## Acceptance Criteria\n\n" + PLACEHOLDER_SCENARIO),
                    "Added Acceptance Criteria section with placeholder scenario");
        }
        if (hasCompleteScenario(file, content)) {
            return Fix.satisfied();
        }
        String updated = content.substring(0, m.end()) + "\n\n" + PLACEHOLDER_SCENARIO.stripTrailing()
                + "\n" + content.substring(m.end());
        return Fix.applied(updated, "Inserted placeholder scenario under '## Acceptance Criteria'");
    }

    /**
     * True when the document already has a scenario carrying both WHEN and THEN,
     * extracted the same way the format check counts scenarios.
     */
    static boolean hasCompleteScenario(Path file, String content) {
        var events = MarkdownWalker.walk(DocumentLoader.parse(file, content));
        return BlockExtractor.sectionScenarios(events, text -> SCENARIO_HEADING.matcher(text).find())
                .stream()
                .anyMatch(ScenarioBlock::hasWhenAndThen);
    }

    private static String append(String content, String section) {
        String trimmed = content.stripTrailing();
        return trimmed.isEmpty() ? section : trimmed + "\n\n" + section;
    }

    enum Status { APPLIED, SATISFIED, UNSUPPORTED }

    record Fix(Status status, String content, String detail) {
        static Fix applied(String content, String detail) { return new Fix(Status.APPLIED, content, detail); }
        static Fix satisfied() { return new Fix(Status.SATISFIED, null, null); }
        static Fix unsupported() { return new Fix(Status.UNSUPPORTED, null, null); }
    }
}
