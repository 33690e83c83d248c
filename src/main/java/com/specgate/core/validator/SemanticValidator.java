package com.specgate.core.validator;

import com.specgate.core.document.BlockExtractor;
import com.specgate.core.document.Document;
import com.specgate.core.document.DocumentLoader;
import com.specgate.core.document.MarkdownEvent;
import com.specgate.core.document.MarkdownWalker;
import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.RequirementBlock;
import com.specgate.core.model.Severity;
import com.specgate.core.model.SeverityMap;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Meaning-level checks on specs: duplicate requirement ids, broken local links
 * and empty or placeholder requirement titles.
 */
public class SemanticValidator {

    private static final Logger log = LoggerFactory.getLogger(SemanticValidator.class);

    static final List<String> PLACEHOLDERS = List.of("TODO", "TBD", "FIXME", "XXX");

    private final SeverityMap severities;

    public SemanticValidator() {
        this(SeverityMap.defaults());
    }

    public SemanticValidator(SeverityMap severities) {
        this.severities = severities;
    }

    public ValidationResult validate(Path file) {
        return load(file)
                .map(this::validate)
                .orElseGet(() -> unreadable(file));
    }

    public ValidationResult validate(Document document) {
        Path file = document.path();
        var result = new ValidationResult();
        List<MarkdownEvent> events = MarkdownWalker.walk(document);

        Map<String, Integer> firstSeen = new HashMap<>();
        for (RequirementBlock requirement : BlockExtractor.requirementHeadings(events)) {
            Integer first = firstSeen.putIfAbsent(requirement.id(), requirement.line());
            if (first != null) {
                result.add(error(String.format("Duplicate requirement ID '%s' (first seen at line %d)",
                        requirement.id(), first), file, requirement.line(), ErrorCategory.DUPLICATE_REQUIREMENT));
            }
            checkTitle(requirement, file, result);
        }

        for (MarkdownEvent event : events) {
            if (event.type() == MarkdownEvent.Type.LINK) {
                checkLink(event.text(), file, event.line(), result);
            }
        }
        return result;
    }

    /**
     * Validates each file, then reports requirement ids declared in more than one
     * file.
     */
    public ValidationResult validateBatch(List<Path> files) {
        var result = new ValidationResult();
        for (Path file : files) {
            result.merge(validate(file));
        }
        return result.merge(crossFileDuplicates(files));
    }

    /**
     * Requirement ids declared in more than one file. Files are processed in list
     * order, so the first file declaring an id wins. The id map lives only for
     * the duration of this call.
     */
    public ValidationResult crossFileDuplicates(List<Path> files) {
        var result = new ValidationResult();
        Map<String, Location> firstSeen = new HashMap<>();

        for (Path file : files) {
            Optional<Document> document = load(file);
            if (document.isEmpty()) continue;

            Map<String, Integer> idsInFile = new LinkedHashMap<>();
            for (RequirementBlock requirement : BlockExtractor.requirementHeadings(MarkdownWalker.walk(document.get()))) {
                idsInFile.putIfAbsent(requirement.id(), requirement.line());
            }
            idsInFile.forEach((id, line) -> {
                Location first = firstSeen.putIfAbsent(id, new Location(file, line));
                if (first != null) {
                    result.add(error(String.format("Duplicate requirement ID '%s' across files (first seen in %s at line %d)",
                            id, first.file(), first.line()), file, line, ErrorCategory.DUPLICATE_REQUIREMENT));
                }
            });
        }
        return result;
    }

    private void checkTitle(RequirementBlock requirement, Path file, ValidationResult result) {
        String title = requirement.title();
        if (title.isEmpty()) {
            result.add(ValidationError.of(String.format("Requirement '%s' has empty title", requirement.id()),
                    file, requirement.line(), Severity.HIGH, ErrorCategory.EMPTY_CONTENT));
            return;
        }
        String upper = title.toUpperCase(Locale.ROOT);
        for (String placeholder : PLACEHOLDERS) {
            if (upper.contains(placeholder)) {
                result.add(ValidationError.of(String.format("Requirement '%s' contains placeholder text: '%s'",
                        requirement.id(), placeholder), file, requirement.line(), Severity.MEDIUM, ErrorCategory.EMPTY_CONTENT));
                return;
            }
        }
    }

    private void checkLink(String destination, Path file, int line, ValidationResult result) {
        if (destination == null || destination.isBlank() || isExternal(destination)) {
            return;
        }
        int hash = destination.indexOf('#');
        String target = hash >= 0 ? destination.substring(0, hash) : destination;
        if (target.isEmpty()) {
            return;
        }
        Path base = file != null && file.getParent() != null ? file.getParent() : Path.of(".");
        boolean exists;
        try {
            exists = Files.exists(base.resolve(target).normalize());
        } catch (InvalidPathException e) {
            exists = false;
        }
        if (!exists) {
            result.add(error("Broken reference to file: " + target, file, line, ErrorCategory.BROKEN_REFERENCE));
        }
    }

    private static boolean isExternal(String destination) {
        String lower = destination.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://")
                || lower.startsWith("mailto:") || lower.startsWith("#");
    }

    private Optional<Document> load(Path file) {
        try {
            return Optional.of(DocumentLoader.load(file));
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private ValidationResult unreadable(Path file) {
        return ValidationResult.empty().add(error("Failed to read file: " + file,
                file, null, ErrorCategory.INVALID_STRUCTURE));
    }

    private ValidationError error(String message, Path file, Integer line, ErrorCategory category) {
        return ValidationError.of(message, file, line, severities.severityOf(category), category);
    }

    private record Location(Path file, int line) {}
}
