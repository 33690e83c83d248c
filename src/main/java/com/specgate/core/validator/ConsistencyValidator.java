package com.specgate.core.validator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.specgate.core.document.BlockExtractor;
import com.specgate.core.document.Document;
import com.specgate.core.document.DocumentLoader;
import com.specgate.core.document.InstanceLayout;
import com.specgate.core.document.MarkdownEvent;
import com.specgate.core.document.MarkdownWalker;
import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.RequirementBlock;
import com.specgate.core.model.Severity;
import com.specgate.core.model.TaskBlock;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Cross-document checks over one workflow instance directory: task to spec
 * references, proposal to specs alignment, the task dependency graph and the
 * spec parent/related hierarchy.
 */
public class ConsistencyValidator {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyValidator.class);

    private final InstanceLayout layout;

    public ConsistencyValidator(Path instanceDir) {
        this.layout = new InstanceLayout(instanceDir);
    }

    /** Runs every check in a fixed order. */
    public ValidationResult validate() {
        var result = new ValidationResult();
        List<TaskBlock> tasks = loadTasks(result);
        result.merge(validateTaskSpecRefs(tasks));
        result.merge(validateProposalAlignment());
        result.merge(validateDependencies(tasks));
        result.merge(validateSpecHierarchy());
        return result;
    }

    // ── Task → spec references ──

    public ValidationResult validateTaskSpecRefs() {
        var result = new ValidationResult();
        return result.merge(validateTaskSpecRefs(loadTasks(result)));
    }

    ValidationResult validateTaskSpecRefs(List<TaskBlock> tasks) {
        var result = new ValidationResult();
        Path tasksFile = layout.tasks();
        Map<String, Optional<List<MarkdownEvent>>> specEvents = new HashMap<>();

        for (TaskBlock task : tasks) {
            SpecRef ref = SpecRef.parse(task.specRef());
            if (ref == null) continue;

            Path specPath = layout.root().resolve(ref.path()).normalize();
            if (!Files.isRegularFile(specPath)) {
                result.add(ValidationError.of(String.format("Task %s references non-existent spec file: %s",
                        task.id(), ref.path()), tasksFile, task.line(), Severity.HIGH, ErrorCategory.BROKEN_REFERENCE));
                continue;
            }
            if (!ref.hasAnchor()) continue;

            var events = specEvents.computeIfAbsent(ref.path(), p -> walk(specPath));
            if (events.isEmpty()) {
                result.add(ValidationError.of(String.format("Failed to read spec file %s for task %s",
                        ref.path(), task.id()), tasksFile, task.line(), Severity.MEDIUM, ErrorCategory.BROKEN_REFERENCE));
                continue;
            }
            if (!anchorResolves(events.get(), ref.anchor())) {
                result.add(ValidationError.of(String.format("Task %s references non-existent anchor #%s in %s",
                        task.id(), ref.anchor(), ref.path()), tasksFile, task.line(), Severity.HIGH,
                        ErrorCategory.BROKEN_REFERENCE));
            }
        }
        return result;
    }

    /**
     * An anchor resolves against a heading of any level whose text is the anchor,
     * or starts with it followed by a colon or whitespace, or against a requirement id.
     */
    static boolean anchorResolves(List<MarkdownEvent> events, String anchor) {
        for (MarkdownEvent event : events) {
            if (event.type() != MarkdownEvent.Type.HEADING) continue;
            String text = event.text();
            if (text.equals(anchor)) return true;
            if (text.startsWith(anchor) && text.length() > anchor.length()) {
                char next = text.charAt(anchor.length());
                if (next == ':' || Character.isWhitespace(next)) return true;
            }
        }
        for (RequirementBlock requirement : BlockExtractor.requirements(events)) {
            if (requirement.id().equals(anchor)) return true;
        }
        return false;
    }

    // ── Proposal ↔ specs alignment ──

    public ValidationResult validateProposalAlignment() {
        var result = new ValidationResult();
        Path proposal = layout.proposal();
        if (!Files.isRegularFile(proposal)) {
            return result;
        }

        Optional<JsonNode> header;
        try {
            header = DocumentLoader.load(proposal).headerNode();
        } catch (JsonProcessingException e) {
            // reported by the schema check
            log.debug("Skipping proposal alignment, header of {} is not valid YAML", proposal);
            return result;
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", proposal, e.getMessage());
            return result;
        }
        if (header.isEmpty()) {
            return result;
        }

        Set<String> declared = new LinkedHashSet<>();
        JsonNode affected = header.get().get("affected_specs");
        if (affected != null && affected.isArray()) {
            for (JsonNode entry : affected) {
                String path = declaredPath(entry);
                if (path != null) declared.add(path);
            }
        }

        for (String path : declared) {
            if (!Files.isRegularFile(layout.root().resolve(path))) {
                result.add(ValidationError.of("Proposal references non-existent spec: " + path,
                        proposal, null, Severity.MEDIUM, ErrorCategory.BROKEN_REFERENCE));
            }
        }
        for (Path spec : layout.specFiles()) {
            String relative = layout.relative(spec);
            if (!declared.contains(relative)) {
                result.add(ValidationError.of(String.format("Spec file %s not listed in proposal.affected_specs", relative),
                        spec, null, Severity.LOW, ErrorCategory.INCONSISTENCY));
            }
        }
        return result;
    }

    private static String declaredPath(JsonNode entry) {
        if (entry.isTextual()) {
            return InstanceLayout.normalizeDeclared(entry.asText());
        }
        if (entry.hasNonNull("path")) {
            return InstanceLayout.normalizeDeclared(entry.get("path").asText());
        }
        if (entry.hasNonNull("id")) {
            return InstanceLayout.SPECS_DIR + "/" + entry.get("id").asText().trim() + ".md";
        }
        return null;
    }

    // ── Task dependency graph ──

    public ValidationResult validateDependencies() {
        var result = new ValidationResult();
        return result.merge(validateDependencies(loadTasks(result)));
    }

    ValidationResult validateDependencies(List<TaskBlock> tasks) {
        var result = new ValidationResult();
        Path tasksFile = layout.tasks();

        Map<String, Integer> seen = new HashMap<>();
        for (TaskBlock task : tasks) {
            Integer first = seen.putIfAbsent(task.id(), task.line());
            if (first != null) {
                result.add(ValidationError.of(String.format("Duplicate task ID '%s' (first seen at line %d)",
                        task.id(), first), tasksFile, task.line(), Severity.MEDIUM, ErrorCategory.INCONSISTENCY));
            }
        }

        var graph = new DependencyGraph(tasks);
        for (var missing : graph.missingDependencies()) {
            result.add(ValidationError.of(String.format("Task %s depends on non-existent task: %s",
                    missing.task().id(), missing.dependency()), tasksFile, missing.task().line(),
                    Severity.HIGH, ErrorCategory.BROKEN_REFERENCE));
        }

        graph.findFirstCycle().ifPresent(cycle -> {
            Integer line = seen.get(cycle.get(0));
            result.add(ValidationError.of("Circular dependency detected: " + String.join(" → ", cycle),
                    tasksFile, line, Severity.HIGH, ErrorCategory.CIRCULAR_DEPENDENCY));
        });
        return result;
    }

    // ── Spec hierarchy ──

    public ValidationResult validateSpecHierarchy() {
        var result = new ValidationResult();
        for (Path spec : layout.specFiles()) {
            Optional<JsonNode> header;
            try {
                header = DocumentLoader.load(spec).headerNodeQuietly();
            } catch (IOException e) {
                log.debug("Skipping hierarchy check of unreadable {}", spec);
                continue;
            }
            if (header.isEmpty()) continue;

            JsonNode parent = header.get().get("parent_spec");
            if (parent != null && parent.isTextual() && !parent.asText().isBlank()) {
                SpecRef parentRef = SpecRef.parse(parent.asText());
                if (!Files.isRegularFile(layout.root().resolve(parentRef.path()))) {
                    result.add(ValidationError.of("Spec references non-existent parent: " + parent.asText(),
                            spec, null, Severity.MEDIUM, ErrorCategory.BROKEN_REFERENCE));
                }
            }

            JsonNode related = header.get().get("related_specs");
            if (related != null && related.isArray()) {
                for (JsonNode entry : related) {
                    String path = entry.isTextual() ? entry.asText() : entry.path("path").asText(null);
                    if (path == null || path.isBlank()) continue;
                    if (!Files.exists(layout.root().resolve(InstanceLayout.normalizeDeclared(path)))) {
                        result.add(ValidationError.of("Spec references non-existent related spec: " + path,
                                spec, null, Severity.LOW, ErrorCategory.BROKEN_REFERENCE));
                    }
                }
            }
        }
        return result;
    }

    // ── helpers ──

    private List<TaskBlock> loadTasks(ValidationResult result) {
        Path tasksFile = layout.tasks();
        if (!Files.isRegularFile(tasksFile)) {
            return List.of();
        }
        try {
            Document document = DocumentLoader.load(tasksFile);
            return BlockExtractor.tasks(MarkdownWalker.walk(document));
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", tasksFile, e.getMessage());
            result.add(ValidationError.of("Failed to read file: " + e.getMessage(), tasksFile, null,
                    Severity.HIGH, ErrorCategory.INVALID_STRUCTURE));
            return List.of();
        }
    }

    private static Optional<List<MarkdownEvent>> walk(Path file) {
        try {
            return Optional.of(MarkdownWalker.walk(DocumentLoader.load(file)));
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
