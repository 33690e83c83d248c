package com.specgate.core.validator;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import com.specgate.core.document.Document;
import com.specgate.core.document.DocumentLoader;
import com.specgate.core.document.Mappers;
import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.Severity;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Validates a document's header block against the JSON schema for its type.
 * <p>
 * Schemas are looked up in the configured schemas directory and fall back to the
 * bundled {@code schemas/} classpath resources. Each schema is compiled lazily
 * and cached for the lifetime of this validator instance.
 */
public class SchemaValidator {

    private static final Logger log = LoggerFactory.getLogger(SchemaValidator.class);
    private static final String CLASSPATH_DIR = "schemas/";

    private final Path schemasDir;
    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private final Map<DocumentType, JsonSchema> compiled = new EnumMap<>(DocumentType.class);

    /**
     * @param schemasDir directory holding {@code <type>.schema.json} files, or null
     *                   to use only the bundled schemas
     */
    public SchemaValidator(Path schemasDir) {
        this.schemasDir = schemasDir;
    }

    public ValidationResult validate(Path file) {
        Document document;
        try {
            document = DocumentLoader.load(file);
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", file, e.getMessage());
            return single("Failed to read file: " + e.getMessage(), file, null, Severity.HIGH);
        }
        return validate(document);
    }

    public ValidationResult validate(Document document) {
        Path file = document.path();
        if (document.headerError() != null) {
            return single("Invalid frontmatter: " + document.headerError(), file, 1, Severity.HIGH);
        }

        JsonNode node;
        try {
            node = structuredContent(document);
        } catch (JsonProcessingException e) {
            return single("Invalid YAML: " + e.getOriginalMessage(), file, 1, Severity.HIGH);
        }
        if (node == null) {
            // header block is optional
            return ValidationResult.empty();
        }

        Optional<DocumentType> type = DocumentType.detect(node, file);
        if (type.isEmpty()) {
            return single("Cannot determine document type for schema validation", file, null, Severity.MEDIUM);
        }

        JsonSchema schema;
        try {
            schema = schemaFor(type.get());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to load schema for {}: {}", type.get(), e.getMessage());
            return single("Failed to load schema: " + e.getMessage(), file, null, Severity.HIGH);
        }

        var result = new ValidationResult();
        schema.validate(node).stream()
                .sorted(Comparator.comparing(ValidationMessage::getMessage))
                .forEach(message -> result.add(ValidationError.of(
                        message.getMessage(), file, 1, severityOf(message), ErrorCategory.INVALID_STRUCTURE)));
        log.debug("Schema check of {} as {}: {} violations", file, type.get(), result.size());
        return result;
    }

    /** Whole-file YAML for state records; the header block for everything else. */
    private static JsonNode structuredContent(Document document) throws JsonProcessingException {
        String name = document.path() != null && document.path().getFileName() != null
                ? document.path().getFileName().toString().toLowerCase(Locale.ROOT) : "";
        if (name.endsWith(".yaml") || name.endsWith(".yml")) {
            if (document.raw().isBlank()) return null;
            return Mappers.yaml().readTree(document.raw());
        }
        return document.headerNode().orElse(null);
    }

    JsonSchema schemaFor(DocumentType type) throws IOException {
        JsonSchema schema = compiled.get(type);
        if (schema == null) {
            schema = factory.getSchema(loadSchemaNode(type));
            compiled.put(type, schema);
        }
        return schema;
    }

    int cachedSchemaCount() {
        return compiled.size();
    }

    private JsonNode loadSchemaNode(DocumentType type) throws IOException {
        if (schemasDir != null) {
            Path candidate = schemasDir.resolve(type.schemaFileName());
            if (Files.isRegularFile(candidate)) {
                log.debug("Loading schema {} from {}", type, candidate);
                return Mappers.json().readTree(candidate.toFile());
            }
        }
        try (InputStream in = SchemaValidator.class.getClassLoader()
                .getResourceAsStream(CLASSPATH_DIR + type.schemaFileName())) {
            if (in == null) {
                throw new IOException("schema not found: " + type.schemaFileName());
            }
            return Mappers.json().readTree(in);
        }
    }

    private static Severity severityOf(ValidationMessage message) {
        String keyword = message.getType() != null ? message.getType().toLowerCase(Locale.ROOT) : "";
        if (keyword.contains("required") || keyword.contains("type") || keyword.contains("enum")) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }

    private static ValidationResult single(String message, Path file, Integer line, Severity severity) {
        return ValidationResult.empty().add(
                ValidationError.of(message, file, line, severity, ErrorCategory.INVALID_STRUCTURE));
    }
}
