package com.specgate.core.validator;

import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.Severity;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SchemaValidatorTest {

    @TempDir
    Path dir;

    private final SchemaValidator validator = new SchemaValidator(null);

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("document without header block passes")
    void noHeader() throws Exception {
        assertTrue(validator.validate(write("auth.md", "# Auth\n")).isEmpty());
    }

    @Test
    @DisplayName("complete spec header passes")
    void validSpecHeader() throws Exception {
        Path file = write("auth.md", "---\nid: auth\ntype: spec\ntitle: Auth\nversion: 1\n---\n# Auth\n");
        assertTrue(validator.validate(file).isEmpty());
    }

    @Test
    @DisplayName("missing required field is a high structural error on line 1")
    void missingRequired() throws Exception {
        Path file = write("auth.md", "---\nid: auth\ntype: spec\nversion: 1\n---\n# Auth\n");

        ValidationResult result = validator.validate(file);

        assertEquals(1, result.size());
        ValidationError error = result.errors().get(0);
        assertTrue(error.message().contains("title"), error.message());
        assertEquals(Severity.HIGH, error.severity());
        assertEquals(ErrorCategory.INVALID_STRUCTURE, error.category());
        assertEquals(1, error.line());
    }

    @Test
    @DisplayName("enum violation is high, length violation is medium")
    void severityByKeyword() throws Exception {
        Path file = write("auth.md",
                "---\nid: auth\ntype: spec\ntitle: ''\nversion: 1\nstatus: bogus\n---\n# Auth\n");

        ValidationResult result = validator.validate(file);

        assertEquals(2, result.size());
        assertEquals(1, result.count(Severity.HIGH));
        assertEquals(1, result.count(Severity.MEDIUM));
        assertTrue(result.errors().stream()
                .anyMatch(e -> e.severity() == Severity.HIGH && e.message().contains("status")));
    }

    @Test
    @DisplayName("declared type wins over the file name")
    void declaredType() throws Exception {
        Path file = write("notes.md", "---\nid: p1\ntype: proposal\nversion: 1\n---\n# Notes\n");

        ValidationResult result = validator.validate(file);

        assertEquals(1, result.size());
        assertTrue(result.errors().get(0).message().contains("status"));
    }

    @Test
    @DisplayName("unclosed header block is invalid frontmatter")
    void unclosedHeader() throws Exception {
        ValidationResult result = validator.validate(write("auth.md", "---\nid: auth\n# Auth\n"));

        assertEquals(1, result.size());
        assertTrue(result.errors().get(0).message().startsWith("Invalid frontmatter"));
        assertEquals(Severity.HIGH, result.errors().get(0).severity());
    }

    @Test
    @DisplayName("unparsable YAML header is reported")
    void invalidYaml() throws Exception {
        ValidationResult result = validator.validate(write("auth.md", "---\nid: [unclosed\n---\n# Auth\n"));

        assertEquals(1, result.size());
        assertTrue(result.errors().get(0).message().startsWith("Invalid YAML"));
    }

    @Test
    @DisplayName("undeterminable type is a medium error")
    void unknownType() throws Exception {
        ValidationResult result = validator.validate(write("notes.txt", "---\nfoo: bar\n---\ntext\n"));

        assertEquals(1, result.size());
        assertEquals(Severity.MEDIUM, result.errors().get(0).severity());
    }

    @Test
    @DisplayName("state records are validated as whole YAML files")
    void stateFile() throws Exception {
        ValidationResult ok = validator.validate(write("STATE.yaml", "change_id: add-auth\nphase: proposed\n"));
        ValidationResult bad = validator.validate(write("other/STATE.yaml", "change_id: add-auth\nphase: done\n"));

        assertTrue(ok.isEmpty());
        assertEquals(1, bad.size());
        assertEquals(Severity.HIGH, bad.errors().get(0).severity());
    }

    @Test
    @DisplayName("schemas directory overrides the bundled schema")
    void customSchemasDir() throws Exception {
        Path schemas = Files.createDirectories(dir.resolve("schemas"));
        Files.writeString(schemas.resolve("spec.schema.json"), """
                {
                  "$schema": "https://json-schema.org/draft/2020-12/schema",
                  "type": "object",
                  "required": ["owner"]
                }
                """);
        Path file = write("auth.md", "---\nid: auth\n---\n# Auth\n");

        ValidationResult result = new SchemaValidator(schemas).validate(file);

        assertEquals(1, result.size());
        assertTrue(result.errors().get(0).message().contains("owner"));
    }

    @Test
    @DisplayName("broken schema file is reported as a load failure")
    void brokenSchema() throws Exception {
        Path schemas = Files.createDirectories(dir.resolve("schemas"));
        Files.writeString(schemas.resolve("spec.schema.json"), "{ not json");
        Path file = write("auth.md", "---\nid: auth\n---\n# Auth\n");

        ValidationResult result = new SchemaValidator(schemas).validate(file);

        assertEquals(1, result.size());
        assertTrue(result.errors().get(0).message().startsWith("Failed to load schema"));
        assertEquals(Severity.HIGH, result.errors().get(0).severity());
    }

    @Test
    @DisplayName("compiled schemas are cached per type")
    void caching() throws Exception {
        Path a = write("a.md", "---\nid: a\ntype: spec\ntitle: A\nversion: 1\n---\n");
        Path b = write("b.md", "---\nid: b\ntype: spec\ntitle: B\nversion: 1\n---\n");

        validator.validate(a);
        validator.validate(b);

        assertEquals(1, validator.cachedSchemaCount());
        assertSame(validator.schemaFor(DocumentType.SPEC), validator.schemaFor(DocumentType.SPEC));
    }

    @Test
    @DisplayName("document type detection falls back to file name conventions")
    void typeDetection() {
        assertEquals(DocumentType.TASKS, DocumentType.fromFileName(Path.of("x/tasks.md")).orElseThrow());
        assertEquals(DocumentType.CHALLENGE, DocumentType.fromFileName(Path.of("CHALLENGE.md")).orElseThrow());
        assertEquals(DocumentType.SPEC, DocumentType.fromFileName(Path.of("specs/auth.md")).orElseThrow());
        assertTrue(DocumentType.fromFileName(Path.of("notes.txt")).isEmpty());
        assertEquals("spec.schema.json", DocumentType.SPEC.schemaFileName());
    }
}
