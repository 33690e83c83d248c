package com.specgate.core.fix;

import com.specgate.core.model.ErrorCategory;
import com.specgate.core.model.Severity;
import com.specgate.core.model.ValidationError;
import com.specgate.core.model.ValidationResult;
import com.specgate.core.model.ValidationRules;
import com.specgate.core.validator.FormatValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AutoFixerTest {

    @TempDir
    Path dir;

    private final FormatValidator format = new FormatValidator(ValidationRules.spec());

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("acceptance criteria without a scenario gets a placeholder scenario and then validates")
    void insertsPlaceholderScenario() throws Exception {
        Path file = write("auth.md", """
                # Spec: Auth

                ## Overview
                Login.

                ## Requirements

                ### R1: Login
                Users log in.

                ## Acceptance Criteria
                - User can login
                """);
        ValidationResult before = format.validate(file);
        assertEquals(1, before.errorsOf(ErrorCategory.MISSING_SCENARIO).size());

        FixResult fix = new AutoFixer(dir).fix(before.fixableErrors());

        assertEquals(1, fix.filesModified());
        assertEquals(1, fix.errorsFixed());
        assertTrue(fix.unfixableErrors().isEmpty());
        String content = Files.readString(file);
        assertTrue(content.contains("## Acceptance Criteria\n\n#### Scenario: Basic Usage\n"
                + "- **WHEN** the feature is used\n- **THEN** it should work correctly\n"));
        assertTrue(content.contains("- User can login"));

        ValidationResult after = format.validate(file);
        assertTrue(after.errorsOf(ErrorCategory.MISSING_SCENARIO).isEmpty());
        assertTrue(after.errorsOf(ErrorCategory.MISSING_WHEN_THEN).isEmpty());
    }

    @Test
    @DisplayName("WHEN and THEN in a prose line do not count as an existing scenario")
    void proseWhenThen() throws Exception {
        Path file = write("auth.md", """
                # Spec: Auth

                ## Overview
                Login.

                ## Requirements

                ### R1: Login
                Users log in.

                ## Acceptance Criteria
                WHEN the user logs in THEN a token is returned.
                """);
        ValidationResult before = format.validate(file);
        assertEquals(1, before.errorsOf(ErrorCategory.MISSING_SCENARIO).size());

        FixResult fix = new AutoFixer(dir).fix(before.fixableErrors());

        assertEquals(1, fix.errorsFixed());
        assertEquals(0, fix.alreadySatisfied());
        assertEquals(1, fix.filesModified());
        assertTrue(format.validate(file).isEmpty());
    }

    @Test
    @DisplayName("complete scenario is detected the way the format check extracts it")
    void completeScenarioDetection() {
        Path file = dir.resolve("auth.md");
        assertTrue(AutoFixer.hasCompleteScenario(file,
                "## Acceptance Criteria\n\n#### Scenario: Login\n- **WHEN** a\n- **THEN** b\n"));
        assertTrue(AutoFixer.hasCompleteScenario(file,
                "## Acceptance Criteria\n- WHEN a THEN b\n"));
        assertFalse(AutoFixer.hasCompleteScenario(file,
                "## Acceptance Criteria\nWHEN a THEN b.\n"));
        assertFalse(AutoFixer.hasCompleteScenario(file,
                "## Overview\n- WHEN a THEN b\n\n## Acceptance Criteria\n- nothing yet\n"));
    }

    @Test
    @DisplayName("missing sections are appended and the document becomes valid")
    void appendsMissingSections() throws Exception {
        Path file = write("foo.md", "# Spec: Foo\n\n## Requirements\n\n### R1: Foo\nThe system does foo.\n");
        List<ValidationError> errors = format.validate(file).errors();

        FixResult fix = new AutoFixer(dir).fix(errors);

        assertEquals(2, fix.errorsFixed());
        assertEquals(1, fix.alreadySatisfied());
        assertEquals(1, fix.filesModified());
        assertEquals(2, fix.details().size());
        assertTrue(fix.details().get(0).endsWith("Added missing '## Overview' heading"));
        assertTrue(format.validate(file).isEmpty());
    }

    @Test
    @DisplayName("second run with the same errors changes nothing")
    void idempotent() throws Exception {
        Path file = write("foo.md", "# Spec: Foo\n\n## Requirements\n\n### R1: Foo\nThe system does foo.\n");
        List<ValidationError> errors = format.validate(file).errors();
        var fixer = new AutoFixer(dir);

        fixer.fix(errors);
        String once = Files.readString(file);
        FixResult second = fixer.fix(errors);

        assertEquals(once, Files.readString(file));
        assertEquals(0, second.errorsFixed());
        assertEquals(0, second.filesModified());
        assertFalse(second.changedAnything());
        assertEquals(3, second.alreadySatisfied());
    }

    @Test
    @DisplayName("scenario missing its clauses gets one placeholder for both WHEN and THEN errors")
    void whenThenErrors() throws Exception {
        Path file = write("auth.md", """
                # Spec: Auth

                ## Overview
                Login.

                ## Requirements

                ### R1: Login
                Users log in.

                ## Acceptance Criteria

                #### Scenario: Login
                - user logs in
                """);
        List<ValidationError> errors = format.validate(file).errors();
        assertEquals(2, errors.size());

        FixResult fix = new AutoFixer(dir).fix(errors);

        assertEquals(1, fix.errorsFixed());
        assertEquals(1, fix.alreadySatisfied());
        assertTrue(format.validate(file).isEmpty());
    }

    @Test
    @DisplayName("custom missing heading gets a generic section")
    void customHeading() throws Exception {
        Path file = write("auth.md", "# Spec\n\n## Overview\nText.\n");
        var error = ValidationError.of("Missing required heading: Non-Goals", file, null,
                Severity.HIGH, ErrorCategory.MISSING_HEADING);

        new AutoFixer(dir).fix(List.of(error));

        assertTrue(Files.readString(file).endsWith("## Non-Goals\n\n<!-- Add content for this section -->\n"));
    }

    @Test
    @DisplayName("unfixable categories and missing files are passed through")
    void unfixable() throws Exception {
        Path file = write("specs/a.md", "### R1: A\n\n### R1: B\n");
        var duplicate = ValidationError.of("Duplicate", Path.of("specs/a.md"), 3, Severity.HIGH,
                ErrorCategory.DUPLICATE_REQUIREMENT);
        var gone = ValidationError.of("Missing required heading: Overview", dir.resolve("gone.md"), null,
                Severity.HIGH, ErrorCategory.MISSING_HEADING);
        String before = Files.readString(file);

        FixResult fix = new AutoFixer(dir).fix(List.of(duplicate, gone));

        assertEquals(List.of(duplicate, gone), fix.unfixableErrors());
        assertEquals(0, fix.errorsFixed());
        assertEquals(before, Files.readString(file));
    }

    @Test
    @DisplayName("heading detection is case-insensitive at any level")
    void headingDetection() {
        assertTrue(AutoFixer.hasHeading("# Title\n\n### overview\n", "Overview"));
        assertFalse(AutoFixer.hasHeading("Overview without marker\n", "Overview"));
    }
}
