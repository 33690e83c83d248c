package com.specgate.core.document;

import com.specgate.core.model.RequirementBlock;
import com.specgate.core.model.ScenarioBlock;
import com.specgate.core.model.TaskAction;
import com.specgate.core.model.TaskBlock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BlockExtractorTest {

    private static List<MarkdownEvent> walk(String body) {
        return MarkdownWalker.walk(body, 0);
    }

    @Nested
    @DisplayName("requirements")
    class Requirements {

        @Test
        @DisplayName("level-3 R<n>: headings become requirement blocks with description")
        void fromHeadings() {
            List<RequirementBlock> blocks = BlockExtractor.requirements(walk("""
                    ## Requirements

                    ### R1: Login
                    Users log in with a password.

                    ### R2: Logout
                    """));

            assertEquals(2, blocks.size());
            assertEquals("R1", blocks.get(0).id());
            assertEquals("Login", blocks.get(0).title());
            assertEquals("Users log in with a password.", blocks.get(0).description());
            assertEquals(3, blocks.get(0).line());
            assertNull(blocks.get(1).description());
        }

        @Test
        @DisplayName("requirementHeadings keeps repeated ids, requirements keeps the first")
        void duplicates() {
            List<MarkdownEvent> events = walk("### R1: A\n\n### R1: B\n");

            assertEquals(2, BlockExtractor.requirementHeadings(events).size());
            List<RequirementBlock> merged = BlockExtractor.requirements(events);
            assertEquals(1, merged.size());
            assertEquals("A", merged.get(0).title());
        }

        @Test
        @DisplayName("YAML requirement blocks add new ids and fill in priority")
        void yamlBlocks() {
            List<RequirementBlock> blocks = BlockExtractor.requirements(walk("""
                    ### R1: Login

                    ```yaml
                    requirement:
                      id: R1
                      priority: high
                    ```

                    ```yaml
                    requirement:
                      id: R7
                      title: Audit
                    ```
                    """));

            assertEquals(2, blocks.size());
            assertEquals("high", blocks.get(0).priority());
            assertEquals("Login", blocks.get(0).title());
            assertEquals("R7", blocks.get(1).id());
            assertEquals("Audit", blocks.get(1).title());
        }
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("scenario heading collects clauses from the following list")
        void headingScenario() {
            List<ScenarioBlock> scenarios = BlockExtractor.scenarios(walk("""
                    #### Scenario: Valid login
                    - **GIVEN** a registered user
                    - **WHEN** they submit valid credentials
                    - **THEN** a token is returned
                    - **AND** the login is audited
                    """));

            assertEquals(1, scenarios.size());
            ScenarioBlock s = scenarios.get(0);
            assertEquals("Valid login", s.name());
            assertEquals(List.of("a registered user"), s.given());
            assertEquals(List.of("they submit valid credentials"), s.when());
            assertEquals(List.of("a token is returned"), s.then());
            assertEquals(List.of("the login is audited"), s.and());
            assertTrue(s.hasWhenAndThen());
        }

        @Test
        @DisplayName("compact one-line items with WHEN and THEN are scenarios")
        void compactScenario() {
            List<ScenarioBlock> scenarios = BlockExtractor.scenarios(walk("""
                    - WHEN the user logs in THEN a token is issued
                    - just a note
                    """));

            assertEquals(1, scenarios.size());
            assertEquals(List.of("the user logs in"), scenarios.get(0).when());
            assertEquals(List.of("a token is issued"), scenarios.get(0).then());
        }

        @Test
        @DisplayName("scenario without THEN reports missing clause")
        void incomplete() {
            List<ScenarioBlock> scenarios = BlockExtractor.scenarios(walk("""
                    #### Scenario: Partial
                    - **WHEN** something happens
                    """));

            assertFalse(scenarios.get(0).hasWhenAndThen());
        }

        @Test
        @DisplayName("section scenarios only count headings and compact items in scenario sections")
        void sectionScoped() {
            List<MarkdownEvent> events = walk("""
                    ## Overview
                    - WHEN a note mentions THEN

                    #### Scenario: Outside

                    ## Acceptance Criteria
                    WHEN the user logs in THEN a token is returned.

                    #### Scenario: Inside
                    - **WHEN** they log in
                    - **THEN** a token is returned
                    """);

            List<ScenarioBlock> scoped = BlockExtractor.sectionScenarios(events, text -> text.startsWith("Scenario:"));

            assertEquals(1, scoped.size());
            assertEquals("Inside", scoped.get(0).name());
            assertTrue(scoped.get(0).hasWhenAndThen());
            assertEquals(3, BlockExtractor.scenarios(events).size());
        }

        @Test
        @DisplayName("compact detection requires whole-word markers")
        void compactDetection() {
            assertTrue(BlockExtractor.isCompactScenario("WHEN a THEN b"));
            assertFalse(BlockExtractor.isCompactScenario("WHENEVER a THENCE b"));
        }
    }

    @Nested
    @DisplayName("tasks")
    class Tasks {

        @Test
        @DisplayName("fenced task blocks are parsed with list or comma-separated dependencies")
        void parsesTasks() {
            List<TaskBlock> tasks = BlockExtractor.tasks(walk("""
                    ## Layer 1

                    ```yaml
                    task:
                      id: "1.1"
                      action: CREATE
                      file: src/Auth.java
                      spec_ref: auth:R1
                      depends_on: []
                    ```

                    ```yml
                    task:
                      id: "2.1"
                      action: modify
                      depends_on: "1.1, 1.2"
                    ```
                    """));

            assertEquals(2, tasks.size());
            TaskBlock first = tasks.get(0);
            assertEquals("1.1", first.id());
            assertEquals(TaskAction.CREATE, first.action());
            assertEquals("src/Auth.java", first.file());
            assertEquals("auth:R1", first.specRef());
            assertTrue(first.dependsOn().isEmpty());
            assertEquals(3, first.line());

            TaskBlock second = tasks.get(1);
            assertEquals(TaskAction.MODIFY, second.action());
            assertNull(second.specRef());
            assertEquals(List.of("1.1", "1.2"), second.dependsOn());
        }

        @Test
        @DisplayName("unquoted numeric ids and references keep their source text")
        void unquotedIds() {
            List<TaskBlock> tasks = BlockExtractor.tasks(walk("""
                    ```yaml
                    task:
                      id: 1.10
                      spec_ref: 2.50
                      depends_on: [1.1, 1.20]
                    ```

                    ```yaml
                    task:
                      id: 3
                      depends_on: 1.10, 2.0
                    ```
                    """));

            assertEquals("1.10", tasks.get(0).id());
            assertEquals("2.50", tasks.get(0).specRef());
            assertEquals(List.of("1.1", "1.20"), tasks.get(0).dependsOn());
            assertEquals("3", tasks.get(1).id());
            assertEquals(List.of("1.10", "2.0"), tasks.get(1).dependsOn());
        }

        @Test
        @DisplayName("malformed and non-task blocks are skipped")
        void skipsMalformed() {
            List<TaskBlock> tasks = BlockExtractor.tasks(walk("""
                    ```yaml
                    task: [unclosed
                    ```

                    ```yaml
                    task:
                      action: CREATE
                    ```

                    ```json
                    {"task": {"id": "9"}}
                    ```

                    ```yaml
                    task:
                      id: "1.1"
                    ```
                    """));

            assertEquals(1, tasks.size());
            assertEquals("1.1", tasks.get(0).id());
        }
    }
}
