package com.specgate.core.document;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.specgate.core.model.RequirementBlock;
import com.specgate.core.model.ScenarioBlock;
import com.specgate.core.model.TaskAction;
import com.specgate.core.model.TaskBlock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts requirement, scenario and task blocks from a markdown event stream.
 * Blocks are transient and rebuilt on every call.
 */
public final class BlockExtractor {

    private static final Logger log = LoggerFactory.getLogger(BlockExtractor.class);

    /** Requirement heading text: {@code R<digits>:<title>}. */
    public static final Pattern REQUIREMENT_HEADING = Pattern.compile("^(R\\d+):(.*)$");

    public static final String REQUIREMENTS_SECTION = "requirements";
    public static final String ACCEPTANCE_SECTION = "acceptance criteria";

    private static final Pattern SCENARIO_HEADING = Pattern.compile("^Scenario:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern CLAUSE = Pattern.compile("^(GIVEN|WHEN|THEN|AND)\\b\\s*(.*)$");
    private static final Pattern COMPACT_SPLIT = Pattern.compile("\\b(GIVEN|WHEN|THEN|AND)\\b");
    private static final Pattern WHEN = Pattern.compile("\\bWHEN\\b");
    private static final Pattern THEN = Pattern.compile("\\bTHEN\\b");

    private BlockExtractor() {}

    /**
     * Requirement headings in document order, including repeated ids.
     */
    public static List<RequirementBlock> requirementHeadings(List<MarkdownEvent> events) {
        var blocks = new ArrayList<RequirementBlock>();
        for (int i = 0; i < events.size(); i++) {
            MarkdownEvent event = events.get(i);
            if (!event.isHeading(3)) continue;
            Matcher m = REQUIREMENT_HEADING.matcher(event.text());
            if (m.matches()) {
                blocks.add(new RequirementBlock(m.group(1), m.group(2).trim(),
                        firstParagraphAfter(events, i), null, event.line()));
            }
        }
        return blocks;
    }

    /**
     * Requirements declared by heading or by a fenced {@code requirement:} YAML block,
     * merged by id (first declaration wins, YAML fills in the priority).
     */
    public static List<RequirementBlock> requirements(List<MarkdownEvent> events) {
        Map<String, RequirementBlock> byId = new LinkedHashMap<>();
        for (RequirementBlock block : requirementHeadings(events)) {
            byId.putIfAbsent(block.id(), block);
        }
        for (MarkdownEvent event : events) {
            JsonNode node = yamlBlock(event, "requirement");
            if (node == null) continue;
            String id = text(node, "id");
            if (id == null) continue;
            RequirementBlock existing = byId.get(id);
            if (existing != null) {
                if (existing.priority() == null) {
                    byId.put(id, new RequirementBlock(id, existing.title(), existing.description(),
                            text(node, "priority"), existing.line()));
                }
            } else {
                String title = text(node, "title");
                byId.put(id, new RequirementBlock(id, title != null ? title : "", null,
                        text(node, "priority"), event.line()));
            }
        }
        return List.copyOf(byId.values());
    }

    /**
     * Scenarios from level-4 {@code Scenario:} headings (clauses taken from the
     * list that follows) and compact one-line list items carrying both WHEN and THEN,
     * wherever they appear in the document.
     */
    public static List<ScenarioBlock> scenarios(List<MarkdownEvent> events) {
        return collectScenarios(events, text -> SCENARIO_HEADING.matcher(text).matches(), false);
    }

    /**
     * Scenarios as the format rules count them: level-4 headings accepted by
     * {@code isScenarioHeading} inside the Requirements or Acceptance Criteria
     * section, and compact WHEN/THEN list items inside Acceptance Criteria.
     */
    public static List<ScenarioBlock> sectionScenarios(List<MarkdownEvent> events,
                                                       Predicate<String> isScenarioHeading) {
        return collectScenarios(events, isScenarioHeading, true);
    }

    /** Section name of a level-2 heading, as compared by {@link #inSection}. */
    public static String sectionName(String headingText) {
        return headingText.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean inSection(String section, String name) {
        return section != null && section.startsWith(name);
    }

    private static List<ScenarioBlock> collectScenarios(List<MarkdownEvent> events,
                                                        Predicate<String> isScenarioHeading,
                                                        boolean scoped) {
        var scenarios = new ArrayList<ScenarioBlock>();
        ScenarioBuilder current = null;
        String section = null;
        int listDepth = 0;

        for (MarkdownEvent event : events) {
            switch (event.type()) {
                case HEADING -> {
                    if (current != null) {
                        scenarios.add(current.build());
                        current = null;
                    }
                    if (event.level() <= 2) {
                        section = event.level() == 2 ? sectionName(event.text()) : null;
                    }
                    boolean inScope = !scoped
                            || inSection(section, ACCEPTANCE_SECTION) || inSection(section, REQUIREMENTS_SECTION);
                    if (event.level() == 4 && inScope && isScenarioHeading.test(event.text())) {
                        current = new ScenarioBuilder(scenarioName(event.text()), event.line());
                    }
                }
                case LIST_START -> listDepth++;
                case LIST_END -> listDepth = Math.max(0, listDepth - 1);
                case TEXT -> {
                    if (current != null) {
                        current.addClauses(event.text());
                    } else if (listDepth > 0 && isCompactScenario(event.text())
                            && (!scoped || inSection(section, ACCEPTANCE_SECTION))) {
                        var compact = new ScenarioBuilder(event.text(), event.line());
                        compact.addClauses(event.text());
                        scenarios.add(compact.build());
                    }
                }
                default -> { }
            }
        }
        if (current != null) {
            scenarios.add(current.build());
        }
        return scenarios;
    }

    private static String scenarioName(String headingText) {
        Matcher m = SCENARIO_HEADING.matcher(headingText);
        return m.matches() ? m.group(1).trim() : headingText.trim();
    }

    public static boolean isCompactScenario(String text) {
        return WHEN.matcher(text).find() && THEN.matcher(text).find();
    }

    /**
     * Tasks from fenced {@code task:} YAML blocks. A malformed block is skipped.
     */
    public static List<TaskBlock> tasks(List<MarkdownEvent> events) {
        var tasks = new ArrayList<TaskBlock>();
        for (MarkdownEvent event : events) {
            JsonNode node = yamlBlock(event, "task");
            if (node == null) continue;
            String id = text(node, "id");
            if (id == null) {
                log.warn("Task block at line {} has no id, skipping", event.line());
                continue;
            }
            tasks.add(new TaskBlock(
                    id,
                    TaskAction.parse(text(node, "action")),
                    text(node, "file"),
                    text(node, "spec_ref"),
                    stringList(node.get("depends_on")),
                    event.line()));
        }
        return tasks;
    }

    /**
     * Returns the object under {@code rootKey} when the event is a YAML code block
     * whose root has that key, otherwise null.
     */
    static JsonNode yamlBlock(MarkdownEvent event, String rootKey) {
        if (event.type() != MarkdownEvent.Type.CODE_BLOCK) return null;
        String info = event.info().toLowerCase(Locale.ROOT);
        if (!info.startsWith("yaml") && !info.startsWith("yml")) return null;
        if (!event.text().contains(rootKey + ":")) return null;
        try {
            JsonNode root = readVerbatim(event.text());
            JsonNode node = root != null ? root.get(rootKey) : null;
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed YAML block at line {}: {}", event.line(), e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.warn("Skipping unreadable YAML block at line {}: {}", event.line(), e.getMessage());
            return null;
        }
    }

    /**
     * Reads a YAML tree keeping every scalar as its source text, so dotted ids
     * such as {@code 1.10} are not collapsed into the number {@code 1.1}.
     */
    static JsonNode readVerbatim(String yaml) throws IOException {
        try (JsonParser parser = Mappers.yaml().getFactory().createParser(yaml)) {
            JsonToken token = parser.nextToken();
            return token == null ? null : readNode(parser, token);
        }
    }

    private static JsonNode readNode(JsonParser parser, JsonToken token) throws IOException {
        JsonNodeFactory nodes = JsonNodeFactory.instance;
        switch (token) {
            case START_OBJECT -> {
                ObjectNode object = nodes.objectNode();
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    String name = parser.currentName();
                    object.set(name, readNode(parser, parser.nextToken()));
                }
                return object;
            }
            case START_ARRAY -> {
                ArrayNode array = nodes.arrayNode();
                JsonToken next;
                while ((next = parser.nextToken()) != JsonToken.END_ARRAY) {
                    array.add(readNode(parser, next));
                }
                return array;
            }
            case VALUE_NULL -> {
                return nodes.nullNode();
            }
            default -> {
                return nodes.textNode(parser.getText());
            }
        }
    }

    private static String firstParagraphAfter(List<MarkdownEvent> events, int headingIndex) {
        for (int i = headingIndex + 1; i < events.size(); i++) {
            MarkdownEvent e = events.get(i);
            if (e.type() == MarkdownEvent.Type.HEADING) return null;
            if (e.type() == MarkdownEvent.Type.TEXT && !e.text().isEmpty()) return e.text();
        }
        return null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        String s = value.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static List<String> stringList(JsonNode node) {
        if (node == null || node.isNull()) return List.of();
        var out = new ArrayList<String>();
        if (node.isArray()) {
            node.forEach(n -> {
                String s = n.asText().trim();
                if (!s.isEmpty()) out.add(s);
            });
        } else {
            for (String s : node.asText().split(",")) {
                if (!s.isBlank()) out.add(s.trim());
            }
        }
        return out;
    }

    private static final class ScenarioBuilder {
        private final String name;
        private final int line;
        private final List<String> given = new ArrayList<>();
        private final List<String> when = new ArrayList<>();
        private final List<String> then = new ArrayList<>();
        private final List<String> and = new ArrayList<>();

        ScenarioBuilder(String name, int line) {
            this.name = name;
            this.line = line;
        }

        void addClauses(String text) {
            // A single item may hold several markers ("WHEN x THEN y").
            Matcher m = COMPACT_SPLIT.matcher(text);
            var starts = new ArrayList<Integer>();
            while (m.find()) starts.add(m.start());
            for (int i = 0; i < starts.size(); i++) {
                int end = i + 1 < starts.size() ? starts.get(i + 1) : text.length();
                addClause(text.substring(starts.get(i), end).trim());
            }
        }

        private void addClause(String clause) {
            Matcher m = CLAUSE.matcher(clause);
            if (!m.matches()) return;
            String body = m.group(2).trim();
            switch (m.group(1)) {
                case "GIVEN" -> given.add(body);
                case "WHEN" -> when.add(body);
                case "THEN" -> then.add(body);
                default -> and.add(body);
            }
        }

        ScenarioBlock build() {
            return new ScenarioBlock(name, List.copyOf(given), List.copyOf(when),
                    List.copyOf(then), List.copyOf(and), line);
        }
    }
}
