package com.specgate.core.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MarkdownWalkerTest {

    private static List<MarkdownEvent> ofType(List<MarkdownEvent> events, MarkdownEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    @Test
    @DisplayName("headings carry level, trimmed text and 1-based line")
    void headings() {
        List<MarkdownEvent> events = MarkdownWalker.walk("# Title\n\n## Overview\n\n### R1: Login\n", 0);
        List<MarkdownEvent> headings = ofType(events, MarkdownEvent.Type.HEADING);

        assertEquals(3, headings.size());
        assertEquals(1, headings.get(0).level());
        assertEquals("Overview", headings.get(1).text());
        assertEquals(3, headings.get(1).line());
        assertTrue(headings.get(2).isHeading(3));
        assertEquals("R1: Login", headings.get(2).text());
        assertEquals(5, headings.get(2).line());
    }

    @Test
    @DisplayName("lines include the header offset")
    void headerOffset() {
        Document doc = DocumentLoader.parse(Path.of("a.md"), "---\nid: a\n---\n## Overview\n");
        MarkdownEvent heading = MarkdownWalker.walk(doc).get(0);

        assertEquals(MarkdownEvent.Type.HEADING, heading.type());
        assertEquals(4, heading.line());
    }

    @Test
    @DisplayName("list items are bracketed by list events and emphasis is flattened")
    void lists() {
        List<MarkdownEvent> events = MarkdownWalker.walk("- **WHEN** user logs in\n- **THEN** token issued\n", 0);

        assertEquals(MarkdownEvent.Type.LIST_START, events.get(0).type());
        assertEquals(MarkdownEvent.Type.LIST_END, events.get(events.size() - 1).type());
        List<MarkdownEvent> texts = ofType(events, MarkdownEvent.Type.TEXT);
        assertEquals("WHEN user logs in", texts.get(0).text());
        assertEquals("THEN token issued", texts.get(1).text());
        assertEquals(2, texts.get(1).line());
    }

    @Test
    @DisplayName("links and fenced code blocks are surfaced")
    void linksAndCode() {
        String body = "See [auth](auth.md#r1) and `code`.\n\n```yaml\ntask:\n  id: \"1.1\"\n```\n";
        List<MarkdownEvent> events = MarkdownWalker.walk(body, 0);

        MarkdownEvent link = ofType(events, MarkdownEvent.Type.LINK).get(0);
        assertEquals("auth.md#r1", link.text());
        assertEquals(1, link.line());

        assertEquals("See auth and code.", ofType(events, MarkdownEvent.Type.TEXT).get(0).text());

        MarkdownEvent code = ofType(events, MarkdownEvent.Type.CODE_BLOCK).get(0);
        assertEquals("yaml", code.info());
        assertTrue(code.text().startsWith("task:"));
        assertEquals(3, code.line());
    }

    @Test
    @DisplayName("empty body yields no events")
    void emptyBody() {
        assertTrue(MarkdownWalker.walk("", 0).isEmpty());
    }
}
