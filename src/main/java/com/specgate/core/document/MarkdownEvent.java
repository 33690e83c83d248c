package com.specgate.core.document;

/**
 * One structural event from a walk over a document body, in document order.
 *
 * @param type  event type
 * @param level heading level (1-6); 0 for other events
 * @param text  heading text, paragraph text, link destination or code block literal
 * @param info  fenced code block info string; null for other events
 * @param line  1-based line in the full file
 */
public record MarkdownEvent(Type type, int level, String text, String info, int line) {

    public enum Type {
        HEADING,
        LIST_START,
        LIST_END,
        TEXT,
        LINK,
        CODE_BLOCK
    }

    static MarkdownEvent heading(int level, String text, int line) {
        return new MarkdownEvent(Type.HEADING, level, text, null, line);
    }

    static MarkdownEvent listStart(int line) {
        return new MarkdownEvent(Type.LIST_START, 0, null, null, line);
    }

    static MarkdownEvent listEnd(int line) {
        return new MarkdownEvent(Type.LIST_END, 0, null, null, line);
    }

    static MarkdownEvent text(String text, int line) {
        return new MarkdownEvent(Type.TEXT, 0, text, null, line);
    }

    static MarkdownEvent link(String destination, int line) {
        return new MarkdownEvent(Type.LINK, 0, destination, null, line);
    }

    static MarkdownEvent codeBlock(String info, String literal, int line) {
        return new MarkdownEvent(Type.CODE_BLOCK, 0, literal, info, line);
    }

    public boolean isHeading(int level) {
        return type == Type.HEADING && this.level == level;
    }
}
