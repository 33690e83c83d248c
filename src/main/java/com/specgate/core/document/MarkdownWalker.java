package com.specgate.core.document;

import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.Link;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a document body into a flat, ordered stream of {@link MarkdownEvent}s.
 * Only the structure the validators need is surfaced: headings, list
 * boundaries, paragraph text, links and fenced code blocks.
 */
public final class MarkdownWalker {

    private static final Parser PARSER = Parser.builder()
            .includeSourceSpans(IncludeSourceSpans.BLOCKS)
            .build();

    private MarkdownWalker() {}

    public static List<MarkdownEvent> walk(Document document) {
        return walk(document.body(), document.bodyOffset());
    }

    /**
     * @param body       markdown text
     * @param lineOffset number of file lines preceding {@code body}
     */
    public static List<MarkdownEvent> walk(String body, int lineOffset) {
        Node root = PARSER.parse(body);
        var visitor = new EventVisitor(lineOffset);
        root.accept(visitor);
        return List.copyOf(visitor.events);
    }

    private static final class EventVisitor extends AbstractVisitor {

        private final int lineOffset;
        private final List<MarkdownEvent> events = new ArrayList<>();
        private int lastLine;

        EventVisitor(int lineOffset) {
            this.lineOffset = lineOffset;
            this.lastLine = lineOffset + 1;
        }

        @Override
        public void visit(Heading heading) {
            int line = lineOf(heading);
            events.add(MarkdownEvent.heading(heading.getLevel(), textOf(heading).trim(), line));
            emitLinks(heading, line);
        }

        @Override
        public void visit(BulletList list) {
            visitList(list);
        }

        @Override
        public void visit(OrderedList list) {
            visitList(list);
        }

        @Override
        public void visit(Paragraph paragraph) {
            int line = lineOf(paragraph);
            events.add(MarkdownEvent.text(textOf(paragraph).trim(), line));
            emitLinks(paragraph, line);
        }

        @Override
        public void visit(FencedCodeBlock block) {
            String info = block.getInfo() != null ? block.getInfo().trim() : "";
            events.add(MarkdownEvent.codeBlock(info, block.getLiteral(), lineOf(block)));
        }

        private void visitList(Node list) {
            events.add(MarkdownEvent.listStart(lineOf(list)));
            visitChildren(list);
            events.add(MarkdownEvent.listEnd(lastLine));
        }

        private void emitLinks(Node block, int line) {
            for (Node child = block.getFirstChild(); child != null; child = child.getNext()) {
                if (child instanceof Link link) {
                    events.add(MarkdownEvent.link(link.getDestination(), line));
                }
                emitLinks(child, line);
            }
        }

        private int lineOf(Node node) {
            List<SourceSpan> spans = node.getSourceSpans();
            if (spans != null && !spans.isEmpty()) {
                lastLine = spans.get(spans.size() - 1).getLineIndex() + 1 + lineOffset;
                return spans.get(0).getLineIndex() + 1 + lineOffset;
            }
            return lastLine;
        }
    }

    static String textOf(Node node) {
        var sb = new StringBuilder();
        appendText(node, sb);
        return sb.toString();
    }

    private static void appendText(Node node, StringBuilder sb) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof Text text) {
                sb.append(text.getLiteral());
            } else if (child instanceof Code code) {
                sb.append(code.getLiteral());
            } else if (child instanceof SoftLineBreak || child instanceof HardLineBreak) {
                sb.append(' ');
            } else {
                appendText(child, sb);
            }
        }
    }
}
