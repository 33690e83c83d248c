package com.specgate.core.document;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a document from disk and splits the optional header block from its body.
 * <p>
 * A header block starts at the very first line with {@code ---} and ends at the
 * next line consisting of {@code ---} (trailing blanks allowed).
 */
public final class DocumentLoader {

    private static final String OPENING = "---\n";
    private static final Pattern CLOSING = Pattern.compile("\n---[ \t]*(\n|$)");

    private DocumentLoader() {}

    public static Document load(Path path) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);
        return parse(path, text);
    }

    public static Document parse(Path path, String text) {
        String normalized = normalize(text);
        if (!normalized.startsWith(OPENING) && !normalized.equals("---")) {
            return new Document(path, normalized, null, normalized, 0, null);
        }

        // Search from the opening newline so an empty header ("---\n---") still closes.
        Matcher m = CLOSING.matcher(normalized);
        if (!m.find(OPENING.length() - 1)) {
            return new Document(path, normalized, null, normalized, 0, "Header block is not closed with '---'");
        }

        int headerStart = Math.min(OPENING.length(), m.start());
        String header = normalized.substring(headerStart, m.start());
        String body = normalized.substring(m.end());
        int bodyOffset = countLines(normalized.substring(0, m.end()));
        if (m.group(1).isEmpty()) {
            // closing delimiter was the last line
            bodyOffset++;
        }
        return new Document(path, normalized, header, body, bodyOffset, null);
    }

    /** Strips a BOM and converts CRLF and CR line endings to LF. */
    public static String normalize(String text) {
        String s = text.startsWith("\uFEFF") ? text.substring(1) : text;
        return s.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static int countLines(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') n++;
        }
        return n;
    }
}
