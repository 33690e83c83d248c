package com.specgate.core.document;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.stream.Collectors;

/**
 * Content checksums used for staleness detection.
 * <p>
 * Content is normalized before hashing (LF line endings, trailing whitespace
 * trimmed per line, trailing newlines dropped) so whitespace-only edits do not
 * make a file stale.
 */
public final class Checksums {

    public static final String PREFIX = "sha256:";

    private Checksums() {}

    public static String of(String content) {
        return sha256(normalize(content));
    }

    /** Checksum of the body only; edits to the header block do not change it. */
    public static String ofBody(String content) {
        Document doc = DocumentLoader.parse(null, content);
        return of(doc.body());
    }

    static String normalize(String content) {
        String text = DocumentLoader.normalize(content);
        String joined = text.lines()
                .map(String::stripTrailing)
                .collect(Collectors.joining("\n"));
        int end = joined.length();
        while (end > 0 && joined.charAt(end - 1) == '\n') end--;
        return joined.substring(0, end);
    }

    private static String sha256(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(s.getBytes(StandardCharsets.UTF_8));
            return PREFIX + HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
