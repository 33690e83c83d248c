package com.specgate.core.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChecksumsTest {

    @Test
    @DisplayName("checksum is sha256 hex with prefix")
    void format() {
        String sum = Checksums.of("hello");
        assertTrue(sum.startsWith(Checksums.PREFIX));
        assertEquals(Checksums.PREFIX.length() + 64, sum.length());
        assertEquals("sha256:2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824", sum);
    }

    @Test
    @DisplayName("line endings, trailing blanks and trailing newlines do not change the checksum")
    void whitespaceInsensitive() {
        String base = Checksums.of("# Title\nText");
        assertEquals(base, Checksums.of("# Title\r\nText\r\n"));
        assertEquals(base, Checksums.of("# Title   \nText\n\n\n"));
    }

    @Test
    @DisplayName("content edits change the checksum")
    void contentSensitive() {
        assertNotEquals(Checksums.of("# Title\nText"), Checksums.of("# Title\nText!"));
        assertNotEquals(Checksums.of("a\n\nb"), Checksums.of("a\nb"));
    }

    @Test
    @DisplayName("body checksum ignores header edits")
    void bodyOnly() {
        String a = Checksums.ofBody("---\nversion: 1\n---\n# Body\n");
        String b = Checksums.ofBody("---\nversion: 2\n---\n# Body\n");
        assertEquals(a, b);
        assertNotEquals(Checksums.of("---\nversion: 1\n---\n# Body\n"),
                Checksums.of("---\nversion: 2\n---\n# Body\n"));
    }
}
