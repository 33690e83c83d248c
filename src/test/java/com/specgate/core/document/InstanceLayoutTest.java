package com.specgate.core.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstanceLayoutTest {

    @TempDir
    Path root;

    private void touch(String rel) throws Exception {
        Path file = root.resolve(rel);
        Files.createDirectories(file.getParent());
        Files.writeString(file, "# x\n");
    }

    @Test
    @DisplayName("spec files are found recursively, sorted, templates and non-markdown excluded")
    void specFiles() throws Exception {
        touch("specs/zeta.md");
        touch("specs/api/alpha.md");
        touch("specs/beta.md");
        touch("specs/_template.md");
        touch("specs/notes.txt");

        var layout = new InstanceLayout(root);
        List<String> found = layout.specFiles().stream().map(layout::relative).toList();

        assertEquals(List.of("specs/api/alpha.md", "specs/beta.md", "specs/zeta.md"), found);
    }

    @Test
    @DisplayName("missing specs directory yields no files")
    void noSpecsDir() {
        assertTrue(new InstanceLayout(root).specFiles().isEmpty());
    }

    @Test
    @DisplayName("instance id is the directory name and well-known files resolve under the root")
    void paths() throws Exception {
        Path instance = Files.createDirectories(root.resolve("add-auth"));
        var layout = new InstanceLayout(instance);

        assertEquals("add-auth", layout.instanceId());
        assertEquals(instance.resolve("proposal.md"), layout.proposal());
        assertEquals(instance.resolve("tasks.md"), layout.tasks());
        assertEquals("proposal.md", layout.relative(layout.proposal()));
    }

    @Test
    @DisplayName("declared paths drop leading ./ and redundant segments")
    void normalizeDeclared() {
        assertEquals("specs/auth.md", InstanceLayout.normalizeDeclared("./specs/auth.md"));
        assertEquals("specs/auth.md", InstanceLayout.normalizeDeclared(" specs/x/../auth.md "));
    }
}
