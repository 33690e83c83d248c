package com.specgate.core.document;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/**
 * File layout of one workflow instance directory:
 * {@code proposal.md}, {@code tasks.md} and {@code specs/**}{@code /*.md}.
 * Spec files whose name starts with {@code _} are templates and never scanned.
 */
public final class InstanceLayout {

    private static final Logger log = LoggerFactory.getLogger(InstanceLayout.class);

    public static final String PROPOSAL = "proposal.md";
    public static final String TASKS = "tasks.md";
    public static final String SPECS_DIR = "specs";

    private final Path root;

    public InstanceLayout(Path root) {
        this.root = root;
    }

    public Path root() { return root; }
    public Path proposal() { return root.resolve(PROPOSAL); }
    public Path tasks() { return root.resolve(TASKS); }
    public Path specsDir() { return root.resolve(SPECS_DIR); }

    /** Instance id, taken from the directory name. */
    public String instanceId() {
        Path name = root.toAbsolutePath().normalize().getFileName();
        return name != null ? name.toString() : root.toString();
    }

    /**
     * Spec files under {@code specs/}, recursively, sorted by relative path so
     * scans are deterministic.
     */
    public List<Path> specFiles() {
        Path dir = specsDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .filter(p -> !p.getFileName().toString().startsWith("_"))
                    .sorted((a, b) -> relative(a).compareTo(relative(b)))
                    .toList();
        } catch (IOException e) {
            log.warn("Cannot list spec files in {}: {}", dir, e.getMessage());
            return List.of();
        }
    }

    /** Path relative to the instance root with {@code /} separators. */
    public String relative(Path path) {
        Path rel = path.isAbsolute() == root.isAbsolute() && path.startsWith(root)
                ? root.relativize(path) : path;
        return rel.normalize().toString().replace('\\', '/');
    }

    /** Normalizes a declared relative path for comparison with {@link #relative(Path)}. */
    public static String normalizeDeclared(String declared) {
        String s = declared.trim().replace('\\', '/');
        while (s.startsWith("./")) s = s.substring(2);
        return Path.of(s).normalize().toString().replace('\\', '/');
    }
}
