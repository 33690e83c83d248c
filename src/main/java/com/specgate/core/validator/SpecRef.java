package com.specgate.core.validator;

import com.specgate.core.document.InstanceLayout;

/**
 * A task's reference to a spec file and optional anchor inside it.
 * <p>
 * Accepted forms: {@code path#anchor}, {@code path}, {@code spec-id:anchor} and
 * {@code spec-id}. A bare spec id resolves to {@code specs/<id>.md}.
 *
 * @param path   path relative to the instance directory
 * @param anchor heading or requirement id inside the file, or null
 */
public record SpecRef(String path, String anchor) {

    public static SpecRef parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String s = raw.trim();
        int hash = s.indexOf('#');
        if (hash >= 0) {
            return new SpecRef(toPath(s.substring(0, hash)), emptyToNull(s.substring(hash + 1)));
        }
        int colon = s.indexOf(':');
        if (colon >= 0) {
            return new SpecRef(toPath(s.substring(0, colon)), emptyToNull(s.substring(colon + 1)));
        }
        return new SpecRef(toPath(s), null);
    }

    public boolean hasAnchor() {
        return anchor != null;
    }

    private static String toPath(String target) {
        String t = target.trim();
        if (t.contains("/") || t.endsWith(".md")) {
            return InstanceLayout.normalizeDeclared(t);
        }
        return InstanceLayout.SPECS_DIR + "/" + t + ".md";
    }

    private static String emptyToNull(String s) {
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
