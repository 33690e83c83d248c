package com.specgate.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * A task parsed from a fenced {@code task:} YAML block in tasks.md.
 *
 * @param id         dotted id, e.g. "1.1"; the leading integer is the layer
 * @param action     CREATE, MODIFY or DELETE; null when absent or unrecognized
 * @param file       target file
 * @param specRef    optional spec reference ({@code spec-id[:anchor]} or {@code path#anchor})
 * @param dependsOn  ids of tasks this task depends on
 * @param line       1-based line of the opening fence
 */
public record TaskBlock(
    String id,
    TaskAction action,
    String file,
    String specRef,
    List<String> dependsOn,
    int line
) implements Serializable {

    public TaskBlock {
        dependsOn = dependsOn != null ? List.copyOf(dependsOn) : List.of();
    }

    /** Layer number from the leading integer of the id, or 0 when it is not numeric. */
    public int layer() {
        if (id == null) return 0;
        int dot = id.indexOf('.');
        String head = dot >= 0 ? id.substring(0, dot) : id;
        try {
            return Integer.parseInt(head);
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
