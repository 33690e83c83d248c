package com.specgate.core.model;

import java.io.Serializable;

/**
 * A requirement declared in a spec, either as a {@code ### R1: Title} heading or
 * as a fenced {@code requirement:} YAML block.
 *
 * @param id          requirement id, e.g. "R1"
 * @param title       heading title after the colon, trimmed; may be empty
 * @param description first paragraph following the heading, or null
 * @param priority    declared priority from a YAML block, or null
 * @param line        1-based source line
 */
public record RequirementBlock(
    String id,
    String title,
    String description,
    String priority,
    int line
) implements Serializable {}
