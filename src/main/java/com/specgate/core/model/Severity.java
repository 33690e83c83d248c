package com.specgate.core.model;

/**
 * Severity of a validation error. Gating decisions downstream are made from
 * the counts per severity; this core never decides pass/fail policy itself.
 */
public enum Severity {
    HIGH,
    MEDIUM,
    LOW
}
