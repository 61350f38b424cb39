package com.groundgate.core.model;

import java.util.Locale;

/**
 * Severity of a {@link FailReason}. Only {@link #ERROR} closes the quality gate.
 */
public enum Severity {
    ERROR,
    WARNING;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
