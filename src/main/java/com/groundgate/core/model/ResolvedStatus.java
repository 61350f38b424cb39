package com.groundgate.core.model;

import java.util.Locale;

/**
 * Engine-computed status of one agent attempt. This is the authoritative value.
 */
public enum ResolvedStatus {
    SUCCESS,
    PARTIAL,
    FAIL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
