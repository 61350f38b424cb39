package com.groundgate.core.model;

import java.io.Serializable;

/**
 * Fixed remediation for a retryable fail code.
 *
 * @param code        the fail code being remediated
 * @param action      machine-readable action name (e.g. {@code add_search})
 * @param description what the next attempt should do differently
 */
public record Remediation(FailCode code, String action, String description) implements Serializable {}
