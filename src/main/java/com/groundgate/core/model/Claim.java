package com.groundgate.core.model;

import java.io.Serializable;

/**
 * A single factual claim extracted from an answer.
 */
public record Claim(String claimId, String text) implements Serializable {}
