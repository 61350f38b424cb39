package com.groundgate.core.model;

import java.io.Serializable;

/**
 * Links a claim to the chunk that backs it. Used for evidence-coverage scoring.
 */
public record EvidenceLink(String claimId, String chunkId) implements Serializable {}
