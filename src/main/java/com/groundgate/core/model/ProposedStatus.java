package com.groundgate.core.model;

/**
 * Status reported by the agent that produced an answer. Advisory only: the engine
 * computes a {@link ResolvedStatus} of its own and never copies this value over.
 */
public enum ProposedStatus {
    SUCCESS,
    PARTIAL,
    FAIL
}
