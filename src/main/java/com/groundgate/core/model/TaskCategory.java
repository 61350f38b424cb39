package com.groundgate.core.model;

/**
 * Kinds of research task the engine runs. Each has its own {@link TaskInputs} record.
 */
public enum TaskCategory {
    GENERIC,
    PAPER_SURVEY,
    CLAIM_REVIEW
}
