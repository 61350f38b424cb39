package com.groundgate.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Output of one Router invocation. Every field is untrusted input.
 */
public record AgentResult(
    String answer,
    List<Citation> citations,
    ProposedStatus proposedStatus,
    AgentMeta meta
) implements Serializable {

    public AgentResult {
        citations = citations == null ? List.of() : List.copyOf(citations);
        proposedStatus = proposedStatus == null ? ProposedStatus.SUCCESS : proposedStatus;
        meta = meta == null ? AgentMeta.empty() : meta;
    }

    public AgentResult withCitations(List<Citation> replacement) {
        return new AgentResult(answer, replacement, proposedStatus, meta);
    }
}
