package com.groundgate.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Producer-side metadata attached to an {@link AgentResult}.
 *
 * @param agent    name of the agent that produced the result
 * @param cost     cost of the invocation in budget units (fed to the retry ledger)
 * @param claims   claims extracted from the answer; {@code null} when not supplied
 * @param evidence claim-to-chunk links; {@code null} when not supplied
 */
public record AgentMeta(
    String agent,
    double cost,
    List<Claim> claims,
    List<EvidenceLink> evidence
) implements Serializable {

    public static AgentMeta empty() {
        return new AgentMeta(null, 0.0, null, null);
    }

    public static AgentMeta withCost(String agent, double cost) {
        return new AgentMeta(agent, cost, null, null);
    }
}
