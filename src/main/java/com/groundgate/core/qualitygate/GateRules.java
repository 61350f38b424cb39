package com.groundgate.core.qualitygate;

import com.groundgate.core.model.FailCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Default ordered rule list for {@link QualityGateVerifier}.
 * <p>
 * Over-assertive phrasing is a warning (a hedge-language suggestion). PII is always an error.
 */
public final class GateRules {

    private GateRules() {}

    public static List<GateRule> assertionRules() {
        return List.of(
                GateRule.warning("(?i)\\bis\\s+definitely\\b", FailCode.ASSERTION_DANGER),
                GateRule.warning("(?i)\\bwill\\s+certainly\\b", FailCode.ASSERTION_DANGER),
                GateRule.warning("(?i)\\bproven\\s+fact\\b", FailCode.ASSERTION_DANGER),
                GateRule.warning("(?i)\\babsolutely\\b", FailCode.ASSERTION_DANGER),
                GateRule.warning("(?i)\\bundoubtedly\\b", FailCode.ASSERTION_DANGER),
                GateRule.warning("確実に", FailCode.ASSERTION_DANGER),
                GateRule.warning("間違いなく", FailCode.ASSERTION_DANGER),
                GateRule.warning("絶対に", FailCode.ASSERTION_DANGER)
        );
    }

    public static List<GateRule> piiRules() {
        return List.of(
                // SSN
                GateRule.redactedError("\\b\\d{3}-\\d{2}-\\d{4}\\b", FailCode.PII_DETECTED),
                // e-mail
                GateRule.redactedError("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b", FailCode.PII_DETECTED),
                // phone
                GateRule.redactedError("\\b\\d{3}-\\d{3}-\\d{4}\\b", FailCode.PII_DETECTED)
        );
    }

    public static List<GateRule> defaults() {
        var rules = new ArrayList<GateRule>(assertionRules());
        rules.addAll(piiRules());
        return List.copyOf(rules);
    }
}
