package com.groundgate.core.qualitygate;

import com.groundgate.core.model.Citation;
import com.groundgate.core.model.Claim;
import com.groundgate.core.model.EvidenceLink;
import com.groundgate.core.model.FailCode;
import com.groundgate.core.model.FailReason;
import com.groundgate.core.model.Severity;
import com.groundgate.core.model.VerifyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Rule engine that turns an answer and its validated citations into coded
 * {@link FailReason}s and a pass/fail gate decision.
 * <p>
 * Checks, in order:
 * <ul>
 *   <li>citations present ({@link FailCode#CITATION_MISSING})</li>
 *   <li>every citation carries a structured locator ({@link FailCode#LOCATOR_MISSING})</li>
 *   <li>injected pattern rules, e.g. over-assertive wording and PII</li>
 *   <li>claim coverage by evidence, when claims and evidence are supplied ({@link FailCode#EVIDENCE_WEAK})</li>
 * </ul>
 * The gate passes iff no reason has severity {@link Severity#ERROR}. Stateless and thread-safe.
 */
public class QualityGateVerifier {

    private static final Logger log = LoggerFactory.getLogger(QualityGateVerifier.class);

    /** Matched snippets echoed into a non-redacted message. */
    private static final int MAX_ECHOED_MATCHES = 3;

    private final GateSettings settings;
    private final List<GateRule> rules;

    public QualityGateVerifier() {
        this(GateSettings.defaults(), GateRules.defaults());
    }

    public QualityGateVerifier(GateSettings settings, List<GateRule> rules) {
        this.settings = settings;
        this.rules = List.copyOf(rules);
    }

    public VerifyResult verify(String answer, List<Citation> citations) {
        return verify(answer, citations, null, null);
    }

    /**
     * Runs every check against the answer.
     *
     * @param answer    answer text; {@code null} is treated as empty
     * @param citations citations that already passed {@code CitationValidator}
     * @param claims    claims extracted from the answer, or {@code null} when not supplied
     * @param evidence  claim-to-chunk links, or {@code null} when not supplied
     * @return a verified {@link VerifyResult}
     */
    public VerifyResult verify(String answer, List<Citation> citations,
                               List<Claim> claims, List<EvidenceLink> evidence) {
        String text = answer == null ? "" : answer;
        List<Citation> cited = citations == null ? List.of() : citations;
        var failReasons = new ArrayList<FailReason>();
        var metrics = new LinkedHashMap<String, Number>();

        if (settings.requireCitations() && cited.isEmpty()) {
            failReasons.add(FailReason.error(FailCode.CITATION_MISSING,
                    "Citations are required but none provided."));
        }
        metrics.put("citation_count", cited.size());

        if (settings.requireLocators() && !cited.isEmpty()) {
            long missing = cited.stream()
                    .filter(c -> !c.parsedLocator().has(settings.locatorKey()))
                    .count();
            if (missing > 0) {
                failReasons.add(FailReason.error(FailCode.LOCATOR_MISSING,
                        missing + " citations missing locator information."));
            }
            metrics.put("locator_coverage", 1.0 - ((double) missing / cited.size()));
        }

        applyRules(text, failReasons, metrics);

        if (claims != null && evidence != null && !claims.isEmpty()) {
            double coverage = evidenceCoverage(claims, evidence);
            metrics.put("evidence_coverage", coverage);
            if (coverage < settings.minEvidenceCoverage()) {
                failReasons.add(FailReason.error(FailCode.EVIDENCE_WEAK,
                        String.format(Locale.ROOT, "Evidence coverage %.2f below threshold %s",
                                coverage, settings.minEvidenceCoverage())));
            }
        }

        VerifyResult result = VerifyResult.of(failReasons, metrics);
        if (result.gatePassed()) {
            log.debug("Quality gate passed with {} warnings", failReasons.size());
        } else {
            log.info("Quality gate failed: {}", result.errorCodes());
        }
        return result;
    }

    /**
     * Result for an answer that never reached the gate. Always a hard failure.
     */
    public VerifyResult unverifiedResult() {
        return VerifyResult.unverified();
    }

    public GateSettings settings() {
        return settings;
    }

    private void applyRules(String text, List<FailReason> failReasons, Map<String, Number> metrics) {
        var matchesByCode = new LinkedHashMap<FailCode, List<String>>();
        var ruleByCode = new EnumMap<FailCode, GateRule>(FailCode.class);
        for (GateRule rule : rules) {
            ruleByCode.putIfAbsent(rule.code(), rule);
            var matches = matchesByCode.computeIfAbsent(rule.code(), k -> new ArrayList<>());
            Matcher matcher = rule.pattern().matcher(text);
            while (matcher.find()) {
                matches.add(matcher.group());
            }
        }

        for (var entry : matchesByCode.entrySet()) {
            FailCode code = entry.getKey();
            List<String> matches = entry.getValue();
            metrics.put(countMetric(code), matches.size());
            if (matches.isEmpty()) {
                continue;
            }
            GateRule first = ruleByCode.get(code);
            failReasons.add(new FailReason(code, describe(code, matches, first.redact()), first.severity()));
        }
    }

    private static String describe(FailCode code, List<String> matches, boolean redact) {
        if (redact) {
            return code == FailCode.PII_DETECTED
                    ? "PII detected in answer: " + matches.size() + " matches"
                    : code.name() + " matched " + matches.size() + " times";
        }
        var shown = matches.subList(0, Math.min(MAX_ECHOED_MATCHES, matches.size()));
        return code == FailCode.ASSERTION_DANGER
                ? "Dangerous assertions detected: " + shown
                : code.name() + " matched: " + shown;
    }

    static String countMetric(FailCode code) {
        return switch (code) {
            case ASSERTION_DANGER -> "assertion_count";
            case PII_DETECTED -> "pii_count";
            default -> code.name().toLowerCase(Locale.ROOT) + "_count";
        };
    }

    /** Distinct claim ids referenced by evidence over the number of claims. */
    private static double evidenceCoverage(List<Claim> claims, List<EvidenceLink> evidence) {
        var referenced = new HashSet<String>();
        for (EvidenceLink link : evidence) {
            if (link != null && link.claimId() != null && !link.claimId().isBlank()) {
                referenced.add(link.claimId());
            }
        }
        return (double) referenced.size() / claims.size();
    }
}
