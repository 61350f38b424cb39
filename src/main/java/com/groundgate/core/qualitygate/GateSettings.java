package com.groundgate.core.qualitygate;

/**
 * Switches and thresholds for {@link QualityGateVerifier}.
 *
 * @param requireCitations    raise CITATION_MISSING when no citation survives
 * @param requireLocators     raise LOCATOR_MISSING when a citation lacks {@code locatorKey}
 * @param minEvidenceCoverage minimum share of claims backed by evidence
 * @param locatorKey          locator field a citation must carry, usually {@code section}
 */
public record GateSettings(
    boolean requireCitations,
    boolean requireLocators,
    double minEvidenceCoverage,
    String locatorKey
) {

    public GateSettings {
        if (minEvidenceCoverage < 0.0 || minEvidenceCoverage > 1.0) {
            throw new IllegalArgumentException("minEvidenceCoverage must be within [0, 1]: " + minEvidenceCoverage);
        }
        if (locatorKey == null || locatorKey.isBlank()) {
            locatorKey = "section";
        }
    }

    public static GateSettings defaults() {
        return new GateSettings(true, true, 0.5, "section");
    }
}
