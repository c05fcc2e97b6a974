package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * An internal inconsistency between two policy rules.
 *
 * <p>Both evidence sides are mandatory. A contradiction that cannot cite a page and
 * snippet on each side is rejected at construction with {@link EvidenceIntegrityException}.</p>
 *
 * @param type                 which detector flagged it
 * @param serviceKey           service the two rules share
 * @param unit                 tariff unit or limit window label, null when not applicable
 * @param details              human readable summary ("3 vs 2 per_week")
 * @param left                 evidence of the first side
 * @param right                evidence of the second side
 * @param severity             HIGH or MEDIUM
 * @param confidence           combined extraction confidence of both sides, 0..1
 * @param confidenceTier       tier assigned by the scorer, null until scored
 * @param supportingRuleCount  number of rules in the violating group
 * @param collaboratorAgreement weakest collaborator agreement of the group, null if not reviewed
 */
public record Contradiction(
        @JsonProperty("type")                   ContradictionType type,
        @JsonProperty("service_key")            String serviceKey,
        @JsonProperty("unit")                   String unit,
        @JsonProperty("details")                String details,
        @JsonProperty("left")                   Evidence left,
        @JsonProperty("right")                  Evidence right,
        @JsonProperty("severity")               Severity severity,
        @JsonProperty("confidence")             double confidence,
        @JsonProperty("confidence_tier")        ConfidenceTier confidenceTier,
        @JsonProperty("supporting_rule_count")  int supportingRuleCount,
        @JsonProperty("collaborator_agreement") Double collaboratorAgreement
) {

    public Contradiction {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        if (serviceKey == null || serviceKey.isBlank()) {
            throw new EvidenceIntegrityException("Contradiction of type " + type + " has no service key");
        }
        if (left == null || right == null) {
            throw new EvidenceIntegrityException(
                    "Contradiction " + type + " on '" + serviceKey + "' is missing "
                            + (left == null ? "left" : "right") + " evidence");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1] but was " + confidence);
        }
    }

    /** Unscored contradiction as produced by a detector. */
    public static Contradiction flagged(ContradictionType type, String serviceKey, String unit, String details,
                                        Rule leftRule, Rule rightRule, Severity severity, int supportingRuleCount,
                                        Double collaboratorAgreement) {
        double confidence = (leftRule.extractionConfidence().value()
                + rightRule.extractionConfidence().value()) / 2.0;
        return new Contradiction(type, serviceKey, unit, details,
                Evidence.of(leftRule), Evidence.of(rightRule), severity,
                confidence, null, supportingRuleCount, collaboratorAgreement);
    }

    public Contradiction withConfidenceTier(ConfidenceTier tier) {
        return new Contradiction(type, serviceKey, unit, details, left, right, severity,
                confidence, tier, supportingRuleCount, collaboratorAgreement);
    }

    /** Confidence tier implied by the numeric confidence alone, floored to the nearest tier. */
    public ConfidenceTier specificityTier() {
        if (confidence >= ConfidenceTier.HIGH.value()) return ConfidenceTier.HIGH;
        if (confidence >= ConfidenceTier.MEDIUM.value()) return ConfidenceTier.MEDIUM;
        return ConfidenceTier.LOW;
    }
}
