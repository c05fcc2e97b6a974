package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Flat output row of one condition assessment. ADEQUATE conditions are not tracked as
 * findings, so their insight status is null and their count 0.
 */
public record GapRow(
        @JsonProperty("condition")         String condition,
        @JsonProperty("status")            GapStatus status,
        @JsonProperty("expected_keywords") List<String> expectedKeywords,
        @JsonProperty("evidence")          List<String> evidence,
        @JsonProperty("risk_level")        RiskLevel riskLevel,
        @JsonProperty("confidence_tier")   ConfidenceTier confidenceTier,
        @JsonProperty("recommendation")    String recommendation,
        @JsonProperty("insight_status")    InsightStatus insightStatus,
        @JsonProperty("occurrence_count")  int occurrenceCount
) {

    public static GapRow of(Gap gap, InsightStatus status, int occurrenceCount) {
        return new GapRow(gap.condition(), gap.status(), gap.expectedKeywords(), gap.evidence(),
                gap.riskLevel(), gap.confidenceTier(), gap.recommendation(), status, occurrenceCount);
    }
}
