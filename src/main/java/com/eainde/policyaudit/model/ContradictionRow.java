package com.eainde.policyaudit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Flat output row of one flagged contradiction.
 *
 * @param serviceKey      service the two rules share
 * @param type            contradiction kind
 * @param unit            tariff unit or limit window, null when not applicable
 * @param details         human readable summary
 * @param leftPage        page of the first side
 * @param leftSnippet     evidence of the first side
 * @param rightPage       page of the second side
 * @param rightSnippet    evidence of the second side
 * @param severity        HIGH or MEDIUM
 * @param confidence      combined extraction confidence, 0..1
 * @param confidenceTier  scorer tier
 * @param insightStatus   NEW or RECURRING
 * @param occurrenceCount times the finding has been seen
 */
public record ContradictionRow(
        @JsonProperty("service_key")      String serviceKey,
        @JsonProperty("type")             ContradictionType type,
        @JsonProperty("unit")             String unit,
        @JsonProperty("details")          String details,
        @JsonProperty("left_page")        int leftPage,
        @JsonProperty("left_snippet")     String leftSnippet,
        @JsonProperty("right_page")       int rightPage,
        @JsonProperty("right_snippet")    String rightSnippet,
        @JsonProperty("severity")         Severity severity,
        @JsonProperty("confidence")       double confidence,
        @JsonProperty("confidence_tier")  ConfidenceTier confidenceTier,
        @JsonProperty("insight_status")   InsightStatus insightStatus,
        @JsonProperty("occurrence_count") int occurrenceCount
) {

    public static ContradictionRow of(Contradiction c, InsightStatus status, int occurrenceCount) {
        return new ContradictionRow(c.serviceKey(), c.type(), c.unit(), c.details(),
                c.left().page(), c.left().snippet(), c.right().page(), c.right().snippet(),
                c.severity(), c.confidence(), c.confidenceTier(), status, occurrenceCount);
    }
}
