package com.eainde.policyaudit.insight;

import com.eainde.policyaudit.model.FindingType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One tracked finding in the insight store.
 *
 * @param canonicalSignature    type-prefixed hash of the normalized description
 * @param findingType           contradiction or gap
 * @param normalizedDescription text the signature was computed from, kept for similarity checks
 * @param occurrenceCount       number of times the finding was seen, across runs in cumulative mode
 * @param firstSeenRunId        run that first reported it
 * @param lastSeenRunId         most recent run that reported it
 * @param representativeRecord  output row of the first occurrence
 * @param subject               subject near-duplicates must share, may be null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsightEntry(
        @JsonProperty("canonical_signature")    String canonicalSignature,
        @JsonProperty("finding_type")           FindingType findingType,
        @JsonProperty("normalized_description") String normalizedDescription,
        @JsonProperty("occurrence_count")       int occurrenceCount,
        @JsonProperty("first_seen_run_id")      String firstSeenRunId,
        @JsonProperty("last_seen_run_id")       String lastSeenRunId,
        @JsonProperty("representative_record")  JsonNode representativeRecord,
        @JsonProperty("subject")                String subject
) {

    public static InsightEntry first(InsightCandidate candidate, String runId) {
        return new InsightEntry(candidate.signature(), candidate.findingType(), candidate.normalizedDescription(),
                1, runId, runId, candidate.representativeRecord(), candidate.subject());
    }

    /** Whether a near-duplicate check of {@code candidate} may consider this entry. */
    public boolean comparableTo(InsightCandidate candidate) {
        return findingType == candidate.findingType()
                && (candidate.subject() == null || candidate.subject().equals(subject));
    }

    public InsightEntry seenAgain(String runId) {
        return new InsightEntry(canonicalSignature, findingType, normalizedDescription,
                occurrenceCount + 1, firstSeenRunId, runId, representativeRecord, subject);
    }
}
