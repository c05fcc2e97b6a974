package com.eainde.policyaudit.insight;

import com.eainde.policyaudit.model.FindingType;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A finding of the current run, prepared for deduplication.
 *
 * @param findingType           contradiction or gap
 * @param normalizedDescription canonical text of the finding
 * @param signature             type-prefixed hash of {@code normalizedDescription}
 * @param representativeRecord  output row to keep if the finding is new
 * @param subject               what the finding is about ("limit|dialysis:hemodialysis|per_week");
 *                              near-duplicates must share it. Null when any same-type entry may match
 */
public record InsightCandidate(
        FindingType findingType,
        String normalizedDescription,
        String signature,
        JsonNode representativeRecord,
        String subject
) {
}
