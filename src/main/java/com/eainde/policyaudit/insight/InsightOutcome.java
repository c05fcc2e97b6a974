package com.eainde.policyaudit.insight;

import com.eainde.policyaudit.model.InsightStatus;

/**
 * Deduplication verdict for one finding of the current run.
 *
 * @param signature       the finding's own signature
 * @param entrySignature  signature of the store entry it was counted against
 * @param status          NEW or RECURRING
 * @param occurrenceCount count of that entry after this finding
 */
public record InsightOutcome(String signature, String entrySignature, InsightStatus status, int occurrenceCount) {

    public boolean mergedIntoNearDuplicate() {
        return !signature.equals(entrySignature);
    }
}
