package com.eainde.policyaudit.insight;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a finding with an unseen signature is a near-duplicate of a tracked one.
 * The deduplication algorithm is the same whichever gate is plugged in.
 */
public interface SimilarityGate {

    /**
     * @param candidate finding whose signature is not in the store
     * @param tracked   entries of the same finding type
     * @return signature of the equivalent tracked entry, if any
     */
    Optional<String> findEquivalent(InsightCandidate candidate, List<InsightEntry> tracked);
}
