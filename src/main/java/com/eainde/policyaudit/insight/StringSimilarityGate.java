package com.eainde.policyaudit.insight;

import com.eainde.policyaudit.key.StringSimilarity;

import java.util.List;
import java.util.Optional;

/** Deterministic gate: the most similar tracked description at or above the threshold. */
public class StringSimilarityGate implements SimilarityGate {

    public static final double DEFAULT_THRESHOLD = 0.85;

    private final double threshold;

    public StringSimilarityGate(double threshold) {
        if (threshold <= 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be in (0, 1] but was " + threshold);
        }
        this.threshold = threshold;
    }

    public StringSimilarityGate() {
        this(DEFAULT_THRESHOLD);
    }

    @Override
    public Optional<String> findEquivalent(InsightCandidate candidate, List<InsightEntry> tracked) {
        String best = null;
        double bestScore = threshold;
        for (InsightEntry entry : tracked) {
            double score = StringSimilarity.ratio(candidate.normalizedDescription(), entry.normalizedDescription());
            if (score > bestScore || (best == null && score >= bestScore)) {
                best = entry.canonicalSignature();
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }
}
