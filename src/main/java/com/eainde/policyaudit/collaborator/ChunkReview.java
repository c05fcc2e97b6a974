package com.eainde.policyaudit.collaborator;

import java.util.Map;
import java.util.OptionalDouble;

/**
 * Collaborator verdict for one chunk.
 *
 * @param chunkIndex index of the reviewed chunk
 * @param agreement  agreement in [0, 1] keyed by the rule's position inside the chunk
 */
public record ChunkReview(int chunkIndex, Map<Integer, Double> agreement) {

    public ChunkReview {
        agreement = agreement == null ? Map.of() : Map.copyOf(agreement);
    }

    public OptionalDouble agreementFor(int positionInChunk) {
        Double score = agreement.get(positionInChunk);
        return score == null ? OptionalDouble.empty() : OptionalDouble.of(score);
    }
}
