package com.eainde.policyaudit.normalize;

import com.eainde.policyaudit.model.ConfidenceTier;

/**
 * Result of one successful pattern strategy.
 *
 * @param value      extracted value
 * @param confidence how specific the matching pattern was
 * @param anchor     character offset in the source text the match is centred on, -1 if unknown
 * @param strategy   name of the strategy that produced the match
 */
public record PatternMatch<T>(T value, ConfidenceTier confidence, int anchor, String strategy) {

    public static <T> PatternMatch<T> of(T value, ConfidenceTier confidence, int anchor, String strategy) {
        return new PatternMatch<>(value, confidence, anchor, strategy);
    }
}
