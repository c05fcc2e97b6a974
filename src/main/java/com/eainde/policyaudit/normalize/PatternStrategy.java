package com.eainde.policyaudit.normalize;

import java.util.Optional;

/**
 * One tagged extraction attempt over a piece of source text.
 * Strategies are tried in priority order and the first success wins.
 */
@FunctionalInterface
public interface PatternStrategy<T> {

    Optional<PatternMatch<T>> apply(String text);
}
