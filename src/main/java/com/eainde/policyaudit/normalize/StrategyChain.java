package com.eainde.policyaudit.normalize;

import java.util.List;
import java.util.Optional;

/**
 * Ordered list of {@link PatternStrategy} instances. The first strategy that
 * produces a match decides the field; later strategies are never consulted.
 */
public final class StrategyChain<T> {

    private final List<PatternStrategy<T>> strategies;

    private StrategyChain(List<PatternStrategy<T>> strategies) {
        if (strategies.isEmpty()) {
            throw new IllegalArgumentException("A strategy chain needs at least one strategy");
        }
        this.strategies = List.copyOf(strategies);
    }

    @SafeVarargs
    public static <T> StrategyChain<T> of(PatternStrategy<T>... strategies) {
        return new StrategyChain<>(List.of(strategies));
    }

    public Optional<PatternMatch<T>> first(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (PatternStrategy<T> strategy : strategies) {
            Optional<PatternMatch<T>> match = strategy.apply(text);
            if (match.isPresent()) {
                return match;
            }
        }
        return Optional.empty();
    }

    public int size() {
        return strategies.size();
    }
}
