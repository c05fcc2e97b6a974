package com.eainde.policyaudit.insight;

/**
 * Lifetime of the insight store.
 *
 * <ul>
 *   <li>{@link #EPHEMERAL}: scoped to one invocation, discarded at the end of the run</li>
 *   <li>{@link #CUMULATIVE}: loaded from and flushed back to a JSON file across runs</li>
 * </ul>
 */
public enum StoreMode {
    EPHEMERAL,
    CUMULATIVE
}
