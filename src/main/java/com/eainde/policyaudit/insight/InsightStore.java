package com.eainde.policyaudit.insight;

import java.util.List;
import java.util.Optional;

/**
 * Key-value store of tracked findings, keyed by canonical signature.
 *
 * <p>Writes are staged for the duration of a run and become durable only on {@link #flush()}.
 * Implementations are not shared between runs.</p>
 */
public interface InsightStore {

    StoreMode mode();

    /** Staged value when present, else the value loaded at open. */
    Optional<InsightEntry> get(String signature);

    /** Adds or replaces an entry for this run. */
    void stage(InsightEntry entry);

    /** Loaded and staged entries, staged values winning, in signature order. */
    List<InsightEntry> entries();

    /** Makes staged entries durable. A no-op for stores that do not persist. */
    void flush();
}
