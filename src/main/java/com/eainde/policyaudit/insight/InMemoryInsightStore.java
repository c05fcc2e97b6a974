package com.eainde.policyaudit.insight;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/** Ephemeral store: lives for one run and is thrown away with it. */
public class InMemoryInsightStore implements InsightStore {

    private final Map<String, InsightEntry> entries = new TreeMap<>();

    @Override
    public StoreMode mode() {
        return StoreMode.EPHEMERAL;
    }

    @Override
    public Optional<InsightEntry> get(String signature) {
        return Optional.ofNullable(entries.get(signature));
    }

    @Override
    public void stage(InsightEntry entry) {
        entries.put(entry.canonicalSignature(), entry);
    }

    @Override
    public List<InsightEntry> entries() {
        return new ArrayList<>(entries.values());
    }

    @Override
    public void flush() {
        // nothing outlives the run
    }
}
