package com.eainde.policyaudit.insight;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Opens a fresh store for each run. The mode is explicit; nothing is held between runs
 * except the cumulative file itself.
 */
public class InsightStoreFactory {

    private final StoreMode mode;
    private final Path storePath;
    private final ObjectMapper objectMapper;

    public InsightStoreFactory(StoreMode mode, Path storePath, ObjectMapper objectMapper) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.objectMapper = objectMapper;
        if (mode == StoreMode.CUMULATIVE && storePath == null) {
            throw new IllegalArgumentException("A cumulative insight store needs a file path");
        }
        this.storePath = storePath;
    }

    public static InsightStoreFactory ephemeral() {
        return new InsightStoreFactory(StoreMode.EPHEMERAL, null, null);
    }

    public InsightStore open() {
        return mode == StoreMode.CUMULATIVE
                ? JsonFileInsightStore.open(storePath, objectMapper)
                : new InMemoryInsightStore();
    }

    public StoreMode mode() {
        return mode;
    }
}
