package com.eainde.policyaudit.insight;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Cumulative store backed by a JSON file: {@code {signature: entry}}.
 *
 * <h3>Write protocol:</h3>
 * <pre>
 * open   → read the file once (missing file = empty store)
 * stage  → in-memory only, the loaded snapshot is never mutated
 * flush  → write snapshot + staged to a temp file in the same directory,
 *          then move it over the target with ATOMIC_MOVE
 * </pre>
 *
 * <p>A run that dies before {@link #flush()}, or whose flush fails, leaves the previous file
 * untouched. A file system that cannot move atomically fails the flush; the file is never
 * replaced non-atomically.</p>
 */
@Slf4j
public class JsonFileInsightStore implements InsightStore {

    private static final TypeReference<Map<String, InsightEntry>> FILE_TYPE = new TypeReference<>() {
    };

    /** Puts the finished temp file in place of the store file. */
    @FunctionalInterface
    interface FileReplacer {
        void replace(Path source, Path target) throws IOException;
    }

    static final FileReplacer ATOMIC_REPLACE = (source, target) ->
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);

    private final Path path;
    private final ObjectMapper objectMapper;
    private final FileReplacer replacer;
    private final Map<String, InsightEntry> loaded;
    private final Map<String, InsightEntry> staged = new TreeMap<>();

    private JsonFileInsightStore(Path path, ObjectMapper objectMapper, FileReplacer replacer,
                                 Map<String, InsightEntry> loaded) {
        this.path = path;
        this.objectMapper = objectMapper;
        this.replacer = replacer;
        this.loaded = Collections.unmodifiableMap(loaded);
    }

    public static JsonFileInsightStore open(Path path, ObjectMapper objectMapper) {
        return open(path, objectMapper, ATOMIC_REPLACE);
    }

    static JsonFileInsightStore open(Path path, ObjectMapper objectMapper, FileReplacer replacer) {
        Map<String, InsightEntry> loaded = new TreeMap<>();
        if (Files.exists(path)) {
            try {
                Map<String, InsightEntry> fromFile = objectMapper.readValue(path.toFile(), FILE_TYPE);
                if (fromFile != null) {
                    loaded.putAll(fromFile);
                }
            } catch (IOException e) {
                throw new InsightStoreException("Cannot read insight store " + path, e);
            }
        }
        log.info("Opened insight store {} with {} tracked findings", path, loaded.size());
        return new JsonFileInsightStore(path, objectMapper, replacer, loaded);
    }

    @Override
    public StoreMode mode() {
        return StoreMode.CUMULATIVE;
    }

    @Override
    public Optional<InsightEntry> get(String signature) {
        InsightEntry entry = staged.get(signature);
        return Optional.ofNullable(entry != null ? entry : loaded.get(signature));
    }

    @Override
    public void stage(InsightEntry entry) {
        staged.put(entry.canonicalSignature(), entry);
    }

    @Override
    public List<InsightEntry> entries() {
        return new ArrayList<>(merged().values());
    }

    @Override
    public void flush() {
        Map<String, InsightEntry> snapshot = merged();
        Path directory = path.toAbsolutePath().getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, path.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            replacer.replace(temp, path);
            log.info("Flushed {} insight entries ({} staged this run) to {}", snapshot.size(), staged.size(), path);
        } catch (AtomicMoveNotSupportedException e) {
            deleteQuietly(temp);
            throw new InsightStoreException("Cannot replace insight store " + path + " atomically", e);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new InsightStoreException("Cannot flush insight store " + path, e);
        }
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private Map<String, InsightEntry> merged() {
        Map<String, InsightEntry> merged = new TreeMap<>(loaded);
        merged.putAll(staged);
        return merged;
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not remove temp file {}: {}", temp, e.getMessage());
        }
    }
}
