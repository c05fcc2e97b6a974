package com.eainde.policyaudit.collaborator;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * On-disk cache of collaborator answers, one {@code <sha1>.txt} file per prompt.
 *
 * <h3>Key:</h3>
 * <pre>
 * sha1( model \0 tag \0 prompt )   e.g. "gpt-4o-mini", "review", "3\0[{...rules...}]"
 * </pre>
 *
 * <p>Only answers that parsed successfully are stored, so a re-run over the same input replays
 * the same agreement scores without calling the model. Cache I/O problems are logged and
 * treated as a miss; they never fail a review.</p>
 */
@Slf4j
public class CollaboratorAnswerCache {

    private static final String SEPARATOR = "\0";

    private final Path directory;
    private final String modelName;

    public CollaboratorAnswerCache(Path directory, String modelName) {
        this.directory = directory;
        this.modelName = modelName == null ? "" : modelName;
    }

    /** A cache that never hits and never stores. */
    public static CollaboratorAnswerCache disabled() {
        return new CollaboratorAnswerCache(null, "");
    }

    public boolean isEnabled() {
        return directory != null;
    }

    public Optional<String> get(String tag, String prompt) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        Path file = fileFor(tag, prompt);
        try {
            String answer = Files.readString(file, StandardCharsets.UTF_8);
            log.debug("Collaborator cache hit {}", file.getFileName());
            return Optional.of(answer);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            log.warn("Cannot read collaborator cache entry {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    public void put(String tag, String prompt, String answer) {
        if (!isEnabled() || answer == null) {
            return;
        }
        Path file = fileFor(tag, prompt);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, file.getFileName().toString(), ".tmp");
            Files.writeString(temp, answer, StandardCharsets.UTF_8);
            Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Cannot write collaborator cache entry {}: {}", file, e.getMessage());
            deleteQuietly(temp);
        }
    }

    String key(String tag, String prompt) {
        return DigestUtils.sha1Hex(modelName + SEPARATOR + tag + SEPARATOR + prompt);
    }

    private Path fileFor(String tag, String prompt) {
        return directory.resolve(key(tag, prompt) + ".txt");
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
