package com.jeeves.runtime.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.jeeves.protocol.PersistenceAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PersistenceAdapter} writing one JSON document per thread id into a state directory
 * ({@code <dir>/<thread-id>.json}). Writes go through a temporary file and a move so a reader
 * never sees a partial document. Characters outside {@code [A-Za-z0-9._-]} in a thread id are
 * replaced by {@code _}.
 */
public final class FilePersistenceAdapter implements PersistenceAdapter {

    private static final Logger log = LoggerFactory.getLogger(FilePersistenceAdapter.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, Object>> STATE_TYPE = new TypeReference<>() {};

    private final Path stateDir;

    public FilePersistenceAdapter(Path stateDir) {
        this.stateDir = stateDir;
    }

    public Path getStateDir() {
        return stateDir;
    }

    /**
     * @throws UncheckedIOException when the directory or file cannot be written
     */
    @Override
    public void saveState(String threadId, Map<String, Object> state) {
        Path target = fileFor(threadId);
        try {
            Files.createDirectories(stateDir);
            Path tmp = Files.createTempFile(stateDir, ".state-", ".tmp");
            MAPPER.writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save state for thread " + threadId + " to " + target, e);
        }
        if (log.isDebugEnabled()) {
            log.debug("State saved | threadId={} file={}", threadId, target);
        }
    }

    /**
     * @throws UncheckedIOException when the file exists but cannot be read or parsed
     */
    @Override
    public Optional<Map<String, Object>> loadState(String threadId) {
        Path file = fileFor(threadId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.readValue(file.toFile(), STATE_TYPE));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load state for thread " + threadId + " from " + file, e);
        }
    }

    Path fileFor(String threadId) {
        if (threadId == null || threadId.isBlank()) {
            throw new IllegalArgumentException("threadId is required");
        }
        return stateDir.resolve(threadId.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }
}
