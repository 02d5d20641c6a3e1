package com.waveforge.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.waveforge.core.persistence.AtomicFileWriter;
import com.waveforge.core.persistence.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Load/save/update access to the registry file, the only durable source of truth for worker state.
 *
 * <p>Writes go through {@link AtomicFileWriter}. {@link #update} holds an exclusive advisory lock on
 * a sibling {@code .lock} file and re-reads the document before applying the mutation, so scheduler
 * and watchdog processes working on the same checkout never lose each other's writes.
 */
public class RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(RegistryStore.class);

    private final Path registryPath;
    private final ObjectMapper mapper;
    /** File locks are held per JVM, so stores sharing a path in one process also share an in-memory lock. */
    private static final ConcurrentHashMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private final ReentrantLock localLock;

    public RegistryStore(Path registryPath) {
        this.registryPath = registryPath.toAbsolutePath();
        this.mapper = JsonMappers.documentMapper();
        this.localLock = LOCAL_LOCKS.computeIfAbsent(this.registryPath, p -> new ReentrantLock());
    }

    public Path path() {
        return registryPath;
    }

    /**
     * Reads the registry from disk. A missing file is an empty registry.
     *
     * @throws RegistryCorruptionException if the document cannot be parsed or a record fails validation
     */
    public RegistryDocument load() {
        if (!Files.exists(registryPath)) {
            return RegistryDocument.empty();
        }
        byte[] content;
        try {
            content = Files.readAllBytes(registryPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read registry " + registryPath, e);
        }
        if (content.length == 0) {
            throw new RegistryCorruptionException(registryPath, "file is empty");
        }
        RegistryDocument document;
        try {
            document = mapper.readValue(content, RegistryDocument.class);
        } catch (JsonProcessingException e) {
            throw new RegistryCorruptionException(registryPath, e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read registry " + registryPath, e);
        }
        if (document == null) {
            throw new RegistryCorruptionException(registryPath, "document is null");
        }
        validate(document);
        return document;
    }

    public void save(RegistryDocument document) {
        validate(document);
        try {
            AtomicFileWriter.write(registryPath, mapper.writeValueAsBytes(document), true);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write registry " + registryPath, e);
        }
        log.debug("Registry saved to {} ({} records)", registryPath, document.tasks().size());
    }

    /**
     * Re-reads the registry under an exclusive lock, applies {@code mutation} and persists the result.
     *
     * @return the document as written
     */
    public RegistryDocument update(UnaryOperator<RegistryDocument> mutation) {
        localLock.lock();
        try {
            Path parent = registryPath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path lockPath = registryPath.resolveSibling(registryPath.getFileName() + ".lock");
            try (FileChannel channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = channel.lock()) {
                RegistryDocument updated = mutation.apply(load());
                save(updated);
                return updated;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to lock registry " + registryPath, e);
        } finally {
            localLock.unlock();
        }
    }

    /**
     * Checks every record against the canonical schema shared by the scheduler and the watchdog.
     */
    void validate(RegistryDocument document) {
        if (document.version() != RegistryDocument.CURRENT_VERSION) {
            throw new RegistryCorruptionException(registryPath,
                    "unsupported version " + document.version() + " (expected " + RegistryDocument.CURRENT_VERSION + ")");
        }
        for (Map.Entry<String, ProcessRecord> entry : document.tasks().entrySet()) {
            String key = entry.getKey();
            ProcessRecord record = entry.getValue();
            if (record == null) {
                throw new RegistryCorruptionException(registryPath, "record '" + key + "' is null");
            }
            if (!key.equals(record.taskId())) {
                throw new RegistryCorruptionException(registryPath,
                        "record '" + key + "' carries task id '" + record.taskId() + "'");
            }
            if (record.status() == null || record.startedAt() == null || record.mode() == null) {
                throw new RegistryCorruptionException(registryPath,
                        "record '" + key + "' is missing status, startedAt or mode");
            }
            if (record.mode() instanceof ExecutionMode.Native n) {
                if (n.pid() <= 0 || n.pgid() <= 0 || n.startTime() == null || n.startTime().isBlank()) {
                    throw new RegistryCorruptionException(registryPath,
                            "record '" + key + "' has an invalid native fingerprint " + n);
                }
            } else if (record.mode() instanceof ExecutionMode.Container c) {
                if (c.id() == null || c.id().isBlank()) {
                    throw new RegistryCorruptionException(registryPath,
                            "record '" + key + "' has no container id");
                }
            }
        }
    }
}
