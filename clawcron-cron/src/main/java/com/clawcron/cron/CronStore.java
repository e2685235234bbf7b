package com.clawcron.cron;

import com.clawcron.common.infra.ExclusiveFileLock;
import com.clawcron.cron.CronTypes.CronJobState;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * File-backed cron job collection.
 *
 * <p>
 * The whole collection lives in one JSON document and is always loaded and
 * saved as a unit. Saves go through a temp file and a rename, so readers see
 * either the old or the new document, never a partial one. Mutating callers
 * wrap their load-modify-save cycle in {@link #withLock(Supplier)}.
 * </p>
 */
@Slf4j
public class CronStore {

    static final int STORE_VERSION = 1;

    static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true);

    /**
     * The store document: {@code {"version": 1, "jobs": [...]}}.
     */
    public record CronStoreFile(int version, List<CronJob> jobs) {
        public CronStoreFile {
            if (jobs != null && jobs.stream().anyMatch(Objects::isNull)) {
                throw new IllegalArgumentException("jobs must not contain null entries");
            }
            jobs = jobs == null ? List.of() : List.copyOf(jobs);
        }

        public static CronStoreFile empty() {
            return new CronStoreFile(STORE_VERSION, List.of());
        }

        public CronStoreFile withJobs(List<CronJob> next) {
            return new CronStoreFile(version, next);
        }
    }

    private final Path storePath;
    private final Path lockPath;
    private final CronStoreOptions options;

    public CronStore(Path storePath) {
        this(storePath, CronStoreOptions.defaults());
    }

    public CronStore(Path storePath, CronStoreOptions options) {
        this.storePath = storePath.toAbsolutePath().normalize();
        this.lockPath = Path.of(this.storePath + ".lock");
        this.options = options;
    }

    public Path getStorePath() {
        return storePath;
    }

    public Path getLockPath() {
        return lockPath;
    }

    public Path getBackupPath() {
        return Path.of(storePath + ".bak");
    }

    // =========================================================================
    // Load
    // =========================================================================

    /**
     * Load the collection. A missing file is an empty collection; a file that
     * exists but cannot be read as a store document is an error.
     *
     * @throws CronException.StoreFailure on read failure or corrupt content
     */
    public CronStoreFile load() {
        if (!Files.exists(storePath)) {
            log.debug("Cron store file not found: {}", storePath);
            return CronStoreFile.empty();
        }

        byte[] content;
        try {
            content = Files.readAllBytes(storePath);
        } catch (IOException e) {
            throw new CronException.StoreFailure("Failed to read cron store " + storePath + ": " + e.getMessage(), e);
        }
        if (content.length == 0) {
            throw new CronException.StoreFailure("Cron store is empty (expected a JSON document): " + storePath, null);
        }

        CronStoreFile parsed;
        try {
            parsed = MAPPER.readValue(content, CronStoreFile.class);
        } catch (IOException e) {
            throw new CronException.StoreFailure("Cron store is corrupt: " + storePath + ": " + e.getMessage(), e);
        }
        if (parsed == null) {
            throw new CronException.StoreFailure("Cron store is corrupt (null document): " + storePath, null);
        }

        List<CronJob> jobs = new ArrayList<>(parsed.jobs().size());
        Set<String> seen = new HashSet<>();
        for (CronJob job : parsed.jobs()) {
            if (job.getId() == null || job.getId().isBlank()) {
                throw new CronException.StoreFailure("Cron store has a job without an id: " + storePath, null);
            }
            if (!seen.add(job.getId())) {
                throw new CronException.StoreFailure(
                        "Cron store has duplicate job id " + job.getId() + ": " + storePath, null);
            }
            jobs.add(job.getState() == null ? job.toBuilder().state(CronJobState.empty()).build() : job);
        }
        log.debug("Loaded cron store {} ({} jobs)", storePath, jobs.size());
        return new CronStoreFile(parsed.version() > 0 ? parsed.version() : STORE_VERSION, jobs);
    }

    // =========================================================================
    // Save
    // =========================================================================

    /**
     * Atomically replace the store document with {@code file}.
     *
     * @throws CronException.StoreFailure if the document cannot be written
     */
    public void save(CronStoreFile file) {
        byte[] json;
        try {
            json = MAPPER.writeValueAsBytes(file);
        } catch (JsonProcessingException e) {
            throw new CronException.StoreFailure("Failed to serialize cron store: " + e.getMessage(), e);
        }

        Path tmp = storePath.resolveSibling(
                storePath.getFileName() + "." + ProcessHandle.current().pid() + "." + UUID.randomUUID() + ".tmp");
        try {
            Path parent = storePath.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            writeDurably(tmp, json);
            moveIntoPlace(tmp);
        } catch (IOException e) {
            throw new CronException.StoreFailure("Failed to save cron store " + storePath + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(tmp);
        }
        log.debug("Saved cron store to {} ({} jobs)", storePath, file.jobs().size());

        try {
            Files.copy(storePath, getBackupPath(), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Failed to refresh cron store backup {}: {}", getBackupPath(), e.getMessage());
        }
    }

    private static void writeDurably(Path tmp, byte[] json) throws IOException {
        try (FileChannel channel = FileChannel.open(tmp,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(json);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.setPosixFilePermissions(tmp, Set.of(
                    PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE));
        } catch (UnsupportedOperationException e) {
            log.debug("POSIX permissions unsupported for {}", tmp);
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, storePath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, using replacing move", storePath);
            Files.move(tmp, storePath, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", tmp, e.getMessage());
        }
    }

    // =========================================================================
    // Locking
    // =========================================================================

    /**
     * Run {@code action} while holding the store's exclusive lock on
     * {@code <store>.lock}, which serializes threads and processes alike. The
     * lock is released on every exit path. Not reentrant: {@code action} must
     * not call back into {@code withLock} on the same store.
     *
     * @throws CronException.LockTimeout  if the lock is not acquired within
     *                                    {@link CronStoreOptions#lockTimeoutMs()}
     * @throws CronException.StoreFailure if the lock file cannot be opened
     */
    public <T> T withLock(Supplier<T> action) {
        ExclusiveFileLock.Handle handle;
        try {
            handle = ExclusiveFileLock.acquire(lockPath, options.lockTimeoutMs(), options.lockPollIntervalMs());
        } catch (ExclusiveFileLock.LockTimeoutError e) {
            throw new CronException.LockTimeout("Cron store busy; " + e.getMessage());
        } catch (IOException e) {
            throw new CronException.StoreFailure("Failed to open cron store lock " + lockPath + ": " + e.getMessage(), e);
        }
        try (handle) {
            return action.get();
        }
    }
}
