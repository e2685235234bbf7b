package com.clawcron.common.infra;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive lock on a sidecar lock file, held against other threads and other
 * processes.
 *
 * <p>
 * Threads of this JVM first queue on a per-path gate; only the winner touches
 * the lock file, and it polls {@link FileChannel#tryLock()} for the OS lock.
 * Closing any descriptor on a file may drop every lock the process holds on
 * it, so the lock file is only ever opened by the gate holder, through a
 * single channel. The OS drops the lock when the owning process dies, so there
 * is no stale lock detection. The lock file itself is left in place on
 * release: deleting it would let a third process lock a fresh inode while a
 * second one still holds the old one.
 * </p>
 */
@Slf4j
public final class ExclusiveFileLock {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_OWNER_BYTES = 4096;

    /**
     * In-process gates keyed by normalized lock path. An entry lives while at
     * least one thread is waiting for or holding that path.
     */
    private static final Map<Path, Gate> GATES = new ConcurrentHashMap<>();

    private ExclusiveFileLock() {
    }

    private static final class Gate {
        final ReentrantLock lock = new ReentrantLock();
        /** Guarded by the map's per-key compute. */
        int users;
    }

    /**
     * Handle to a held lock. Closing it releases the lock; it must be closed by
     * the thread that acquired it.
     */
    public static final class Handle implements AutoCloseable {
        private final Path lockPath;
        private final Path key;
        private final Gate gate;
        private final FileChannel channel;
        private final FileLock lock;
        private volatile boolean released = false;

        Handle(Path lockPath, Path key, Gate gate, FileChannel channel, FileLock lock) {
            this.lockPath = lockPath;
            this.key = key;
            this.gate = gate;
            this.channel = channel;
            this.lock = lock;
        }

        public Path getLockPath() {
            return lockPath;
        }

        public boolean isHeld() {
            return !released && lock.isValid();
        }

        public void release() {
            if (released)
                return;
            released = true;
            try {
                lock.release();
            } catch (IOException e) {
                log.debug("Failed to release lock {}: {}", lockPath, e.getMessage());
            }
            try {
                channel.close();
            } catch (IOException e) {
                log.debug("Failed to close lock channel {}: {}", lockPath, e.getMessage());
            }
            gate.lock.unlock();
            leave(key);
        }

        @Override
        public void close() {
            release();
        }
    }

    /**
     * Thrown when the lock cannot be acquired within the timeout.
     */
    public static class LockTimeoutError extends RuntimeException {
        private final Path lockPath;

        public LockTimeoutError(Path lockPath, String message) {
            super(message);
            this.lockPath = lockPath;
        }

        public Path getLockPath() {
            return lockPath;
        }
    }

    /**
     * Acquire the lock at {@code lockPath}, waiting at most {@code timeoutMs}
     * for other threads and processes to let go. Not reentrant.
     *
     * @throws LockTimeoutError      if another holder keeps the lock past the
     *                               timeout or the waiting thread is interrupted
     * @throws IllegalStateException if the calling thread already holds it
     * @throws IOException           if the lock file cannot be created or opened
     */
    public static Handle acquire(Path lockPath, long timeoutMs, long pollIntervalMs) throws IOException {
        Path key = lockPath.toAbsolutePath().normalize();
        Gate gate = enter(key);
        boolean gated = false;
        try {
            if (gate.lock.isHeldByCurrentThread()) {
                throw new IllegalStateException("Lock already held by this thread: " + lockPath);
            }
            long startedAt = System.currentTimeMillis();
            if (!tryGate(gate, lockPath, timeoutMs)) {
                // The lock file is not read here: the holder's OS lock must not be disturbed
                throw new LockTimeoutError(lockPath, String.format(
                        "Lock timeout after %dms (held by another thread of this process): %s",
                        timeoutMs, lockPath));
            }
            gated = true;
            Handle handle = acquireOsLock(lockPath, key, gate, startedAt, timeoutMs, Math.max(1, pollIntervalMs));
            log.debug("Acquired lock: {}", lockPath);
            return handle;
        } catch (IOException | RuntimeException e) {
            if (gated)
                gate.lock.unlock();
            leave(key);
            throw e;
        }
    }

    /** Whether any thread of this process is waiting for or holding the lock. */
    static boolean isTracked(Path lockPath) {
        return GATES.containsKey(lockPath.toAbsolutePath().normalize());
    }

    private static Gate enter(Path key) {
        return GATES.compute(key, (k, existing) -> {
            Gate gate = existing != null ? existing : new Gate();
            gate.users++;
            return gate;
        });
    }

    private static void leave(Path key) {
        GATES.computeIfPresent(key, (k, gate) -> --gate.users == 0 ? null : gate);
    }

    private static boolean tryGate(Gate gate, Path lockPath, long timeoutMs) {
        try {
            return gate.lock.tryLock(Math.max(0, timeoutMs), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutError(lockPath, "Lock acquisition interrupted: " + lockPath);
        }
    }

    private static Handle acquireOsLock(Path lockPath, Path key, Gate gate, long startedAt, long timeoutMs,
            long pollMs) throws IOException {
        Path parent = key.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        while (true) {
            FileChannel channel = FileChannel.open(lockPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (IOException | RuntimeException e) {
                channel.close();
                throw e;
            }

            if (lock != null) {
                writeOwner(channel);
                return new Handle(lockPath, key, gate, channel, lock);
            }

            // Held by another process; this process holds no lock on the file
            long elapsed = System.currentTimeMillis() - startedAt;
            if (elapsed >= timeoutMs) {
                String owner = readOwner(channel);
                channel.close();
                throw new LockTimeoutError(lockPath, String.format(
                        "Lock timeout after %dms (held by %s): %s", timeoutMs, owner, lockPath));
            }
            channel.close();
            try {
                Thread.sleep(Math.min(pollMs, Math.max(1, timeoutMs - elapsed)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutError(lockPath, "Lock acquisition interrupted: " + lockPath);
            }
        }
    }

    // =========================================================================
    // Owner payload
    // =========================================================================

    private static void writeOwner(FileChannel channel) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pid", ProcessHandle.current().pid());
        payload.put("createdAt", Instant.now().toString());
        try {
            byte[] bytes = MAPPER.writeValueAsBytes(payload);
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(bytes), 0);
            channel.force(false);
        } catch (IOException e) {
            // The owner payload is diagnostic only
            log.debug("Failed to write lock owner payload: {}", e.getMessage());
        }
    }

    /**
     * Describe the holder recorded in an open lock file, for diagnostics.
     * Reads through the caller's channel so no extra descriptor is opened.
     */
    static String readOwner(FileChannel channel) {
        try {
            ByteBuffer buffer = ByteBuffer.allocate(MAX_OWNER_BYTES);
            int read = channel.read(buffer, 0);
            if (read <= 0)
                return "unknown";
            JsonNode node = MAPPER.readTree(Arrays.copyOf(buffer.array(), read));
            if (node != null && node.hasNonNull("pid")) {
                return "pid=" + node.get("pid").asLong();
            }
        } catch (IOException e) {
            log.debug("Failed to read lock owner: {}", e.getMessage());
        }
        return "unknown";
    }
}
