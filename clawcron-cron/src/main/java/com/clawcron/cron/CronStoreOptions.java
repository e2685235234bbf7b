package com.clawcron.cron;

import com.clawcron.common.config.StatePaths;

import java.util.Map;

/**
 * Tuning for store lock acquisition.
 *
 * @param lockTimeoutMs      how long a mutation waits for the store lock
 * @param lockPollIntervalMs delay between lock attempts while waiting
 */
public record CronStoreOptions(long lockTimeoutMs, long lockPollIntervalMs) {

    public static final long DEFAULT_LOCK_TIMEOUT_MS = 10_000;
    public static final long DEFAULT_LOCK_POLL_INTERVAL_MS = 50;

    public static final String LOCK_TIMEOUT_ENV = "CLAWCRON_CRON_LOCK_TIMEOUT_MS";
    public static final String LOCK_POLL_ENV = "CLAWCRON_CRON_LOCK_POLL_MS";

    public CronStoreOptions {
        if (lockTimeoutMs < 0) {
            throw new IllegalArgumentException("lockTimeoutMs must not be negative");
        }
        if (lockPollIntervalMs <= 0) {
            throw new IllegalArgumentException("lockPollIntervalMs must be positive");
        }
    }

    public static CronStoreOptions defaults() {
        return new CronStoreOptions(DEFAULT_LOCK_TIMEOUT_MS, DEFAULT_LOCK_POLL_INTERVAL_MS);
    }

    /**
     * Defaults overridden by {@code CLAWCRON_CRON_LOCK_TIMEOUT_MS} and
     * {@code CLAWCRON_CRON_LOCK_POLL_MS} when those hold positive integers.
     */
    public static CronStoreOptions fromEnv(Map<String, String> env) {
        return new CronStoreOptions(
                StatePaths.envPositiveLong(env, LOCK_TIMEOUT_ENV, DEFAULT_LOCK_TIMEOUT_MS),
                StatePaths.envPositiveLong(env, LOCK_POLL_ENV, DEFAULT_LOCK_POLL_INTERVAL_MS));
    }
}
