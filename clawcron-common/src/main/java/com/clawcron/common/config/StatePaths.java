package com.clawcron.common.config;

import java.nio.file.Path;
import java.util.Map;

/**
 * State directory and user path resolution.
 *
 * <p>
 * Every resolver has an overload taking the environment and home directory
 * explicitly so callers (and tests) never depend on process-global state.
 * </p>
 */
public final class StatePaths {

    private StatePaths() {
    }

    public static final String STATE_DIR_ENV = "CLAWCRON_STATE_DIR";
    private static final String STATE_DIRNAME = ".clawcron";

    // =========================================================================
    // State directory
    // =========================================================================

    /**
     * State directory for mutable data (cron store, locks).
     * Can be overridden via CLAWCRON_STATE_DIR.
     * Default: ~/.clawcron
     */
    public static Path resolveStateDir() {
        return resolveStateDir(System.getenv(), homeDir());
    }

    public static Path resolveStateDir(Map<String, String> env, String homedir) {
        String override = envTrimmed(env, STATE_DIR_ENV);
        if (override != null) {
            return resolveUserPath(override, homedir);
        }
        return Path.of(homedir, STATE_DIRNAME);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Resolve a user path: expands a leading ~ to the home directory and
     * normalizes to an absolute path. Blank input yields {@code null}.
     */
    public static Path resolveUserPath(String input) {
        return resolveUserPath(input, homeDir());
    }

    public static Path resolveUserPath(String input, String homedir) {
        if (input == null)
            return null;
        String trimmed = input.trim();
        if (trimmed.isEmpty())
            return null;
        if (trimmed.equals("~") || trimmed.startsWith("~/") || trimmed.startsWith("~\\")) {
            return Path.of(homedir + trimmed.substring(1)).toAbsolutePath().normalize();
        }
        return Path.of(trimmed).toAbsolutePath().normalize();
    }

    /**
     * Read an environment value, treating blank as absent.
     */
    public static String envTrimmed(Map<String, String> env, String key) {
        if (env == null)
            return null;
        String val = env.get(key);
        return val != null && !val.trim().isEmpty() ? val.trim() : null;
    }

    /**
     * Read a positive long from the environment, falling back to
     * {@code defaultValue} when absent, malformed or not positive.
     */
    public static long envPositiveLong(Map<String, String> env, String key, long defaultValue) {
        String raw = envTrimmed(env, key);
        if (raw == null)
            return defaultValue;
        try {
            long parsed = Long.parseLong(raw);
            return parsed > 0 ? parsed : defaultValue;
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    static String homeDir() {
        return System.getProperty("user.home");
    }
}
