package com.clawcron.cron;

import com.clawcron.common.config.StatePaths;

import java.nio.file.Path;
import java.util.Map;

/**
 * Cron store location: explicit override, then {@code CLAWCRON_CRON_STORE},
 * then {@code <stateDir>/cron/jobs.json}.
 */
public final class CronStorePaths {

    private CronStorePaths() {
    }

    public static final String STORE_PATH_ENV = "CLAWCRON_CRON_STORE";

    public static Path resolveCronStorePath(String override) {
        return resolveCronStorePath(override, System.getenv(), System.getProperty("user.home"));
    }

    public static Path resolveCronStorePath(String override, Map<String, String> env, String homedir) {
        Path explicit = StatePaths.resolveUserPath(override, homedir);
        if (explicit != null) {
            return explicit;
        }
        Path fromEnv = StatePaths.resolveUserPath(StatePaths.envTrimmed(env, STORE_PATH_ENV), homedir);
        if (fromEnv != null) {
            return fromEnv;
        }
        return StatePaths.resolveStateDir(env, homedir).resolve("cron").resolve("jobs.json");
    }
}
