package com.clawcron.cron;

/**
 * Base failure for cron store and lifecycle operations. {@link CronService}
 * converts these into {@link CronResult.Failed} values at its boundary.
 */
public class CronException extends RuntimeException {

    private final CronErrorKind kind;

    protected CronException(CronErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected CronException(CronErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CronErrorKind getKind() {
        return kind;
    }

    public static class NotFound extends CronException {
        public NotFound(String id) {
            super(CronErrorKind.NOT_FOUND, "Job not found: " + id);
        }
    }

    public static class Validation extends CronException {
        public Validation(String message) {
            super(CronErrorKind.VALIDATION, message);
        }

        public Validation(String message, Throwable cause) {
            super(CronErrorKind.VALIDATION, message, cause);
        }
    }

    public static class InvalidSchedule extends CronException {
        public InvalidSchedule(String message) {
            super(CronErrorKind.SCHEDULE, message);
        }

        public InvalidSchedule(String message, Throwable cause) {
            super(CronErrorKind.SCHEDULE, message, cause);
        }
    }

    public static class LockTimeout extends CronException {
        public LockTimeout(String message) {
            super(CronErrorKind.LOCK_TIMEOUT, message);
        }
    }

    public static class StoreFailure extends CronException {
        public StoreFailure(String message, Throwable cause) {
            super(CronErrorKind.IO, message, cause);
        }
    }
}
