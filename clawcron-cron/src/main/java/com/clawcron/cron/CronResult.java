package com.clawcron.cron;

/**
 * Outcome of a {@link CronService} operation: either the data or a tagged
 * error. Operations never throw across the service boundary.
 */
public sealed interface CronResult<T> {

    boolean ok();

    record Ok<T>(T data) implements CronResult<T> {
        @Override
        public boolean ok() {
            return true;
        }
    }

    record Failed<T>(CronErrorKind kind, String message) implements CronResult<T> {
        @Override
        public boolean ok() {
            return false;
        }
    }

    static <T> CronResult<T> success(T data) {
        return new Ok<>(data);
    }

    static <T> CronResult<T> failure(CronException error) {
        return new Failed<>(error.getKind(), error.getMessage());
    }

    static <T> CronResult<T> failure(CronErrorKind kind, String message) {
        return new Failed<>(kind, message);
    }

    /**
     * Data of a successful result.
     *
     * @throws IllegalStateException if this is a failure
     */
    default T data() {
        if (this instanceof Ok<T> success)
            return success.data();
        Failed<T> failed = (Failed<T>) this;
        throw new IllegalStateException(failed.kind() + ": " + failed.message());
    }

    /** Error kind of a failure, or null on success. */
    default CronErrorKind errorKind() {
        return this instanceof Failed<T> failed ? failed.kind() : null;
    }
}
