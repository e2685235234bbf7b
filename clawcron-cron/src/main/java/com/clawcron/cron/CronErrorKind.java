package com.clawcron.cron;

/**
 * Failure categories reported by {@link CronService} operations.
 */
public enum CronErrorKind {
    /** Unknown job id. */
    NOT_FOUND,
    /** Missing or malformed required field on create/update. */
    VALIDATION,
    /** Unparseable or unusable schedule. */
    SCHEDULE,
    /** Store lock not acquired within the wait budget. */
    LOCK_TIMEOUT,
    /** Underlying read/write failure, including a corrupt store document. */
    IO
}
