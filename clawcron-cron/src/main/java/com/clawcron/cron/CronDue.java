package com.clawcron.cron;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Selection of jobs that are ready to run.
 */
public final class CronDue {

    private CronDue() {
    }

    private static final Comparator<CronJob> EARLIEST_FIRST = Comparator
            .comparing((CronJob job) -> job.getState().getNextRunAtMs())
            .thenComparing(CronJob::getId);

    /**
     * A job is due when it is enabled, not running, and its next run time is
     * set and not after {@code referenceTimeMs}. A running job is never due.
     */
    public static boolean isDue(CronJob job, long referenceTimeMs) {
        if (job == null || !job.isEnabled() || job.getState() == null)
            return false;
        if (job.getState().getRunningAtMs() != null)
            return false;
        Long next = job.getState().getNextRunAtMs();
        return next != null && next <= referenceTimeMs;
    }

    /**
     * Due jobs ordered by next run time, then id.
     */
    public static List<CronJob> getDueJobs(Collection<CronJob> jobs, long referenceTimeMs) {
        return jobs.stream()
                .filter(job -> isDue(job, referenceTimeMs))
                .sorted(EARLIEST_FIRST)
                .toList();
    }
}
