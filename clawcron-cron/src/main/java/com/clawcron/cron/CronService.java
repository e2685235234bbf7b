package com.clawcron.cron;

import com.clawcron.cron.CronStore.CronStoreFile;
import com.clawcron.cron.CronTypes.AgentTurn;
import com.clawcron.cron.CronTypes.CronJobCreate;
import com.clawcron.cron.CronTypes.CronJobPatch;
import com.clawcron.cron.CronTypes.CronJobState;
import com.clawcron.cron.CronTypes.CronStatusSummary;
import com.clawcron.cron.CronTypes.Every;
import com.clawcron.cron.CronTypes.Payload;
import com.clawcron.cron.CronTypes.RunOutcome;
import com.clawcron.cron.CronTypes.RunStatus;
import com.clawcron.cron.CronTypes.Schedule;
import com.clawcron.cron.CronTypes.SystemEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Cron job lifecycle: create, update, remove, run bookkeeping and due-job
 * selection over a {@link CronStore}.
 *
 * <p>
 * This is the only writer of the store. Every mutation runs its whole
 * load-modify-save cycle under the store lock; reads use the latest snapshot
 * without locking. The current time is always passed in by the caller and
 * read once per call. No operation throws: failures come back as
 * {@link CronResult.Failed}.
 * </p>
 */
@Slf4j
public class CronService {

    private static final Comparator<CronJob> BY_NEXT_RUN = Comparator.comparingLong(
            job -> job.getState().getNextRunAtMs() != null ? job.getState().getNextRunAtMs() : 0L);

    private final CronStore store;

    public CronService(CronStore store) {
        this.store = store;
    }

    public CronStore getStore() {
        return store;
    }

    // =========================================================================
    // Reads
    // =========================================================================

    public CronResult<CronJob> get(String id) {
        return run("get", () -> {
            String key = requireId(id);
            return store.load().jobs().stream()
                    .filter(job -> job.getId().equals(key))
                    .findFirst()
                    .orElseThrow(() -> new CronException.NotFound(key));
        });
    }

    /**
     * Jobs ordered by next run time (unset first). Disabled jobs are included
     * only when {@code includeDisabled} is set.
     */
    public CronResult<List<CronJob>> list(boolean includeDisabled) {
        return run("list", () -> store.load().jobs().stream()
                .filter(job -> includeDisabled || job.isEnabled())
                .sorted(BY_NEXT_RUN)
                .toList());
    }

    public CronResult<List<CronJob>> getDueJobs(long referenceTimeMs) {
        return run("getDueJobs", () -> CronDue.getDueJobs(store.load().jobs(), referenceTimeMs));
    }

    public CronResult<CronStatusSummary> getStatus() {
        return run("getStatus", () -> {
            List<CronJob> jobs = store.load().jobs();
            Long nextWakeAtMs = jobs.stream()
                    .filter(CronJob::isEnabled)
                    .map(job -> job.getState().getNextRunAtMs())
                    .filter(Objects::nonNull)
                    .min(Long::compare)
                    .orElse(null);
            return CronStatusSummary.builder()
                    .enabled(true)
                    .storePath(store.getStorePath().toString())
                    .jobs(jobs.size())
                    .nextWakeAtMs(nextWakeAtMs)
                    .build();
        });
    }

    // =========================================================================
    // Mutations
    // =========================================================================

    public CronResult<CronJob> create(CronJobCreate input, long nowMs) {
        return run("create", () -> {
            if (input == null) {
                throw new CronException.Validation("job input is required");
            }
            if (input.getSchedule() == null) {
                throw new CronException.Validation("schedule is required");
            }
            if (input.getPayload() == null) {
                throw new CronException.Validation("payload is required");
            }
            Schedule schedule = anchorAt(input.getSchedule(), nowMs);
            CronSchedule.validate(schedule);
            validatePayload(input.getPayload());

            boolean enabled = !Boolean.FALSE.equals(input.getEnabled());

            return store.withLock(() -> {
                CronStoreFile file = store.load();

                CronJobState state = CronJobState.empty();
                if (enabled) {
                    state = withNextRun(state, schedule, nowMs, input.getName());
                }
                state = state.overlay(input.getState());
                if (!enabled) {
                    state = state.toBuilder().nextRunAtMs(null).build();
                }

                CronJob job = CronJob.builder()
                        .id(newId(file.jobs()))
                        .name(input.getName())
                        .description(input.getDescription())
                        .enabled(enabled)
                        .deleteAfterRun(Boolean.TRUE.equals(input.getDeleteAfterRun()))
                        .schedule(schedule)
                        .payload(input.getPayload())
                        .sessionTarget(input.getSessionTarget())
                        .wakeMode(input.getWakeMode())
                        .agentId(input.getAgentId())
                        .isolation(input.getIsolation())
                        .createdAtMs(nowMs)
                        .updatedAtMs(nowMs)
                        .state(state)
                        .build();

                List<CronJob> jobs = new ArrayList<>(file.jobs());
                jobs.add(job);
                store.save(file.withJobs(jobs));
                log.info("Created cron job {} ({}) next run at {}",
                        job.getId(), job.getName(), job.getState().getNextRunAtMs());
                return job;
            });
        });
    }

    /**
     * Apply the non-null fields of {@code patch}. The patch is fully validated
     * before anything is written; a rejected patch leaves the job unchanged.
     */
    public CronResult<CronJob> update(String id, CronJobPatch patch, long nowMs) {
        return run("update", () -> {
            String key = requireId(id);
            if (patch == null) {
                throw new CronException.Validation("patch is required");
            }
            Schedule patchedSchedule = null;
            if (patch.getSchedule() != null) {
                patchedSchedule = anchorAt(patch.getSchedule(), nowMs);
                CronSchedule.validate(patchedSchedule);
            }
            Schedule scheduleUpdate = patchedSchedule;

            return mutate(key, existing -> {
                CronJob.CronJobBuilder next = existing.toBuilder();
                if (patch.getName() != null)
                    next.name(patch.getName());
                if (patch.getDescription() != null)
                    next.description(patch.getDescription());
                if (patch.getDeleteAfterRun() != null)
                    next.deleteAfterRun(patch.getDeleteAfterRun());
                if (patch.getSessionTarget() != null)
                    next.sessionTarget(patch.getSessionTarget());
                if (patch.getWakeMode() != null)
                    next.wakeMode(patch.getWakeMode());
                if (patch.getAgentId() != null)
                    next.agentId(patch.getAgentId());
                if (patch.getIsolation() != null)
                    next.isolation(patch.getIsolation());
                if (scheduleUpdate != null)
                    next.schedule(scheduleUpdate);
                if (patch.getPayload() != null) {
                    Payload merged = mergePayload(existing.getPayload(), patch.getPayload());
                    validatePayload(merged);
                    next.payload(merged);
                }

                boolean enabled = patch.getEnabled() != null ? patch.getEnabled() : existing.isEnabled();
                next.enabled(enabled);

                Schedule schedule = scheduleUpdate != null ? scheduleUpdate : existing.getSchedule();
                CronJobState state = existing.getState().overlay(patch.getState());
                if (enabled && (scheduleUpdate != null || patch.getEnabled() != null)) {
                    state = withNextRun(state, schedule, nowMs, existing.getName());
                } else if (!enabled) {
                    state = state.toBuilder().nextRunAtMs(null).build();
                }

                return next.state(state).updatedAtMs(nowMs).build();
            });
        });
    }

    /**
     * Remove a job. Returns whether anything was removed; the store is not
     * rewritten when the id is unknown.
     */
    public CronResult<Boolean> remove(String id) {
        return run("remove", () -> {
            String key = requireId(id);
            return store.withLock(() -> {
                CronStoreFile file = store.load();
                List<CronJob> remaining = file.jobs().stream()
                        .filter(job -> !job.getId().equals(key))
                        .toList();
                if (remaining.size() == file.jobs().size()) {
                    return false;
                }
                store.save(file.withJobs(remaining));
                log.info("Removed cron job {}", key);
                return true;
            });
        });
    }

    /**
     * Record that the executor started the job. Calling it again on a running
     * job refreshes {@code runningAtMs}.
     */
    public CronResult<CronJob> markRunning(String id, long nowMs) {
        return run("markRunning", () -> {
            String key = requireId(id);
            return mutate(key, existing -> {
                if (existing.isRunning()) {
                    log.debug("Cron job {} already running since {}, refreshing",
                            key, existing.getState().getRunningAtMs());
                }
                return existing.toBuilder()
                        .state(existing.getState().toBuilder().runningAtMs(nowMs).build())
                        .updatedAtMs(nowMs)
                        .build();
            });
        });
    }

    /**
     * Record a finished run and decide what happens next. A successful one-shot
     * job is deleted ({@code deleteAfterRun}) or disabled; anything else that is
     * still enabled gets its next run computed from {@code nowMs}, the
     * completion time. An {@code every} job runs again one interval after it
     * completed.
     *
     * @return the job as of completion (for a deleted job, its final snapshot)
     */
    public CronResult<CronJob> markCompleted(String id, RunOutcome outcome, long nowMs) {
        return run("markCompleted", () -> {
            String key = requireId(id);
            if (outcome == null || outcome.status() == null) {
                throw new CronException.Validation("run status is required");
            }
            if (outcome.durationMs() < 0) {
                throw new CronException.Validation("durationMs must not be negative");
            }

            return store.withLock(() -> {
                CronStoreFile file = store.load();
                int index = indexOf(file.jobs(), key);
                CronJob existing = file.jobs().get(index);

                CronJobState state = existing.getState().toBuilder()
                        .runningAtMs(null)
                        .lastRunAtMs(nowMs)
                        .lastStatus(outcome.status())
                        .lastError(outcome.error())
                        .lastDurationMs(outcome.durationMs())
                        .build();
                CronJob.CronJobBuilder next = existing.toBuilder().updatedAtMs(nowMs);
                List<CronJob> jobs = new ArrayList<>(file.jobs());

                if (existing.isOneShot() && outcome.status() == RunStatus.OK) {
                    if (existing.isDeleteAfterRun()) {
                        CronJob finished = next.state(state).build();
                        jobs.remove(index);
                        store.save(file.withJobs(jobs));
                        log.info("Cron job {} finished its one-shot run and was deleted", key);
                        return finished;
                    }
                    next.enabled(false);
                    state = state.toBuilder().nextRunAtMs(null).build();
                    log.info("Cron job {} finished its one-shot run and was disabled", key);
                } else if (existing.isEnabled()) {
                    state = withNextRunAfterCompletion(state, existing.getSchedule(), nowMs, existing.getName());
                } else {
                    state = state.toBuilder().nextRunAtMs(null).build();
                }

                CronJob updated = next.state(state).build();
                jobs.set(index, updated);
                store.save(file.withJobs(jobs));
                log.info("Cron job {} completed with status {} in {}ms, next run at {}",
                        key, outcome.status().key(), outcome.durationMs(), state.getNextRunAtMs());
                return updated;
            });
        });
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private <T> CronResult<T> run(String operation, Supplier<T> action) {
        try {
            return CronResult.success(action.get());
        } catch (CronException e) {
            log.debug("Cron {} failed ({}): {}", operation, e.getKind(), e.getMessage());
            return CronResult.failure(e);
        } catch (RuntimeException e) {
            log.warn("Cron {} failed unexpectedly: {}", operation, e.toString());
            return CronResult.failure(CronErrorKind.IO, operation + " failed: " + e);
        }
    }

    /**
     * Replace one job, located by id, with {@code change.apply(existing)} under
     * the store lock.
     */
    private CronJob mutate(String id, UnaryOperator<CronJob> change) {
        return store.withLock(() -> {
            CronStoreFile file = store.load();
            int index = indexOf(file.jobs(), id);
            CronJob updated = change.apply(file.jobs().get(index));
            List<CronJob> jobs = new ArrayList<>(file.jobs());
            jobs.set(index, updated);
            store.save(file.withJobs(jobs));
            return updated;
        });
    }

    private static int indexOf(List<CronJob> jobs, String id) {
        for (int i = 0; i < jobs.size(); i++) {
            if (jobs.get(i).getId().equals(id))
                return i;
        }
        throw new CronException.NotFound(id);
    }

    private static String requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new CronException.Validation("job id is required");
        }
        return id.trim();
    }

    private static String newId(List<CronJob> existing) {
        while (true) {
            String candidate = UUID.randomUUID().toString();
            if (existing.stream().noneMatch(job -> job.getId().equals(candidate)))
                return candidate;
        }
    }

    /**
     * An {@code every} schedule without an anchor is pinned to the time it was
     * stored, so later evaluations keep the same phase.
     */
    static Schedule anchorAt(Schedule schedule, long nowMs) {
        if (schedule instanceof Every every && every.anchorMs() == null) {
            return new Every(every.intervalMs(), nowMs);
        }
        return schedule;
    }

    /**
     * Compute the next run; an unusable schedule leaves it unset and records
     * the reason instead of failing the operation.
     */
    static CronJobState withNextRun(CronJobState state, Schedule schedule, long nowMs, String jobName) {
        try {
            return state.toBuilder().nextRunAtMs(CronSchedule.computeNextRunAtMs(schedule, nowMs)).build();
        } catch (CronException.InvalidSchedule e) {
            log.warn("Cron job {} has an unusable schedule: {}", jobName, e.getMessage());
            return state.toBuilder().nextRunAtMs(null).lastError(e.getMessage()).build();
        }
    }

    /**
     * An {@code every} job's period restarts at the completion time; other
     * schedules are evaluated against it as usual.
     */
    static CronJobState withNextRunAfterCompletion(CronJobState state, Schedule schedule, long completedAtMs,
            String jobName) {
        if (schedule instanceof Every every && every.intervalMs() > 0) {
            return state.toBuilder().nextRunAtMs(Math.addExact(completedAtMs, every.intervalMs())).build();
        }
        return withNextRun(state, schedule, completedAtMs, jobName);
    }

    /**
     * Same kind: sub-fields missing from the patch are carried over. Different
     * kind: the patch replaces the payload outright.
     */
    static Payload mergePayload(Payload existing, Payload patch) {
        if (patch instanceof SystemEvent event) {
            String carried = existing instanceof SystemEvent previous ? previous.text() : null;
            return new SystemEvent(event.text() != null ? event.text() : carried);
        }
        AgentTurn turn = (AgentTurn) patch;
        AgentTurn base = existing instanceof AgentTurn previous ? previous : AgentTurn.EMPTY;
        return new AgentTurn(
                turn.message() != null ? turn.message() : base.message(),
                turn.model() != null ? turn.model() : base.model(),
                turn.thinking() != null ? turn.thinking() : base.thinking(),
                turn.timeoutSeconds() != null ? turn.timeoutSeconds() : base.timeoutSeconds(),
                turn.deliver() != null ? turn.deliver() : base.deliver(),
                turn.channel() != null ? turn.channel() : base.channel(),
                turn.to() != null ? turn.to() : base.to(),
                turn.bestEffortDeliver() != null ? turn.bestEffortDeliver() : base.bestEffortDeliver());
    }

    static void validatePayload(Payload payload) {
        if (payload instanceof SystemEvent event) {
            if (event.text() == null || event.text().isBlank()) {
                throw new CronException.Validation("systemEvent payload requires text");
            }
            return;
        }
        AgentTurn turn = (AgentTurn) payload;
        if (turn.message() == null || turn.message().isBlank()) {
            throw new CronException.Validation("agentTurn payload requires a message");
        }
        if (turn.timeoutSeconds() != null && turn.timeoutSeconds() <= 0) {
            throw new CronException.Validation("agentTurn timeoutSeconds must be positive");
        }
    }
}
