package com.clawcron.cron;

import com.clawcron.cron.CronStore.CronStoreFile;
import com.clawcron.cron.CronTypes.AgentTurn;
import com.clawcron.cron.CronTypes.At;
import com.clawcron.cron.CronTypes.Cron;
import com.clawcron.cron.CronTypes.CronJobCreate;
import com.clawcron.cron.CronTypes.CronJobPatch;
import com.clawcron.cron.CronTypes.CronJobState;
import com.clawcron.cron.CronTypes.CronStatusSummary;
import com.clawcron.cron.CronTypes.Every;
import com.clawcron.cron.CronTypes.RunOutcome;
import com.clawcron.cron.CronTypes.RunStatus;
import com.clawcron.cron.CronTypes.SystemEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link CronService}.
 */
class CronServiceTest {

    @TempDir
    Path tempDir;

    private Path storePath;
    private CronService service;

    @BeforeEach
    void setUp() {
        storePath = tempDir.resolve("cron").resolve("jobs.json");
        service = new CronService(new CronStore(storePath));
    }

    private static CronJobCreate everyMinute(String name) {
        return CronJobCreate.builder()
                .name(name)
                .schedule(new Every(60_000, 0L))
                .payload(new SystemEvent("tick"))
                .build();
    }

    private static CronJobCreate oneShot(String name, long atMs, boolean deleteAfterRun) {
        return CronJobCreate.builder()
                .name(name)
                .deleteAfterRun(deleteAfterRun)
                .schedule(new At(atMs))
                .payload(new SystemEvent("remind"))
                .build();
    }

    private CronJob create(CronJobCreate input, long nowMs) {
        CronResult<CronJob> result = service.create(input, nowMs);
        assertTrue(result.ok(), () -> "create failed: " + result);
        return result.data();
    }

    private CronJob stored(String id) {
        return service.get(id).data();
    }

    private List<String> dueIds(long referenceTimeMs) {
        return service.getDueJobs(referenceTimeMs).data().stream().map(CronJob::getId).toList();
    }

    // =========================================================================
    // Scenarios
    // =========================================================================

    @Nested
    class Scenarios {
        @Test
        void recurringJobRunsAndReschedulesFromCompletionTime() {
            CronJob x = create(everyMinute("X"), 0);
            assertEquals(60_000L, x.getState().getNextRunAtMs());

            assertEquals(List.of(x.getId()), dueIds(60_000));

            CronJob running = service.markRunning(x.getId(), 60_000).data();
            assertEquals(60_000L, running.getState().getRunningAtMs());
            assertTrue(dueIds(60_000).isEmpty());

            CronJob completed = service.markCompleted(x.getId(), RunOutcome.ok(500), 60_500).data();
            assertNull(completed.getState().getRunningAtMs());
            assertEquals(120_500L, completed.getState().getNextRunAtMs());
            assertEquals(RunStatus.OK, completed.getState().getLastStatus());
            assertEquals(60_500L, completed.getState().getLastRunAtMs());
            assertEquals(500L, completed.getState().getLastDurationMs());
            assertEquals(completed, stored(x.getId()));
        }

        @Test
        void oneShotWithDeleteAfterRunDisappearsAfterSuccess() {
            CronJob y = create(oneShot("Y", 5000, true), 0);

            assertEquals(List.of(y.getId()), dueIds(5000));

            CronResult<CronJob> completed = service.markCompleted(y.getId(), RunOutcome.ok(10), 5010);
            assertTrue(completed.ok());
            assertEquals(RunStatus.OK, completed.data().getState().getLastStatus());

            assertEquals(CronErrorKind.NOT_FOUND, service.get(y.getId()).errorKind());
            assertTrue(service.list(true).data().isEmpty());
        }
    }

    // =========================================================================
    // create
    // =========================================================================

    @Nested
    class Create {
        @Test
        void assignsIdTimestampsAndNextRun() {
            CronJob job = create(everyMinute("poll"), 1_000);

            assertNotNull(job.getId());
            assertEquals(1_000, job.getCreatedAtMs());
            assertEquals(1_000, job.getUpdatedAtMs());
            assertTrue(job.isEnabled());
            assertFalse(job.isDeleteAfterRun());
            assertEquals(60_000L, job.getState().getNextRunAtMs());
            assertEquals(job, stored(job.getId()));
        }

        @Test
        void futureOneShot_nextRunIsAtMs() {
            CronJob job = create(oneShot("r", 90_000, false), 1_000);
            assertEquals(90_000L, job.getState().getNextRunAtMs());
        }

        @Test
        void idsAreUnique() {
            CronJob a = create(everyMinute("a"), 0);
            CronJob b = create(everyMinute("b"), 0);
            assertNotEquals(a.getId(), b.getId());
            assertEquals(2, service.list(true).data().size());
        }

        @Test
        void disabled_hasNoNextRun() {
            CronJob job = create(everyMinute("off").toBuilder().enabled(false).build(), 0);
            assertFalse(job.isEnabled());
            assertNull(job.getState().getNextRunAtMs());
        }

        @Test
        void everyWithoutAnchor_isPinnedToCreationTime() {
            CronJob job = create(CronJobCreate.builder()
                    .schedule(new Every(10_000, null))
                    .payload(new SystemEvent("tick"))
                    .build(), 3_000);

            assertEquals(new Every(10_000, 3_000L), job.getSchedule());
            assertEquals(13_000L, job.getState().getNextRunAtMs());
        }

        @Test
        void routingMetadataIsStoredVerbatim() {
            CronJob job = create(everyMinute("routed").toBuilder()
                    .sessionTarget("isolated")
                    .wakeMode("now")
                    .agentId("ops")
                    .isolation(Map.of("postToMainPrefix", "Cron"))
                    .build(), 0);

            CronJob reloaded = stored(job.getId());
            assertEquals("isolated", reloaded.getSessionTarget());
            assertEquals("now", reloaded.getWakeMode());
            assertEquals("ops", reloaded.getAgentId());
            assertEquals(Map.of("postToMainPrefix", "Cron"), reloaded.getIsolation());
        }

        @Test
        void stateOverridesAreLayeredOnTop() {
            CronJob job = create(everyMinute("imported").toBuilder()
                    .state(CronJobState.builder().lastStatus(RunStatus.OK).lastRunAtMs(42L).build())
                    .build(), 0);

            assertEquals(60_000L, job.getState().getNextRunAtMs());
            assertEquals(RunStatus.OK, job.getState().getLastStatus());
            assertEquals(42L, job.getState().getLastRunAtMs());
        }

        @Test
        void missingScheduleOrPayload_isValidationError() {
            assertEquals(CronErrorKind.VALIDATION, service.create(null, 0).errorKind());
            assertEquals(CronErrorKind.VALIDATION, service.create(CronJobCreate.builder()
                    .payload(new SystemEvent("x")).build(), 0).errorKind());
            assertEquals(CronErrorKind.VALIDATION, service.create(CronJobCreate.builder()
                    .schedule(new At(5000)).build(), 0).errorKind());
            assertEquals(CronErrorKind.VALIDATION, service.create(CronJobCreate.builder()
                    .schedule(new At(5000)).payload(new SystemEvent("  ")).build(), 0).errorKind());
            assertEquals(CronErrorKind.VALIDATION, service.create(CronJobCreate.builder()
                    .schedule(new At(5000)).payload(AgentTurn.of("")).build(), 0).errorKind());
            assertFalse(Files.exists(storePath));
        }

        @Test
        void malformedSchedule_isScheduleError() {
            CronResult<CronJob> result = service.create(CronJobCreate.builder()
                    .schedule(new Cron("every tuesday", null))
                    .payload(new SystemEvent("x"))
                    .build(), 0);

            assertFalse(result.ok());
            assertEquals(CronErrorKind.SCHEDULE, result.errorKind());
            assertTrue(service.list(true).data().isEmpty());
        }
    }

    // =========================================================================
    // update
    // =========================================================================

    @Nested
    class Update {
        @Test
        void unknownId_isNotFound() {
            assertEquals(CronErrorKind.NOT_FOUND,
                    service.update("missing", CronJobPatch.builder().name("x").build(), 0).errorKind());
        }

        @Test
        void appliesOnlyPresentFields() {
            CronJob job = create(everyMinute("before").toBuilder().description("keep me").build(), 0);

            CronJob updated = service.update(job.getId(), CronJobPatch.builder().name("after").build(), 500).data();

            assertEquals("after", updated.getName());
            assertEquals("keep me", updated.getDescription());
            assertEquals(job.getSchedule(), updated.getSchedule());
            assertEquals(job.getPayload(), updated.getPayload());
            assertEquals(job.getCreatedAtMs(), updated.getCreatedAtMs());
            assertEquals(500, updated.getUpdatedAtMs());
            // Neither schedule nor enabled changed: next run untouched
            assertEquals(60_000L, updated.getState().getNextRunAtMs());
        }

        @Test
        void disableClearsNextRunAndReenableRecomputesFromCallTime() {
            CronJob job = create(everyMinute("toggle"), 0);

            CronJob disabled = service.update(job.getId(), CronJobPatch.builder().enabled(false).build(), 10_000).data();
            assertFalse(disabled.isEnabled());
            assertNull(disabled.getState().getNextRunAtMs());
            assertEquals(job.getSchedule(), disabled.getSchedule());

            CronJob enabled = service.update(job.getId(), CronJobPatch.builder().enabled(true).build(), 250_000).data();
            assertTrue(enabled.isEnabled());
            assertEquals(300_000L, enabled.getState().getNextRunAtMs());
        }

        @Test
        void scheduleChangeRecomputesNextRun() {
            CronJob job = create(everyMinute("move"), 0);

            CronJob updated = service.update(job.getId(),
                    CronJobPatch.builder().schedule(new At(90_000)).build(), 1_000).data();

            assertEquals(new At(90_000), updated.getSchedule());
            assertEquals(90_000L, updated.getState().getNextRunAtMs());
        }

        @Test
        void samePayloadKind_carriesOverUnspecifiedFields() {
            CronJob job = create(CronJobCreate.builder()
                    .schedule(new Every(60_000, 0L))
                    .payload(new AgentTurn("check inbox", "fast", "low", 60, true, "telegram", "@me", false))
                    .build(), 0);

            CronJob updated = service.update(job.getId(), CronJobPatch.builder()
                    .payload(new AgentTurn(null, "smart", null, null, null, null, "@you", null))
                    .build(), 100).data();

            assertEquals(new AgentTurn("check inbox", "smart", "low", 60, true, "telegram", "@you", false),
                    updated.getPayload());
        }

        @Test
        void differentPayloadKind_replacesWholesale() {
            CronJob job = create(CronJobCreate.builder()
                    .schedule(new Every(60_000, 0L))
                    .payload(new AgentTurn("check inbox", "fast", "low", 60, true, "telegram", "@me", false))
                    .build(), 0);

            CronJob updated = service.update(job.getId(), CronJobPatch.builder()
                    .payload(new SystemEvent("plain event"))
                    .build(), 100).data();
            assertEquals(new SystemEvent("plain event"), updated.getPayload());

            CronJob back = service.update(job.getId(), CronJobPatch.builder()
                    .payload(AgentTurn.of("fresh"))
                    .build(), 200).data();
            assertEquals(AgentTurn.of("fresh"), back.getPayload());
        }

        @Test
        void badPayloadPatch_leavesJobUnchanged() {
            CronJob job = create(everyMinute("stable"), 0);

            // Switching kinds without a message cannot be completed from the old payload
            CronResult<CronJob> result = service.update(job.getId(), CronJobPatch.builder()
                    .name("renamed")
                    .payload(new AgentTurn(null, "smart", null, null, null, null, null, null))
                    .build(), 100);

            assertEquals(CronErrorKind.VALIDATION, result.errorKind());
            assertEquals(job, stored(job.getId()));
        }

        @Test
        void badSchedulePatch_leavesJobUnchanged() {
            CronJob job = create(everyMinute("stable"), 0);

            CronResult<CronJob> result = service.update(job.getId(), CronJobPatch.builder()
                    .enabled(false)
                    .schedule(new Cron("0 9 * * *", "Nowhere/City"))
                    .build(), 100);

            assertEquals(CronErrorKind.SCHEDULE, result.errorKind());
            assertEquals(job, stored(job.getId()));
        }

        @Test
        void statePatchOverwritesGivenFields() {
            CronJob job = create(everyMinute("repair"), 0);

            CronJob updated = service.update(job.getId(), CronJobPatch.builder()
                    .state(CronJobState.builder().lastError("manual reset").lastStatus(RunStatus.SKIPPED).build())
                    .build(), 100).data();

            assertEquals("manual reset", updated.getState().getLastError());
            assertEquals(RunStatus.SKIPPED, updated.getState().getLastStatus());
            assertEquals(60_000L, updated.getState().getNextRunAtMs());
        }

        @Test
        void returnsNewValueWithoutTouchingPreviousSnapshot() {
            CronJob job = create(everyMinute("immutable"), 0);
            CronJob snapshot = stored(job.getId());

            service.update(job.getId(), CronJobPatch.builder().name("changed").enabled(false).build(), 100);

            assertEquals("immutable", snapshot.getName());
            assertTrue(snapshot.isEnabled());
            assertEquals(60_000L, snapshot.getState().getNextRunAtMs());
        }
    }

    // =========================================================================
    // remove / get / list
    // =========================================================================

    @Nested
    class RemoveAndRead {
        @Test
        void remove_reportsWhetherAnythingWasRemoved() {
            CronJob job = create(everyMinute("doomed"), 0);

            assertEquals(Boolean.TRUE, service.remove(job.getId()).data());
            assertEquals(Boolean.FALSE, service.remove(job.getId()).data());
            assertEquals(CronErrorKind.NOT_FOUND, service.get(job.getId()).errorKind());
        }

        @Test
        void remove_unknownId_doesNotWriteStore() throws IOException {
            create(everyMinute("keep"), 0);
            Files.writeString(storePath, Files.readString(storePath) + "\n");
            String before = Files.readString(storePath);

            assertEquals(Boolean.FALSE, service.remove("missing").data());
            assertEquals(before, Files.readString(storePath));
        }

        @Test
        void remove_onMissingStore_createsNothing() {
            assertEquals(Boolean.FALSE, service.remove("missing").data());
            assertFalse(Files.exists(storePath));
        }

        @Test
        void list_filtersDisabledAndSortsByNextRun() {
            CronJob late = create(oneShot("late", 90_000, false), 0);
            CronJob early = create(oneShot("early", 30_000, false), 0);
            CronJob off = create(everyMinute("off").toBuilder().enabled(false).build(), 0);

            List<String> enabled = service.list(false).data().stream().map(CronJob::getId).toList();
            assertEquals(List.of(early.getId(), late.getId()), enabled);

            List<String> all = service.list(true).data().stream().map(CronJob::getId).toList();
            assertEquals(List.of(off.getId(), early.getId(), late.getId()), all);
        }

        @Test
        void blankId_isValidationError() {
            assertEquals(CronErrorKind.VALIDATION, service.get(" ").errorKind());
            assertEquals(CronErrorKind.VALIDATION, service.remove(null).errorKind());
        }
    }

    // =========================================================================
    // markRunning / markCompleted
    // =========================================================================

    @Nested
    class RunBookkeeping {
        @Test
        void markRunning_unknownId_isNotFound() {
            assertEquals(CronErrorKind.NOT_FOUND, service.markRunning("missing", 0).errorKind());
            assertEquals(CronErrorKind.NOT_FOUND,
                    service.markCompleted("missing", RunOutcome.ok(1), 0).errorKind());
        }

        @Test
        void markRunning_isIdempotentAndRefreshesTimestamp() {
            CronJob job = create(everyMinute("dup"), 0);

            service.markRunning(job.getId(), 60_000);
            CronResult<CronJob> again = service.markRunning(job.getId(), 61_000);

            assertTrue(again.ok());
            assertEquals(61_000L, again.data().getState().getRunningAtMs());
        }

        @Test
        void runningJobStaysExcludedUntilCompleted() {
            CronJob job = create(everyMinute("busy"), 0);
            service.markRunning(job.getId(), 60_000);

            assertTrue(dueIds(60_000).isEmpty());
            assertTrue(dueIds(10_000_000).isEmpty());

            service.markCompleted(job.getId(), RunOutcome.ok(5), 60_005);
            assertTrue(dueIds(120_000).isEmpty());
            assertEquals(List.of(job.getId()), dueIds(120_005));
        }

        @Test
        void oneShotWithoutDelete_isDisabledAfterSuccess() {
            CronJob job = create(oneShot("once", 5000, false), 0);
            service.markRunning(job.getId(), 5000);

            CronJob completed = service.markCompleted(job.getId(), RunOutcome.ok(10), 5010).data();

            assertFalse(completed.isEnabled());
            assertNull(completed.getState().getNextRunAtMs());
            assertNull(completed.getState().getRunningAtMs());
            List<CronJob> all = service.list(true).data();
            assertEquals(1, all.size());
            assertFalse(all.get(0).isEnabled());
            assertNull(all.get(0).getState().getNextRunAtMs());
        }

        @Test
        void oneShotFailure_isNotConsumed() {
            CronJob job = create(oneShot("flaky", 5000, true), 0);

            CronJob completed = service.markCompleted(job.getId(), RunOutcome.error("network down", 20), 5020).data();

            assertTrue(completed.isEnabled());
            assertEquals(RunStatus.ERROR, completed.getState().getLastStatus());
            assertEquals("network down", completed.getState().getLastError());
            // The fire time has passed, so nothing further is scheduled
            assertNull(completed.getState().getNextRunAtMs());
            assertTrue(service.get(job.getId()).ok());
        }

        @Test
        void recurringFailure_isRescheduled() {
            CronJob job = create(everyMinute("retry"), 0);

            CronJob completed = service.markCompleted(job.getId(), RunOutcome.error("boom", 100), 61_000).data();

            assertEquals(RunStatus.ERROR, completed.getState().getLastStatus());
            assertEquals("boom", completed.getState().getLastError());
            assertEquals(121_000L, completed.getState().getNextRunAtMs());
        }

        @Test
        void skippedRun_isRecorded() {
            CronJob job = create(everyMinute("skip"), 0);

            CronJob completed = service.markCompleted(job.getId(),
                    new RunOutcome(RunStatus.SKIPPED, null, 0), 60_000).data();

            assertEquals(RunStatus.SKIPPED, completed.getState().getLastStatus());
            assertEquals(120_000L, completed.getState().getNextRunAtMs());
        }

        @Test
        void disabledJob_keepsNoNextRunAfterCompletion() {
            CronJob job = create(everyMinute("paused"), 0);
            service.markRunning(job.getId(), 60_000);
            service.update(job.getId(), CronJobPatch.builder().enabled(false).build(), 60_100);

            CronJob completed = service.markCompleted(job.getId(), RunOutcome.ok(200), 60_200).data();

            assertFalse(completed.isEnabled());
            assertNull(completed.getState().getNextRunAtMs());
            assertNull(completed.getState().getRunningAtMs());
        }

        @Test
        void delayedCompletion_restartsPeriodWithoutCatchUp() {
            CronJob job = create(everyMinute("slow"), 0);
            service.markRunning(job.getId(), 60_000);

            CronJob completed = service.markCompleted(job.getId(), RunOutcome.ok(600_000), 660_000).data();

            assertEquals(720_000L, completed.getState().getNextRunAtMs());
            assertEquals(List.of(), dueIds(700_000));
        }

        @Test
        void unusableStoredSchedule_isRecordedNotThrown() {
            CronJob broken = CronJob.builder()
                    .id("broken")
                    .enabled(true)
                    .schedule(new Cron("not a cron", null))
                    .payload(new SystemEvent("x"))
                    .state(CronJobState.builder().nextRunAtMs(1_000L).build())
                    .build();
            service.getStore().save(CronStoreFile.empty().withJobs(List.of(broken)));

            CronResult<CronJob> result = service.markCompleted("broken", RunOutcome.ok(1), 2_000);

            assertTrue(result.ok());
            assertNull(result.data().getState().getNextRunAtMs());
            assertTrue(result.data().getState().getLastError().contains("not a cron"));
        }

        @Test
        void invalidOutcome_isValidationError() {
            CronJob job = create(everyMinute("x"), 0);
            assertEquals(CronErrorKind.VALIDATION, service.markCompleted(job.getId(), null, 0).errorKind());
            assertEquals(CronErrorKind.VALIDATION,
                    service.markCompleted(job.getId(), new RunOutcome(null, null, 0), 0).errorKind());
            assertEquals(CronErrorKind.VALIDATION,
                    service.markCompleted(job.getId(), new RunOutcome(RunStatus.OK, null, -1), 0).errorKind());
        }
    }

    // =========================================================================
    // getStatus
    // =========================================================================

    @Nested
    class Status {
        @Test
        void emptyStore() {
            CronStatusSummary status = service.getStatus().data();
            assertTrue(status.isEnabled());
            assertEquals(0, status.getJobs());
            assertNull(status.getNextWakeAtMs());
            assertEquals(storePath.toAbsolutePath().normalize().toString(), status.getStorePath());
        }

        @Test
        void nextWakeIsEarliestEnabledNextRun() {
            create(oneShot("late", 90_000, false), 0);
            create(oneShot("early", 30_000, false), 0);
            CronJob off = create(oneShot("off", 10_000, false), 0);
            service.update(off.getId(), CronJobPatch.builder().enabled(false).build(), 1);

            CronStatusSummary status = service.getStatus().data();
            assertEquals(3, status.getJobs());
            assertEquals(30_000L, status.getNextWakeAtMs());
        }
    }

    // =========================================================================
    // Failure surfacing and concurrency
    // =========================================================================

    @Nested
    class FailuresAndConcurrency {
        @Test
        void corruptStore_isIoErrorForEveryOperation() throws IOException {
            Files.createDirectories(storePath.getParent());
            Files.writeString(storePath, "{ this is not json");

            assertEquals(CronErrorKind.IO, service.list(true).errorKind());
            assertEquals(CronErrorKind.IO, service.getDueJobs(0).errorKind());
            assertEquals(CronErrorKind.IO, service.getStatus().errorKind());
            assertEquals(CronErrorKind.IO, service.create(everyMinute("x"), 0).errorKind());
            assertEquals(CronErrorKind.IO, service.remove("x").errorKind());
            // The corrupt document is left for inspection
            assertEquals("{ this is not json", Files.readString(storePath));
        }

        @Test
        void heldLock_isLockTimeoutError() throws Exception {
            CronJob job = create(everyMinute("contended"), 0);
            CronService impatient = new CronService(new CronStore(storePath, new CronStoreOptions(100, 10)));
            CountDownLatch acquired = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            ExecutorService executor = Executors.newSingleThreadExecutor();
            try {
                executor.submit(() -> service.getStore().withLock(() -> {
                    acquired.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return null;
                }));
                assertTrue(acquired.await(5, TimeUnit.SECONDS));

                assertEquals(CronErrorKind.LOCK_TIMEOUT, impatient.markRunning(job.getId(), 1).errorKind());
                // Readers do not wait for the lock
                assertTrue(impatient.get(job.getId()).ok());
            } finally {
                release.countDown();
                executor.shutdownNow();
            }
        }

        @Test
        void concurrentWriters_loseNoUpdates() throws Exception {
            int writers = 4;
            int perWriter = 10;
            ExecutorService executor = Executors.newFixedThreadPool(writers);
            try {
                List<Future<Integer>> results = new ArrayList<>();
                for (int w = 0; w < writers; w++) {
                    CronService writer = new CronService(new CronStore(storePath));
                    String prefix = "w" + w + "-";
                    results.add(executor.submit(() -> {
                        int ok = 0;
                        for (int i = 0; i < perWriter; i++) {
                            if (writer.create(everyMinute(prefix + i), i).ok())
                                ok++;
                        }
                        return ok;
                    }));
                }
                for (Future<Integer> result : results) {
                    assertEquals(perWriter, result.get(30, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }

            assertEquals(writers * perWriter, service.list(true).data().size());
        }

        @Test
        void sharedService_concurrentThreads_loseNoUpdates() throws Exception {
            int threads = 6;
            int perThread = 10;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<Future<Integer>> results = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    String prefix = "t" + t + "-";
                    results.add(executor.submit(() -> {
                        start.await();
                        int ok = 0;
                        for (int i = 0; i < perThread; i++) {
                            if (service.create(everyMinute(prefix + i), i).ok())
                                ok++;
                        }
                        return ok;
                    }));
                }
                start.countDown();
                for (Future<Integer> result : results) {
                    assertEquals(perThread, result.get(30, TimeUnit.SECONDS));
                }
            } finally {
                executor.shutdownNow();
            }

            List<CronJob> jobs = service.list(true).data();
            assertEquals(threads * perThread, jobs.size());
            assertEquals(threads * perThread, jobs.stream().map(CronJob::getId).distinct().count());
        }

        @Test
        void writersInSeparateProcesses_loseNoUpdates() throws Exception {
            int perWriter = 15;
            List<Process> children = new ArrayList<>();
            List<Path> outputs = new ArrayList<>();
            try {
                for (int p = 0; p < 2; p++) {
                    Path output = tempDir.resolve("writer-" + p + ".out");
                    outputs.add(output);
                    children.add(cronWriter(output, "p" + p + "-", perWriter).start());
                }
                for (int i = 0; i < perWriter; i++) {
                    assertTrue(service.create(everyMinute("local-" + i), i).ok());
                }
                for (int p = 0; p < children.size(); p++) {
                    Process child = children.get(p);
                    assertTrue(child.waitFor(60, TimeUnit.SECONDS), "writer process did not finish");
                    String output = Files.readString(outputs.get(p));
                    assertEquals(0, child.exitValue(), output);
                    assertTrue(output.lines().anyMatch(("CREATED " + perWriter)::equals), output);
                }
            } finally {
                children.forEach(Process::destroyForcibly);
            }

            List<CronJob> jobs = service.list(true).data();
            assertEquals(3 * perWriter, jobs.size());
            assertEquals(3 * perWriter, jobs.stream().map(CronJob::getName).distinct().count());
        }

        private ProcessBuilder cronWriter(Path output, String prefix, int count) {
            String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
            return new ProcessBuilder(java, "-cp", System.getProperty("java.class.path"),
                    ExternalCronWriter.class.getName(), storePath.toString(), prefix, String.valueOf(count))
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile());
        }
    }
}
