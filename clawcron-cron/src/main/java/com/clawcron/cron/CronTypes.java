package com.clawcron.cron;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;
import java.util.Map;

/**
 * Cron job type definitions: schedule and payload variants, job state, and
 * create/patch inputs.
 *
 * <p>
 * Every type here is immutable. Mutations go through {@code toBuilder()} and
 * produce a new value.
 * </p>
 */
public final class CronTypes {

    private CronTypes() {
    }

    // =========================================================================
    // Schedule
    // =========================================================================

    /**
     * When a job fires. Serialized with a {@code kind} discriminator.
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = At.class, name = "at"),
            @JsonSubTypes.Type(value = Every.class, name = "every"),
            @JsonSubTypes.Type(value = Cron.class, name = "cron")
    })
    public sealed interface Schedule permits At, Every, Cron {
    }

    /** Fires exactly once at {@code atMs}. */
    public record At(@JsonProperty("atMs") long atMs) implements Schedule {
    }

    /** Fires every {@code intervalMs}, phase-aligned to {@code anchorMs}. */
    public record Every(
            @JsonProperty("everyMs") @JsonAlias("intervalMs") long intervalMs,
            @JsonProperty("anchorMs") Long anchorMs) implements Schedule {
    }

    /** Calendar recurrence; {@code timezone} is an IANA zone id, UTC when absent. */
    public record Cron(
            @JsonProperty("expr") @JsonAlias("expression") String expression,
            @JsonProperty("tz") @JsonAlias("timezone") String timezone) implements Schedule {
    }

    // =========================================================================
    // Payload
    // =========================================================================

    /**
     * What the external executor should do when the job fires. Opaque to the
     * scheduler beyond validation and patch merging.
     */
    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
    @JsonSubTypes({
            @JsonSubTypes.Type(value = SystemEvent.class, name = "systemEvent"),
            @JsonSubTypes.Type(value = AgentTurn.class, name = "agentTurn")
    })
    public sealed interface Payload permits SystemEvent, AgentTurn {
    }

    public record SystemEvent(String text) implements Payload {
    }

    public record AgentTurn(
            String message,
            String model,
            String thinking,
            Integer timeoutSeconds,
            Boolean deliver,
            String channel,
            String to,
            Boolean bestEffortDeliver) implements Payload {

        static final AgentTurn EMPTY = new AgentTurn(null, null, null, null, null, null, null, null);

        public static AgentTurn of(String message) {
            return new AgentTurn(message, null, null, null, null, null, null, null);
        }
    }

    // =========================================================================
    // Run status
    // =========================================================================

    public enum RunStatus {
        OK, ERROR, SKIPPED;

        @JsonValue
        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static RunStatus fromKey(String key) {
            if (key == null)
                return null;
            for (RunStatus status : values()) {
                if (status.key().equalsIgnoreCase(key.trim()))
                    return status;
            }
            throw new IllegalArgumentException("unknown run status: " + key);
        }
    }

    /**
     * What the executor reports back after running a job.
     */
    public record RunOutcome(RunStatus status, String error, long durationMs) {

        public static RunOutcome ok(long durationMs) {
            return new RunOutcome(RunStatus.OK, null, durationMs);
        }

        public static RunOutcome error(String error, long durationMs) {
            return new RunOutcome(RunStatus.ERROR, error, durationMs);
        }
    }

    // =========================================================================
    // Job state
    // =========================================================================

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class CronJobState {
        Long nextRunAtMs;
        Long runningAtMs;
        Long lastRunAtMs;
        RunStatus lastStatus;
        String lastError;
        Long lastDurationMs;

        public static CronJobState empty() {
            return CronJobState.builder().build();
        }

        /**
         * Layer the non-null fields of {@code overrides} on top of this state.
         */
        public CronJobState overlay(CronJobState overrides) {
            if (overrides == null)
                return this;
            CronJobStateBuilder next = toBuilder();
            if (overrides.nextRunAtMs != null)
                next.nextRunAtMs(overrides.nextRunAtMs);
            if (overrides.runningAtMs != null)
                next.runningAtMs(overrides.runningAtMs);
            if (overrides.lastRunAtMs != null)
                next.lastRunAtMs(overrides.lastRunAtMs);
            if (overrides.lastStatus != null)
                next.lastStatus(overrides.lastStatus);
            if (overrides.lastError != null)
                next.lastError(overrides.lastError);
            if (overrides.lastDurationMs != null)
                next.lastDurationMs(overrides.lastDurationMs);
            return next.build();
        }
    }

    // =========================================================================
    // Create/Patch inputs
    // =========================================================================

    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class CronJobCreate {
        String name;
        String description;
        /** Defaults to true when absent. */
        Boolean enabled;
        Boolean deleteAfterRun;
        Schedule schedule;
        Payload payload;
        String sessionTarget;
        String wakeMode;
        String agentId;
        Map<String, Object> isolation;
        /** Initial state fields layered over the computed state. */
        CronJobState state;
    }

    /**
     * Partial update. Null fields are left untouched.
     */
    @Value
    @Builder(toBuilder = true)
    @Jacksonized
    public static class CronJobPatch {
        String name;
        String description;
        Boolean enabled;
        Boolean deleteAfterRun;
        Schedule schedule;
        Payload payload;
        String sessionTarget;
        String wakeMode;
        String agentId;
        Map<String, Object> isolation;
        CronJobState state;
    }

    // =========================================================================
    // Status
    // =========================================================================

    /**
     * Store summary for an external poller deciding when to recheck.
     */
    @Value
    @Builder
    public static class CronStatusSummary {
        boolean enabled;
        String storePath;
        int jobs;
        Long nextWakeAtMs;
    }
}
