package com.clawcron.cron;

import com.clawcron.cron.CronTypes.CronJobState;
import com.clawcron.cron.CronTypes.Payload;
import com.clawcron.cron.CronTypes.Schedule;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Scheduled job definition plus its execution state.
 *
 * <p>
 * Routing metadata ({@code sessionTarget}, {@code wakeMode}, {@code agentId},
 * {@code isolation}) belongs to the executor and is stored verbatim.
 * </p>
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CronJob {
    String id;
    String name;
    String description;
    boolean enabled;
    boolean deleteAfterRun;
    Schedule schedule;
    Payload payload;

    String sessionTarget;
    String wakeMode;
    String agentId;
    Map<String, Object> isolation;

    long createdAtMs;
    long updatedAtMs;

    @Builder.Default
    CronJobState state = CronJobState.empty();

    @JsonIgnore
    public boolean isOneShot() {
        return schedule instanceof CronTypes.At;
    }

    @JsonIgnore
    public boolean isRunning() {
        return state != null && state.getRunningAtMs() != null;
    }
}
