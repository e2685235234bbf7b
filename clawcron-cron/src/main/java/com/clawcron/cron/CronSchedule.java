package com.clawcron.cron;

import com.clawcron.cron.CronTypes.At;
import com.clawcron.cron.CronTypes.Cron;
import com.clawcron.cron.CronTypes.Every;
import com.clawcron.cron.CronTypes.Schedule;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.function.Function;

/**
 * Next-fire-time computation for the three schedule kinds.
 *
 * <p>
 * Pure: the reference time is always an explicit argument, and every result is
 * strictly later than it.
 * </p>
 */
public final class CronSchedule {

    private CronSchedule() {
    }

    private static final CronParser UNIX_PARSER = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS_PARSER = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    /** Bound on re-queries when the library answers with a non-future instant. */
    private static final int MAX_CRON_STEPS = 4;

    /**
     * Compute the next fire time strictly after {@code referenceTimeMs}.
     *
     * @return epoch ms, or null when the schedule will never fire again
     * @throws CronException.InvalidSchedule if the schedule cannot be evaluated
     */
    public static Long computeNextRunAtMs(Schedule schedule, long referenceTimeMs) {
        if (schedule == null) {
            throw new CronException.InvalidSchedule("schedule is required");
        }
        if (schedule instanceof At at) {
            return at.atMs() > referenceTimeMs ? at.atMs() : null;
        }
        if (schedule instanceof Every every) {
            return nextEvery(every, referenceTimeMs);
        }
        return nextCron((Cron) schedule, referenceTimeMs);
    }

    /**
     * Structural validation used before a schedule is stored.
     *
     * @throws CronException.InvalidSchedule on the first problem found
     */
    public static void validate(Schedule schedule) {
        if (schedule == null) {
            throw new CronException.InvalidSchedule("schedule is required");
        }
        if (schedule instanceof At at) {
            if (at.atMs() <= 0)
                throw new CronException.InvalidSchedule("at schedule requires a positive atMs");
        } else if (schedule instanceof Every every) {
            if (every.intervalMs() <= 0)
                throw new CronException.InvalidSchedule("every schedule requires a positive interval");
            if (every.anchorMs() != null && every.anchorMs() < 0)
                throw new CronException.InvalidSchedule("every schedule anchor must not be negative");
        } else {
            Cron cron = (Cron) schedule;
            resolveZone(cron.timezone());
            parseExpression(cron.expression());
        }
    }

    // =========================================================================
    // every
    // =========================================================================

    private static Long nextEvery(Every every, long referenceTimeMs) {
        long interval = every.intervalMs();
        if (interval <= 0) {
            throw new CronException.InvalidSchedule("every schedule requires a positive interval");
        }
        long anchor = every.anchorMs() != null ? every.anchorMs() : referenceTimeMs;
        if (referenceTimeMs < anchor) {
            return anchor;
        }
        long steps = (referenceTimeMs - anchor) / interval + 1;
        try {
            return Math.addExact(anchor, Math.multiplyExact(steps, interval));
        } catch (ArithmeticException e) {
            throw new CronException.InvalidSchedule("every schedule overflows the time range", e);
        }
    }

    // =========================================================================
    // cron
    // =========================================================================

    private static Long nextCron(Cron cron, long referenceTimeMs) {
        ZoneId zone = resolveZone(cron.timezone());
        ExecutionTime executionTime = ExecutionTime.forCron(parseExpression(cron.expression()));
        return firstAfter(executionTime::nextExecution, Instant.ofEpochMilli(referenceTimeMs).atZone(zone),
                referenceTimeMs, cron.expression());
    }

    /**
     * First instant produced by {@code next} that is strictly after
     * {@code referenceTimeMs}, re-querying from just past each stale answer.
     *
     * @return epoch ms, or null when {@code next} has no further execution
     * @throws CronException.InvalidSchedule if the answers never move past the
     *                                       reference time
     */
    static Long firstAfter(Function<ZonedDateTime, Optional<ZonedDateTime>> next, ZonedDateTime cursor,
            long referenceTimeMs, String expression) {
        for (int i = 0; i < MAX_CRON_STEPS; i++) {
            Optional<ZonedDateTime> candidate = next.apply(cursor);
            if (candidate.isEmpty()) {
                return null;
            }
            long candidateMs = candidate.get().toInstant().toEpochMilli();
            if (candidateMs > referenceTimeMs) {
                return candidateMs;
            }
            cursor = candidate.get().plusSeconds(1);
        }
        throw new CronException.InvalidSchedule("cron expression '" + expression
                + "' did not advance past " + Instant.ofEpochMilli(referenceTimeMs));
    }

    static com.cronutils.model.Cron parseExpression(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new CronException.InvalidSchedule("cron expression is required");
        }
        int fields = expr.split("\\s+").length;
        CronParser parser = switch (fields) {
            case 5 -> UNIX_PARSER;
            case 6 -> SECONDS_PARSER;
            default -> throw new CronException.InvalidSchedule(
                    "cron expression must have 5 or 6 fields: " + expr);
        };
        try {
            com.cronutils.model.Cron parsed = parser.parse(expr);
            parsed.validate();
            return parsed;
        } catch (IllegalArgumentException e) {
            throw new CronException.InvalidSchedule("invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new CronException.InvalidSchedule("unknown timezone: " + timezone, e);
        }
    }
}
