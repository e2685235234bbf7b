package com.clawcron.cron;

import com.clawcron.cron.CronTypes.CronJobCreate;
import com.clawcron.cron.CronTypes.CronJobPatch;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Cron job input normalization: coerces loosely typed maps (as received over
 * RPC or from a CLI) into typed create/patch values.
 */
public final class CronNormalize {

    private CronNormalize() {
    }

    private static final Set<String> SCHEDULE_KINDS = Set.of("at", "every", "cron");
    private static final Set<String> PAYLOAD_KINDS = Set.of("systemEvent", "agentTurn");

    public static final String DEFAULT_WAKE_MODE = "next-heartbeat";

    /**
     * Normalize a raw create map, apply defaults and convert it.
     *
     * @throws CronException.Validation      if the map cannot be converted
     * @throws CronException.InvalidSchedule if the schedule kind or time is unusable
     */
    public static CronJobCreate normalizeCreate(Map<String, Object> raw) {
        Map<String, Object> next = normalizeCommon(raw);

        if (!(next.get("enabled") instanceof Boolean)) {
            next.put("enabled", true);
        }
        if (!next.containsKey("wakeMode")) {
            next.put("wakeMode", DEFAULT_WAKE_MODE);
        }
        if (!next.containsKey("sessionTarget") && next.get("payload") instanceof Map<?, ?> payload) {
            next.put("sessionTarget", "agentTurn".equals(payload.get("kind")) ? "isolated" : "main");
        }
        if (!next.containsKey("deleteAfterRun") && next.get("schedule") instanceof Map<?, ?> schedule
                && "at".equals(schedule.get("kind"))) {
            next.put("deleteAfterRun", true);
        }
        return convert(next, CronJobCreate.class);
    }

    /**
     * Normalize a raw patch map. No defaults are applied.
     */
    public static CronJobPatch normalizePatch(Map<String, Object> raw) {
        return convert(normalizeCommon(raw), CronJobPatch.class);
    }

    // =========================================================================
    // Schedule / payload coercion
    // =========================================================================

    /**
     * Infer the schedule kind when missing and coerce times to epoch ms.
     */
    static Map<String, Object> coerceSchedule(Map<String, Object> schedule) {
        Map<String, Object> next = new LinkedHashMap<>(schedule);
        String kind = schedule.get("kind") instanceof String k ? k.trim() : null;

        if (kind == null || kind.isEmpty()) {
            if (schedule.containsKey("atMs") || schedule.containsKey("at")) {
                kind = "at";
            } else if (schedule.containsKey("everyMs") || schedule.containsKey("intervalMs")) {
                kind = "every";
            } else if (schedule.containsKey("expr") || schedule.containsKey("expression")) {
                kind = "cron";
            }
        }
        if (kind == null || !SCHEDULE_KINDS.contains(kind)) {
            throw new CronException.InvalidSchedule("unknown schedule kind: " + schedule.get("kind"));
        }
        next.put("kind", kind);

        if ("at".equals(kind)) {
            Object atMs = schedule.containsKey("atMs") ? schedule.get("atMs") : schedule.get("at");
            next.remove("at");
            if (atMs instanceof Number n) {
                next.put("atMs", n.longValue());
            } else if (atMs instanceof String s) {
                next.put("atMs", CronParse.requireAbsoluteTimeMs(s));
            } else {
                throw new CronException.InvalidSchedule("at schedule requires atMs");
            }
        } else if ("every".equals(kind)) {
            coerceLong(next, "everyMs");
            coerceLong(next, "intervalMs");
            coerceLong(next, "anchorMs");
        }
        return next;
    }

    /**
     * Infer the payload kind when missing and tidy delivery routing fields.
     */
    static Map<String, Object> coercePayload(Map<String, Object> payload) {
        Map<String, Object> next = new LinkedHashMap<>(payload);
        String kind = payload.get("kind") instanceof String k ? k.trim() : null;
        if (kind == null || kind.isEmpty()) {
            if (payload.get("message") instanceof String) {
                kind = "agentTurn";
            } else if (payload.get("text") instanceof String) {
                kind = "systemEvent";
            }
        }
        if (kind == null || !PAYLOAD_KINDS.contains(kind)) {
            throw new CronException.Validation("unknown payload kind: " + payload.get("kind"));
        }
        next.put("kind", kind);

        if (payload.get("channel") instanceof String ch) {
            String trimmed = ch.trim().toLowerCase(Locale.ROOT);
            if (trimmed.isEmpty())
                next.remove("channel");
            else
                next.put("channel", trimmed);
        }
        if (payload.get("to") instanceof String to) {
            String trimmed = to.trim();
            if (trimmed.isEmpty())
                next.remove("to");
            else
                next.put("to", trimmed);
        }
        return next;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    @SuppressWarnings("unchecked")
    private static Map<String, Object> normalizeCommon(Map<String, Object> raw) {
        if (raw == null) {
            throw new CronException.Validation("job input is required");
        }
        Map<String, Object> next = unwrapJob(raw);

        if (next.get("schedule") instanceof Map<?, ?> schedule) {
            next.put("schedule", coerceSchedule((Map<String, Object>) schedule));
        }
        if (next.get("payload") instanceof Map<?, ?> payload) {
            next.put("payload", coercePayload((Map<String, Object>) payload));
        }
        for (String key : new String[] { "name", "description", "agentId" }) {
            if (next.get(key) instanceof String s) {
                next.put(key, s.trim());
            }
        }
        return next;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> unwrapJob(Map<String, Object> raw) {
        if (raw.get("data") instanceof Map<?, ?> data) {
            return new LinkedHashMap<>((Map<String, Object>) data);
        }
        if (raw.get("job") instanceof Map<?, ?> job) {
            return new LinkedHashMap<>((Map<String, Object>) job);
        }
        return new LinkedHashMap<>(raw);
    }

    private static void coerceLong(Map<String, Object> map, String key) {
        if (map.get(key) instanceof String s) {
            try {
                map.put(key, Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                throw new CronException.InvalidSchedule(key + " must be a number: " + s);
            }
        }
    }

    private static <T> T convert(Map<String, Object> map, Class<T> type) {
        try {
            return CronStore.MAPPER.convertValue(map, type);
        } catch (IllegalArgumentException e) {
            throw new CronException.Validation("invalid job input: " + e.getMessage(), e);
        }
    }
}
