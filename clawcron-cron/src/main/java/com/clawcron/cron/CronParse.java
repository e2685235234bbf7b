package com.clawcron.cron;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Absolute time parsing for one-shot schedules entered by hand.
 */
public final class CronParse {

    private CronParse() {
    }

    private static final Pattern EPOCH_MS = Pattern.compile("^\\d+$");
    private static final Pattern DATE_ONLY = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");
    private static final Pattern LOCAL_DATE_TIME = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T");
    private static final Pattern ZONE_SUFFIX = Pattern.compile("([Zz]|[+-]\\d{2}:?\\d{2})$");
    private static final Pattern COMPACT_OFFSET = Pattern.compile("([+-]\\d{2})(\\d{2})$");

    /**
     * Give an ISO date or date-time an explicit offset. Dates become midnight
     * UTC, zone-less date-times are read as UTC, and a compact {@code +0800}
     * offset gains its colon. Anything else is returned unchanged.
     */
    static String normalizeUtcIso(String raw) {
        if (DATE_ONLY.matcher(raw).matches())
            return raw + "T00:00:00Z";
        if (ZONE_SUFFIX.matcher(raw).find())
            return COMPACT_OFFSET.matcher(raw).replaceFirst("$1:$2");
        return LOCAL_DATE_TIME.matcher(raw).find() ? raw + "Z" : raw;
    }

    /**
     * Epoch milliseconds for a positive epoch-ms string or an ISO-8601 date or
     * date-time (offset optional).
     *
     * @return epoch milliseconds, or null if the input is blank or unparseable
     */
    public static Long parseAbsoluteTimeMs(String input) {
        String raw = input == null ? "" : input.trim();
        if (raw.isEmpty())
            return null;
        if (EPOCH_MS.matcher(raw).matches())
            return positiveEpochMs(raw);
        try {
            return OffsetDateTime.parse(normalizeUtcIso(raw)).toInstant().toEpochMilli();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /**
     * Like {@link #parseAbsoluteTimeMs(String)} but fails with a schedule error.
     */
    public static long requireAbsoluteTimeMs(String input) {
        Long parsed = parseAbsoluteTimeMs(input);
        if (parsed == null) {
            throw new CronException.InvalidSchedule("invalid absolute time: " + input);
        }
        return parsed;
    }

    private static Long positiveEpochMs(String digits) {
        try {
            long ms = Long.parseLong(digits);
            return ms > 0 ? ms : null;
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return null;
        }
    }
}
