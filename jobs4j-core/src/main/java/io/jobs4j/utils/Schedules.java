package io.jobs4j.utils;

import java.text.ParseException;
import java.time.*;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

import org.quartz.CronExpression;

/**
 * Schedule arithmetic for system jobs.
 * <p>
 * Supported schedule specs:
 * <ul>
 *   <li>Numeric seconds: "30"</li>
 *   <li>Human-readable intervals: "5 minutes", "1 day 3 hours", "15m"</li>
 *   <li>Cron expressions, 5 or 6 fields: "0 2 * * *", "0 *&#47;10 * * * *"</li>
 *   <li>Daily time of day: "AT 09:00"</li>
 * </ul>
 * <p>
 * Interval boundaries are aligned to the epoch, so every scheduler replica derives the same
 * due boundary for the same instant no matter when it started. Cron and "AT" schedules are
 * calendar based and evaluated in the schedule timezone.
 */
public final class Schedules {

    private static final String AT_PREFIX = "AT ";
    private static final int MAX_CATCH_UP_STEPS = 100_000;

    public enum Kind {
        INTERVAL,
        CRON,
        TIME_OF_DAY
    }

    private Schedules() {
    }

    /**
     * Classify a schedule spec. Throws {@link IllegalArgumentException} when it is none of the
     * supported formats.
     */
    public static Kind kindOf(String spec) {
        String s = requireSpec(spec);
        if (s.startsWith(AT_PREFIX)) {
            parseTimeOfDay(s);
            return Kind.TIME_OF_DAY;
        }
        if (s.matches("^\\d+$")) {
            intervalMillis(s);
            return Kind.INTERVAL;
        }
        if (looksLikeCron(s)) {
            return Kind.CRON;
        }
        if (intervalMillis(s) == 0) {
            throw new IllegalArgumentException("Interval must be positive: " + spec);
        }
        return Kind.INTERVAL;
    }

    /**
     * Validate a schedule spec together with its timezone.
     */
    public static void validate(String spec, String timezone) {
        kindOf(spec);
        zoneOf(timezone, true);
    }

    /**
     * First boundary strictly after {@code after}.
     */
    public static Instant nextBoundaryAfter(String spec, String timezone, Instant after) {
        Objects.requireNonNull(after, "after must not be null");
        String s = requireSpec(spec);
        ZoneId zone = zoneOf(timezone, false);

        return switch (kindOf(s)) {
            case INTERVAL -> {
                long period = intervalMillis(s);
                long slot = Math.floorDiv(after.toEpochMilli(), period);
                yield Instant.ofEpochMilli((slot + 1) * period);
            }
            case TIME_OF_DAY -> {
                LocalTime lt = parseTimeOfDay(s);
                ZonedDateTime base = ZonedDateTime.ofInstant(after, zone);
                ZonedDateTime candidate = base.with(lt);
                if (!candidate.isAfter(base)) {
                    candidate = candidate.plusDays(1);
                }
                yield candidate.toInstant();
            }
            case CRON -> nextCronTime(normalizeCron(s), zone, after);
        };
    }

    /**
     * Latest boundary that lies in {@code (since, now]}, or {@code null} when none was crossed.
     *
     * <p>Missed boundaries collapse into the latest one: a scheduler that was down for three
     * periods enqueues one run, not three.
     *
     * @param since last boundary already handled (exclusive)
     * @param now   current time (inclusive)
     */
    public static Instant latestDueBoundary(String spec, String timezone, Instant since, Instant now) {
        Objects.requireNonNull(since, "since must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (!now.isAfter(since)) {
            return null;
        }

        if (kindOf(spec) == Kind.INTERVAL) {
            long period = intervalMillis(spec.trim());
            Instant latest = Instant.ofEpochMilli(Math.floorDiv(now.toEpochMilli(), period) * period);
            return latest.isAfter(since) ? latest : null;
        }

        Instant boundary = nextBoundaryAfter(spec, timezone, since);
        if (boundary.isAfter(now)) {
            return null;
        }
        for (int i = 0; i < MAX_CATCH_UP_STEPS; i++) {
            Instant next = nextBoundaryAfter(spec, timezone, boundary);
            if (next.isAfter(now)) {
                return boundary;
            }
            boundary = next;
        }
        return boundary;
    }

    /**
     * Normalize cron expressions into Quartz syntax:
     * - Accepts 6-field Spring cron.
     * - Accepts 5-field cron by prepending seconds "0".
     * - Fills the Quartz '?' placeholder into day-of-month or day-of-week.
     */
    public static String normalizeCron(String spec) {
        String s = requireSpec(spec);

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("?".equals(dom) || "?".equals(dow)) {
            return String.join(" ", sec, min, hour, dom, month, dow);
        }
        if ("*".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom)) {
            dom = "?";
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Returns true if the string can be parsed as a Quartz {@link CronExpression}.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    private static Instant nextCronTime(String cron, ZoneId zone, Instant after) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date nextDate = exp.getNextValidTimeAfter(Date.from(after));
        if (nextDate == null) {
            throw new IllegalArgumentException("Cron expression produced no next execution time: " + cron);
        }
        return nextDate.toInstant();
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = Long.parseLong(digits);
            if (n <= 0) {
                throw new IllegalArgumentException("Interval must be positive: " + input);
            }
            return switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(Math.multiplyExact(7L, n));
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(ChronoUnit.WEEKS.getDuration().toSeconds(), n));
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(ChronoUnit.DAYS.getDuration().toSeconds(), n));
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(ChronoUnit.HOURS.getDuration().toSeconds(), n));
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(ChronoUnit.MINUTES.getDuration().toSeconds(), n));
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds = Math.addExact(totalSeconds, n);
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        if (totalSeconds <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return Duration.ofSeconds(totalSeconds);
    }

    /* ================= helper ================= */

    /**
     * Interval length in milliseconds; intervals that do not fit in a {@code long} are rejected.
     */
    private static long intervalMillis(String s) {
        try {
            return parseHumanDuration(s).toMillis();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Interval is too large: " + s, e);
        }
    }

    private static String requireSpec(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("spec must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("spec must not be empty");
        }
        return s;
    }

    private static LocalTime parseTimeOfDay(String spec) {
        String timeOfDay = spec.substring(AT_PREFIX.length()).trim();
        try {
            return LocalTime.parse(timeOfDay);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Invalid timeOfDay. Expected HH:mm or HH:mm:ss: " + timeOfDay, ex);
        }
    }

    private static ZoneId zoneOf(String timezone, boolean strict) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            if (strict) {
                throw new IllegalArgumentException("Invalid timezone: " + timezone, e);
            }
            return ZoneOffset.UTC;
        }
    }
}
