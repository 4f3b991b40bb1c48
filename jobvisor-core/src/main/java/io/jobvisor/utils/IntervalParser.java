package io.jobvisor.utils;

import io.jobvisor.core.JobSpec;
import io.jobvisor.core.TimeOfDay;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses schedule expressions and evaluates them against the clock.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Frequencies: "7 m", "1h", "30 s", "2 hours"</li>
 *   <li>Times of day: "12:45 am pst", "9 pm", "21:30", "06:00 Europe/Berlin"</li>
 *   <li>Days: "Mon", "tuesday", "SAT"</li>
 * </ul>
 * <p>
 * Recurring triggers are day-scoped: the chain {@code start, start + freq, ...} ends at local
 * midnight (or at the stop time) and restarts from the start time on the next allowed day, so drift
 * never carries over from one day to the next.
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    private static final Pattern FREQUENCY = Pattern.compile("^(\\d+)\\s*([a-z]+)$");
    private static final Pattern TIME_OF_DAY = Pattern.compile(
            "^(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?(?:\\s+(\\S+))?$", Pattern.CASE_INSENSITIVE);

    // US abbreviations resolve to the region so daylight saving is followed.
    private static final Map<String, String> ZONE_ABBREVIATIONS = Map.ofEntries(
            Map.entry("pst", "America/Los_Angeles"),
            Map.entry("pdt", "America/Los_Angeles"),
            Map.entry("pt", "America/Los_Angeles"),
            Map.entry("mst", "America/Denver"),
            Map.entry("mdt", "America/Denver"),
            Map.entry("mt", "America/Denver"),
            Map.entry("cst", "America/Chicago"),
            Map.entry("cdt", "America/Chicago"),
            Map.entry("ct", "America/Chicago"),
            Map.entry("est", "America/New_York"),
            Map.entry("edt", "America/New_York"),
            Map.entry("et", "America/New_York"),
            Map.entry("utc", "UTC"),
            Map.entry("gmt", "UTC"),
            Map.entry("z", "UTC")
    );

    /**
     * Parse a frequency such as {@code "7 m"} or {@code "1h"}.
     */
    public static Duration parseFrequency(String spec) {
        if (spec == null) {
            throw new IllegalArgumentException("frequency must not be null");
        }
        String s = spec.trim().toLowerCase(Locale.ROOT);
        Matcher m = FREQUENCY.matcher(s);
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid frequency '" + spec + "'. Expected '<integer> <unit>' with unit s, m or h");
        }

        long n;
        try {
            n = Long.parseLong(m.group(1));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Frequency out of range: " + spec);
        }
        if (n <= 0) {
            throw new IllegalArgumentException("Frequency must be positive: " + spec);
        }

        return switch (m.group(2)) {
            case "s", "sec", "secs", "second", "seconds" -> Duration.ofSeconds(n);
            case "m", "min", "mins", "minute", "minutes" -> Duration.ofMinutes(n);
            case "h", "hr", "hrs", "hour", "hours" -> Duration.ofHours(n);
            default -> throw new IllegalArgumentException("Unsupported frequency unit '" + m.group(2) + "' in: " + spec);
        };
    }

    /**
     * Parse a time of day such as {@code "12:45 am pst"}.
     *
     * @param defaultZone zone used when the expression carries none
     */
    public static TimeOfDay parseTimeOfDay(String spec, ZoneId defaultZone) {
        Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("time of day must not be blank");
        }
        Matcher m = TIME_OF_DAY.matcher(spec.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Invalid time of day '" + spec + "'. Expected 'HH:MM am|pm <timezone>' or 'HH:MM'");
        }

        int hour = Integer.parseInt(m.group(1));
        int minute = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        String meridiem = m.group(3) == null ? null : m.group(3).toLowerCase(Locale.ROOT);

        if (meridiem == null && m.group(2) == null) {
            throw new IllegalArgumentException("Ambiguous time of day '" + spec + "'. Add minutes or am/pm");
        }
        if (minute > 59) {
            throw new IllegalArgumentException("Invalid minutes in time of day: " + spec);
        }
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                throw new IllegalArgumentException("Hour must be 1-12 with am/pm: " + spec);
            }
            if (meridiem.equals("pm") && hour != 12) {
                hour += 12;
            } else if (meridiem.equals("am") && hour == 12) {
                hour = 0;
            }
        } else if (hour > 23) {
            throw new IllegalArgumentException("Hour must be 0-23: " + spec);
        }

        ZoneId zone = m.group(4) == null ? defaultZone : resolveZone(m.group(4));
        return new TimeOfDay(LocalTime.of(hour, minute), zone);
    }

    /**
     * Resolve a timezone abbreviation ("pst", "utc") or an IANA zone id.
     */
    public static ZoneId resolveZone(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("timezone must not be blank");
        }
        String mapped = ZONE_ABBREVIATIONS.get(token.trim().toLowerCase(Locale.ROOT));
        try {
            return ZoneId.of(mapped != null ? mapped : token.trim());
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Unknown timezone: " + token);
        }
    }

    public static Set<DayOfWeek> parseDays(Collection<String> days) {
        Set<DayOfWeek> parsed = EnumSet.noneOf(DayOfWeek.class);
        if (days == null) {
            return parsed;
        }
        for (String day : days) {
            parsed.add(parseDay(day));
        }
        return parsed;
    }

    private static DayOfWeek parseDay(String day) {
        if (day == null || day.isBlank()) {
            throw new IllegalArgumentException("day must not be blank");
        }
        String d = day.trim().toLowerCase(Locale.ROOT);
        for (DayOfWeek candidate : DayOfWeek.values()) {
            String full = candidate.name().toLowerCase(Locale.ROOT);
            if (d.equals(full) || (d.length() >= 3 && full.startsWith(d))) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown day: " + day);
    }

    /**
     * Computes the next clock occurrence of a job.
     *
     * <p>Occurrences on an allowed local date D are {@code start(D) + k * frequency} (k &ge; 0) that fall
     * before the next local midnight and not after {@code stop(D)} when a stop time is set.
     * Without a frequency only {@code start(D)} occurs.
     *
     * @param from      reference instant
     * @param inclusive whether an occurrence exactly at {@code from} counts
     * @return the next occurrence, or {@code null} when the job has no clock trigger
     */
    public static Instant nextOccurrence(JobSpec spec, Instant from, boolean inclusive) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(from, "from must not be null");
        TimeOfDay start = spec.startTime();
        if (start == null) {
            return null;
        }

        LocalDate date = from.atZone(start.zone()).toLocalDate();
        // a week plus one day always reaches an allowed date
        for (int i = 0; i <= 8; i++) {
            LocalDate candidateDate = date.plusDays(i);
            if (!spec.allowsDay(candidateDate.getDayOfWeek())) {
                continue;
            }
            Instant occurrence = occurrenceOn(spec, candidateDate, from, inclusive);
            if (occurrence != null) {
                return occurrence;
            }
        }
        return null;
    }

    private static Instant occurrenceOn(JobSpec spec, LocalDate date, Instant from, boolean inclusive) {
        TimeOfDay start = spec.startTime();
        Instant first = start.on(date).toInstant();
        Instant endOfDay = date.plusDays(1).atStartOfDay(start.zone()).toInstant();
        // a stop at or before the start belongs to a window wrapping past midnight, not to this chain
        Instant stop = spec.stopTime() == null || !spec.stopTime().time().isAfter(start.time())
                ? null
                : ZonedDateTime.of(date, spec.stopTime().time(), start.zone()).toInstant();

        Instant candidate;
        if (reaches(first, from, inclusive)) {
            candidate = first;
        } else if (spec.frequency() == null) {
            return null;
        } else {
            Duration frequency = spec.frequency();
            long steps = Duration.between(first, from).toNanos() / frequency.toNanos();
            candidate = first.plus(frequency.multipliedBy(steps));
            if (!reaches(candidate, from, inclusive)) {
                candidate = candidate.plus(frequency);
            }
        }

        if (!candidate.isBefore(endOfDay)) {
            return null;
        }
        if (stop != null && candidate.isAfter(stop)) {
            return null;
        }
        return candidate;
    }

    private static boolean reaches(Instant candidate, Instant from, boolean inclusive) {
        return inclusive ? !candidate.isBefore(from) : candidate.isAfter(from);
    }

    /**
     * Whether {@code now} lies inside a program's run window.
     *
     * <p>The window is {@code [start, stop)} in the start time's zone; a missing start means midnight and a
     * missing stop means end of day. A stop earlier than the start wraps over midnight, and the allowed-day
     * check then applies to the day the window opened.
     */
    public static boolean withinWindow(JobSpec spec, Instant now) {
        Objects.requireNonNull(spec, "spec must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (!spec.hasWindow()) {
            return spec.days().isEmpty() || spec.allowsDay(now.atZone(ZoneId.systemDefault()).getDayOfWeek());
        }

        ZoneId zone = spec.startTime() != null ? spec.startTime().zone() : spec.stopTime().zone();
        ZonedDateTime local = now.atZone(zone);
        LocalTime t = local.toLocalTime();
        LocalTime opens = spec.startTime() == null ? LocalTime.MIDNIGHT : spec.startTime().time();
        LocalTime closes = spec.stopTime() == null ? null : spec.stopTime().time();

        if (closes == null || closes.isAfter(opens)) {
            boolean inside = !t.isBefore(opens) && (closes == null || t.isBefore(closes));
            return inside && spec.allowsDay(local.getDayOfWeek());
        }
        if (closes.equals(opens)) {
            return spec.allowsDay(local.getDayOfWeek());
        }
        if (!t.isBefore(opens)) {
            return spec.allowsDay(local.getDayOfWeek());
        }
        if (t.isBefore(closes)) {
            return spec.allowsDay(local.getDayOfWeek().minus(1));
        }
        return false;
    }
}
