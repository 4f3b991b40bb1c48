package io.jobvisor.core;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * A wall-clock time in a specific zone, e.g. "12:45 am pst".
 */
public record TimeOfDay(LocalTime time, ZoneId zone) {

    public TimeOfDay {
        Objects.requireNonNull(time, "time must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
    }

    /**
     * This time of day on the given local date. Gaps and overlaps are resolved by {@link ZonedDateTime#of}.
     */
    public ZonedDateTime on(LocalDate date) {
        return ZonedDateTime.of(date, time, zone);
    }
}
