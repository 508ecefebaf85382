package com.clapgrow.summary.common.group;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Recurring delivery schedule of a group summary.
 *
 * @param frequency daily or weekly
 * @param time      local time of day of the delivery (seconds are ignored)
 * @param dayOfWeek weekday of a weekly delivery; must be null for daily cadences
 */
public record Cadence(CadenceFrequency frequency, LocalTime time, DayOfWeek dayOfWeek) {

    public Cadence {
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(time, "time");
        if (frequency == CadenceFrequency.WEEKLY && dayOfWeek == null) {
            throw new IllegalArgumentException("Weekly cadence requires a day of week");
        }
        if (frequency == CadenceFrequency.DAILY && dayOfWeek != null) {
            throw new IllegalArgumentException("Daily cadence must not specify a day of week");
        }
        time = time.withSecond(0).withNano(0);
    }

    public static Cadence daily(LocalTime time) {
        return new Cadence(CadenceFrequency.DAILY, time, null);
    }

    public static Cadence weekly(DayOfWeek dayOfWeek, LocalTime time) {
        return new Cadence(CadenceFrequency.WEEKLY, time, dayOfWeek);
    }
}
