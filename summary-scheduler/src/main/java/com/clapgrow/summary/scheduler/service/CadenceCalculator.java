package com.clapgrow.summary.scheduler.service;

import com.clapgrow.summary.common.group.Cadence;

import java.time.LocalDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Computes regular delivery slots from a cadence.
 */
public final class CadenceCalculator {

    private CadenceCalculator() {
    }

    /**
     * First slot of the cadence strictly after {@code from}.
     *
     * <ul>
     *   <li>DAILY: today at the configured time if that is still ahead, otherwise tomorrow</li>
     *   <li>WEEKLY: the configured weekday at the configured time, this week if still ahead,
     *       otherwise next week</li>
     * </ul>
     */
    public static LocalDateTime computeNextRegularRun(Cadence cadence, LocalDateTime from) {
        return switch (cadence.frequency()) {
            case DAILY -> {
                LocalDateTime candidate = from.toLocalDate().atTime(cadence.time());
                yield candidate.isAfter(from) ? candidate : candidate.plusDays(1);
            }
            case WEEKLY -> {
                LocalDateTime candidate = from.toLocalDate()
                    .with(TemporalAdjusters.nextOrSame(cadence.dayOfWeek()))
                    .atTime(cadence.time());
                yield candidate.isAfter(from) ? candidate : candidate.plusWeeks(1);
            }
        };
    }
}
