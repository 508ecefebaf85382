package com.clapgrow.summary.scheduler.service;

import com.clapgrow.summary.common.group.Cadence;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class CadenceCalculatorTest {

    private static final Cadence DAILY_20 = Cadence.daily(LocalTime.of(20, 0));

    @Test
    void testDaily_BeforeTime_SameDay() {
        assertEquals(LocalDateTime.of(2024, 5, 1, 20, 0),
            CadenceCalculator.computeNextRegularRun(DAILY_20, LocalDateTime.of(2024, 5, 1, 19, 0)));
    }

    @Test
    void testDaily_AfterTime_NextDay() {
        assertEquals(LocalDateTime.of(2024, 5, 2, 20, 0),
            CadenceCalculator.computeNextRegularRun(DAILY_20, LocalDateTime.of(2024, 5, 1, 20, 1)));
    }

    @Test
    void testDaily_ExactlyAtTime_NextDay() {
        assertEquals(LocalDateTime.of(2024, 5, 2, 20, 0),
            CadenceCalculator.computeNextRegularRun(DAILY_20, LocalDateTime.of(2024, 5, 1, 20, 0)));
    }

    @Test
    void testDaily_AcrossMonthEnd() {
        assertEquals(LocalDateTime.of(2024, 6, 1, 20, 0),
            CadenceCalculator.computeNextRegularRun(DAILY_20, LocalDateTime.of(2024, 5, 31, 21, 30)));
    }

    @Test
    void testWeekly_LaterThisWeek() {
        // 2024-05-01 is a Wednesday
        Cadence fridayMorning = Cadence.weekly(DayOfWeek.FRIDAY, LocalTime.of(9, 30));

        assertEquals(LocalDateTime.of(2024, 5, 3, 9, 30),
            CadenceCalculator.computeNextRegularRun(fridayMorning, LocalDateTime.of(2024, 5, 1, 12, 0)));
    }

    @Test
    void testWeekly_SameDayBeforeTime_Today() {
        Cadence wednesdayEvening = Cadence.weekly(DayOfWeek.WEDNESDAY, LocalTime.of(18, 0));

        assertEquals(LocalDateTime.of(2024, 5, 1, 18, 0),
            CadenceCalculator.computeNextRegularRun(wednesdayEvening, LocalDateTime.of(2024, 5, 1, 12, 0)));
    }

    @Test
    void testWeekly_SameSlot_OneWeekLater() {
        Cadence wednesdayEvening = Cadence.weekly(DayOfWeek.WEDNESDAY, LocalTime.of(18, 0));

        assertEquals(LocalDateTime.of(2024, 5, 8, 18, 0),
            CadenceCalculator.computeNextRegularRun(wednesdayEvening, LocalDateTime.of(2024, 5, 1, 18, 0)));
    }

    @Test
    void testWeekly_EarlierWeekday_NextWeek() {
        Cadence mondayMorning = Cadence.weekly(DayOfWeek.MONDAY, LocalTime.of(8, 0));

        assertEquals(LocalDateTime.of(2024, 5, 6, 8, 0),
            CadenceCalculator.computeNextRegularRun(mondayMorning, LocalDateTime.of(2024, 5, 1, 7, 0)));
    }
}
