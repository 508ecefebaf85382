package com.clapgrow.summary.common.group;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;

import static org.junit.jupiter.api.Assertions.*;

class CadenceTest {

    @Test
    void testWeeklyCadence_RequiresDayOfWeek() {
        assertThrows(IllegalArgumentException.class,
            () -> new Cadence(CadenceFrequency.WEEKLY, LocalTime.of(18, 0), null));
    }

    @Test
    void testDailyCadence_RejectsDayOfWeek() {
        assertThrows(IllegalArgumentException.class,
            () -> new Cadence(CadenceFrequency.DAILY, LocalTime.of(18, 0), DayOfWeek.SUNDAY));
    }

    @Test
    void testTime_IsTruncatedToMinutes() {
        Cadence cadence = Cadence.daily(LocalTime.of(20, 0, 42));

        assertEquals(LocalTime.of(20, 0), cadence.time());
    }

    @Test
    void testDisplayName_FallsBackToGroupId() {
        GroupConfig config = new GroupConfig("123-456@g.us", " ", Cadence.daily(LocalTime.NOON), true);

        assertEquals("123-456@g.us", config.displayName());
    }
}
