package com.clapgrow.summary.common.group;

import java.time.Period;

public enum CadenceFrequency {
    DAILY(Period.ofDays(1)),
    WEEKLY(Period.ofWeeks(1));

    private final Period period;

    CadenceFrequency(Period period) {
        this.period = period;
    }

    /**
     * Length of one regular cadence step.
     */
    public Period getPeriod() {
        return period;
    }
}
