package com.iimsoft.timeline.calendar;

/**
 * Units understood by {@link DateUtils}.
 *
 * Declared from the finest to the coarsest unit: {@link DateUtils#startOf} relies on this order.
 * Month and year lengths are fixed approximations (30 and 360 days) used by {@link DateUtils#diff}.
 */
public enum DateUnit {
    MILLISECOND(1L),
    SECOND(1_000L),
    MINUTE(60_000L),
    HOUR(3_600_000L),
    DAY(86_400_000L),
    MONTH(30L * 86_400_000L),
    YEAR(12L * 30L * 86_400_000L);

    private final long millis;

    DateUnit(long millis) {
        this.millis = millis;
    }

    public long getMillis() {
        return millis;
    }
}
