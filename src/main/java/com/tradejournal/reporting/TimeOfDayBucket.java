package com.tradejournal.reporting;

import java.time.LocalTime;

/**
 * Intraday windows used to group trades by entry time. Half-hour windows around the open and close,
 * hourly through the middle of the day. The last bucket is open-ended.
 */
public enum TimeOfDayBucket {
    OPEN("09:30-10:00", LocalTime.of(10, 0)),
    EARLY_MORNING("10:00-10:30", LocalTime.of(10, 30)),
    MID_MORNING("10:30-11:00", LocalTime.of(11, 0)),
    LATE_MORNING("11:00-11:30", LocalTime.of(11, 30)),
    PRE_LUNCH("11:30-12:00", LocalTime.of(12, 0)),
    LUNCH("12:00-13:00", LocalTime.of(13, 0)),
    EARLY_AFTERNOON("13:00-14:00", LocalTime.of(14, 0)),
    AFTERNOON("14:00-15:00", LocalTime.of(15, 0)),
    POWER_HOUR("15:00-15:30", LocalTime.of(15, 30)),
    CLOSE("15:30-16:00", null);

    private final String label;
    private final LocalTime upperBound;

    TimeOfDayBucket(String label, LocalTime upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    public String getLabel() {
        return label;
    }

    /** First bucket whose upper bound is after the entry time; pre-market entries land in OPEN. */
    public static TimeOfDayBucket of(LocalTime entryTime) {
        for (TimeOfDayBucket bucket : values()) {
            if (bucket.upperBound == null || entryTime.isBefore(bucket.upperBound)) {
                return bucket;
            }
        }
        return CLOSE;
    }
}
