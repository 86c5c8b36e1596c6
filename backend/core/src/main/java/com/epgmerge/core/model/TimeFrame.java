package com.epgmerge.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Forward-looking programme window in whole hours, measured from the start of a run.
 */
public record TimeFrame(int hours) {
    public static final int DEFAULT_HOURS = 48;

    public TimeFrame {
        if (hours < 0) {
            throw new IllegalArgumentException("Time frame must be non-negative, got " + hours);
        }
    }

    public static TimeFrame defaultFrame() {
        return new TimeFrame(DEFAULT_HOURS);
    }

    public Instant windowEnd(Instant start) {
        return start.plus(Duration.ofHours(hours));
    }
}
