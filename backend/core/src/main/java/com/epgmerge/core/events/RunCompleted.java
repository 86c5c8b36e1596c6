package com.epgmerge.core.events;

import java.time.Instant;

public record RunCompleted(
        Instant timestamp,
        int channelCount,
        int programmeCount,
        int feedsSucceeded,
        int feedsFailed,
        String outputFile,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "RunCompleted";
    }
}
