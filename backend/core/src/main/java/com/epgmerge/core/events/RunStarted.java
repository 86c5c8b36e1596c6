package com.epgmerge.core.events;

import java.time.Instant;

public record RunStarted(
        Instant timestamp,
        String sourceFile,
        int feedCount,
        int timeFrameHours
) implements Event {
    @Override
    public String type() {
        return "RunStarted";
    }
}
