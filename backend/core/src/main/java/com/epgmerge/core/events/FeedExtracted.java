package com.epgmerge.core.events;

import java.time.Instant;

public record FeedExtracted(
        Instant timestamp,
        String url,
        int channelCount,
        int programmeCount
) implements Event {
    @Override
    public String type() {
        return "FeedExtracted";
    }
}
