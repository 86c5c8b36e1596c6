package com.epgmerge.core.events;

import java.time.Instant;

public record FeedSkipped(
        Instant timestamp,
        String url,
        String reason,
        String message
) implements Event {
    @Override
    public String type() {
        return "FeedSkipped";
    }
}
