package com.epgmerge.core.events;

import java.time.Instant;

public record FeedDownloaded(
        Instant timestamp,
        String url,
        String stagedFile,
        long bytes,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "FeedDownloaded";
    }
}
