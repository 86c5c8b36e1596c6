package com.epgmerge.core.events;

import java.time.Instant;

public record FeedDownloadStarted(Instant timestamp, String url) implements Event {
    @Override
    public String type() {
        return "FeedDownloadStarted";
    }
}
