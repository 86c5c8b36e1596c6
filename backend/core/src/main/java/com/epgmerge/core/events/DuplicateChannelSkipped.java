package com.epgmerge.core.events;

import java.time.Instant;

public record DuplicateChannelSkipped(Instant timestamp, String url, String channelId) implements Event {
    @Override
    public String type() {
        return "DuplicateChannelSkipped";
    }
}
