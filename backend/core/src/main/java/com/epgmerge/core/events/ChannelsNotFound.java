package com.epgmerge.core.events;

import java.time.Instant;
import java.util.List;

public record ChannelsNotFound(Instant timestamp, String url, List<String> channelIds) implements Event {
    @Override
    public String type() {
        return "ChannelsNotFound";
    }
}
