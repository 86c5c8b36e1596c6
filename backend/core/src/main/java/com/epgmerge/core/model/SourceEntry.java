package com.epgmerge.core.model;

import java.util.List;
import java.util.Objects;

public record SourceEntry(String url, List<String> channelIds) {
    public SourceEntry {
        Objects.requireNonNull(url, "url is required");
        channelIds = List.copyOf(channelIds);
    }
}
