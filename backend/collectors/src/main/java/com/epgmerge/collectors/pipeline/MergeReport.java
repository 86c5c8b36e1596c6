package com.epgmerge.collectors.pipeline;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

public record MergeReport(
        int channelCount,
        int programmeCount,
        int feedsSucceeded,
        List<String> failedFeeds,
        Path outputFile,
        Duration elapsed
) {
    public MergeReport {
        failedFeeds = List.copyOf(failedFeeds);
    }
}
