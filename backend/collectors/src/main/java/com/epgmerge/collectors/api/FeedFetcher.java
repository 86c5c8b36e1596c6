package com.epgmerge.collectors.api;

import java.nio.file.Path;

public interface FeedFetcher {
    /**
     * Downloads {@code url} into the scratch area in a single attempt.
     *
     * @return the staged file, or a failure when the feed cannot be retrieved
     */
    StepResult<Path> fetch(String url);
}
