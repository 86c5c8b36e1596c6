package com.epgmerge.service.logging;

import com.epgmerge.core.bus.EventBus;
import com.epgmerge.core.events.AlertRaised;
import com.epgmerge.core.events.ChannelsNotFound;
import com.epgmerge.core.events.DuplicateChannelSkipped;
import com.epgmerge.core.events.FeedDownloadStarted;
import com.epgmerge.core.events.FeedDownloaded;
import com.epgmerge.core.events.FeedExtracted;
import com.epgmerge.core.events.FeedSkipped;
import com.epgmerge.core.events.RunCompleted;
import com.epgmerge.core.events.RunStarted;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes run events to {@code java.util.logging}. Progress goes out at INFO, skipped feeds and
 * cleanup problems at WARNING.
 */
public class RunEventLogger {
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final Logger logger;

    public RunEventLogger() {
        this(Logger.getLogger("com.epgmerge.run"));
    }

    public RunEventLogger(Logger logger) {
        this.logger = logger;
    }

    public void register(EventBus bus) {
        bus.subscribe(RunStarted.class, event -> logger.info(() -> "Start: " + format(event.timestamp())
                + " (" + event.feedCount() + " feeds from " + event.sourceFile()
                + ", time frame " + event.timeFrameHours() + "h)"));
        bus.subscribe(FeedDownloadStarted.class, event -> logger.info(() -> "Downloading: " + event.url()));
        bus.subscribe(FeedDownloaded.class, event -> logger.info(() -> "Download of " + event.url()
                + " completed in " + event.durationMillis() + " ms (" + event.bytes() + " bytes saved to "
                + event.stagedFile() + ")"));
        bus.subscribe(FeedSkipped.class, event -> logger.warning(() -> "Feed " + event.url()
                + " skipped [" + event.reason() + "]: " + event.message()));
        bus.subscribe(DuplicateChannelSkipped.class, event -> logger.info(() -> "Channel " + event.channelId()
                + " skipped: duplicated (already taken from an earlier source, requested again by " + event.url() + ")"));
        bus.subscribe(ChannelsNotFound.class, event -> event.channelIds()
                .forEach(id -> logger.info(() -> "Channel " + id + " not found in " + event.url())));
        bus.subscribe(FeedExtracted.class, event -> logger.info(() -> "Extracted from " + event.url()
                + ": channels " + event.channelCount() + ", programmes " + event.programmeCount()));
        bus.subscribe(AlertRaised.class, event -> logger.log(levelFor(event), () -> event.message()));
        bus.subscribe(RunCompleted.class, event -> logger.info(() -> "End: " + format(event.timestamp())
                + " (channels " + event.channelCount() + ", programmes " + event.programmeCount()
                + ", feeds ok " + event.feedsSucceeded() + ", feeds failed " + event.feedsFailed()
                + ", written to " + event.outputFile() + " in " + event.durationMillis() + " ms)"));
    }

    static Level levelFor(AlertRaised alert) {
        return "cleanup".equals(alert.category()) ? Level.WARNING : Level.INFO;
    }

    private static String format(Instant instant) {
        return TIMESTAMP.format(instant);
    }
}
