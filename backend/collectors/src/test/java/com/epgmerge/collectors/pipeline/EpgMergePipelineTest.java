package com.epgmerge.collectors.pipeline;

import com.epgmerge.collectors.api.PipelineContext;
import com.epgmerge.collectors.decode.FeedDecoder;
import com.epgmerge.collectors.extract.ChannelProgrammeExtractor;
import com.epgmerge.collectors.fetch.HttpFeedFetcher;
import com.epgmerge.collectors.fetch.ScratchDirectory;
import com.epgmerge.collectors.merge.EpgDocumentWriter;
import com.epgmerge.collectors.source.SourceSpecParser;
import com.epgmerge.collectors.support.EventCapture;
import com.epgmerge.collectors.support.FeedServer;
import com.epgmerge.collectors.support.FixtureUtils;
import com.epgmerge.core.bus.EventBus;
import com.epgmerge.core.events.AlertRaised;
import com.epgmerge.core.events.ChannelsNotFound;
import com.epgmerge.core.events.DuplicateChannelSkipped;
import com.epgmerge.core.events.FeedExtracted;
import com.epgmerge.core.events.FeedSkipped;
import com.epgmerge.core.events.RunCompleted;
import com.epgmerge.core.events.RunStarted;
import com.epgmerge.core.util.XmlUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Element;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EpgMergePipelineTest {
    private static final Instant NOW = Instant.parse("2026-02-09T20:00:00Z");

    @TempDir
    Path dir;

    private FeedServer server;
    private EventCapture capture;
    private EpgMergePipeline pipeline;
    private Path scratchRoot;
    private Path sourceFile;
    private Path outputFile;

    @BeforeEach
    void setUp() throws Exception {
        server = new FeedServer();
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
        capture = new EventCapture(bus);
        PipelineContext ctx = new PipelineContext(bus, Clock.fixed(NOW, ZoneOffset.UTC));
        scratchRoot = dir.resolve("temp_epg_files");
        ScratchDirectory scratch = new ScratchDirectory(scratchRoot);
        pipeline = new EpgMergePipeline(
                ctx,
                new SourceSpecParser(),
                new HttpFeedFetcher(
                        HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(1)).build(),
                        Duration.ofMillis(500),
                        scratch,
                        ctx
                ),
                new FeedDecoder(scratch, ctx),
                new ChannelProgrammeExtractor(),
                new EpgDocumentWriter(4),
                scratch
        );
        sourceFile = dir.resolve("source_epg.txt");
        outputFile = dir.resolve("epg.xml");
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void singleGzipFeedProducesTheRequestedChannelAndReportsTheMissingOne() throws Exception {
        String feed = """
                <tv>
                  <channel id="bbc1"><display-name>BBC One</display-name></channel>
                  <channel id="other"/>
                  <programme channel="bbc1" start="20260209210000 +0000" stop="20260209220000 +0000"><title>Soon</title></programme>
                </tv>
                """;
        server.serve("/a/epg.xml.gz", FixtureUtils.gzip(feed.getBytes(StandardCharsets.UTF_8)));
        writeSource("timeframe=24", server.url("/a/epg.xml.gz"), "bbc1", "bbc2");

        MergeReport report = pipeline.run(sourceFile, outputFile);

        assertEquals(1, report.channelCount());
        assertEquals(1, report.programmeCount());
        assertEquals(1, report.feedsSucceeded());
        Element tv = XmlUtils.parse(outputFile).getDocumentElement();
        assertEquals("tv", tv.getTagName());
        assertEquals(List.of("bbc1"), ids(tv));
        assertEquals(1, XmlUtils.childElements(tv, "programme").size());
        assertEquals(List.of("bbc2"), capture.byType(ChannelsNotFound.class).get(0).channelIds());
        assertEquals(24, capture.byType(RunStarted.class).get(0).timeFrameHours());
    }

    @Test
    void earlierFeedWinsAChannelListedTwice() throws Exception {
        server.serve("/a/epg.xml.gz", FixtureUtils.gzip(FixtureUtils.fixtureBytes("fixtures/feed-a.xml")))
                .serve("/b/epg.xml", FixtureUtils.fixtureBytes("fixtures/feed-b.xml"));
        writeSource("timeframe=24",
                server.url("/a/epg.xml.gz"), "bbc1", "bbc2",
                server.url("/b/epg.xml"), "bbc1", "ITV1", "alpha");

        MergeReport report = pipeline.run(sourceFile, outputFile);

        Element tv = XmlUtils.parse(outputFile).getDocumentElement();
        assertEquals(List.of("alpha", "bbc1", "bbc2", "ITV1"), ids(tv));
        Element bbc1 = XmlUtils.childElements(tv, "channel").get(1);
        assertEquals("BBC One", bbc1.getElementsByTagName("display-name").item(0).getTextContent());
        assertFalse(titles(tv).contains("Feed B bbc1 show"));
        assertEquals(List.of("Alpha Hour", "On air", "Evening News", "Last minute of the window",
                "Unparseable start", "Offset listing", "Drama", "Late Film"), titles(tv));

        List<DuplicateChannelSkipped> duplicates = capture.byType(DuplicateChannelSkipped.class);
        assertEquals(1, duplicates.size());
        assertEquals("bbc1", duplicates.get(0).channelId());
        assertEquals(2, report.feedsSucceeded());
        assertEquals(2, capture.byType(FeedExtracted.class).size());
    }

    @Test
    void channelOfAFailedFeedIsClaimableByALaterFeed() throws Exception {
        server.respond("/down/epg.xml", 503, new byte[0])
                .serve("/b/epg.xml", FixtureUtils.fixtureBytes("fixtures/feed-b.xml"));
        writeSource("timeframe=24",
                server.url("/down/epg.xml"), "bbc1",
                server.url("/b/epg.xml"), "bbc1");

        MergeReport report = pipeline.run(sourceFile, outputFile);

        assertEquals(List.of(server.url("/down/epg.xml")), report.failedFeeds());
        Element tv = XmlUtils.parse(outputFile).getDocumentElement();
        assertEquals(List.of("bbc1"), ids(tv));
        assertEquals(List.of("Feed B bbc1 show"), titles(tv));
        assertTrue(capture.byType(DuplicateChannelSkipped.class).isEmpty());
        assertEquals("HTTP_STATUS", capture.byType(FeedSkipped.class).get(0).reason());
    }

    @Test
    void corruptGzipAndInvalidXmlAreSkippedWithoutStoppingTheRun() throws Exception {
        server.serve("/corrupt/epg.xml.gz", "definitely not gzip".getBytes(StandardCharsets.UTF_8))
                .serve("/broken/guide.xml", "<tv><channel id=\"x\">".getBytes(StandardCharsets.UTF_8))
                .serve("/b/epg.xml", FixtureUtils.fixtureBytes("fixtures/feed-b.xml"));
        writeSource("timeframe=24",
                server.url("/corrupt/epg.xml.gz"), "alpha",
                server.url("/broken/guide.xml"), "alpha",
                server.url("/b/epg.xml"), "alpha");

        MergeReport report = pipeline.run(sourceFile, outputFile);

        assertEquals(List.of("CORRUPT_ARCHIVE", "INVALID_XML"),
                capture.byType(FeedSkipped.class).stream().map(FeedSkipped::reason).toList());
        assertEquals(2, report.failedFeeds().size());
        assertEquals(List.of("alpha"), ids(XmlUtils.parse(outputFile).getDocumentElement()));
    }

    @Test
    void timedOutFeedIsAbandonedAfterOneAttempt() throws Exception {
        server.stall("/slow/epg.xml", 3_000, FixtureUtils.fixtureBytes("fixtures/feed-b.xml"))
                .serve("/b/epg.xml", FixtureUtils.fixtureBytes("fixtures/feed-b.xml"));
        writeSource("timeframe=24",
                server.url("/slow/epg.xml"), "ITV1",
                server.url("/b/epg.xml"), "alpha");

        MergeReport report = pipeline.run(sourceFile, outputFile);

        assertEquals("TIMEOUT", capture.byType(FeedSkipped.class).get(0).reason());
        assertEquals(List.of("alpha"), ids(XmlUtils.parse(outputFile).getDocumentElement()));
        assertEquals(1, report.feedsSucceeded());
        assertEquals(2, server.requestCount());
    }

    @Test
    void feedWithNothingLeftToRequestIsNotDownloaded() throws Exception {
        server.serve("/a/epg.xml", FixtureUtils.fixtureBytes("fixtures/feed-a.xml"))
                .serve("/b/epg.xml", FixtureUtils.fixtureBytes("fixtures/feed-b.xml"));
        writeSource("timeframe=24",
                server.url("/a/epg.xml"), "bbc1",
                server.url("/b/epg.xml"), "bbc1");

        MergeReport report = pipeline.run(sourceFile, outputFile);

        assertEquals(1, server.requestCount());
        assertEquals(1, report.feedsSucceeded());
        assertTrue(report.failedFeeds().isEmpty());
        assertTrue(capture.byType(AlertRaised.class).stream().anyMatch(a -> "source".equals(a.category())));
    }

    @Test
    void scratchDirectoryIsEmptiedBeforeAndAfterTheRun() throws Exception {
        Files.createDirectories(scratchRoot);
        Files.writeString(scratchRoot.resolve("epg.xml"), "stale from an earlier run");
        server.serve("/a/epg.xml", FixtureUtils.fixtureBytes("fixtures/feed-a.xml"));
        writeSource("timeframe=24", server.url("/a/epg.xml"), "cnn");

        pipeline.run(sourceFile, outputFile);

        assertEquals(List.of("cnn"), ids(XmlUtils.parse(outputFile).getDocumentElement()));
        try (Stream<Path> left = Files.list(scratchRoot)) {
            assertEquals(0, left.count());
        }
    }

    @Test
    void invalidTimeFrameFallsBackToDefaultAndIsReported() throws Exception {
        server.serve("/a/epg.xml", FixtureUtils.fixtureBytes("fixtures/feed-a.xml"));
        writeSource("timeframe=soon", server.url("/a/epg.xml"), "bbc1");

        pipeline.run(sourceFile, outputFile);

        assertEquals(48, capture.byType(RunStarted.class).get(0).timeFrameHours());
        assertTrue(capture.byType(AlertRaised.class).stream().anyMatch(a -> "config".equals(a.category())));
        assertTrue(titles(XmlUtils.parse(outputFile).getDocumentElement()).contains("Starts at the window edge"));
    }

    @Test
    void missingSourceFileStopsTheRunBeforeAnyOutput() {
        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> pipeline.run(dir.resolve("missing.txt"), outputFile));

        assertTrue(error.getMessage().contains("missing.txt"));
        assertFalse(Files.exists(outputFile));
        assertTrue(capture.byType(RunStarted.class).isEmpty());
    }

    @Test
    void runWithNoUsableFeedsWritesAnEmptyGuide() throws Exception {
        server.respond("/down/epg.xml", 500, new byte[0]);
        writeSource("timeframe=24", server.url("/down/epg.xml"), "bbc1");

        MergeReport report = pipeline.run(sourceFile, outputFile);

        assertEquals(0, report.channelCount());
        assertTrue(XmlUtils.childElements(XmlUtils.parse(outputFile).getDocumentElement(), "channel").isEmpty());
        RunCompleted completed = capture.byType(RunCompleted.class).get(0);
        assertEquals(1, completed.feedsFailed());
    }

    private void writeSource(String... lines) throws Exception {
        Files.write(sourceFile, List.of(lines), StandardCharsets.UTF_8);
    }

    private static List<String> ids(Element tv) {
        return XmlUtils.childElements(tv, "channel").stream().map(e -> e.getAttribute("id")).toList();
    }

    private static List<String> titles(Element tv) {
        return XmlUtils.childElements(tv, "programme").stream()
                .map(e -> e.getElementsByTagName("title").item(0).getTextContent())
                .toList();
    }
}
