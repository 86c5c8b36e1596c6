package com.epgmerge.service;

import com.epgmerge.collectors.api.PipelineContext;
import com.epgmerge.collectors.config.EpgMergeConfig;
import com.epgmerge.collectors.decode.FeedDecoder;
import com.epgmerge.collectors.extract.ChannelProgrammeExtractor;
import com.epgmerge.collectors.fetch.HttpFeedFetcher;
import com.epgmerge.collectors.fetch.ScratchDirectory;
import com.epgmerge.collectors.merge.EpgDocumentWriter;
import com.epgmerge.collectors.pipeline.EpgMergePipeline;
import com.epgmerge.collectors.pipeline.MergeReport;
import com.epgmerge.collectors.source.SourceSpecParser;
import com.epgmerge.core.bus.EventBus;
import com.epgmerge.service.config.ConfigLoader;
import com.epgmerge.service.http.HttpClientFactory;
import com.epgmerge.service.journal.JsonlRunJournal;
import com.epgmerge.service.logging.RunEventLogger;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        configureLogging();
        int code = run(args, Clock.systemUTC());
        if (code != 0) {
            System.exit(code);
        }
    }

    /**
     * Runs one merge with the configuration found in {@code args[0]} (default {@code config}).
     *
     * @return 0 on success, 1 when the run could not complete, 2 on bad arguments
     */
    static int run(String[] args, Clock clock) {
        if (args.length > 1) {
            LOGGER.severe("Usage: Main [configDir]");
            return 2;
        }
        Path configDir = Path.of(args.length == 1 ? args[0] : "config");

        try {
            EpgMergeConfig config = ConfigLoader.loadMerge(configDir);
            EventBus eventBus = new EventBus();
            new RunEventLogger().register(eventBus);
            if (config.journalFile() != null) {
                new JsonlRunJournal(Path.of(config.journalFile())).register(eventBus);
            }

            EpgMergePipeline pipeline = buildPipeline(config, eventBus, clock, HttpClientFactory.create(config.connectTimeout()));
            MergeReport report = pipeline.run(config.sourcePath(), config.outputPath());
            LOGGER.info(() -> "EPG XML file successfully created: " + report.outputFile());
            return 0;
        } catch (IllegalStateException e) {
            LOGGER.log(Level.SEVERE, e.getMessage(), e);
            return 1;
        }
    }

    static EpgMergePipeline buildPipeline(EpgMergeConfig config, EventBus eventBus, Clock clock, HttpClient httpClient) {
        PipelineContext ctx = new PipelineContext(eventBus, clock);
        ScratchDirectory scratch = new ScratchDirectory(config.scratchPath());
        return new EpgMergePipeline(
                ctx,
                new SourceSpecParser(config.defaultTimeFrame()),
                new HttpFeedFetcher(httpClient, config.requestTimeout(), scratch, ctx),
                new FeedDecoder(scratch, ctx),
                new ChannelProgrammeExtractor(),
                new EpgDocumentWriter(config.indent()),
                scratch
        );
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not load bundled logging.properties; using JVM defaults", e);
        }
    }
}
