package com.epgmerge.collectors.pipeline;

import com.epgmerge.collectors.api.FeedFetcher;
import com.epgmerge.collectors.api.PipelineContext;
import com.epgmerge.collectors.api.StepResult;
import com.epgmerge.collectors.decode.FeedDecoder;
import com.epgmerge.collectors.extract.ChannelProgrammeExtractor;
import com.epgmerge.collectors.extract.Extraction;
import com.epgmerge.collectors.fetch.ScratchDirectory;
import com.epgmerge.collectors.merge.EpgDocumentWriter;
import com.epgmerge.collectors.merge.MergeContext;
import com.epgmerge.collectors.source.SourceSpecParser;
import com.epgmerge.core.events.AlertRaised;
import com.epgmerge.core.events.ChannelsNotFound;
import com.epgmerge.core.events.DuplicateChannelSkipped;
import com.epgmerge.core.events.FeedExtracted;
import com.epgmerge.core.events.FeedSkipped;
import com.epgmerge.core.events.RunCompleted;
import com.epgmerge.core.events.RunStarted;
import com.epgmerge.core.model.SourceEntry;
import com.epgmerge.core.model.SourceSpec;
import com.epgmerge.core.model.TimeFrame;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one merge: parse the source list, then fetch, decode and extract each feed in file order,
 * and finally write the merged guide.
 * <p>
 * A feed that fails at any step is skipped and leaves its channel ids unclaimed. Only an unreadable
 * source list or an unwritable output file ends the run with an exception.
 */
public class EpgMergePipeline {
    private final PipelineContext ctx;
    private final SourceSpecParser parser;
    private final FeedFetcher fetcher;
    private final FeedDecoder decoder;
    private final ChannelProgrammeExtractor extractor;
    private final EpgDocumentWriter writer;
    private final ScratchDirectory scratch;

    public EpgMergePipeline(
            PipelineContext ctx,
            SourceSpecParser parser,
            FeedFetcher fetcher,
            FeedDecoder decoder,
            ChannelProgrammeExtractor extractor,
            EpgDocumentWriter writer,
            ScratchDirectory scratch
    ) {
        this.ctx = Objects.requireNonNull(ctx, "ctx is required");
        this.parser = Objects.requireNonNull(parser, "parser is required");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher is required");
        this.decoder = Objects.requireNonNull(decoder, "decoder is required");
        this.extractor = Objects.requireNonNull(extractor, "extractor is required");
        this.writer = Objects.requireNonNull(writer, "writer is required");
        this.scratch = Objects.requireNonNull(scratch, "scratch is required");
    }

    public MergeReport run(Path sourceFile, Path outputFile) {
        Instant start = ctx.clock().instant();
        SourceSpec spec = parser.parse(sourceFile);
        if (spec.defaultTimeFrame()) {
            alert("config", "No valid time frame in " + sourceFile + "; using " + spec.timeFrame().hours() + "h",
                    Map.of("sourceFile", sourceFile.toString(), "timeFrameHours", spec.timeFrame().hours()));
        }
        ctx.eventBus().publish(new RunStarted(start, sourceFile.toString(), spec.entries().size(), spec.timeFrame().hours()));

        scratch.clear(this::reportCleanupFailure);
        MergeContext merge = new MergeContext();
        int succeeded = 0;
        List<String> failed = new ArrayList<>();
        try {
            for (SourceEntry entry : spec.entries()) {
                FeedOutcome outcome = processFeed(entry, merge, start, spec.timeFrame());
                if (outcome == FeedOutcome.SUCCEEDED) {
                    succeeded++;
                } else if (outcome == FeedOutcome.FAILED) {
                    failed.add(entry.url());
                }
            }
            writer.write(merge, outputFile);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing merged guide to " + outputFile, e);
        } finally {
            scratch.clear(this::reportCleanupFailure);
        }

        Instant end = ctx.clock().instant();
        Duration elapsed = Duration.between(start, end);
        ctx.eventBus().publish(new RunCompleted(
                end,
                merge.channels().size(),
                merge.programmes().size(),
                succeeded,
                failed.size(),
                outputFile.toString(),
                elapsed.toMillis()
        ));
        return new MergeReport(merge.channels().size(), merge.programmes().size(), succeeded, failed, outputFile, elapsed);
    }

    FeedOutcome processFeed(SourceEntry entry, MergeContext merge, Instant start, TimeFrame timeFrame) {
        String url = entry.url();
        List<String> claimed = merge.claim(entry, channelId ->
                ctx.eventBus().publish(new DuplicateChannelSkipped(ctx.clock().instant(), url, channelId)));
        if (claimed.isEmpty()) {
            alert("source", "No channels left to request from " + url, Map.of("url", url));
            return FeedOutcome.NOTHING_REQUESTED;
        }

        StepResult<Path> fetched = fetcher.fetch(url);
        if (!fetched.isSuccess()) {
            return skip(url, fetched);
        }
        StepResult<Path> decoded = decoder.decode(fetched.value());
        try {
            if (!decoded.isSuccess()) {
                return skip(url, decoded);
            }
            StepResult<Extraction> extracted = extractor.extract(decoded.value(), claimed, start, timeFrame);
            if (!extracted.isSuccess()) {
                return skip(url, extracted);
            }

            Extraction extraction = extracted.value();
            if (!extraction.notFound().isEmpty()) {
                ctx.eventBus().publish(new ChannelsNotFound(ctx.clock().instant(), url, extraction.notFound()));
            }
            merge.accept(claimed, extraction);
            ctx.eventBus().publish(new FeedExtracted(
                    ctx.clock().instant(),
                    url,
                    extraction.channelCount(),
                    extraction.programmeCount()
            ));
            return FeedOutcome.SUCCEEDED;
        } finally {
            scratch.delete(fetched.value(), this::reportCleanupFailure);
            if (decoded.isSuccess()) {
                scratch.delete(decoded.value(), this::reportCleanupFailure);
            }
        }
    }

    private FeedOutcome skip(String url, StepResult<?> result) {
        ctx.eventBus().publish(new FeedSkipped(ctx.clock().instant(), url, result.failure().name(), result.message()));
        return FeedOutcome.FAILED;
    }

    private void reportCleanupFailure(Path file, IOException error) {
        alert("cleanup", "Cannot remove " + file + ": " + error.getMessage(), Map.of("file", file.toString()));
    }

    private void alert(String category, String message, Map<String, Object> details) {
        ctx.eventBus().publish(new AlertRaised(ctx.clock().instant(), category, message, details));
    }

    enum FeedOutcome {
        SUCCEEDED,
        FAILED,
        NOTHING_REQUESTED
    }
}
