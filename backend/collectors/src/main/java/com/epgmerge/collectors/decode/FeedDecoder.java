package com.epgmerge.collectors.decode;

import com.epgmerge.collectors.api.FailureKind;
import com.epgmerge.collectors.api.PipelineContext;
import com.epgmerge.collectors.api.StepResult;
import com.epgmerge.collectors.fetch.ScratchDirectory;
import com.epgmerge.core.events.AlertRaised;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.zip.GZIPInputStream;

/**
 * Turns a staged download into a plain XML file. Compression is recognised by the {@code .gz}
 * extension only.
 */
public class FeedDecoder {
    private static final String GZIP_EXTENSION = ".gz";
    private static final String XML_EXTENSION = ".xml";

    private final ScratchDirectory scratch;
    private final PipelineContext ctx;

    public FeedDecoder(ScratchDirectory scratch, PipelineContext ctx) {
        this.scratch = Objects.requireNonNull(scratch, "scratch is required");
        this.ctx = Objects.requireNonNull(ctx, "ctx is required");
    }

    public static boolean isGzip(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(GZIP_EXTENSION);
    }

    /**
     * Decompresses {@code staged} into a sibling {@code <stem>.xml} and removes the archive; a file
     * without the {@code .gz} extension is returned unchanged.
     */
    public StepResult<Path> decode(Path staged) {
        if (!isGzip(staged)) {
            return StepResult.success(staged);
        }
        String name = staged.getFileName().toString();
        String stem = name.substring(0, name.length() - GZIP_EXTENSION.length());
        String xmlName = stem.toLowerCase(Locale.ROOT).endsWith(XML_EXTENSION) ? stem : stem + XML_EXTENSION;

        Path target;
        try {
            target = scratch.uniqueFile(xmlName);
        } catch (UncheckedIOException e) {
            return StepResult.failure(FailureKind.STAGING, e.getMessage());
        }

        try (InputStream raw = Files.newInputStream(staged); InputStream in = new GZIPInputStream(raw)) {
            Files.copy(in, target);
        } catch (IOException e) {
            scratch.delete(target, (path, error) -> e.addSuppressed(error));
            return StepResult.failure(FailureKind.CORRUPT_ARCHIVE,
                    "Cannot decompress " + staged.getFileName() + ": " + describe(e));
        }

        scratch.delete(staged, this::reportCleanupFailure);
        return StepResult.success(target);
    }

    private void reportCleanupFailure(Path file, IOException error) {
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "cleanup",
                "Cannot remove " + file + ": " + describe(error),
                Map.of("file", file.toString())
        ));
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
