package com.epgmerge.collectors.fetch;

import com.epgmerge.collectors.api.FailureKind;
import com.epgmerge.collectors.api.FeedFetcher;
import com.epgmerge.collectors.api.PipelineContext;
import com.epgmerge.collectors.api.StepResult;
import com.epgmerge.core.events.FeedDownloadStarted;
import com.epgmerge.core.events.FeedDownloaded;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Downloads a feed with the JDK {@link HttpClient}, streaming the body straight into the scratch
 * directory. One attempt per call; the request timeout bounds the whole exchange, body included.
 */
public class HttpFeedFetcher implements FeedFetcher {
    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final ScratchDirectory scratch;
    private final PipelineContext ctx;

    public HttpFeedFetcher(HttpClient httpClient, Duration requestTimeout, ScratchDirectory scratch, PipelineContext ctx) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout is required");
        this.scratch = Objects.requireNonNull(scratch, "scratch is required");
        this.ctx = Objects.requireNonNull(ctx, "ctx is required");
    }

    @Override
    public StepResult<Path> fetch(String url) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new FeedDownloadStarted(startedAt, url));

        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return StepResult.failure(FailureKind.INVALID_URL, "Invalid URL " + url + ": " + e.getMessage());
        }
        Optional<String> fileName = fileNameOf(uri);
        if (fileName.isEmpty()) {
            return StepResult.failure(FailureKind.INVALID_URL, "URL " + url + " does not name a file");
        }

        Path target;
        HttpRequest request;
        try {
            target = scratch.uniqueFile(fileName.get());
            request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(requestTimeout)
                    .build();
        } catch (UncheckedIOException e) {
            return StepResult.failure(FailureKind.STAGING, e.getMessage());
        } catch (IllegalArgumentException e) {
            return StepResult.failure(FailureKind.INVALID_URL, "Unsupported URL " + url + ": " + e.getMessage());
        }

        StepResult<Path> result = httpClient.sendAsync(request, stagingHandler(target))
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return classify(error, url, elapsed(startedAt));
                    }
                    if (response.statusCode() < 200 || response.statusCode() > 299) {
                        return StepResult.<Path>failure(FailureKind.HTTP_STATUS,
                                "HTTP " + response.statusCode() + " from " + url + " after " + elapsed(startedAt) + " ms");
                    }
                    return StepResult.success(target);
                })
                .join();

        if (!result.isSuccess()) {
            return result;
        }

        long bytes;
        try {
            bytes = Files.size(target);
        } catch (IOException e) {
            return StepResult.failure(FailureKind.STAGING, "Staged file " + target + " is unreadable: " + e.getMessage());
        }
        ctx.eventBus().publish(new FeedDownloaded(ctx.clock().instant(), url, target.toString(), bytes, elapsed(startedAt)));
        return result;
    }

    /**
     * Last path segment of {@code uri}, or its host when there is no path at all. A path ending in
     * {@code /} names no file.
     */
    static Optional<String> fileNameOf(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isEmpty()) {
            return Optional.ofNullable(uri.getHost()).filter(host -> !host.isBlank());
        }
        if (path.endsWith("/")) {
            return Optional.empty();
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        if (name.isBlank() || name.equals(".") || name.equals("..")) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    private static HttpResponse.BodyHandler<Path> stagingHandler(Path target) {
        return responseInfo -> {
            int status = responseInfo.statusCode();
            if (status >= 200 && status <= 299) {
                return HttpResponse.BodySubscribers.ofFile(target);
            }
            return HttpResponse.BodySubscribers.replacing(target);
        };
    }

    private StepResult<Path> classify(Throwable error, String url, long elapsedMillis) {
        Throwable root = rootCause(error);
        String detail = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        String message = "Download of " + url + " failed after " + elapsedMillis + " ms: " + detail;
        if (root instanceof HttpTimeoutException || root instanceof TimeoutException) {
            return StepResult.failure(FailureKind.TIMEOUT, message);
        }
        if (root instanceof IllegalArgumentException) {
            return StepResult.failure(FailureKind.INVALID_URL, message);
        }
        return StepResult.failure(FailureKind.TRANSPORT, message);
    }

    private long elapsed(Instant startedAt) {
        return Duration.between(startedAt, ctx.clock().instant()).toMillis();
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root;
    }
}
