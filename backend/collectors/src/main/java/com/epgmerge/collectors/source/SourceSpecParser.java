package com.epgmerge.collectors.source;

import com.epgmerge.core.model.SourceEntry;
import com.epgmerge.core.model.SourceSpec;
import com.epgmerge.core.model.TimeFrame;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the source list.
 * <pre>
 * timeframe=24
 * http://example.com/epg.xml.gz   # feed
 * bbc1
 * bbc2
 * </pre>
 * The first non-blank line carries the time frame after its last {@code =}. Each {@code http...}
 * line opens a feed and the lines after it are the channel ids requested from that feed.
 */
public final class SourceSpecParser {
    private static final char COMMENT = '#';
    private static final String URL_PREFIX = "http";
    private static final char BOM = '\uFEFF';

    private final TimeFrame defaultTimeFrame;

    public SourceSpecParser() {
        this(TimeFrame.defaultFrame());
    }

    public SourceSpecParser(TimeFrame defaultTimeFrame) {
        this.defaultTimeFrame = Objects.requireNonNull(defaultTimeFrame, "defaultTimeFrame is required");
    }

    public SourceSpec parse(Path file) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IllegalStateException("Source file not found: " + file, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading source file " + file, e);
        }
        return parseLines(lines);
    }

    public SourceSpec parseLines(List<String> rawLines) {
        List<String> lines = new ArrayList<>(rawLines);
        if (!lines.isEmpty() && !lines.get(0).isEmpty() && lines.get(0).charAt(0) == BOM) {
            lines.set(0, lines.get(0).substring(1));
        }

        Optional<TimeFrame> timeFrame = lines.stream()
                .filter(line -> !line.isBlank())
                .findFirst()
                .flatMap(SourceSpecParser::parseTimeFrame);

        Map<String, Set<String>> channelsByUrl = new LinkedHashMap<>();
        String currentUrl = null;
        for (String raw : lines) {
            String line = stripComment(raw).strip();
            if (line.isEmpty()) {
                continue;
            }
            if (line.startsWith(URL_PREFIX)) {
                currentUrl = line;
                channelsByUrl.computeIfAbsent(currentUrl, ignored -> new LinkedHashSet<>());
            } else if (currentUrl != null) {
                channelsByUrl.get(currentUrl).add(line);
            }
        }

        List<SourceEntry> entries = new ArrayList<>();
        channelsByUrl.forEach((url, ids) -> entries.add(new SourceEntry(url, List.copyOf(ids))));
        return new SourceSpec(entries, timeFrame.orElse(defaultTimeFrame), timeFrame.isEmpty());
    }

    static Optional<TimeFrame> parseTimeFrame(String firstLine) {
        String tail = firstLine.substring(firstLine.lastIndexOf('=') + 1).strip();
        if (tail.isEmpty() || !tail.chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new TimeFrame(Integer.parseInt(tail)));
        } catch (NumberFormatException e) {
            // too many digits for an int
            return Optional.empty();
        }
    }

    private static String stripComment(String line) {
        int hash = line.indexOf(COMMENT);
        return hash < 0 ? line : line.substring(0, hash);
    }
}
