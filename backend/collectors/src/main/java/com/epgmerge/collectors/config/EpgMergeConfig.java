package com.epgmerge.collectors.config;

import com.epgmerge.core.model.TimeFrame;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Run settings. Every field is optional in the config file; absent values fall back to the defaults below.
 */
public record EpgMergeConfig(
        String sourceFile,
        String outputFile,
        String scratchDir,
        Duration requestTimeout,
        Duration connectTimeout,
        Integer defaultTimeFrameHours,
        Integer indent,
        String journalFile
) {
    public static final String DEFAULT_SOURCE_FILE = "source_epg.txt";
    public static final String DEFAULT_OUTPUT_FILE = "epg.xml";
    public static final String DEFAULT_SCRATCH_DIR = "temp_epg_files";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final int DEFAULT_INDENT = 4;

    public EpgMergeConfig {
        sourceFile = blankToDefault(sourceFile, DEFAULT_SOURCE_FILE);
        outputFile = blankToDefault(outputFile, DEFAULT_OUTPUT_FILE);
        scratchDir = blankToDefault(scratchDir, DEFAULT_SCRATCH_DIR);
        requestTimeout = positiveOrDefault(requestTimeout);
        connectTimeout = positiveOrDefault(connectTimeout);
        if (defaultTimeFrameHours == null || defaultTimeFrameHours < 0) {
            defaultTimeFrameHours = TimeFrame.DEFAULT_HOURS;
        }
        if (indent == null || indent < 0) {
            indent = DEFAULT_INDENT;
        }
        if (journalFile != null && journalFile.isBlank()) {
            journalFile = null;
        }
    }

    public static EpgMergeConfig defaults() {
        return new EpgMergeConfig(null, null, null, null, null, null, null, null);
    }

    public Path sourcePath() {
        return Path.of(sourceFile);
    }

    public Path outputPath() {
        return Path.of(outputFile);
    }

    public Path scratchPath() {
        return Path.of(scratchDir);
    }

    public TimeFrame defaultTimeFrame() {
        return new TimeFrame(defaultTimeFrameHours);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static Duration positiveOrDefault(Duration value) {
        return value == null || value.isZero() || value.isNegative() ? DEFAULT_TIMEOUT : value;
    }
}
