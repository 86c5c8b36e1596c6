package com.epgmerge.service.config;

import com.epgmerge.collectors.config.EpgMergeConfig;
import com.epgmerge.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    public static final String MERGE_CONFIG_FILE = "epg-merge.json";

    private ConfigLoader() {
    }

    /**
     * Loads {@code epg-merge.json} from {@code configDir}. A missing file yields the defaults; a file that
     * exists but cannot be read or parsed fails fast.
     */
    public static EpgMergeConfig loadMerge(Path configDir) {
        Path path = configDir.resolve(MERGE_CONFIG_FILE);
        if (!Files.exists(path)) {
            return EpgMergeConfig.defaults();
        }
        EpgMergeConfig config = read(path, EpgMergeConfig.class);
        return config == null ? EpgMergeConfig.defaults() : config;
    }

    private static <T> T read(Path path, Class<T> type) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
