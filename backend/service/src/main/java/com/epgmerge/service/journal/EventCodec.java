package com.epgmerge.service.journal;

import com.epgmerge.core.events.AlertRaised;
import com.epgmerge.core.events.ChannelsNotFound;
import com.epgmerge.core.events.DuplicateChannelSkipped;
import com.epgmerge.core.events.Event;
import com.epgmerge.core.events.FeedDownloadStarted;
import com.epgmerge.core.events.FeedDownloaded;
import com.epgmerge.core.events.FeedExtracted;
import com.epgmerge.core.events.FeedSkipped;
import com.epgmerge.core.events.RunCompleted;
import com.epgmerge.core.events.RunStarted;
import com.epgmerge.core.util.JsonUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

/**
 * One JSON object per event: {@code {"type":..., "timestamp":..., "event":{...}}}.
 */
public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "RunStarted", RunStarted.class,
            "RunCompleted", RunCompleted.class,
            "FeedDownloadStarted", FeedDownloadStarted.class,
            "FeedDownloaded", FeedDownloaded.class,
            "FeedSkipped", FeedSkipped.class,
            "ChannelsNotFound", ChannelsNotFound.class,
            "DuplicateChannelSkipped", DuplicateChannelSkipped.class,
            "FeedExtracted", FeedExtracted.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event " + event.type(), e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
