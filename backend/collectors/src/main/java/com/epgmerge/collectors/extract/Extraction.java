package com.epgmerge.collectors.extract;

import com.epgmerge.core.model.ChannelRecord;
import com.epgmerge.core.model.ProgrammeRecord;

import java.util.List;

/**
 * Records taken from one feed, in document order, plus the requested ids the feed did not carry.
 */
public record Extraction(List<ChannelRecord> channels, List<ProgrammeRecord> programmes, List<String> notFound) {
    public Extraction {
        channels = List.copyOf(channels);
        programmes = List.copyOf(programmes);
        notFound = List.copyOf(notFound);
    }

    public int channelCount() {
        return channels.size();
    }

    public int programmeCount() {
        return programmes.size();
    }
}
