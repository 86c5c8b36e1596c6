package com.epgmerge.collectors.merge;

import com.epgmerge.collectors.extract.Extraction;
import com.epgmerge.core.model.ChannelRecord;
import com.epgmerge.core.model.ProgrammeRecord;
import com.epgmerge.core.model.SourceEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Accumulated state of one merge run: the channel ids already owned by an earlier feed and the
 * records collected so far. Not thread-safe; a run touches it from one thread only.
 */
public class MergeContext {
    private final Set<String> processedChannels = new LinkedHashSet<>();
    private final List<ChannelRecord> channels = new ArrayList<>();
    private final List<ProgrammeRecord> programmes = new ArrayList<>();

    /**
     * Returns the ids of {@code entry} that no earlier successful feed has claimed, in entry order.
     * Each id left out is passed to {@code onDuplicate}.
     */
    public List<String> claim(SourceEntry entry, Consumer<String> onDuplicate) {
        List<String> claimable = new ArrayList<>();
        for (String channelId : entry.channelIds()) {
            if (processedChannels.contains(channelId)) {
                onDuplicate.accept(channelId);
            } else {
                claimable.add(channelId);
            }
        }
        return claimable;
    }

    /**
     * Folds in a successfully extracted feed. Every claimed id becomes processed, including the ones
     * the feed did not actually contain.
     */
    public void accept(Collection<String> claimed, Extraction extraction) {
        channels.addAll(extraction.channels());
        programmes.addAll(extraction.programmes());
        processedChannels.addAll(claimed);
    }

    public List<ChannelRecord> channels() {
        return Collections.unmodifiableList(channels);
    }

    public List<ProgrammeRecord> programmes() {
        return Collections.unmodifiableList(programmes);
    }
}
