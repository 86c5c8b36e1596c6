package com.epgmerge.collectors.merge;

import com.epgmerge.collectors.extract.Extraction;
import com.epgmerge.core.model.ChannelRecord;
import com.epgmerge.core.model.SourceEntry;
import com.epgmerge.core.util.XmlUtils;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MergeContextTest {
    private final Document document = XmlUtils.newDocument();

    @Test
    void claimExcludesIdsOwnedByAnEarlierFeed() {
        MergeContext merge = new MergeContext();
        merge.accept(List.of("bbc1", "bbc2"), new Extraction(List.of(channel("bbc1")), List.of(), List.of("bbc2")));

        List<String> duplicates = new ArrayList<>();
        List<String> claimed = merge.claim(new SourceEntry("http://b/epg.xml", List.of("bbc1", "itv1", "bbc2")), duplicates::add);

        assertEquals(List.of("itv1"), claimed);
        assertEquals(List.of("bbc1", "bbc2"), duplicates);
    }

    @Test
    void idsNotFoundInASuccessfulFeedAreStillProcessed() {
        MergeContext merge = new MergeContext();
        merge.accept(List.of("bbc1", "bbc2"), new Extraction(List.of(channel("bbc1")), List.of(), List.of("bbc2")));

        List<String> duplicates = new ArrayList<>();
        assertTrue(merge.claim(new SourceEntry("http://b/epg.xml", List.of("bbc2")), duplicates::add).isEmpty());
        assertEquals(List.of("bbc2"), duplicates);
        assertEquals(1, merge.channels().size());
    }

    @Test
    void unacceptedClaimsLeaveIdsClaimable() {
        MergeContext merge = new MergeContext();
        SourceEntry failing = new SourceEntry("http://a/epg.xml", List.of("bbc1"));
        merge.claim(failing, id -> {
            throw new AssertionError("nothing processed yet");
        });

        List<String> reclaimed = merge.claim(new SourceEntry("http://b/epg.xml", List.of("bbc1")), id -> {
            throw new AssertionError("bbc1 must still be claimable");
        });

        assertEquals(List.of("bbc1"), reclaimed);
    }

    @Test
    void accumulatedRecordsAreReadOnlyToCallers() {
        MergeContext merge = new MergeContext();
        merge.accept(List.of("a"), new Extraction(List.of(channel("a")), List.of(), List.of()));

        assertThrows(UnsupportedOperationException.class, () -> merge.channels().add(channel("b")));
        assertThrows(UnsupportedOperationException.class, () -> merge.programmes().clear());
        assertEquals(1, merge.channels().size());
    }

    private ChannelRecord channel(String id) {
        Element element = document.createElement("channel");
        element.setAttribute("id", id);
        return ChannelRecord.of(element);
    }
}
