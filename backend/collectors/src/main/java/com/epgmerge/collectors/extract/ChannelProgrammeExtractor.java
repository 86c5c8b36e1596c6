package com.epgmerge.collectors.extract;

import com.epgmerge.collectors.api.FailureKind;
import com.epgmerge.collectors.api.StepResult;
import com.epgmerge.core.model.ChannelRecord;
import com.epgmerge.core.model.ProgrammeRecord;
import com.epgmerge.core.model.TimeFrame;
import com.epgmerge.core.util.XmlUtils;
import com.epgmerge.core.util.XmltvTime;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Selects the requested channels of one XMLTV document and the programmes airing inside the
 * time window. Kept elements are copied out of the parsed feed, so a returned {@link Extraction}
 * holds only the selected subtrees and the feed document can be collected.
 */
public class ChannelProgrammeExtractor {
    static final String CHANNEL_TAG = "channel";
    static final String PROGRAMME_TAG = "programme";

    public StepResult<Extraction> extract(Path xmlFile, List<String> requested, Instant start, TimeFrame timeFrame) {
        Document document;
        try {
            document = XmlUtils.parse(xmlFile);
        } catch (SAXException e) {
            return StepResult.failure(FailureKind.INVALID_XML, "File " + xmlFile.getFileName() + " is not valid XML: " + e.getMessage());
        } catch (IOException e) {
            return StepResult.failure(FailureKind.INVALID_XML, "Cannot read " + xmlFile.getFileName() + ": " + e.getMessage());
        }
        return StepResult.success(extract(document, requested, start, timeFrame));
    }

    public Extraction extract(Document document, List<String> requested, Instant start, TimeFrame timeFrame) {
        Element root = document.getDocumentElement();
        Set<String> requestedIds = Set.copyOf(requested);
        Set<String> notYetFound = new LinkedHashSet<>(requested);
        Document retained = XmlUtils.newDocument();

        List<ChannelRecord> channels = new ArrayList<>();
        for (Element channel : XmlUtils.childElements(root, CHANNEL_TAG)) {
            if (channel.hasAttribute("id") && notYetFound.remove(channel.getAttribute("id"))) {
                channels.add(ChannelRecord.of(detach(retained, channel)));
            }
        }

        Instant windowEnd = timeFrame.windowEnd(start);
        List<ProgrammeRecord> programmes = new ArrayList<>();
        for (Element programme : XmlUtils.childElements(root, PROGRAMME_TAG)) {
            if (!programme.hasAttribute("channel") || !requestedIds.contains(programme.getAttribute("channel"))) {
                continue;
            }
            ProgrammeRecord record = ProgrammeRecord.of(programme);
            if (airsWithin(record, start, windowEnd)) {
                programmes.add(ProgrammeRecord.of(detach(retained, programme)));
            }
        }

        return new Extraction(channels, programmes, List.copyOf(notYetFound));
    }

    // deep copy owned by the small per-feed document, with no parent in the source tree
    private static Element detach(Document retained, Element element) {
        return (Element) retained.importNode(element, true);
    }

    /**
     * True when the programme overlaps {@code [start, windowEnd)} with strict bounds on both sides.
     * A programme whose start or stop cannot be parsed is always kept.
     */
    static boolean airsWithin(ProgrammeRecord programme, Instant start, Instant windowEnd) {
        Optional<OffsetDateTime> programmeStart = XmltvTime.parse(programme.start());
        Optional<OffsetDateTime> programmeStop = XmltvTime.parse(programme.stop());
        if (programmeStart.isEmpty() || programmeStop.isEmpty()) {
            return true;
        }
        return programmeStart.get().toInstant().isBefore(windowEnd)
                && programmeStop.get().toInstant().isAfter(start);
    }
}
