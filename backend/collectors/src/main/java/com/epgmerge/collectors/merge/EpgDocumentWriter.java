package com.epgmerge.collectors.merge;

import com.epgmerge.core.model.ChannelRecord;
import com.epgmerge.core.model.ProgrammeRecord;
import com.epgmerge.core.util.XmlUtils;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Builds and writes the merged {@code <tv>} document: channels first, then programmes, each group
 * in a fixed order so identical inputs produce identical output.
 */
public class EpgDocumentWriter {
    public static final String ROOT_TAG = "tv";

    public static final Comparator<ChannelRecord> CHANNEL_ORDER =
            Comparator.comparing(ChannelRecord::id, String.CASE_INSENSITIVE_ORDER);

    // start compares as the raw attribute string, which matches time order only for equal offsets
    public static final Comparator<ProgrammeRecord> PROGRAMME_ORDER =
            Comparator.comparing(ProgrammeRecord::channel, String.CASE_INSENSITIVE_ORDER)
                    .thenComparing(ProgrammeRecord::start);

    private final int indent;

    public EpgDocumentWriter(int indent) {
        this.indent = indent;
    }

    public Document build(List<ChannelRecord> channels, List<ProgrammeRecord> programmes) {
        Document document = XmlUtils.newDocument();
        document.setXmlStandalone(true);
        Element tv = document.createElement(ROOT_TAG);
        document.appendChild(tv);

        channels.stream()
                .sorted(CHANNEL_ORDER)
                .forEach(channel -> tv.appendChild(copyInto(document, channel.element())));
        programmes.stream()
                .sorted(PROGRAMME_ORDER)
                .forEach(programme -> tv.appendChild(copyInto(document, programme.element())));
        return document;
    }

    public void write(MergeContext merge, Path outputFile) throws IOException {
        Document document = build(merge.channels(), merge.programmes());
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        XmlUtils.write(document, outputFile, indent);
    }

    private static Node copyInto(Document document, Element source) {
        Node copy = document.importNode(source, true);
        XmlUtils.stripWhitespace(copy);
        return copy;
    }
}
