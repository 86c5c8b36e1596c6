package com.epgmerge.core.model;

import org.w3c.dom.Element;

import java.util.Objects;

/**
 * A {@code <programme>} element taken verbatim from a feed. Start and stop are the raw XMLTV
 * attribute values; an absent attribute reads as the empty string.
 */
public record ProgrammeRecord(String channel, String start, String stop, Element element) {
    public ProgrammeRecord {
        Objects.requireNonNull(channel, "channel is required");
        Objects.requireNonNull(element, "element is required");
    }

    public static ProgrammeRecord of(Element element) {
        return new ProgrammeRecord(
                element.getAttribute("channel"),
                element.getAttribute("start"),
                element.getAttribute("stop"),
                element
        );
    }
}
