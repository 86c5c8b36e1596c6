package com.epgmerge.core.model;

import org.w3c.dom.Element;

import java.util.Objects;

/**
 * A {@code <channel>} element taken verbatim from a feed, keyed by its {@code id} attribute.
 */
public record ChannelRecord(String id, Element element) {
    public ChannelRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(element, "element is required");
    }

    public static ChannelRecord of(Element element) {
        return new ChannelRecord(element.getAttribute("id"), element);
    }
}
