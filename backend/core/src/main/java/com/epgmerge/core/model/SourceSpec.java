package com.epgmerge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Parsed source list: feeds in file order plus the programme window.
 *
 * @param defaultTimeFrame true when the file carried no usable time frame and the default was applied
 */
public record SourceSpec(List<SourceEntry> entries, TimeFrame timeFrame, boolean defaultTimeFrame) {
    public SourceSpec {
        entries = List.copyOf(entries);
        Objects.requireNonNull(timeFrame, "timeFrame is required");
    }
}
