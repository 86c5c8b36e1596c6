package com.epgmerge.collectors.api;

import com.epgmerge.core.bus.EventBus;

import java.time.Clock;
import java.util.Objects;

public record PipelineContext(EventBus eventBus, Clock clock) {
    public PipelineContext {
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
    }
}
