package com.epgmerge.collectors.api;

import java.util.Objects;

/**
 * Outcome of one per-feed step: either a payload or a failure kind with a human-readable message.
 */
public record StepResult<T>(T value, FailureKind failure, String message) {
    public static <T> StepResult<T> success(T value) {
        return new StepResult<>(Objects.requireNonNull(value, "value is required"), null, null);
    }

    public static <T> StepResult<T> failure(FailureKind kind, String message) {
        return new StepResult<>(null, Objects.requireNonNull(kind, "kind is required"), message);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
