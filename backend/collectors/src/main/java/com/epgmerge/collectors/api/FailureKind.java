package com.epgmerge.collectors.api;

/**
 * Reasons a single feed is skipped. None of them abort the run.
 */
public enum FailureKind {
    INVALID_URL,
    TRANSPORT,
    TIMEOUT,
    HTTP_STATUS,
    STAGING,
    CORRUPT_ARCHIVE,
    INVALID_XML
}
