package com.mintstream.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    FEED_CONNECTION_ERROR("FEED_CONNECTION_ERROR", true),
    MALFORMED_MESSAGE("MALFORMED_MESSAGE", false),
    STORE_ERROR("STORE_ERROR", true),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;

    /** Whether retrying the same operation later can succeed. */
    private final boolean transientFailure;
}
