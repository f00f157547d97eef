package com.mintstream.domain.enums;

/** Lifecycle of a single feed session. */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    ACTIVE,
    CLOSING
}
