package com.mintstream.domain.enums;

/**
 * States of the feed reconnect loop.
 *
 * <p>{@code DISCONNECTED -> CONNECTING -> ACTIVE -> CONNECTION_LOST -> BACKOFF -> CONNECTING}.
 * {@code CONNECTING} goes straight to {@code BACKOFF} when the handshake fails. The loop ends in
 * {@code EXHAUSTED} once the retry ceiling is reached, or in {@code STOPPED} on shutdown.
 */
public enum ReconnectState {
    DISCONNECTED,
    CONNECTING,
    ACTIVE,
    CONNECTION_LOST,
    BACKOFF,
    EXHAUSTED,
    STOPPED;

    public boolean isTerminal() {
        return this == EXHAUSTED || this == STOPPED;
    }
}
