package com.mintstream.feed;

import com.mintstream.exception.FeedConnectionException;

/** Opens feed sessions against the configured endpoint. */
public interface FeedConnector {

    /**
     * Opens a new session, waiting at most the configured open timeout.
     *
     * @throws FeedConnectionException if the handshake fails or times out
     */
    FeedConnection open();
}
