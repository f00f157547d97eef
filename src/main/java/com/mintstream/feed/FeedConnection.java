package com.mintstream.feed;

import com.mintstream.domain.enums.SessionState;
import com.mintstream.exception.FeedConnectionException;
import java.io.IOException;
import java.util.Optional;

/**
 * One open streaming session to the feed.
 *
 * <p>{@link #receive()} is called only by the reconnect loop. {@link #send(String)} may be
 * called from any thread concurrently with {@code receive()}.
 */
public interface FeedConnection extends AutoCloseable {

    /**
     * Sends a text frame.
     *
     * @throws IOException if the session is closed or the write fails
     */
    void send(String text) throws IOException;

    /**
     * Waits up to one heartbeat interval for the next inbound text frame.
     *
     * @return the frame, or empty if the interval passed quietly (a keep-alive ping is sent)
     * @throws FeedConnectionException if the session closed, failed, or missed its heartbeat
     */
    Optional<String> receive();

    boolean isOpen();

    SessionState getState();

    /** Closes the session within the configured close timeout. Idempotent, never throws. */
    @Override
    void close();
}
