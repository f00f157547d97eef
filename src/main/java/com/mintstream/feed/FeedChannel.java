package com.mintstream.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintstream.observability.FeedMetrics;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handle on the live feed session for components that only send.
 *
 * <p>The reconnect loop attaches each session once it is open and detaches it when it is
 * lost, so the dispatcher and the sweeper always address whatever session is current. Sends
 * while no session is active are rejected (return false) rather than failing.
 */
@Component
public class FeedChannel {

    private static final Logger log = LoggerFactory.getLogger(FeedChannel.class);

    private final ObjectMapper objectMapper;
    private final FeedMetrics feedMetrics;

    private volatile FeedConnection connection;

    public FeedChannel(ObjectMapper objectMapper, FeedMetrics feedMetrics) {
        this.objectMapper = objectMapper;
        this.feedMetrics = feedMetrics;
    }

    /** Called by the reconnect loop once a session is open. */
    public void attach(FeedConnection feedConnection) {
        this.connection = feedConnection;
    }

    /** Clears the current session if it is the given one. */
    public void detach(FeedConnection feedConnection) {
        if (this.connection == feedConnection) {
            this.connection = null;
        }
    }

    public boolean isActive() {
        FeedConnection current = connection;
        return current != null && current.isOpen();
    }

    public boolean subscribeNewTokens() {
        return send(FeedCommand.subscribeNewToken());
    }

    public boolean subscribeTokenTrade(List<String> mints) {
        return send(FeedCommand.subscribeTokenTrade(mints));
    }

    public boolean unsubscribeTokenTrade(List<String> mints) {
        return send(FeedCommand.unsubscribeTokenTrade(mints));
    }

    /**
     * Sends a command over the current session.
     *
     * @return true if the session accepted the frame
     */
    public boolean send(FeedCommand command) {
        FeedConnection current = connection;
        if (current == null || !current.isOpen()) {
            log.debug("No active feed session, {} not sent", command.method());
            return false;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode feed command " + command.method(), e);
        }

        try {
            current.send(json);
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to send {} {}: {}", command.method(), keysOf(command), e.getMessage());
            return false;
        }

        feedMetrics.recordSent();
        log.info("Sent {} {} (total sent: {})", command.method(), keysOf(command), feedMetrics.getMessagesSent());
        return true;
    }

    private String keysOf(FeedCommand command) {
        List<String> keys = command.keys();
        if (keys == null || keys.isEmpty()) {
            return "";
        }
        return keys.size() <= 3 ? keys.toString() : "[" + keys.size() + " tokens]";
    }
}
