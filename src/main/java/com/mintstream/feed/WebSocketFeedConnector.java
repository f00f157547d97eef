package com.mintstream.feed;

import com.mintstream.config.FeedConfig;
import com.mintstream.exception.FeedConnectionException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

/**
 * Opens feed sessions with the Spring {@link WebSocketClient}.
 */
@Component
public class WebSocketFeedConnector implements FeedConnector {

    private static final Logger log = LoggerFactory.getLogger(WebSocketFeedConnector.class);

    private final WebSocketClient feedWebSocketClient;
    private final FeedConfig feedConfig;

    public WebSocketFeedConnector(WebSocketClient feedWebSocketClient, FeedConfig feedConfig) {
        this.feedWebSocketClient = feedWebSocketClient;
        this.feedConfig = feedConfig;
    }

    @Override
    public FeedConnection open() {
        URI uri = resolveUri();
        WebSocketFeedConnection connection = new WebSocketFeedConnection(
                feedConfig.getHeartbeatInterval(), feedConfig.getPongTimeout(), feedConfig.getInboundQueueCapacity());

        log.info("Connecting to feed at {}...", uri);
        CompletableFuture<WebSocketSession> handshake =
                feedWebSocketClient.execute(connection.handler(), new WebSocketHttpHeaders(), uri);

        try {
            WebSocketSession session =
                    handshake.get(feedConfig.getOpenTimeout().toMillis(), TimeUnit.MILLISECONDS);
            connection.bind(new ConcurrentWebSocketSessionDecorator(
                    session,
                    Math.toIntExact(feedConfig.getCloseTimeout().toMillis()),
                    feedConfig.getSendBufferSizeLimit()));
            return connection;
        } catch (TimeoutException e) {
            handshake.cancel(true);
            throw new FeedConnectionException(
                    "Timed out after " + feedConfig.getOpenTimeout().toSeconds() + "s opening feed session", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new FeedConnectionException("Failed to open feed session: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handshake.cancel(true);
            throw new FeedConnectionException("Interrupted while opening feed session", e);
        }
    }

    private URI resolveUri() {
        String uri = feedConfig.getUri();
        if (uri == null || uri.isBlank()) {
            throw new FeedConnectionException("Feed URI is not configured (mintstream.feed.uri / FEED_URI)");
        }
        try {
            return URI.create(uri);
        } catch (IllegalArgumentException e) {
            throw new FeedConnectionException("Invalid feed URI: " + uri, e);
        }
    }
}
