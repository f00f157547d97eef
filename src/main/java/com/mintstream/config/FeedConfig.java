package com.mintstream.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the streaming feed connection.
 *
 * <p>Binds to the {@code mintstream.feed.*} prefix in application.properties. The endpoint
 * is normally supplied through the {@code FEED_URI} environment variable.
 */
@Configuration
@ConfigurationProperties(prefix = "mintstream.feed")
@Getter
@Setter
public class FeedConfig {

    /** WebSocket endpoint of the token feed. */
    private String uri;

    /** Keep-alive interval. A quiet interval triggers a ping. */
    private Duration heartbeatInterval = Duration.ofSeconds(20);

    /** Time allowed for any frame to arrive after a keep-alive ping before the session is dropped. */
    private Duration pongTimeout = Duration.ofSeconds(10);

    /** Inbound frames buffered ahead of the reconnect loop; a full buffer pauses socket reads. */
    private int inboundQueueCapacity = 10_000;

    /** Upper bound for the WebSocket handshake. */
    private Duration openTimeout = Duration.ofSeconds(10);

    /** Upper bound for closing a session and for a single outbound send. */
    private Duration closeTimeout = Duration.ofSeconds(10);

    /** Fixed pause (logged as a countdown) between losing an active session and backing off. */
    private Duration reconnectGrace = Duration.ofSeconds(5);

    /** Consecutive failed attempts tolerated before the reconnect loop gives up. */
    private int maxRetries = 10;

    /** Cap applied to the exponential reconnect delay. */
    private Duration maxBackoff = Duration.ofSeconds(60);

    /** Outbound buffer limit for the concurrent session decorator, in bytes. */
    private int sendBufferSizeLimit = 512 * 1024;
}
