package com.mintstream.config;

import java.util.Map;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

/**
 * Provides the JSR-356 backed WebSocket client used to open feed sessions.
 */
@Configuration
public class WebSocketClientConfig {

    /** Tomcat's bound on blocking writes, which includes the close frame. */
    static final String BLOCKING_SEND_TIMEOUT_PROPERTY = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    @Bean
    public WebSocketClient feedWebSocketClient(FeedConfig feedConfig) {
        StandardWebSocketClient client = new StandardWebSocketClient();
        client.setUserProperties(
                Map.of(BLOCKING_SEND_TIMEOUT_PROPERTY, feedConfig.getCloseTimeout().toMillis()));
        return client;
    }
}
