package com.mintstream.unit.feed;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mintstream.feed.FeedChannel;
import com.mintstream.observability.FeedMetrics;
import com.mintstream.subscription.SubscriptionRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link FeedChannel}: wire format of outbound commands and behaviour without
 * a live session.
 */
class FeedChannelTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private FeedMetrics feedMetrics;
    private FeedChannel feedChannel;

    @BeforeEach
    void setUp() {
        feedMetrics = new FeedMetrics(new SimpleMeterRegistry(), new SubscriptionRegistry());
        feedChannel = new FeedChannel(objectMapper, feedMetrics);
    }

    @Test
    @DisplayName("without a session every send is rejected")
    void noSessionRejects() {
        assertThat(feedChannel.isActive()).isFalse();
        assertThat(feedChannel.subscribeNewTokens()).isFalse();
        assertThat(feedChannel.subscribeTokenTrade(List.of("MintX"))).isFalse();
        assertThat(feedMetrics.getMessagesSent()).isZero();
    }

    @Test
    @DisplayName("commands are encoded as method plus keys, the base subscription without keys")
    void wireFormat() throws Exception {
        ScriptedFeedConnection session = new ScriptedFeedConnection();
        feedChannel.attach(session);

        assertThat(feedChannel.subscribeNewTokens()).isTrue();
        assertThat(feedChannel.subscribeTokenTrade(List.of("MintX"))).isTrue();
        assertThat(feedChannel.unsubscribeTokenTrade(List.of("MintY"))).isTrue();

        assertThat(session.getSent()).hasSize(3);
        assertThat(objectMapper.readTree(session.getSent().get(0)))
                .isEqualTo(objectMapper.readTree("{\"method\":\"subscribeNewToken\"}"));
        assertThat(objectMapper.readTree(session.getSent().get(1)))
                .isEqualTo(objectMapper.readTree("{\"method\":\"subscribeTokenTrade\",\"keys\":[\"MintX\"]}"));
        assertThat(objectMapper.readTree(session.getSent().get(2)))
                .isEqualTo(objectMapper.readTree("{\"method\":\"unsubscribeTokenTrade\",\"keys\":[\"MintY\"]}"));
        assertThat(feedMetrics.getMessagesSent()).isEqualTo(3);
    }

    @Test
    @DisplayName("a closed session rejects sends instead of throwing")
    void closedSessionRejects() {
        ScriptedFeedConnection session = new ScriptedFeedConnection();
        feedChannel.attach(session);
        session.close();

        assertThat(feedChannel.isActive()).isFalse();
        assertThat(feedChannel.unsubscribeTokenTrade(List.of("MintY"))).isFalse();
    }

    @Test
    @DisplayName("detach ignores a session that is no longer current")
    void detachIgnoresStaleSession() {
        ScriptedFeedConnection old = new ScriptedFeedConnection();
        ScriptedFeedConnection current = new ScriptedFeedConnection();
        feedChannel.attach(old);
        feedChannel.attach(current);

        feedChannel.detach(old);

        assertThat(feedChannel.isActive()).isTrue();
        assertThat(feedChannel.subscribeNewTokens()).isTrue();
        assertThat(current.getSent()).hasSize(1);
        assertThat(old.getSent()).isEmpty();
    }
}
