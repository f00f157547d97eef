package com.mintstream.feed;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Outbound feed command, serialized as {@code {"method": ..., "keys": [...]}}.
 * The base subscription carries no keys.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FeedCommand(String method, List<String> keys) {

    public static final String SUBSCRIBE_NEW_TOKEN = "subscribeNewToken";
    public static final String SUBSCRIBE_TOKEN_TRADE = "subscribeTokenTrade";
    public static final String UNSUBSCRIBE_TOKEN_TRADE = "unsubscribeTokenTrade";

    public static FeedCommand subscribeNewToken() {
        return new FeedCommand(SUBSCRIBE_NEW_TOKEN, null);
    }

    public static FeedCommand subscribeTokenTrade(List<String> mints) {
        return new FeedCommand(SUBSCRIBE_TOKEN_TRADE, List.copyOf(mints));
    }

    public static FeedCommand unsubscribeTokenTrade(List<String> mints) {
        return new FeedCommand(UNSUBSCRIBE_TOKEN_TRADE, List.copyOf(mints));
    }
}
