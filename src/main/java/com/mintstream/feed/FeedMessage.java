package com.mintstream.feed;

import com.mintstream.domain.model.TokenCreation;
import com.mintstream.domain.model.TokenTrade;

/**
 * Decoded inbound feed message. Exactly one of the nested variants is produced per frame
 * by {@link FeedMessageDecoder}.
 */
public interface FeedMessage {

    /** A new token announcement; leads to onboarding. */
    record TokenCreated(TokenCreation creation) implements FeedMessage {}

    /** A buy or sell of a token; appended to the trade log. */
    record TokenTraded(TokenTrade trade) implements FeedMessage {}

    /** Valid JSON that matches no known shape, e.g. subscription acknowledgements. */
    record Unrecognized(String summary) implements FeedMessage {}
}
