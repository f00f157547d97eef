package com.mintstream.feed;

import com.mintstream.service.TokenOnboardingService;
import com.mintstream.service.TradeActivityService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routes each decoded feed message: creations to onboarding, trades to the trade log.
 * Unrecognized messages are dropped.
 *
 * <p>Runs on the reconnect loop thread, one message at a time, in receipt order. Each
 * dispatch performs at most one store call plus one send.
 */
@Component
public class FeedMessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(FeedMessageDispatcher.class);

    private final FeedMessageDecoder feedMessageDecoder;
    private final TokenOnboardingService tokenOnboardingService;
    private final TradeActivityService tradeActivityService;

    public FeedMessageDispatcher(
            FeedMessageDecoder feedMessageDecoder,
            TokenOnboardingService tokenOnboardingService,
            TradeActivityService tradeActivityService) {
        this.feedMessageDecoder = feedMessageDecoder;
        this.tokenOnboardingService = tokenOnboardingService;
        this.tradeActivityService = tradeActivityService;
    }

    /**
     * @throws com.mintstream.exception.MalformedFeedMessageException if the payload cannot be decoded
     */
    public void dispatch(String payload) {
        FeedMessage message = feedMessageDecoder.decode(payload);

        if (message instanceof FeedMessage.TokenCreated created) {
            tokenOnboardingService.handleNewToken(created.creation());
        } else if (message instanceof FeedMessage.TokenTraded traded) {
            tradeActivityService.saveActivity(traded.trade());
        } else if (message instanceof FeedMessage.Unrecognized unrecognized) {
            log.debug("Ignoring unrecognized feed message: {}", unrecognized.summary());
        }
    }
}
