package com.mintstream.service;

import com.mintstream.domain.model.TokenTrade;
import com.mintstream.exception.EventStoreException;
import com.mintstream.observability.PersistenceErrorReporter;
import com.mintstream.store.EventStore;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Appends trades to the store. Never touches the subscription registry: a trade for an
 * unknown token is stored but does not onboard it.
 */
@Service
public class TradeActivityService {

    private static final Logger log = LoggerFactory.getLogger(TradeActivityService.class);

    private final EventStore eventStore;
    private final PersistenceErrorReporter persistenceErrorReporter;

    public TradeActivityService(EventStore eventStore, PersistenceErrorReporter persistenceErrorReporter) {
        this.eventStore = eventStore;
        this.persistenceErrorReporter = persistenceErrorReporter;
    }

    /**
     * Stores the trade. Store failures are reported, never thrown, so the receive loop keeps going.
     *
     * @return true if the trade was stored
     */
    public boolean saveActivity(TokenTrade trade) {
        if (trade.getUpdatedAt() == null) {
            trade.setUpdatedAt(LocalDateTime.now());
        }
        try {
            eventStore.append(trade);
            log.debug("Trade saved for {}: {} {} SOL", trade.getMint(), trade.getTxType(), trade.getSolAmount());
            return true;
        } catch (EventStoreException e) {
            persistenceErrorReporter.report("append-trade", trade.getMint(), e);
            return false;
        }
    }
}
