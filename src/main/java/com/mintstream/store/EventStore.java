package com.mintstream.store;

import com.mintstream.domain.model.TokenCreation;
import com.mintstream.domain.model.TokenTrade;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Set;

/**
 * Durable storage for token creations and trades.
 *
 * <p>Implementations acquire a pooled connection per call and release it on every exit path.
 * All failures surface as {@link com.mintstream.exception.EventStoreException}.
 */
public interface EventStore {

    /**
     * Stores a token creation unless a record for the same mint exists.
     *
     * @return true if a new row was written, false if the mint was already stored
     */
    boolean insertIfAbsent(TokenCreation tokenCreation);

    /** Appends a trade. Never deduplicates. */
    void append(TokenTrade tokenTrade);

    /**
     * Of the given mints, those whose creation time is strictly before the cutoff. Mints with
     * no stored creation are never returned.
     */
    Set<String> findMintsCreatedBefore(LocalDateTime cutoff, Collection<String> mints);

    /** Mints whose creation time is at or after the cutoff. */
    Set<String> findMintsCreatedSince(LocalDateTime cutoff);

    /**
     * Deletes every trade whose update time is strictly before the cutoff.
     *
     * @return number of trades removed
     */
    int deleteTradesOlderThan(LocalDateTime cutoff);
}
