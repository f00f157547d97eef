package com.mintstream.store;

import com.mintstream.domain.model.TokenCreation;
import com.mintstream.domain.model.TokenTrade;
import com.mintstream.exception.EventStoreException;
import com.mintstream.mapper.TokenMapper;
import com.mintstream.mapper.TokenTradeMapper;
import com.mintstream.repository.jpa.TokenJpaRepository;
import com.mintstream.repository.jpa.TokenTradeJpaRepository;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.mapstruct.factory.Mappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

/**
 * {@link EventStore} backed by Spring Data JPA.
 *
 * <p>Every method is a single repository call, so each runs in its own short transaction and
 * returns its Hikari connection to the pool before returning, including when it throws.
 * Spring's {@link DataAccessException} and {@link TransactionException} hierarchies (the
 * latter covers an unreachable database or an exhausted pool) become {@link EventStoreException}.
 *
 * <p>A constraint violation on insert counts as a duplicate only when a row for the mint is
 * found afterwards. Any other violation (an over-long column, a numeric overflow) is a
 * store failure.
 */
@Component
public class JpaEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JpaEventStore.class);

    /** Upper bound on IN-list size per query. */
    static final int MINT_BATCH_SIZE = 500;

    private final TokenJpaRepository tokenJpaRepository;
    private final TokenTradeJpaRepository tokenTradeJpaRepository;
    private final TokenMapper tokenMapper = Mappers.getMapper(TokenMapper.class);
    private final TokenTradeMapper tokenTradeMapper = Mappers.getMapper(TokenTradeMapper.class);

    public JpaEventStore(TokenJpaRepository tokenJpaRepository, TokenTradeJpaRepository tokenTradeJpaRepository) {
        this.tokenJpaRepository = tokenJpaRepository;
        this.tokenTradeJpaRepository = tokenTradeJpaRepository;
    }

    @Override
    public boolean insertIfAbsent(TokenCreation tokenCreation) {
        try {
            if (tokenJpaRepository.existsByMint(tokenCreation.getMint())) {
                log.debug("Token {} already stored, skipping insert", tokenCreation.getMint());
                return false;
            }
            tokenJpaRepository.saveAndFlush(tokenMapper.toEntity(tokenCreation));
            return true;
        } catch (DataIntegrityViolationException e) {
            if (existsAfterConflict(tokenCreation.getMint(), e)) {
                log.debug("Token {} inserted concurrently, keeping existing row", tokenCreation.getMint());
                return false;
            }
            throw new EventStoreException("Failed to store token " + tokenCreation.getMint(), e);
        } catch (DataAccessException | TransactionException e) {
            throw new EventStoreException("Failed to store token " + tokenCreation.getMint(), e);
        }
    }

    private boolean existsAfterConflict(String mint, DataIntegrityViolationException conflict) {
        try {
            return tokenJpaRepository.existsByMint(mint);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Could not re-check token {} after insert conflict: {}", mint, e.getMessage());
            conflict.addSuppressed(e);
            return false;
        }
    }

    @Override
    public void append(TokenTrade tokenTrade) {
        try {
            tokenTradeJpaRepository.save(tokenTradeMapper.toEntity(tokenTrade));
        } catch (DataAccessException | TransactionException e) {
            throw new EventStoreException("Failed to store trade for " + tokenTrade.getMint(), e);
        }
    }

    @Override
    public Set<String> findMintsCreatedBefore(LocalDateTime cutoff, Collection<String> mints) {
        Set<String> stale = new HashSet<>();
        List<String> candidates = new ArrayList<>(mints);
        try {
            for (int from = 0; from < candidates.size(); from += MINT_BATCH_SIZE) {
                List<String> batch = candidates.subList(from, Math.min(from + MINT_BATCH_SIZE, candidates.size()));
                stale.addAll(tokenJpaRepository.findMintsCreatedBefore(cutoff, batch));
            }
            return stale;
        } catch (DataAccessException | TransactionException e) {
            throw new EventStoreException("Failed to query tokens created before " + cutoff, e);
        }
    }

    @Override
    public Set<String> findMintsCreatedSince(LocalDateTime cutoff) {
        try {
            return new HashSet<>(tokenJpaRepository.findMintsCreatedSince(cutoff));
        } catch (DataAccessException | TransactionException e) {
            throw new EventStoreException("Failed to query tokens created since " + cutoff, e);
        }
    }

    @Override
    public int deleteTradesOlderThan(LocalDateTime cutoff) {
        try {
            return tokenTradeJpaRepository.deleteOlderThan(cutoff);
        } catch (DataAccessException | TransactionException e) {
            throw new EventStoreException("Failed to purge trades older than " + cutoff, e);
        }
    }
}
