package com.mintstream.repository.jpa;

import com.mintstream.entity.TokenTradeEntity;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA repository for the token_trades table.
 */
@Repository
public interface TokenTradeJpaRepository extends JpaRepository<TokenTradeEntity, Long> {

    List<TokenTradeEntity> findByMint(String mint);

    /** Bulk delete of trades strictly older than the cutoff. Returns the number of rows removed. */
    @Modifying
    @Transactional
    @Query("DELETE FROM TokenTradeEntity t WHERE t.updatedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
