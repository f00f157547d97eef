package com.mintstream.repository.jpa;

import com.mintstream.entity.TokenEntity;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the tokens table.
 */
@Repository
public interface TokenJpaRepository extends JpaRepository<TokenEntity, Long> {

    boolean existsByMint(String mint);

    /** Mints among the given ones created strictly before the cutoff. */
    @Query("SELECT t.mint FROM TokenEntity t WHERE t.createdAt < :cutoff AND t.mint IN :mints")
    List<String> findMintsCreatedBefore(
            @Param("cutoff") LocalDateTime cutoff, @Param("mints") Collection<String> mints);

    /** Mints created at or after the cutoff. */
    @Query("SELECT t.mint FROM TokenEntity t WHERE t.createdAt >= :cutoff")
    List<String> findMintsCreatedSince(@Param("cutoff") LocalDateTime cutoff);
}
