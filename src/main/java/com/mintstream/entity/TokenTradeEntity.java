package com.mintstream.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the token_trades table.
 * Append-only; no uniqueness on any column. Purged in bulk by updated_at.
 */
@Entity
@Table(
        name = "token_trades",
        indexes = {
            @Index(name = "idx_token_trades_mint", columnList = "mint"),
            @Index(name = "idx_token_trades_updated_at", columnList = "updated_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TokenTradeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mint", length = 64, nullable = false)
    private String mint;

    @Column(name = "trader_public_key", length = 64)
    private String traderPublicKey;

    @Column(name = "tx_type", length = 16)
    private String txType;

    @Column(name = "sol_amount", precision = 38, scale = 9)
    private BigDecimal solAmount;

    @Column(name = "v_tokens_in_bonding_curve", precision = 38, scale = 9)
    private BigDecimal virtualTokenReserves;

    @Column(name = "v_sol_in_bonding_curve", precision = 38, scale = 9)
    private BigDecimal virtualSolReserves;

    @Column(name = "market_cap_sol", precision = 38, scale = 9)
    private BigDecimal marketCapSol;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
