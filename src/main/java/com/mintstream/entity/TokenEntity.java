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
 * JPA entity for the tokens table.
 * One row per mint, enforced by a unique constraint so a racing second insert fails
 * instead of duplicating the token.
 */
@Entity
@Table(name = "tokens", indexes = @Index(name = "idx_tokens_created_at", columnList = "created_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TokenEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "mint", length = 64, nullable = false, unique = true)
    private String mint;

    @Column(name = "signature", length = 128)
    private String signature;

    @Column(name = "trader_public_key", length = 64)
    private String traderPublicKey;

    @Column(name = "tx_type", length = 16)
    private String txType;

    @Column(name = "initial_buy", precision = 38, scale = 9)
    private BigDecimal initialBuy;

    @Column(name = "sol_amount", precision = 38, scale = 9)
    private BigDecimal solAmount;

    @Column(name = "bonding_curve_key", length = 64)
    private String bondingCurveKey;

    @Column(name = "v_tokens_in_bonding_curve", precision = 38, scale = 9)
    private BigDecimal virtualTokenReserves;

    @Column(name = "v_sol_in_bonding_curve", precision = 38, scale = 9)
    private BigDecimal virtualSolReserves;

    @Column(name = "market_cap_sol", precision = 38, scale = 9)
    private BigDecimal marketCapSol;

    @Column(name = "name")
    private String name;

    @Column(name = "symbol", length = 64)
    private String symbol;

    @Column(name = "uri", length = 512)
    private String uri;

    @Column(name = "pool", length = 32)
    private String pool;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
