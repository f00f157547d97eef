package com.mintstream.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A newly created token as announced by the feed.
 *
 * <p>Stored once per mint. The record is never updated after insert; its {@code createdAt}
 * drives the staleness check that tears down the token's trade subscription.
 */
@Data
@Builder
public class TokenCreation {

    private String mint;
    private String signature;

    /** Account that created the token. */
    private String traderPublicKey;

    private String txType;

    /** Tokens bought by the creator in the creation transaction. */
    private BigDecimal initialBuy;

    private BigDecimal solAmount;
    private String bondingCurveKey;
    /** {@code vTokensInBondingCurve} on the wire. */
    private BigDecimal virtualTokenReserves;
    /** {@code vSolInBondingCurve} on the wire. */
    private BigDecimal virtualSolReserves;

    /** Market cap estimate in SOL at creation time. */
    private BigDecimal marketCapSol;

    private String name;
    private String symbol;

    /** Metadata URI. */
    private String uri;

    private String pool;
    private LocalDateTime createdAt;
}
