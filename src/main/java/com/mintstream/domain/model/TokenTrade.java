package com.mintstream.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * A single buy or sell of a token. Trades form an append-only log; duplicates are expected
 * and kept. Rows are purged once older than the trade retention window.
 */
@Data
@Builder
public class TokenTrade {

    private String mint;
    private String traderPublicKey;

    /** Raw {@code txType} from the feed, normally "buy" or "sell". */
    private String txType;

    private BigDecimal solAmount;
    private BigDecimal virtualTokenReserves;
    private BigDecimal virtualSolReserves;
    private BigDecimal marketCapSol;
    private LocalDateTime updatedAt;
}
