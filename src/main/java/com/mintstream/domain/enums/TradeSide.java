package com.mintstream.domain.enums;

import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Direction of a trade as reported in the feed's {@code txType} field. */
@Getter
@RequiredArgsConstructor
public enum TradeSide {
    BUY("buy"),
    SELL("sell");

    private final String wireValue;

    public static Optional<TradeSide> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (TradeSide side : values()) {
            if (side.wireValue.equals(value)) {
                return Optional.of(side);
            }
        }
        return Optional.empty();
    }
}
