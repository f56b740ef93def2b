package com.snuffles.lotledger.service.exception;

import lombok.Getter;

import java.math.BigDecimal;

/**
 * A SELL asked for more than the open lots hold. Short positions are not supported, so the
 * whole sale is refused.
 */
@Getter
public class InsufficientLotsException extends RuntimeException {

    private final String symbol;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientLotsException(String symbol, BigDecimal requested, BigDecimal available) {
        super("Insufficient open lots for " + symbol + ": requested " + requested.toPlainString()
            + ", available " + available.toPlainString());
        this.symbol = symbol;
        this.requested = requested;
        this.available = available;
    }
}
