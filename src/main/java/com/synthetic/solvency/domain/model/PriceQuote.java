package com.synthetic.solvency.domain.model;

/**
 * Copy of the feed's current price cell handed to consumers.
 */
public record PriceQuote(long price, long lastUpdate) {

    public static final PriceQuote NONE = new PriceQuote(0L, 0L);
}
