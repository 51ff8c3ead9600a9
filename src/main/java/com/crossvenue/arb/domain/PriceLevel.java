package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One level of an order book: a price in [0, 1] and the number of contracts resting there.
 */
@Value
@Builder
public class PriceLevel {
    BigDecimal price;
    BigDecimal size;

    public static PriceLevel of(String price, String size) {
        return new PriceLevel(new BigDecimal(price), new BigDecimal(size));
    }

    public BigDecimal notional() {
        return price.multiply(size);
    }
}
