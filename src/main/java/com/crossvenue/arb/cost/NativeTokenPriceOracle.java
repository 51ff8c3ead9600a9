package com.crossvenue.arb.cost;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * USD price of the network's native gas token. Empty when no oracle is configured; may throw on
 * I/O failure.
 */
public interface NativeTokenPriceOracle {
    Optional<BigDecimal> nativeTokenPriceUsd();
}
