package com.crossvenue.arb.cost;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Current network gas price. Empty when no source is configured; may throw on I/O failure.
 */
public interface GasPriceSource {
    Optional<BigDecimal> currentGasPriceGwei();
}
