package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
@Builder
public class ExposureMetrics {
    BigDecimal totalExposureUsd;
    Map<String, BigDecimal> exposureByMarket;
    Map<StrategyKind, BigDecimal> exposureByStrategy;
    String largestMarketId;
    BigDecimal maxSingleMarketExposureUsd;
    BigDecimal maxSingleMarketExposurePct; // of total capital
    double diversificationScore; // 1 - HHI over per-market shares
}
