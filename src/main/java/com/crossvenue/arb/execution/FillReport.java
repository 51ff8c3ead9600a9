package com.crossvenue.arb.execution;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class FillReport {
    String externalOrderId;
    FillStatus status;
    BigDecimal fillPrice; // null unless (partially) filled
    BigDecimal filledSizeUsd;
    String reason;

    public static FillReport filled(String externalOrderId, BigDecimal fillPrice, BigDecimal filledSizeUsd) {
        return FillReport.builder()
                .externalOrderId(externalOrderId)
                .status(FillStatus.FILLED)
                .fillPrice(fillPrice)
                .filledSizeUsd(filledSizeUsd)
                .build();
    }

    public static FillReport unfilled(String externalOrderId, FillStatus status, String reason) {
        return FillReport.builder()
                .externalOrderId(externalOrderId)
                .status(status)
                .filledSizeUsd(BigDecimal.ZERO)
                .reason(reason)
                .build();
    }
}
