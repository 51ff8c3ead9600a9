package com.crossvenue.arb.execution;

import com.crossvenue.arb.domain.Outcome;
import com.crossvenue.arb.domain.Side;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One order of a two-leg trade. A leg is owned by exactly one {@link TwoLegExecution}; its status
 * is only changed by the executor running that execution.
 */
@Getter
@ToString(exclude = "claimed")
public class Leg {

    private final String legId;
    private final String marketId;
    private final String venueId;
    private final Outcome outcome;
    private final Side side;
    private final BigDecimal price;
    private final BigDecimal sizeUsd;

    private volatile String externalOrderId;
    private volatile LegStatus status = LegStatus.PENDING;
    private volatile BigDecimal fillPrice;
    private volatile BigDecimal filledSizeUsd;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicBoolean claimed = new AtomicBoolean();

    @Builder
    public Leg(String marketId, String venueId, Outcome outcome, Side side, BigDecimal price, BigDecimal sizeUsd) {
        this.legId = UUID.randomUUID().toString();
        this.marketId = marketId;
        this.venueId = venueId;
        this.outcome = outcome;
        this.side = side;
        this.price = price;
        this.sizeUsd = sizeUsd;
    }

    public boolean isFilled() {
        return status == LegStatus.FILLED;
    }

    /** Offsetting order for whatever this leg has filled, at its fill price. */
    public Leg offsetting() {
        return Leg.builder()
                .marketId(marketId)
                .venueId(venueId)
                .outcome(outcome)
                .side(side.opposite())
                .price(fillPrice != null ? fillPrice : price)
                .sizeUsd(filledSizeUsd != null ? filledSizeUsd : sizeUsd)
                .build();
    }

    OrderRequest toOrderRequest() {
        return OrderRequest.builder()
                .clientOrderId(legId)
                .marketId(marketId)
                .outcome(outcome)
                .side(side)
                .price(price)
                .sizeUsd(sizeUsd)
                .build();
    }

    boolean claim() {
        return claimed.compareAndSet(false, true);
    }

    void markSubmitted(String externalOrderId) {
        this.externalOrderId = externalOrderId;
        this.status = LegStatus.SUBMITTED;
    }

    void markFilled(BigDecimal fillPrice) {
        this.fillPrice = fillPrice;
        this.filledSizeUsd = sizeUsd;
        this.status = LegStatus.FILLED;
    }

    void markPartiallyFilled(BigDecimal fillPrice, BigDecimal filledSizeUsd) {
        this.fillPrice = fillPrice;
        this.filledSizeUsd = filledSizeUsd;
        this.status = LegStatus.PARTIALLY_FILLED;
    }

    void markStatus(LegStatus status) {
        this.status = status;
    }
}
