package com.crossvenue.arb.cost;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class VenueProfile {
    String venueId;
    FeeModel feeModel;
    VenueFeeSchedule feeSchedule;
    int fillRiskRank;
}
