package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.Opportunity;
import com.crossvenue.arb.domain.ProfitabilityAnalysis;
import lombok.Value;

@Value
public class RankedOpportunity {
    Opportunity opportunity;
    ProfitabilityAnalysis analysis;
}
