package com.crossvenue.arb.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Output of the relationship classifier for an ordered market pair. Confidence is in [0, 1].
 */
@Value
@Builder
public class RelationshipSignal {
    String marketAId;
    String marketBId;
    RelationshipKind kind;
    RelationshipDirection direction;
    double confidence;
}
