package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.RelationshipDirection;
import com.crossvenue.arb.domain.RelationshipKind;
import com.crossvenue.arb.domain.RelationshipSignal;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipSignalCacheTest {

    @Test
    void answersBothOrientations() {
        RelationshipSignalCache cache = new RelationshipSignalCache();
        cache.update(signal("fed-cut-march", "fed-cut-2026", RelationshipDirection.A_IMPLIES_B, 0.92));

        RelationshipSignal direct = cache.classify("fed-cut-march", "fed-cut-2026").orElseThrow();
        RelationshipSignal reversed = cache.classify("fed-cut-2026", "fed-cut-march").orElseThrow();

        assertEquals(RelationshipDirection.A_IMPLIES_B, direct.getDirection());
        assertEquals("fed-cut-2026", reversed.getMarketAId());
        assertEquals("fed-cut-march", reversed.getMarketBId());
        assertEquals(RelationshipDirection.B_IMPLIES_A, reversed.getDirection());
        assertEquals(0.92, reversed.getConfidence());
        assertTrue(cache.classify("fed-cut-march", "unrelated").isEmpty());
    }

    @Test
    void latestSignalForPairWins() {
        RelationshipSignalCache cache = new RelationshipSignalCache();
        cache.update(signal("a", "b", RelationshipDirection.A_IMPLIES_B, 0.9));
        cache.update(signal("b", "a", RelationshipDirection.SYMMETRIC, 0.7));

        assertEquals(1, cache.size());
        assertEquals(RelationshipDirection.SYMMETRIC, cache.classify("a", "b").orElseThrow().getDirection());
        assertEquals(0.7, cache.classify("a", "b").orElseThrow().getConfidence());

        cache.clear();
        assertTrue(cache.classify("a", "b").isEmpty());
    }

    private static RelationshipSignal signal(String a, String b, RelationshipDirection direction, double confidence) {
        return RelationshipSignal.builder()
                .marketAId(a)
                .marketBId(b)
                .kind(RelationshipKind.ENTAILMENT)
                .direction(direction)
                .confidence(confidence)
                .build();
    }
}
