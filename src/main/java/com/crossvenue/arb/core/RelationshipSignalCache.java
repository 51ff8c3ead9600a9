package com.crossvenue.arb.core;

import com.crossvenue.arb.domain.RelationshipDirection;
import com.crossvenue.arb.domain.RelationshipSignal;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifier results pushed by the external relationship classifier. A pair is stored once and
 * answered in either orientation.
 */
@Component
public class RelationshipSignalCache implements RelationshipClassifier {

    private final ConcurrentHashMap<String, RelationshipSignal> signals = new ConcurrentHashMap<>();

    public void update(RelationshipSignal signal) {
        signals.put(key(signal.getMarketAId(), signal.getMarketBId()), signal);
        signals.remove(key(signal.getMarketBId(), signal.getMarketAId()));
    }

    @Override
    public Optional<RelationshipSignal> classify(String marketAId, String marketBId) {
        RelationshipSignal direct = signals.get(key(marketAId, marketBId));
        if (direct != null) {
            return Optional.of(direct);
        }
        return Optional.ofNullable(signals.get(key(marketBId, marketAId))).map(RelationshipSignalCache::reversed);
    }

    public int size() {
        return signals.size();
    }

    public void clear() {
        signals.clear();
    }

    static RelationshipSignal reversed(RelationshipSignal signal) {
        RelationshipDirection direction = signal.getDirection();
        if (direction == RelationshipDirection.A_IMPLIES_B) {
            direction = RelationshipDirection.B_IMPLIES_A;
        } else if (direction == RelationshipDirection.B_IMPLIES_A) {
            direction = RelationshipDirection.A_IMPLIES_B;
        }
        return RelationshipSignal.builder()
                .marketAId(signal.getMarketBId())
                .marketBId(signal.getMarketAId())
                .kind(signal.getKind())
                .direction(direction)
                .confidence(signal.getConfidence())
                .build();
    }

    private static String key(String a, String b) {
        return a + '\u0000' + b;
    }
}
