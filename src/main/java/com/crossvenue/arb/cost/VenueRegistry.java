package com.crossvenue.arb.cost;

import com.crossvenue.arb.config.ArbitrageProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Venue-keyed fee and fill-risk table, resolved once at startup from {@code arb.cost.venues}.
 * Venues missing from the table resolve to {@link #fallback()}, a flat fee of
 * {@code arb.cost.unknown-venue-fee-pct}.
 */
@Slf4j
@Component
public class VenueRegistry {

    public static final String FALLBACK_VENUE_ID = "unknown";

    private final Map<String, VenueProfile> profiles;
    private final VenueProfile fallback;

    public VenueRegistry(ArbitrageProperties properties) {
        ArbitrageProperties.Cost cost = properties.getCost();
        Map<String, VenueProfile> table = new LinkedHashMap<>();
        cost.getVenues().forEach((venueId, cfg) -> table.put(normalize(venueId), toProfile(normalize(venueId), cfg)));
        this.profiles = Collections.unmodifiableMap(table);
        this.fallback = VenueProfile.builder()
                .venueId(FALLBACK_VENUE_ID)
                .feeModel(FeeModel.FLAT)
                .feeSchedule(VenueFeeSchedule.flat(cost.getUnknownVenueFeePct()))
                .fillRiskRank(Integer.MAX_VALUE)
                .build();
        log.info("Venue fee table loaded: {}", profiles.keySet());
    }

    public Optional<VenueProfile> lookup(String venueId) {
        if (venueId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(normalize(venueId)));
    }

    public VenueProfile resolve(String venueId) {
        return lookup(venueId).orElse(fallback);
    }

    public VenueProfile fallback() {
        return fallback;
    }

    private static VenueProfile toProfile(String venueId, ArbitrageProperties.Venue cfg) {
        VenueFeeSchedule schedule = switch (cfg.getFeeModel()) {
            case WINNER_FLAT -> VenueFeeSchedule.winnerFlat(cfg.getFeePct());
            case PRICE_BRACKETED -> VenueFeeSchedule.priceBracketed(cfg.getLowerBound(), cfg.getUpperBound(),
                    cfg.getMidFeePct(), cfg.getExtremeFeePct());
            case FLAT -> VenueFeeSchedule.flat(cfg.getFeePct());
        };
        return VenueProfile.builder()
                .venueId(venueId)
                .feeModel(cfg.getFeeModel())
                .feeSchedule(schedule)
                .fillRiskRank(cfg.getFillRiskRank())
                .build();
    }

    private static String normalize(String venueId) {
        return venueId.trim().toLowerCase(Locale.ROOT);
    }
}
