package com.signalengine.domain.model;

import com.signalengine.domain.enums.Market;
import java.util.Locale;

/**
 * A tradable symbol on a venue. The ticker is unique per venue, so {@link #key()} identifies
 * the instrument across the whole engine (queue dedupe keys, Redis keys, batch summaries).
 *
 * @param ticker   exchange ticker, stored upper-case
 * @param venue    exchange code (HOSE, NASDAQ, ...), stored upper-case
 * @param active   whether the scheduler should dispatch work for it
 * @param policyId id of the strategy policy used to aggregate its timeframes
 */
public record Instrument(String ticker, String venue, boolean active, String policyId) {

    public Instrument {
        ticker = ticker.trim().toUpperCase(Locale.ROOT);
        venue = venue.trim().toUpperCase(Locale.ROOT);
    }

    public String key() {
        return venue + ":" + ticker;
    }

    public Market market() {
        return Market.forVenue(venue);
    }
}
