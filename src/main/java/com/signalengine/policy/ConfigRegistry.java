package com.signalengine.policy;

import com.signalengine.domain.model.Instrument;
import com.signalengine.timeseries.Timeframe;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup of policies, thresholds and instruments, loaded once at start-up.
 */
public interface ConfigRegistry {

    /**
     * @throws com.signalengine.exception.ConfigurationException if no policy has this id
     */
    StrategyPolicy resolvePolicy(String policyId);

    /** Empty when the instrument has no threshold for the timeframe; that timeframe is then excluded. */
    Optional<ThresholdSet> resolveThresholds(Instrument instrument, Timeframe timeframe);

    Collection<Instrument> instruments();

    /**
     * @throws com.signalengine.exception.ConfigurationException if the venue is not configured
     */
    Set<Timeframe> knownTimeframes(String venue);

    Optional<Instrument> findInstrument(String venue, String ticker);
}
