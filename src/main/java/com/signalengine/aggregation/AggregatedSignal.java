package com.signalengine.aggregation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.signalengine.domain.enums.SignalType;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Combined verdict over the timeframes of one instrument.
 *
 * <p>{@code instrument} is null when the engine is used standalone and is filled in by the
 * pipeline before emission.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AggregatedSignal {

    /** Instrument key ({@code VENUE:TICKER}). */
    String instrument;

    String policyId;

    SignalType signalType;

    /** {@code max(bullScore, bearScore) / totalWeight}, 0 on HOLD by veto or empty input. */
    double confidence;

    int bullCount;

    int bearCount;

    double bullScore;

    double bearScore;

    /** Sum of the weights of every timeframe considered, NEUTRAL included. */
    double totalWeight;

    /** True when the policy's synchronization rule forced HOLD. */
    boolean synchronizationVeto;

    List<TimeframeContribution> contributions;

    Instant generatedAt;

    @JsonIgnore
    public boolean isActionable() {
        return signalType != SignalType.HOLD;
    }
}
