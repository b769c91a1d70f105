package com.signalengine.pipeline;

import com.signalengine.aggregation.AggregatedSignal;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PipelineState;
import com.signalengine.indicator.IndicatorResult;
import com.signalengine.timeseries.Timeframe;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one instrument within a run.
 *
 * <p>A skipped instrument was never started: {@code finalState} and {@code stateTrail} are
 * empty. A failed one carries {@code error}; its signal is null unless the failure came
 * after aggregation.
 */
@Value
@Builder
public class InstrumentRunResult {

    String instrumentKey;

    PipelineMode mode;

    PipelineState finalState;

    @Builder.Default
    List<PipelineState> stateTrail = List.of();

    /** Timeframes left out of aggregation, with the reason. */
    @Builder.Default
    Map<Timeframe, String> excludedTimeframes = Map.of();

    @Builder.Default
    Map<Timeframe, IndicatorResult> indicatorResults = Map.of();

    AggregatedSignal signal;

    boolean emissionFailed;

    boolean skipped;

    String error;

    public boolean isFailed() {
        return finalState == PipelineState.FAILED;
    }

    public boolean isSignalGenerated() {
        return signal != null && signal.isActionable();
    }
}
