package com.signalengine.timeseries;

import com.signalengine.domain.model.Instrument;
import java.util.List;
import java.util.Optional;

/**
 * Source of historical and latest candles for the pipeline.
 *
 * <p>Implementations signal fetch failures with
 * {@link com.signalengine.exception.DataUnavailableException}; an instrument with no stored
 * data yields an empty list rather than an error.
 */
public interface MarketDataSource {

    /** Candles whose bucket starts inside {@code window}, ordered oldest first. */
    List<Candle> fetchCandles(Instrument instrument, Timeframe timeframe, CandleWindow window);

    /** The most recent candle of the timeframe, possibly still in progress. */
    Optional<Candle> latestCandle(Instrument instrument, Timeframe timeframe);
}
