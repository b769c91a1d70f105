package com.signalengine.indicator;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.timeseries.Timeframe;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Registry of {@link CandleSeries}, one per (instrument, timeframe).
 */
@Component
public class SeriesCache {

    private final int maxBars;
    private final Map<SeriesKey, CandleSeries> series = new ConcurrentHashMap<>();

    public SeriesCache(SignalEngineProperties properties) {
        this.maxBars = properties.getPipeline().getMaxBars();
    }

    public CandleSeries getOrCreate(String instrumentKey, Timeframe timeframe) {
        return series.computeIfAbsent(
                new SeriesKey(instrumentKey, timeframe), key -> new CandleSeries(instrumentKey, timeframe, maxBars));
    }

    public Optional<CandleSeries> find(String instrumentKey, Timeframe timeframe) {
        return Optional.ofNullable(series.get(new SeriesKey(instrumentKey, timeframe)));
    }

    public int size() {
        return series.size();
    }

    private record SeriesKey(String instrumentKey, Timeframe timeframe) {}
}
