package com.signalengine.indicator;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.timeseries.Candle;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Computes the MACD line and its signal line over a candle series with ta4j.
 *
 * <p>Periods default to 7 / 72 / 144. ta4j's EMA seeds with the first value and uses
 * {@code k = 2 / (n + 1)}, i.e. the non-adjusted exponential mean.
 */
@Component
public class MacdCalculator {

    private final int fastPeriod;
    private final int slowPeriod;
    private final int signalPeriod;

    public MacdCalculator(SignalEngineProperties properties) {
        int fastPeriod = properties.getMacd().getFastPeriod();
        int slowPeriod = properties.getMacd().getSlowPeriod();
        int signalPeriod = properties.getMacd().getSignalPeriod();
        if (fastPeriod <= 0 || slowPeriod <= fastPeriod || signalPeriod <= 0) {
            throw new IllegalArgumentException("Invalid MACD periods " + fastPeriod + "/" + slowPeriod + "/" + signalPeriod);
        }
        this.fastPeriod = fastPeriod;
        this.slowPeriod = slowPeriod;
        this.signalPeriod = signalPeriod;
    }

    /**
     * MACD at the last candle.
     *
     * @param candles ordered oldest first with strictly increasing bucket starts
     * @return empty when there are no candles
     */
    public Optional<MacdSnapshot> compute(List<Candle> candles) {
        if (candles.isEmpty()) {
            return Optional.empty();
        }

        BarSeries series = toBarSeries(candles);
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        MACDIndicator macd = new MACDIndicator(close, fastPeriod, slowPeriod);
        EMAIndicator signal = new EMAIndicator(macd, signalPeriod);

        int last = series.getEndIndex();
        double macdValue = macd.getValue(last).doubleValue();
        double signalValue = signal.getValue(last).doubleValue();
        Candle lastCandle = candles.get(candles.size() - 1);
        return Optional.of(new MacdSnapshot(
                macdValue, signalValue, macdValue - signalValue, lastCandle.getBucketStart(), series.getBarCount()));
    }

    private BarSeries toBarSeries(List<Candle> candles) {
        Candle first = candles.get(0);
        BarSeries series = new BaseBarSeriesBuilder()
                .withName(first.getInstrumentKey() + ":" + first.getTimeframe())
                .build();
        for (Candle candle : candles) {
            // ta4j bars are keyed by end time
            series.addBar(
                    candle.getTimeframe().getDuration(),
                    candle.getBucketStart().plus(candle.getTimeframe().getDuration()).atZone(ZoneOffset.UTC),
                    candle.getOpen(),
                    candle.getHigh(),
                    candle.getLow(),
                    candle.getClose(),
                    candle.getVolume());
        }
        return series;
    }
}
