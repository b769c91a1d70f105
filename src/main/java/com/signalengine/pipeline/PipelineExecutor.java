package com.signalengine.pipeline;

import com.signalengine.aggregation.AggregatedSignal;
import com.signalengine.aggregation.AggregationEngine;
import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PipelineState;
import com.signalengine.domain.model.Instrument;
import com.signalengine.event.EventPublisherHelper;
import com.signalengine.exception.DataUnavailableException;
import com.signalengine.exception.EmissionException;
import com.signalengine.indicator.CandleSeries;
import com.signalengine.indicator.IndicatorResult;
import com.signalengine.indicator.MacdCalculator;
import com.signalengine.indicator.MacdSnapshot;
import com.signalengine.indicator.SeriesCache;
import com.signalengine.policy.ConfigRegistry;
import com.signalengine.policy.StrategyPolicy;
import com.signalengine.policy.ThresholdSet;
import com.signalengine.signal.SignalSink;
import com.signalengine.timeseries.Candle;
import com.signalengine.timeseries.CandleWindow;
import com.signalengine.timeseries.MarketDataSource;
import com.signalengine.timeseries.Timeframe;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the signal pipeline for one instrument or a batch of instruments.
 *
 * <p>Each instrument walks {@code FETCHING -> COMPUTING -> CLASSIFYING -> AGGREGATING ->
 * EMITTING -> DONE}, or ends in FAILED. Failures are isolated per instrument: they are
 * recorded on the instrument's result and in the summary's error map, and the batch moves
 * on to the next instrument.
 *
 * <p>Within one instrument, a timeframe that cannot be fetched or has no thresholds is
 * excluded from aggregation with a reason. In REALTIME mode a cached timeframe whose latest
 * candle lookup comes back empty is excluded as well. The instrument fails only when no timeframe
 * survives fetching. A sink failure is counted but keeps the computed signal on the result.
 *
 * <p>The thread's interrupt flag is checked between instruments; when a job times out the
 * remaining instruments are reported as skipped.
 */
@Service
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    public static final String NO_NEW_CANDLE = "no new candle";

    private final ConfigRegistry configRegistry;
    private final MarketDataSource marketDataSource;
    private final SeriesCache seriesCache;
    private final MacdCalculator macdCalculator;
    private final AggregationEngine aggregationEngine;
    private final SignalSink signalSink;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final Duration backfillWindow;
    private final int warmupBars;

    public PipelineExecutor(
            ConfigRegistry configRegistry,
            MarketDataSource marketDataSource,
            SeriesCache seriesCache,
            MacdCalculator macdCalculator,
            AggregationEngine aggregationEngine,
            SignalSink signalSink,
            EventPublisherHelper eventPublisherHelper,
            SignalEngineProperties properties,
            Clock clock) {
        this.configRegistry = configRegistry;
        this.marketDataSource = marketDataSource;
        this.seriesCache = seriesCache;
        this.macdCalculator = macdCalculator;
        this.aggregationEngine = aggregationEngine;
        this.signalSink = signalSink;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.backfillWindow = properties.getPipeline().getBackfillWindow();
        this.warmupBars = properties.getPipeline().getWarmupBars();
    }

    public RunSummary run(Instrument instrument, PipelineMode mode) {
        return runBatch(List.of(instrument), mode);
    }

    public RunSummary runBatch(List<Instrument> instruments, PipelineMode mode) {
        Instant startedAt = clock.instant();
        List<InstrumentRunResult> results = new ArrayList<>(instruments.size());

        for (Instrument instrument : instruments) {
            if (Thread.currentThread().isInterrupted()) {
                results.add(skipped(instrument, mode, "run interrupted"));
                continue;
            }
            if (!instrument.active()) {
                results.add(skipped(instrument, mode, "instrument inactive"));
                continue;
            }
            results.add(runInstrument(instrument, mode));
        }

        RunSummary summary = RunSummary.of(mode, results, startedAt, clock.instant());
        log.info(
                "{} run finished: processed={}, signals={}, skipped={}, failed={}, emissionFailures={}",
                mode,
                summary.getProcessed(),
                summary.getSignalsGenerated(),
                summary.getSkipped(),
                summary.getFailed(),
                summary.getEmissionFailures());
        eventPublisherHelper.publishPipelineRun(this, summary);
        return summary;
    }

    InstrumentRunResult runInstrument(Instrument instrument, PipelineMode mode) {
        PipelineRun run = new PipelineRun(instrument.key());
        Map<Timeframe, String> excluded = new EnumMap<>(Timeframe.class);
        Map<Timeframe, IndicatorResult> indicatorResults = new EnumMap<>(Timeframe.class);
        AggregatedSignal signal = null;
        boolean emissionFailed = false;

        try {
            StrategyPolicy policy = configRegistry.resolvePolicy(instrument.policyId());

            Map<Timeframe, ThresholdSet> thresholds = new EnumMap<>(Timeframe.class);
            Map<Timeframe, CandleSeries> series = fetch(instrument, policy, mode, thresholds, excluded);
            if (series.isEmpty()) {
                throw new DataUnavailableException("No timeframe data available for " + instrument.key());
            }

            run.transitionTo(PipelineState.COMPUTING);
            Map<Timeframe, MacdSnapshot> snapshots = new EnumMap<>(Timeframe.class);
            series.forEach((timeframe, candleSeries) -> macdCalculator
                    .compute(candleSeries.snapshot())
                    .ifPresentOrElse(
                            snapshot -> snapshots.put(timeframe, snapshot),
                            () -> excluded.put(timeframe, "no candles")));

            run.transitionTo(PipelineState.CLASSIFYING);
            snapshots.forEach((timeframe, snapshot) -> {
                IndicatorResult result = IndicatorResult.classify(timeframe, snapshot, thresholds.get(timeframe));
                indicatorResults.put(timeframe, result);
                log.debug(
                        "{} {}: macd={} signal={} -> {}",
                        instrument.key(),
                        timeframe,
                        snapshot.macd(),
                        snapshot.signal(),
                        result.zone());
            });

            run.transitionTo(PipelineState.AGGREGATING);
            signal = aggregationEngine
                    .aggregate(indicatorResults, policy)
                    .toBuilder()
                    .instrument(instrument.key())
                    .build();

            run.transitionTo(PipelineState.EMITTING);
            try {
                signalSink.emit(signal);
            } catch (EmissionException e) {
                emissionFailed = true;
                log.warn("Emission failed for {}: {}", instrument.key(), e.getMessage());
            }

            run.transitionTo(PipelineState.DONE);
            return result(instrument, mode, run, excluded, indicatorResults, signal, emissionFailed, null);
        } catch (DataUnavailableException e) {
            log.warn("{} {} failed in {}: {}", mode, instrument.key(), run.state(), e.getMessage());
            run.fail();
            return result(instrument, mode, run, excluded, indicatorResults, signal, emissionFailed, e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} {} failed in {}: {}", mode, instrument.key(), run.state(), e.getMessage(), e);
            run.fail();
            return result(instrument, mode, run, excluded, indicatorResults, signal, emissionFailed, e.getMessage());
        }
    }

    /**
     * Loads candles for every weighted timeframe into the series cache and returns the
     * series that have data. Excluded timeframes are recorded with a reason.
     */
    private Map<Timeframe, CandleSeries> fetch(
            Instrument instrument,
            StrategyPolicy policy,
            PipelineMode mode,
            Map<Timeframe, ThresholdSet> thresholds,
            Map<Timeframe, String> excluded) {
        Map<Timeframe, CandleSeries> fetched = new EnumMap<>(Timeframe.class);
        Instant now = clock.instant();

        for (Timeframe timeframe : policy.getWeights().keySet()) {
            Optional<ThresholdSet> threshold = configRegistry.resolveThresholds(instrument, timeframe);
            if (threshold.isEmpty()) {
                excluded.put(timeframe, "no thresholds");
                continue;
            }

            CandleSeries candleSeries = seriesCache.getOrCreate(instrument.key(), timeframe);
            try {
                switch (mode) {
                    case BACKFILL -> candleSeries.replaceAll(marketDataSource.fetchCandles(
                            instrument, timeframe, CandleWindow.endingAt(now, backfillWindow)));
                    case REALTIME -> {
                        boolean warmedUp = candleSeries.isEmpty();
                        if (warmedUp) {
                            Duration warmup = timeframe.getDuration().multipliedBy(warmupBars);
                            candleSeries.replaceAll(marketDataSource.fetchCandles(
                                    instrument, timeframe, CandleWindow.endingAt(now, warmup)));
                        }
                        Optional<Candle> latest = marketDataSource.latestCandle(instrument, timeframe);
                        latest.ifPresent(candleSeries::append);
                        // a cached series is scored only when a fresh candle arrived
                        if (latest.isEmpty() && !warmedUp) {
                            log.info("No new {} candle for {}, excluding from run", timeframe, instrument.key());
                            excluded.put(timeframe, NO_NEW_CANDLE);
                            continue;
                        }
                    }
                }
            } catch (DataUnavailableException e) {
                log.warn("Excluding {} {} from {} run: {}", instrument.key(), timeframe, mode, e.getMessage());
                excluded.put(timeframe, e.getMessage());
                continue;
            }

            if (candleSeries.isEmpty()) {
                excluded.put(timeframe, "no candles");
                continue;
            }
            thresholds.put(timeframe, threshold.get());
            fetched.put(timeframe, candleSeries);
        }
        return fetched;
    }

    private InstrumentRunResult result(
            Instrument instrument,
            PipelineMode mode,
            PipelineRun run,
            Map<Timeframe, String> excluded,
            Map<Timeframe, IndicatorResult> indicatorResults,
            AggregatedSignal signal,
            boolean emissionFailed,
            String error) {
        return InstrumentRunResult.builder()
                .instrumentKey(instrument.key())
                .mode(mode)
                .finalState(run.state())
                .stateTrail(run.trail())
                .excludedTimeframes(Collections.unmodifiableMap(new EnumMap<>(excluded)))
                .indicatorResults(Collections.unmodifiableMap(new EnumMap<>(indicatorResults)))
                .signal(signal)
                .emissionFailed(emissionFailed)
                .error(error)
                .build();
    }

    private InstrumentRunResult skipped(Instrument instrument, PipelineMode mode, String reason) {
        log.debug("Skipping {} in {} run: {}", instrument.key(), mode, reason);
        return InstrumentRunResult.builder()
                .instrumentKey(instrument.key())
                .mode(mode)
                .skipped(true)
                .error(reason)
                .build();
    }
}
