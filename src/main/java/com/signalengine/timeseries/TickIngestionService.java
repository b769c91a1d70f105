package com.signalengine.timeseries;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.model.Tick;
import com.signalengine.event.TickEvent;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Folds broker ticks into base candles and stores every closed candle.
 *
 * <p>Each instrument has its own {@link CandleAggregator} at the configured base width.
 * Ticks of one instrument are folded inside {@link ConcurrentHashMap#compute}, so a given
 * aggregator is only ever touched by one thread at a time and sees ticks in publication
 * order. The listener is synchronous for that reason: async delivery would reorder ticks
 * and turn on-time ticks into dropped late ones.
 */
@Component
public class TickIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TickIngestionService.class);

    private final CandleStore candleStore;
    private final Timeframe baseTimeframe;

    private final Map<String, CandleAggregator> aggregators = new ConcurrentHashMap<>();

    public TickIngestionService(CandleStore candleStore, SignalEngineProperties properties) {
        this.candleStore = candleStore;
        this.baseTimeframe = Timeframe.fromLabel(properties.getPipeline().getBaseCandleWidth());
    }

    @EventListener
    public void onTick(TickEvent tickEvent) {
        ingest(tickEvent.getTick());
    }

    /**
     * Folds one tick into its instrument's aggregator.
     *
     * @return the candle closed by this tick, if any
     */
    public Optional<Candle> ingest(Tick tick) {
        String instrumentKey = tick.instrument().key();
        Candle[] closed = new Candle[1];

        aggregators.compute(instrumentKey, (key, aggregator) -> {
            CandleAggregator target = aggregator != null ? aggregator : new CandleAggregator(key, baseTimeframe);
            long droppedBefore = target.getDroppedTicks();
            target.addTick(tick.timestamp(), tick.bid(), tick.ask(), tick.volume())
                    .ifPresent(candle -> closed[0] = candle);
            if (target.getDroppedTicks() > droppedBefore) {
                log.debug("Dropped late tick for {} at {}", key, tick.timestamp());
            }
            return target;
        });

        if (closed[0] != null) {
            candleStore.append(closed[0]);
            return Optional.of(closed[0]);
        }
        return Optional.empty();
    }

    /** In-progress base candle of an instrument. */
    public Optional<Candle> currentCandle(String instrumentKey) {
        CandleAggregator aggregator = aggregators.get(instrumentKey);
        return aggregator == null ? Optional.empty() : aggregator.current();
    }
}
