package com.signalengine.unit.timeseries;

import static org.assertj.core.api.Assertions.assertThat;

import com.signalengine.timeseries.Candle;
import com.signalengine.timeseries.CandleAggregator;
import com.signalengine.timeseries.Timeframe;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CandleAggregatorTest {

    // bucket-aligned for 60s
    private static final Instant T = Instant.parse("2026-03-02T02:15:00Z");

    private CandleAggregator aggregator;

    @BeforeEach
    void setUp() {
        aggregator = new CandleAggregator("HOSE:VIC", Timeframe.ONE_MINUTE);
    }

    private Optional<Candle> tick(Instant at, String bid, String ask, long volume) {
        return aggregator.addTick(at, new BigDecimal(bid), new BigDecimal(ask), volume);
    }

    @Nested
    @DisplayName("Bucketing")
    class Bucketing {

        @Test
        @DisplayName("t, t+1s, t+61s closes exactly one candle and opens one new candle")
        void rollsOverOnce() {
            assertThat(tick(T, "99", "101", 10)).isEmpty();
            assertThat(tick(T.plusSeconds(1), "101", "103", 5)).isEmpty();

            Optional<Candle> closed = tick(T.plusSeconds(61), "104", "106", 7);

            assertThat(closed).isPresent();
            assertThat(closed.get().getBucketStart()).isEqualTo(T);
            assertThat(closed.get().getOpen()).isEqualByComparingTo("100");
            assertThat(closed.get().getHigh()).isEqualByComparingTo("102");
            assertThat(closed.get().getLow()).isEqualByComparingTo("100");
            assertThat(closed.get().getClose()).isEqualByComparingTo("102");
            assertThat(closed.get().getVolume()).isEqualTo(15);

            Candle current = aggregator.current().orElseThrow();
            assertThat(current.getBucketStart()).isEqualTo(T.plusSeconds(60));
            assertThat(current.getOpen()).isEqualByComparingTo("105");
            assertThat(current.getVolume()).isEqualTo(7);
        }

        @Test
        @DisplayName("A late tick after rollover is dropped without touching any candle")
        void lateTickDropped() {
            tick(T, "99", "101", 10);
            tick(T.plusSeconds(1), "101", "103", 5);
            Candle closed = tick(T.plusSeconds(61), "104", "106", 7).orElseThrow();
            Candle before = aggregator.current().orElseThrow();

            Optional<Candle> result = tick(T.minusSeconds(5), "1", "1", 1_000);

            assertThat(result).isEmpty();
            assertThat(aggregator.current()).contains(before);
            assertThat(closed.getVolume()).isEqualTo(15);
            assertThat(aggregator.getDroppedTicks()).isEqualTo(1);
        }

        @Test
        @DisplayName("Skipping several buckets closes only the in-progress candle")
        void gapClosesOnce() {
            tick(T, "10", "10", 1);

            Optional<Candle> closed = tick(T.plusSeconds(600), "11", "11", 1);

            assertThat(closed).map(Candle::getBucketStart).contains(T);
            assertThat(aggregator.current().orElseThrow().getBucketStart()).isEqualTo(T.plusSeconds(600));
        }
    }

    @Test
    @DisplayName("No candle exists before the first tick")
    void emptyBeforeFirstTick() {
        assertThat(aggregator.current()).isEmpty();
    }

    @Test
    @DisplayName("Five-minute buckets floor to the width")
    void widerTimeframe() {
        CandleAggregator fiveMinute = new CandleAggregator("HOSE:VIC", Timeframe.FIVE_MINUTES);
        fiveMinute.addTick(T.plusSeconds(130), BigDecimal.ONE, BigDecimal.ONE, 1);

        assertThat(fiveMinute.current().orElseThrow().getBucketStart()).isEqualTo(Instant.parse("2026-03-02T02:15:00Z"));
    }
}
