package com.signalengine.unit.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.signalengine.aggregation.AggregatedSignal;
import com.signalengine.aggregation.AggregationEngine;
import com.signalengine.domain.enums.PolicyComponent;
import com.signalengine.domain.enums.SignalType;
import com.signalengine.domain.enums.StrategyType;
import com.signalengine.domain.enums.Zone;
import com.signalengine.indicator.IndicatorResult;
import com.signalengine.policy.StrategyPolicy;
import com.signalengine.policy.ThresholdSet;
import com.signalengine.timeseries.Timeframe;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class AggregationEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T03:00:00Z");
    private static final ThresholdSet THRESHOLD = ThresholdSet.uniform(0.3);

    private AggregationEngine engine;

    @BeforeEach
    void setUp() {
        engine = new AggregationEngine(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private StrategyPolicy.Builder policy() {
        return StrategyPolicy.builder()
                .id("test")
                .type(StrategyType.MACD_ZONE)
                .components(Set.of(PolicyComponent.FMACD, PolicyComponent.SMACD, PolicyComponent.BARS_MT))
                .weight(Timeframe.TWO_MINUTES, 2)
                .weight(Timeframe.FIVE_MINUTES, 3)
                .weight(Timeframe.FIFTEEN_MINUTES, 1)
                .consensusMinimum(2);
    }

    private static IndicatorResult result(Timeframe timeframe, Zone zone) {
        return switch (zone) {
            case BULL -> IndicatorResult.classify(timeframe, 0.5, 0.4, THRESHOLD);
            case BEAR -> IndicatorResult.classify(timeframe, -0.5, -0.4, THRESHOLD);
            case NEUTRAL -> IndicatorResult.classify(timeframe, 0.1, -0.1, THRESHOLD);
        };
    }

    private static Map<Timeframe, IndicatorResult> results(Object... timeframeZonePairs) {
        Map<Timeframe, IndicatorResult> results = new EnumMap<>(Timeframe.class);
        for (int i = 0; i < timeframeZonePairs.length; i += 2) {
            Timeframe timeframe = (Timeframe) timeframeZonePairs[i];
            results.put(timeframe, result(timeframe, (Zone) timeframeZonePairs[i + 1]));
        }
        return results;
    }

    @Nested
    @DisplayName("Weighted consensus")
    class WeightedConsensus {

        @Test
        @DisplayName("Two BULL and one BEAR with consensus 2 is BUY at 5/6")
        void bullMajorityBuys() {
            AggregatedSignal signal = engine.aggregate(
                    results(
                            Timeframe.TWO_MINUTES, Zone.BULL,
                            Timeframe.FIVE_MINUTES, Zone.BULL,
                            Timeframe.FIFTEEN_MINUTES, Zone.BEAR),
                    policy().build());

            assertThat(signal.getSignalType()).isEqualTo(SignalType.BUY);
            assertThat(signal.getBullScore()).isEqualTo(5.0);
            assertThat(signal.getBearScore()).isEqualTo(1.0);
            assertThat(signal.getBullCount()).isEqualTo(2);
            assertThat(signal.getBearCount()).isEqualTo(1);
            assertThat(signal.getConfidence()).isCloseTo(5.0 / 6.0, within(1e-9));
            assertThat(signal.getContributions()).hasSize(3);
            assertThat(signal.getGeneratedAt()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("BEAR majority meeting the consensus is SELL")
        void bearMajoritySells() {
            AggregatedSignal signal = engine.aggregate(
                    results(
                            Timeframe.TWO_MINUTES, Zone.BEAR,
                            Timeframe.FIVE_MINUTES, Zone.BEAR,
                            Timeframe.FIFTEEN_MINUTES, Zone.NEUTRAL),
                    policy().build());

            assertThat(signal.getSignalType()).isEqualTo(SignalType.SELL);
            assertThat(signal.getConfidence()).isCloseTo(5.0 / 6.0, within(1e-9));
        }

        @Test
        @DisplayName("Higher score below the consensus minimum is HOLD")
        void belowConsensusHolds() {
            AggregatedSignal signal = engine.aggregate(
                    results(Timeframe.FIVE_MINUTES, Zone.BULL, Timeframe.FIFTEEN_MINUTES, Zone.BEAR),
                    policy().build());

            assertThat(signal.getSignalType()).isEqualTo(SignalType.HOLD);
            assertThat(signal.getBullCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("Equal bull and bear scores are HOLD")
        void tieHolds() {
            AggregatedSignal signal = engine.aggregate(
                    results(Timeframe.TWO_MINUTES, Zone.BULL, Timeframe.FIVE_MINUTES, Zone.BEAR),
                    policy().weight(Timeframe.FIVE_MINUTES, 2).consensusMinimum(1).build());

            assertThat(signal.getSignalType()).isEqualTo(SignalType.HOLD);
            assertThat(signal.getBullScore()).isEqualTo(signal.getBearScore());
        }

        @Test
        @DisplayName("All NEUTRAL is HOLD with confidence 0 and no votes")
        void allNeutralHolds() {
            AggregatedSignal signal = engine.aggregate(
                    results(
                            Timeframe.TWO_MINUTES, Zone.NEUTRAL,
                            Timeframe.FIVE_MINUTES, Zone.NEUTRAL,
                            Timeframe.FIFTEEN_MINUTES, Zone.NEUTRAL),
                    policy().build());

            assertThat(signal.getSignalType()).isEqualTo(SignalType.HOLD);
            assertThat(signal.getConfidence()).isZero();
            assertThat(signal.getBullCount()).isZero();
            assertThat(signal.getBearCount()).isZero();
            assertThat(signal.getTotalWeight()).isEqualTo(6.0);
        }

        @Test
        @DisplayName("Timeframes without a policy weight are ignored")
        void unweightedIgnored() {
            AggregatedSignal signal = engine.aggregate(
                    results(
                            Timeframe.TWO_MINUTES, Zone.BULL,
                            Timeframe.FIVE_MINUTES, Zone.BULL,
                            Timeframe.ONE_HOUR, Zone.BEAR),
                    policy().build());

            assertThat(signal.getBearCount()).isZero();
            assertThat(signal.getTotalWeight()).isEqualTo(5.0);
            assertThat(signal.getConfidence()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCases {

        @Test
        @DisplayName("Empty input is HOLD with confidence 0")
        void emptyInputHolds() {
            AggregatedSignal signal = engine.aggregate(Map.of(), policy().build());

            assertThat(signal.getSignalType()).isEqualTo(SignalType.HOLD);
            assertThat(signal.getConfidence()).isZero();
            assertThat(signal.getTotalWeight()).isZero();
            assertThat(signal.getContributions()).isEmpty();
        }

        @Test
        @DisplayName("Empty input under a synchronized policy is also HOLD with confidence 0")
        void emptyInputSynchronized() {
            StrategyPolicy synced = policy()
                    .requireSynchronization(true)
                    .syncTimeframes(Set.of(Timeframe.TWO_MINUTES, Timeframe.FIVE_MINUTES))
                    .build();

            AggregatedSignal signal = engine.aggregate(Map.of(), synced);

            assertThat(signal.getSignalType()).isEqualTo(SignalType.HOLD);
            assertThat(signal.getConfidence()).isZero();
        }
    }

    @Nested
    @DisplayName("Synchronization veto")
    class SynchronizationVeto {

        private StrategyPolicy synced() {
            return policy()
                    .requireSynchronization(true)
                    .syncTimeframes(Set.of(Timeframe.TWO_MINUTES, Timeframe.FIVE_MINUTES))
                    .build();
        }

        @Test
        @DisplayName("Disagreeing sync timeframes force HOLD whatever the scores")
        void disagreementVetoes() {
            AggregatedSignal signal = engine.aggregate(
                    results(
                            Timeframe.TWO_MINUTES, Zone.BEAR,
                            Timeframe.FIVE_MINUTES, Zone.BULL,
                            Timeframe.FIFTEEN_MINUTES, Zone.BULL),
                    synced().toBuilder().consensusMinimum(1).build());

            assertThat(signal.getSignalType()).isEqualTo(SignalType.HOLD);
            assertThat(signal.getConfidence()).isZero();
            assertThat(signal.isSynchronizationVeto()).isTrue();
            assertThat(signal.getBullScore()).isEqualTo(4.0);
        }

        @Test
        @DisplayName("A NEUTRAL sync timeframe vetoes")
        void neutralVetoes() {
            AggregatedSignal signal = engine.aggregate(
                    results(
                            Timeframe.TWO_MINUTES, Zone.NEUTRAL,
                            Timeframe.FIVE_MINUTES, Zone.BULL,
                            Timeframe.FIFTEEN_MINUTES, Zone.BULL),
                    synced());

            assertThat(signal.isSynchronizationVeto()).isTrue();
            assertThat(signal.getSignalType()).isEqualTo(SignalType.HOLD);
        }

        @Test
        @DisplayName("A missing sync timeframe vetoes")
        void missingVetoes() {
            AggregatedSignal signal = engine.aggregate(
                    results(Timeframe.FIVE_MINUTES, Zone.BULL, Timeframe.FIFTEEN_MINUTES, Zone.BULL),
                    synced());

            assertThat(signal.isSynchronizationVeto()).isTrue();
        }

        @Test
        @DisplayName("Agreeing sync timeframes let the weighted vote decide")
        void agreementPasses() {
            AggregatedSignal signal = engine.aggregate(
                    results(
                            Timeframe.TWO_MINUTES, Zone.BULL,
                            Timeframe.FIVE_MINUTES, Zone.BULL,
                            Timeframe.FIFTEEN_MINUTES, Zone.BEAR),
                    synced());

            assertThat(signal.isSynchronizationVeto()).isFalse();
            assertThat(signal.getSignalType()).isEqualTo(SignalType.BUY);
        }
    }
}
