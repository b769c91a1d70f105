package com.signalengine.aggregation;

import com.signalengine.domain.enums.SignalType;
import com.signalengine.domain.enums.Zone;
import com.signalengine.indicator.IndicatorResult;
import com.signalengine.policy.StrategyPolicy;
import com.signalengine.timeseries.Timeframe;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Combines per-timeframe zones into one BUY / SELL / HOLD verdict under a
 * {@link StrategyPolicy}.
 *
 * <p>Only timeframes present in both the results and the policy weights are considered.
 * BULL adds the timeframe weight to the bull score, BEAR to the bear score, NEUTRAL only to
 * the total weight. BUY needs {@code bullScore > bearScore} and at least
 * {@code consensusMinimum} BULL timeframes; SELL is the mirror; anything else, ties included,
 * is HOLD. Confidence is {@code max(bullScore, bearScore) / totalWeight} clamped to [0, 1].
 *
 * <p>With {@code requireSynchronization}, every sync timeframe must be present and share the
 * same non-neutral zone, otherwise the result is HOLD with confidence 0 whatever the scores.
 *
 * <p>Stateless; {@link #aggregate} has no side effects and never throws for empty input.
 */
@Component
public class AggregationEngine {

    private final Clock clock;

    public AggregationEngine(Clock clock) {
        this.clock = clock;
    }

    public AggregatedSignal aggregate(Map<Timeframe, IndicatorResult> results, StrategyPolicy policy) {
        double bullScore = 0;
        double bearScore = 0;
        double totalWeight = 0;
        int bullCount = 0;
        int bearCount = 0;
        List<TimeframeContribution> contributions = new ArrayList<>();

        for (Map.Entry<Timeframe, Double> weighted : policy.getWeights().entrySet()) {
            IndicatorResult result = results.get(weighted.getKey());
            if (result == null) {
                continue;
            }
            double weight = weighted.getValue();
            totalWeight += weight;
            switch (result.zone()) {
                case BULL -> {
                    bullScore += weight;
                    bullCount++;
                }
                case BEAR -> {
                    bearScore += weight;
                    bearCount++;
                }
                case NEUTRAL -> {
                    // denominator only
                }
            }
            contributions.add(new TimeframeContribution(
                    weighted.getKey(), result.zone(), weight, result.confidence()));
        }

        AggregatedSignal.AggregatedSignalBuilder signal = AggregatedSignal.builder()
                .policyId(policy.getId())
                .bullCount(bullCount)
                .bearCount(bearCount)
                .bullScore(bullScore)
                .bearScore(bearScore)
                .totalWeight(totalWeight)
                .contributions(List.copyOf(contributions))
                .generatedAt(clock.instant());

        if (policy.isRequireSynchronization() && !inSync(results, policy)) {
            return signal.signalType(SignalType.HOLD)
                    .confidence(0)
                    .synchronizationVeto(true)
                    .build();
        }

        SignalType type = SignalType.HOLD;
        if (bullScore > bearScore && bullCount >= policy.getConsensusMinimum()) {
            type = SignalType.BUY;
        } else if (bearScore > bullScore && bearCount >= policy.getConsensusMinimum()) {
            type = SignalType.SELL;
        }

        double confidence = totalWeight > 0 ? Math.max(bullScore, bearScore) / totalWeight : 0;
        return signal.signalType(type)
                .confidence(Math.min(1.0, Math.max(0.0, confidence)))
                .synchronizationVeto(false)
                .build();
    }

    /** True when every sync timeframe is present with the same non-neutral zone. */
    private boolean inSync(Map<Timeframe, IndicatorResult> results, StrategyPolicy policy) {
        Zone agreed = null;
        for (Timeframe timeframe : policy.getSyncTimeframes()) {
            IndicatorResult result = results.get(timeframe);
            if (result == null || result.zone() == Zone.NEUTRAL) {
                return false;
            }
            if (agreed == null) {
                agreed = result.zone();
            } else if (agreed != result.zone()) {
                return false;
            }
        }
        return true;
    }
}
