package com.signalengine.aggregation;

import com.signalengine.domain.enums.Zone;
import com.signalengine.timeseries.Timeframe;

/**
 * How one timeframe entered an aggregation.
 *
 * @param confidence the timeframe's own confidence (see {@link com.signalengine.indicator.IndicatorResult})
 */
public record TimeframeContribution(Timeframe timeframe, Zone zone, double weight, double confidence) {}
