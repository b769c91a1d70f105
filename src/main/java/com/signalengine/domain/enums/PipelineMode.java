package com.signalengine.domain.enums;

/**
 * How a pipeline run acquires its candles.
 *
 * <ul>
 *   <li>BACKFILL: pulls a bounded historical window per timeframe and rebuilds the cached series</li>
 *   <li>REALTIME: appends only the latest available candle per timeframe to the cached series</li>
 * </ul>
 */
public enum PipelineMode {
    BACKFILL,
    REALTIME
}
