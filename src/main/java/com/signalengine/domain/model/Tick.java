package com.signalengine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One quote update from the broker bridge.
 *
 * @param instrument the quoted instrument
 * @param timestamp  exchange time of the quote
 * @param bid        best bid
 * @param ask        best ask
 * @param volume     volume traded since the previous tick
 */
public record Tick(Instrument instrument, Instant timestamp, BigDecimal bid, BigDecimal ask, long volume) {}
