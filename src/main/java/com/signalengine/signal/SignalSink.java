package com.signalengine.signal;

import com.signalengine.aggregation.AggregatedSignal;

/**
 * Receives every signal the pipeline produces. Fan-out to storage and notification is the
 * sink's business.
 */
public interface SignalSink {

    /**
     * @throws com.signalengine.exception.EmissionException if the signal could not be delivered
     */
    void emit(AggregatedSignal signal);
}
