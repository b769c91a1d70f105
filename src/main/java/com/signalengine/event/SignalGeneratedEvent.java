package com.signalengine.event;

import com.signalengine.aggregation.AggregatedSignal;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a signal has been stored by the sink. Downstream notification and storage
 * fan-out listen to this; the engine itself only counts it.
 */
public class SignalGeneratedEvent extends ApplicationEvent {

    private final AggregatedSignal signal;

    public SignalGeneratedEvent(Object source, AggregatedSignal signal) {
        super(source);
        this.signal = signal;
    }

    public AggregatedSignal getSignal() {
        return signal;
    }
}
