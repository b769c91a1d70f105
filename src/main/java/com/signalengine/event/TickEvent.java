package com.signalengine.event;

import com.signalengine.domain.model.Tick;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the broker bridge for every quote update.
 *
 * <p>The highest-frequency event in the engine. {@link com.signalengine.timeseries.TickIngestionService}
 * folds these into base candles; listeners must not block the publishing thread for long.
 */
public class TickEvent extends ApplicationEvent {

    private final Tick tick;
    private final long receivedAt;

    public TickEvent(Object source, Tick tick) {
        super(source);
        this.tick = tick;
        this.receivedAt = System.nanoTime();
    }

    public Tick getTick() {
        return tick;
    }

    /** System.nanoTime() at publication. */
    public long getReceivedAt() {
        return receivedAt;
    }
}
