package com.signalengine.signal;

import com.signalengine.aggregation.AggregatedSignal;
import com.signalengine.event.EventPublisherHelper;
import com.signalengine.exception.EmissionException;
import com.signalengine.repository.redis.SignalRedisRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Stores the signal as the instrument's latest in Redis, then publishes
 * {@link com.signalengine.event.SignalGeneratedEvent} for downstream listeners.
 */
@Component
public class RedisSignalSink implements SignalSink {

    private static final Logger log = LoggerFactory.getLogger(RedisSignalSink.class);

    private final SignalRedisRepository signalRedisRepository;
    private final EventPublisherHelper eventPublisherHelper;

    public RedisSignalSink(SignalRedisRepository signalRedisRepository, EventPublisherHelper eventPublisherHelper) {
        this.signalRedisRepository = signalRedisRepository;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void emit(AggregatedSignal signal) {
        try {
            signalRedisRepository.save(signal);
        } catch (DataAccessException | IllegalArgumentException e) {
            throw new EmissionException("Failed to store signal for " + signal.getInstrument(), e);
        }
        eventPublisherHelper.publishSignalGenerated(this, signal);
        log.info(
                "Signal {} for {} (confidence={}, bull={}, bear={})",
                signal.getSignalType(),
                signal.getInstrument(),
                String.format("%.2f", signal.getConfidence()),
                signal.getBullScore(),
                signal.getBearScore());
    }
}
