package com.signalengine.event;

import com.signalengine.aggregation.AggregatedSignal;
import com.signalengine.domain.model.Tick;
import com.signalengine.job.Job;
import com.signalengine.pipeline.RunSummary;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for every event the
 * engine publishes.
 *
 * <p>Delivery is synchronous unless the listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Tick ----

    public void publishTick(Object source, Tick tick) {
        applicationEventPublisher.publishEvent(new TickEvent(source, tick));
    }

    // ---- Signal ----

    public void publishSignalGenerated(Object source, AggregatedSignal signal) {
        applicationEventPublisher.publishEvent(new SignalGeneratedEvent(source, signal));
    }

    // ---- Pipeline ----

    public void publishPipelineRun(Object source, RunSummary summary) {
        applicationEventPublisher.publishEvent(new PipelineRunEvent(source, summary));
    }

    // ---- Job ----

    public void publishJobAdmitted(Object source, Job job) {
        applicationEventPublisher.publishEvent(new JobEvent(source, job, JobEventType.ADMITTED));
    }

    public void publishJobDuplicateSkipped(Object source, Job job) {
        applicationEventPublisher.publishEvent(
                new JobEvent(source, job, JobEventType.DUPLICATE_SKIPPED, "skip: duplicate"));
    }

    public void publishJobStarted(Object source, Job job) {
        applicationEventPublisher.publishEvent(new JobEvent(source, job, JobEventType.STARTED));
    }

    public void publishJobCompleted(Object source, Job job, RunSummary summary) {
        applicationEventPublisher.publishEvent(new JobEvent(source, job, JobEventType.COMPLETED, null, summary));
    }

    public void publishJobFailed(Object source, Job job, String reason) {
        applicationEventPublisher.publishEvent(new JobEvent(source, job, JobEventType.FAILED, reason));
    }

    public void publishJobTimedOut(Object source, Job job, String reason) {
        applicationEventPublisher.publishEvent(new JobEvent(source, job, JobEventType.TIMED_OUT, reason));
    }

    public void publishJobSkipped(Object source, Job job, String reason) {
        applicationEventPublisher.publishEvent(new JobEvent(source, job, JobEventType.SKIPPED, reason));
    }
}
