package com.signalengine.observability;

import com.signalengine.domain.enums.SignalType;
import com.signalengine.event.JobEvent;
import com.signalengine.event.PipelineRunEvent;
import com.signalengine.event.SignalGeneratedEvent;
import com.signalengine.job.JobQueue;
import com.signalengine.job.WorkerClassControl;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the signal engine:
 * <ul>
 *   <li><b>signals.generated</b> (counter, tag {@code type}): every emitted signal</li>
 *   <li><b>pipeline.instrument.failures</b> (counter): instruments that ended FAILED</li>
 *   <li><b>pipeline.run.duration</b> (timer): wall time of a pipeline run</li>
 *   <li><b>jobs.duplicate.skipped</b> (counter): dispatches dropped by the dedupe claim</li>
 *   <li><b>jobs.timed.out</b> (counter)</li>
 *   <li><b>jobs.completed</b> (counter, tag {@code status}): finished jobs by final status</li>
 *   <li><b>workers.paused</b> (gauge): number of paused worker classes</li>
 *   <li><b>jobs.queued</b> (gauge): jobs waiting across all queues</li>
 * </ul>
 */
@Service
public class SignalMetricsService {

    private static final Logger log = LoggerFactory.getLogger(SignalMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Map<SignalType, Counter> signalCounters = new EnumMap<>(SignalType.class);
    private final Counter instrumentFailureCounter;
    private final Counter duplicateSkippedCounter;
    private final Counter timedOutCounter;
    private final Timer runDurationTimer;

    public SignalMetricsService(
            MeterRegistry meterRegistry, JobQueue jobQueue, WorkerClassControl workerClassControl) {
        this.meterRegistry = meterRegistry;

        for (SignalType type : SignalType.values()) {
            signalCounters.put(
                    type,
                    Counter.builder("signals.generated")
                            .description("Aggregated signals emitted")
                            .tag("type", type.name())
                            .register(meterRegistry));
        }

        this.instrumentFailureCounter = Counter.builder("pipeline.instrument.failures")
                .description("Instruments whose pipeline run ended FAILED")
                .register(meterRegistry);

        this.duplicateSkippedCounter = Counter.builder("jobs.duplicate.skipped")
                .description("Job dispatches dropped because the dedupe key was held")
                .register(meterRegistry);

        this.timedOutCounter = Counter.builder("jobs.timed.out")
                .description("Jobs that exceeded their timeout")
                .register(meterRegistry);

        this.runDurationTimer = Timer.builder("pipeline.run.duration")
                .description("Wall time of a pipeline run")
                .publishPercentiles(0.5, 0.95)
                .register(meterRegistry);

        meterRegistry.gauge("workers.paused", workerClassControl, control -> control.pausedClasses()
                .size());
        meterRegistry.gauge("jobs.queued", jobQueue, queue -> queue.queueNames().stream()
                .mapToInt(queue::size)
                .sum());
    }

    @EventListener
    @Order(20)
    public void onSignalGenerated(SignalGeneratedEvent event) {
        signalCounters.get(event.getSignal().getSignalType()).increment();
    }

    @EventListener
    @Order(20)
    public void onPipelineRun(PipelineRunEvent event) {
        int failed = event.getSummary().getFailed();
        if (failed > 0) {
            instrumentFailureCounter.increment(failed);
        }
        if (event.getSummary().getStartedAt() != null && event.getSummary().getFinishedAt() != null) {
            runDurationTimer.record(
                    Duration.between(event.getSummary().getStartedAt(), event.getSummary().getFinishedAt()));
        }
    }

    @EventListener
    @Order(20)
    public void onJobEvent(JobEvent event) {
        switch (event.getEventType()) {
            case DUPLICATE_SKIPPED -> duplicateSkippedCounter.increment();
            case TIMED_OUT -> {
                timedOutCounter.increment();
                finished("TIMED_OUT");
            }
            case COMPLETED -> finished("DONE");
            case FAILED -> finished("FAILED");
            case SKIPPED -> finished("SKIPPED");
            default -> log.trace("No metric for job event {}", event.getEventType());
        }
    }

    private void finished(String status) {
        meterRegistry.counter("jobs.completed", "status", status).increment();
    }
}
