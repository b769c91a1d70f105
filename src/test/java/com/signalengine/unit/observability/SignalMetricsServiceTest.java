package com.signalengine.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.signalengine.aggregation.AggregatedSignal;
import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.SignalType;
import com.signalengine.event.JobEvent;
import com.signalengine.event.JobEventType;
import com.signalengine.event.PipelineRunEvent;
import com.signalengine.event.SignalGeneratedEvent;
import com.signalengine.job.InMemoryJobQueue;
import com.signalengine.job.Job;
import com.signalengine.job.WorkerClassControl;
import com.signalengine.observability.SignalMetricsService;
import com.signalengine.pipeline.RunSummary;
import com.signalengine.unit.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SignalMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private WorkerClassControl workerClassControl;
    private InMemoryJobQueue jobQueue;
    private SignalMetricsService metricsService;

    private final Job job = Job.builder().id("j-1").queueName("vn").mode(PipelineMode.REALTIME).build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        workerClassControl = new WorkerClassControl();
        SignalEngineProperties properties = new SignalEngineProperties();
        properties.getQueues().put("vn", 1);
        jobQueue = new InMemoryJobQueue(properties, new MutableClock(Instant.parse("2026-03-02T03:00:00Z")));
        metricsService = new SignalMetricsService(meterRegistry, jobQueue, workerClassControl);
    }

    private double count(String name, String tagKey, String tagValue) {
        return meterRegistry.get(name).tag(tagKey, tagValue).counter().count();
    }

    @Nested
    @DisplayName("Counter metrics")
    class Counters {

        @Test
        @DisplayName("signals.generated counts by signal type")
        void signalsGenerated() {
            AggregatedSignal buy = AggregatedSignal.builder().signalType(SignalType.BUY).build();
            metricsService.onSignalGenerated(new SignalGeneratedEvent(this, buy));
            metricsService.onSignalGenerated(new SignalGeneratedEvent(this, buy));

            assertThat(count("signals.generated", "type", "BUY")).isEqualTo(2.0);
            assertThat(count("signals.generated", "type", "SELL")).isZero();
        }

        @Test
        @DisplayName("pipeline run records failures and duration")
        void pipelineRun() {
            RunSummary summary = RunSummary.builder()
                    .mode(PipelineMode.BACKFILL)
                    .failed(2)
                    .errors(Map.of())
                    .results(List.of())
                    .startedAt(Instant.parse("2026-03-02T03:00:00Z"))
                    .finishedAt(Instant.parse("2026-03-02T03:00:04Z"))
                    .build();

            metricsService.onPipelineRun(new PipelineRunEvent(this, summary));

            assertThat(meterRegistry.get("pipeline.instrument.failures").counter().count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.get("pipeline.run.duration").timer().totalTime(TimeUnit.SECONDS))
                    .isEqualTo(4.0);
        }

        @Test
        @DisplayName("job events feed the duplicate, timeout and completion counters")
        void jobEvents() {
            metricsService.onJobEvent(new JobEvent(this, job, JobEventType.DUPLICATE_SKIPPED, "skip: duplicate"));
            metricsService.onJobEvent(new JobEvent(this, job, JobEventType.TIMED_OUT, "timeout"));
            metricsService.onJobEvent(new JobEvent(this, job, JobEventType.COMPLETED));
            metricsService.onJobEvent(new JobEvent(this, job, JobEventType.SKIPPED, "lease held"));
            metricsService.onJobEvent(new JobEvent(this, job, JobEventType.STARTED));

            assertThat(meterRegistry.get("jobs.duplicate.skipped").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("jobs.timed.out").counter().count()).isEqualTo(1.0);
            assertThat(count("jobs.completed", "status", "TIMED_OUT")).isEqualTo(1.0);
            assertThat(count("jobs.completed", "status", "DONE")).isEqualTo(1.0);
            assertThat(count("jobs.completed", "status", "SKIPPED")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Gauge metrics")
    class Gauges {

        @Test
        @DisplayName("workers.paused follows the worker class control")
        void workersPaused() {
            workerClassControl.pause("us");
            workerClassControl.pause("backfill");

            assertThat(meterRegistry.get("workers.paused").gauge().value()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("jobs.queued is zero for empty queues")
        void jobsQueued() {
            assertThat(meterRegistry.get("jobs.queued").gauge().value()).isZero();
        }
    }
}
