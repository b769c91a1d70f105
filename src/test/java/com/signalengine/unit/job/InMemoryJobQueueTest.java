package com.signalengine.unit.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.JobStatus;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.domain.model.Instrument;
import com.signalengine.exception.DuplicateJobException;
import com.signalengine.exception.ResourceNotFoundException;
import com.signalengine.job.InMemoryJobQueue;
import com.signalengine.job.Job;
import com.signalengine.job.JobHandle;
import com.signalengine.job.PrioritizedJob;
import com.signalengine.pipeline.RunSummary;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class InMemoryJobQueueTest {

    private InMemoryJobQueue jobQueue;

    @BeforeEach
    void setUp() {
        SignalEngineProperties properties = new SignalEngineProperties();
        properties.getQueues().put("us", 2);
        properties.getQueues().put("multi-tf", 1);
        jobQueue = new InMemoryJobQueue(properties, Clock.fixed(Instant.parse("2026-03-02T15:00:00Z"), ZoneOffset.UTC));
    }

    private static Job job(String id, String queue, PriorityClass priorityClass) {
        return job(id, queue, priorityClass, "rt:" + id);
    }

    private static Job job(String id, String queue, PriorityClass priorityClass, String dedupeKey) {
        return Job.builder()
                .id(id)
                .queueName(queue)
                .instruments(List.of(new Instrument("AAPL", "NASDAQ", true, "macd-zone")))
                .mode(PipelineMode.REALTIME)
                .dedupeKey(dedupeKey)
                .timeout(Duration.ofSeconds(300))
                .priorityClass(priorityClass)
                .build();
    }

    private String pollId(String queue) throws InterruptedException {
        return jobQueue.poll(queue, Duration.ofMillis(10)).map(entry -> entry.getJob().getId()).orElse(null);
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        @DisplayName("Higher priority classes are polled first, FIFO within a class")
        void priorityThenFifo() throws InterruptedException {
            jobQueue.enqueue(job("rt-1", "us", PriorityClass.REALTIME));
            jobQueue.enqueue(job("bf-1", "us", PriorityClass.BACKFILL));
            jobQueue.enqueue(job("rt-2", "us", PriorityClass.REALTIME));
            jobQueue.enqueue(job("mt-1", "us", PriorityClass.MULTI_TIMEFRAME));

            assertThat(pollId("us")).isEqualTo("mt-1");
            assertThat(pollId("us")).isEqualTo("bf-1");
            assertThat(pollId("us")).isEqualTo("rt-1");
            assertThat(pollId("us")).isEqualTo("rt-2");
            assertThat(pollId("us")).isNull();
        }

        @Test
        @DisplayName("Queues are independent")
        void queuesIndependent() throws InterruptedException {
            jobQueue.enqueue(job("a", "us", PriorityClass.REALTIME));

            Optional<PrioritizedJob> polled = jobQueue.poll("multi-tf", Duration.ofMillis(10));

            assertThat(polled).isEmpty();
            assertThat(jobQueue.size("us")).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Status tracking")
    class StatusTracking {

        @Test
        @DisplayName("Only the first claim of a job succeeds")
        void singleClaim() {
            JobHandle handle = jobQueue.enqueue(job("a", "us", PriorityClass.REALTIME));

            assertThat(jobQueue.claim(handle)).isTrue();
            assertThat(jobQueue.claim(handle)).isFalse();
            assertThat(jobQueue.status(handle)).isEqualTo(JobStatus.RUNNING);
        }

        @Test
        @DisplayName("A finished job keeps its summary")
        void doneKeepsSummary() {
            JobHandle handle = jobQueue.enqueue(job("a", "us", PriorityClass.REALTIME));
            jobQueue.claim(handle);
            RunSummary summary = RunSummary.builder().mode(PipelineMode.REALTIME).processed(1).build();

            jobQueue.markDone(handle, summary);

            assertThat(jobQueue.status(handle)).isEqualTo(JobStatus.DONE);
            assertThat(jobQueue.result(handle)).contains(summary);
            assertThat(jobQueue.find(handle).orElseThrow().getFinishedAt()).isNotNull();
        }

        @Test
        @DisplayName("Failed and skipped jobs carry their reason")
        void failureReason() {
            JobHandle failed = jobQueue.enqueue(job("a", "us", PriorityClass.REALTIME));
            JobHandle skipped = jobQueue.enqueue(job("b", "multi-tf", PriorityClass.MULTI_TIMEFRAME));

            jobQueue.markFailed(failed, "boom");
            jobQueue.markSkipped(skipped, "lease held");

            assertThat(jobQueue.find(failed).orElseThrow().getError()).isEqualTo("boom");
            assertThat(jobQueue.status(skipped)).isEqualTo(JobStatus.SKIPPED);
            assertThat(jobQueue.result(failed)).isEmpty();
        }

        @Test
        @DisplayName("Unknown job and unknown queue are not found")
        void unknown() {
            assertThatThrownBy(() -> jobQueue.status(new JobHandle("x", "us")))
                    .isInstanceOf(ResourceNotFoundException.class);
            assertThatThrownBy(() -> jobQueue.enqueue(job("x", "eu", PriorityClass.REALTIME)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Dedupe key ownership")
    class DedupeKeyOwnership {

        @Test
        @DisplayName("A second job with an unfinished job's key is refused and not queued")
        void unfinishedKeyRefused() {
            JobHandle first = jobQueue.enqueue(job("a", "us", PriorityClass.REALTIME, "rt:NASDAQ:AAPL:us"));

            assertThatThrownBy(() -> jobQueue.enqueue(job("b", "us", PriorityClass.REALTIME, "rt:NASDAQ:AAPL:us")))
                    .isInstanceOf(DuplicateJobException.class);
            assertThat(jobQueue.size("us")).isEqualTo(1);
            assertThat(jobQueue.findUnfinished("rt:NASDAQ:AAPL:us")).contains(first);
        }

        @Test
        @DisplayName("A running job still owns its key")
        void runningKeyRefused() {
            JobHandle first = jobQueue.enqueue(job("a", "us", PriorityClass.REALTIME, "rt:NASDAQ:AAPL:us"));
            jobQueue.claim(first);

            assertThatThrownBy(() -> jobQueue.enqueue(job("b", "us", PriorityClass.REALTIME, "rt:NASDAQ:AAPL:us")))
                    .isInstanceOf(DuplicateJobException.class);
        }

        @Test
        @DisplayName("Finishing a job frees its key")
        void finishedKeyFreed() {
            JobHandle first = jobQueue.enqueue(job("a", "us", PriorityClass.REALTIME, "rt:NASDAQ:AAPL:us"));
            jobQueue.claim(first);
            jobQueue.markFailed(first, "boom");

            assertThat(jobQueue.findUnfinished("rt:NASDAQ:AAPL:us")).isEmpty();
            JobHandle second = jobQueue.enqueue(job("b", "us", PriorityClass.REALTIME, "rt:NASDAQ:AAPL:us"));
            assertThat(jobQueue.findUnfinished("rt:NASDAQ:AAPL:us")).contains(second);
        }
    }
}
