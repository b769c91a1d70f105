package com.signalengine.unit.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.signalengine.calendar.MarketCalendarService;
import com.signalengine.config.SignalEngineProperties;
import com.signalengine.domain.enums.Market;
import com.signalengine.domain.enums.PipelineMode;
import com.signalengine.domain.enums.PipelineState;
import com.signalengine.domain.enums.PriorityClass;
import com.signalengine.domain.model.Instrument;
import com.signalengine.event.JobEvent;
import com.signalengine.event.JobEventType;
import com.signalengine.exception.ResourceNotFoundException;
import com.signalengine.job.DispatchResult;
import com.signalengine.job.Job;
import com.signalengine.job.JobDispatcher;
import com.signalengine.job.JobHandle;
import com.signalengine.job.JobRequest;
import com.signalengine.pipeline.InstrumentRunResult;
import com.signalengine.pipeline.RunSummary;
import com.signalengine.policy.ConfigRegistry;
import com.signalengine.scheduler.BackfillTracker;
import com.signalengine.scheduler.RealtimeDispatchCycle;
import com.signalengine.unit.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RealtimeDispatchCycleTest {

    // Monday 10:00 in Ho Chi Minh, Sunday 22:00 in New York
    private static final Instant NOW = Instant.parse("2026-03-02T03:00:00Z");

    private static final Instrument VIC = new Instrument("VIC", "HOSE", true, "trinity");
    private static final Instrument AAPL = new Instrument("AAPL", "NASDAQ", true, "macd-zone");
    private static final Instrument IBM = new Instrument("IBM", "NYSE", false, "macd-zone");

    @Mock
    private ConfigRegistry configRegistry;

    @Mock
    private JobDispatcher jobDispatcher;

    private MutableClock clock;
    private SignalEngineProperties properties;
    private BackfillTracker backfillTracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        properties = new SignalEngineProperties();
        backfillTracker = new BackfillTracker(properties, clock);
        when(configRegistry.instruments()).thenReturn(List.of(VIC, AAPL, IBM));
        when(jobDispatcher.dispatch(any())).thenReturn(DispatchResult.admitted(new JobHandle("j", "q"), "k"));
    }

    private RealtimeDispatchCycle cycle() {
        return new RealtimeDispatchCycle(
                configRegistry, jobDispatcher, backfillTracker, new MarketCalendarService(properties), properties, clock);
    }

    private List<JobRequest> dispatched(int expected) {
        ArgumentCaptor<JobRequest> requests = ArgumentCaptor.forClass(JobRequest.class);
        verify(jobDispatcher, times(expected)).dispatch(requests.capture());
        return requests.getAllValues();
    }

    @Nested
    @DisplayName("Backfill first")
    class BackfillFirst {

        @Test
        @DisplayName("Instruments without a recent backfill get a BACKFILL job on the backfill queue")
        void dispatchesBackfill() {
            RealtimeDispatchCycle.CycleResult result = cycle().runCycle();

            List<JobRequest> requests = dispatched(2);
            assertThat(requests).extracting(JobRequest::getDedupeKey).containsExactly("bf:HOSE:VIC", "bf:NASDAQ:AAPL");
            assertThat(requests).allSatisfy(request -> {
                assertThat(request.getQueueName()).isEqualTo("backfill");
                assertThat(request.getMode()).isEqualTo(PipelineMode.BACKFILL);
                assertThat(request.getPriorityClass()).isEqualTo(PriorityClass.BACKFILL);
                assertThat(request.getTimeout()).isEqualTo(Duration.ofMinutes(30));
            });
            assertThat(result.admitted()).isEqualTo(2);
        }

        @Test
        @DisplayName("A completed backfill job marks its DONE instruments as backfilled")
        void completedBackfillRecorded() {
            Job job = Job.builder().id("j").queueName("backfill").mode(PipelineMode.BACKFILL).build();
            RunSummary summary = RunSummary.builder()
                    .mode(PipelineMode.BACKFILL)
                    .results(List.of(
                            InstrumentRunResult.builder()
                                    .instrumentKey("HOSE:VIC")
                                    .finalState(PipelineState.DONE)
                                    .build(),
                            InstrumentRunResult.builder()
                                    .instrumentKey("NASDAQ:AAPL")
                                    .finalState(PipelineState.FAILED)
                                    .build()))
                    .build();

            backfillTracker.onJobEvent(new JobEvent(this, job, JobEventType.COMPLETED, null, summary));

            assertThat(backfillTracker.isBackfilled("HOSE:VIC")).isTrue();
            assertThat(backfillTracker.isBackfilled("NASDAQ:AAPL")).isFalse();
        }
    }

    @Nested
    @DisplayName("Realtime")
    class Realtime {

        @Test
        @DisplayName("Backfilled instrument in an open market gets a REALTIME job on its market queue")
        void dispatchesRealtimeWhenOpen() {
            backfillTracker.markBackfilled("HOSE:VIC");
            backfillTracker.markBackfilled("NASDAQ:AAPL");

            cycle().runCycle();

            // US market is closed at this instant
            List<JobRequest> requests = dispatched(1);
            JobRequest request = requests.get(0);
            assertThat(request.getQueueName()).isEqualTo(Market.VN.getQueueName());
            assertThat(request.getDedupeKey()).isEqualTo("rt:HOSE:VIC:vn");
            assertThat(request.getMode()).isEqualTo(PipelineMode.REALTIME);
            assertThat(request.getPriorityClass()).isEqualTo(PriorityClass.REALTIME);
            assertThat(request.getTimeout()).isEqualTo(Duration.ofSeconds(300));
        }

        @Test
        @DisplayName("Only-symbols restricts the cycle")
        void onlySymbols() {
            properties.getScheduler().getRealtimeDispatch().setOnlySymbols(List.of("aapl"));

            cycle().runCycle();

            assertThat(dispatched(1)).extracting(JobRequest::getDedupeKey).containsExactly("bf:NASDAQ:AAPL");
        }

        @Test
        @DisplayName("Backfill memory expires and the instrument is backfilled again")
        void backfillMemoryExpires() {
            backfillTracker.markBackfilled("HOSE:VIC");
            clock.advance(Duration.ofHours(23));
            assertThat(backfillTracker.isBackfilled("HOSE:VIC")).isTrue();

            clock.advance(Duration.ofHours(2));
            assertThat(backfillTracker.isBackfilled("HOSE:VIC")).isFalse();
        }
    }

    @Test
    @DisplayName("A dispatch error for one instrument does not stop the cycle")
    void errorIsolated() {
        when(jobDispatcher.dispatch(any()))
                .thenThrow(new ResourceNotFoundException("Queue", "backfill"))
                .thenReturn(DispatchResult.duplicate("bf:NASDAQ:AAPL"));

        RealtimeDispatchCycle.CycleResult result = cycle().runCycle();

        assertThat(result.errors()).isEqualTo(1);
        assertThat(result.duplicates()).isEqualTo(1);
    }
}
