package com.signalengine.unit.scheduler;

import static org.assertj.core.api.Assertions.assertThat;

import com.signalengine.config.SignalEngineProperties;
import com.signalengine.job.WorkerClassControl;
import com.signalengine.lease.InMemoryLeaseStore;
import com.signalengine.scheduler.ConflictArbiter;
import com.signalengine.unit.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConflictArbiterTest {

    private MutableClock clock;
    private InMemoryLeaseStore leaseStore;
    private WorkerClassControl workerClassControl;
    private ConflictArbiter arbiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T15:00:00Z"));
        leaseStore = new InMemoryLeaseStore(clock);
        workerClassControl = new WorkerClassControl();

        SignalEngineProperties properties = new SignalEngineProperties();
        properties.getScheduler().setCompetingWorkerClasses(List.of("us", "backfill"));
        arbiter = new ConflictArbiter(leaseStore, workerClassControl, properties, clock);
    }

    @Nested
    @DisplayName("High-priority class active")
    class Active {

        @Test
        @DisplayName("Competing worker classes are paused while the lease is held")
        void pausesCompetitors() {
            leaseStore.tryAcquire("MULTI_TIMEFRAME", Duration.ofMinutes(30));

            assertThat(arbiter.tick()).isTrue();

            assertThat(workerClassControl.pausedClasses()).containsExactlyInAnyOrder("us", "backfill");
            assertThat(workerClassControl.isPaused("vn")).isFalse();
        }

        @Test
        @DisplayName("Repeated ticks keep the classes paused")
        void staysPaused() {
            leaseStore.tryAcquire("MULTI_TIMEFRAME", Duration.ofMinutes(30));

            arbiter.tick();
            arbiter.tick();

            assertThat(workerClassControl.isPaused("us")).isTrue();
        }
    }

    @Nested
    @DisplayName("High-priority class inactive")
    class Inactive {

        @Test
        @DisplayName("Released lease resumes the competing classes")
        void resumesAfterRelease() {
            leaseStore.tryAcquire("MULTI_TIMEFRAME", Duration.ofMinutes(30));
            arbiter.tick();

            leaseStore.release("MULTI_TIMEFRAME");

            assertThat(arbiter.tick()).isFalse();
            assertThat(workerClassControl.pausedClasses()).isEmpty();
        }

        @Test
        @DisplayName("Expired lease resumes the competing classes")
        void resumesAfterExpiry() {
            leaseStore.tryAcquire("MULTI_TIMEFRAME", Duration.ofMinutes(30));
            arbiter.tick();

            clock.advance(Duration.ofMinutes(31));

            assertThat(arbiter.tick()).isFalse();
            assertThat(workerClassControl.isPaused("us")).isFalse();
        }

        @Test
        @DisplayName("Other workflow leases do not pause anything")
        void otherLeaseIgnored() {
            leaseStore.tryAcquire("BACKFILL", Duration.ofMinutes(30));

            assertThat(arbiter.tick()).isFalse();
            assertThat(workerClassControl.pausedClasses()).isEmpty();
        }
    }
}
