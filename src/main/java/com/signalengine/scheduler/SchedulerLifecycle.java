package com.signalengine.scheduler;

import com.signalengine.config.SignalEngineProperties;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Starts the cadence loops with the application context and cancels them on shutdown:
 * the conflict arbiter loop ({@code signalengine.scheduler.enabled}) and the realtime
 * dispatch loop ({@code signalengine.scheduler.realtime-dispatch.enabled}).
 */
@Component
public class SchedulerLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycle.class);

    private final ConflictArbiter conflictArbiter;
    private final RealtimeDispatchCycle realtimeDispatchCycle;
    private final TaskScheduler taskScheduler;
    private final SignalEngineProperties.Scheduler settings;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final List<CadenceLoop> loops = new ArrayList<>();

    public SchedulerLifecycle(
            ConflictArbiter conflictArbiter,
            RealtimeDispatchCycle realtimeDispatchCycle,
            @Qualifier("cadenceScheduler") TaskScheduler taskScheduler,
            SignalEngineProperties properties,
            Clock clock) {
        this.conflictArbiter = conflictArbiter;
        this.realtimeDispatchCycle = realtimeDispatchCycle;
        this.taskScheduler = taskScheduler;
        this.settings = properties.getScheduler();
        this.clock = clock;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        if (!settings.isEnabled()) {
            log.info("Scheduler disabled");
            return;
        }

        loops.add(new CadenceLoop(
                "conflict-arbiter",
                conflictArbiter::tick,
                taskScheduler,
                settings.getArbiterCadence(),
                settings.getInitialBackoff(),
                settings.getMaxBackoff(),
                clock));

        if (settings.getRealtimeDispatch().isEnabled()) {
            loops.add(new CadenceLoop(
                    "realtime-dispatch",
                    realtimeDispatchCycle::runCycle,
                    taskScheduler,
                    settings.getRealtimeDispatch().getCadence(),
                    settings.getInitialBackoff(),
                    settings.getMaxBackoff(),
                    clock));
        }

        loops.forEach(CadenceLoop::start);
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            loops.forEach(CadenceLoop::cancel);
            loops.clear();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // after the worker pool
        return 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
