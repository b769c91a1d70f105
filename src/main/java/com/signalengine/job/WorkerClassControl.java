package com.signalengine.job;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Pause switch per worker class (queue). Workers of a paused class take no new jobs; jobs
 * already running finish normally.
 */
@Component
public class WorkerClassControl {

    private final Set<String> paused = ConcurrentHashMap.newKeySet();

    /** @return true if the class was running before */
    public boolean pause(String workerClass) {
        return paused.add(workerClass);
    }

    /** @return true if the class was paused before */
    public boolean resume(String workerClass) {
        return paused.remove(workerClass);
    }

    public boolean isPaused(String workerClass) {
        return paused.contains(workerClass);
    }

    public Set<String> pausedClasses() {
        return Set.copyOf(paused);
    }
}
