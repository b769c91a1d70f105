package com.signalengine.domain.enums;

/**
 * Lifecycle of a job in the queue. SKIPPED means an exclusive job found its lease already
 * held by another run and did no work.
 */
public enum JobStatus {
    QUEUED,
    RUNNING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isFinished() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }
}
