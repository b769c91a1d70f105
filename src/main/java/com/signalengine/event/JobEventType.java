package com.signalengine.event;

/**
 * Classifies a {@link JobEvent}.
 */
public enum JobEventType {

    /** Dedupe key claimed and job enqueued. */
    ADMITTED,

    /** Dedupe key already claimed; the request was dropped. */
    DUPLICATE_SKIPPED,

    /** A worker claimed the job and started the pipeline. */
    STARTED,

    COMPLETED,

    FAILED,

    /** The pipeline exceeded the job timeout. Also counted as FAILED by the queue. */
    TIMED_OUT,

    /** Exclusive job found its workflow lease held by another run. */
    SKIPPED
}
