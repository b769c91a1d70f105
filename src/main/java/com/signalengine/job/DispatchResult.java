package com.signalengine.job;

/**
 * Outcome of a dispatch: either the handle of the admitted job, or a duplicate skip.
 */
public record DispatchResult(boolean admitted, JobHandle handle, String dedupeKey, String reason) {

    public static DispatchResult admitted(JobHandle handle, String dedupeKey) {
        return new DispatchResult(true, handle, dedupeKey, null);
    }

    public static DispatchResult duplicate(String dedupeKey) {
        return new DispatchResult(false, null, dedupeKey, "skip: duplicate");
    }
}
