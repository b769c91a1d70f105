package com.signalengine.exception;

import java.util.Map;

/**
 * A job with the same dedupe key is already admitted within its lease window.
 * Soft error: the dispatcher converts it into a silent skip.
 */
public class DuplicateJobException extends BaseException {

    public DuplicateJobException(String dedupeKey) {
        super(ErrorCode.DUPLICATE_JOB, "Duplicate job for dedupe key: " + dedupeKey, Map.of("dedupeKey", dedupeKey));
    }
}
