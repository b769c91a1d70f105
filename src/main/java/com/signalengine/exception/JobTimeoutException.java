package com.signalengine.exception;

import java.time.Duration;

public class JobTimeoutException extends BaseException {

    public JobTimeoutException(String jobId, Duration timeout) {
        super(ErrorCode.JOB_TIMEOUT, String.format("Job %s exceeded its timeout of %ss", jobId, timeout.toSeconds()));
    }
}
