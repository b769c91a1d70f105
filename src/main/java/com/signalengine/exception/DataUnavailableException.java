package com.signalengine.exception;

import java.util.Map;

/**
 * Market data could not be fetched for one instrument/timeframe. Isolated to that
 * timeframe (or instrument) within a pipeline run.
 */
public class DataUnavailableException extends BaseException {

    public DataUnavailableException(String message) {
        super(ErrorCode.DATA_UNAVAILABLE, message);
    }

    public DataUnavailableException(String message, Map<String, Object> details) {
        super(ErrorCode.DATA_UNAVAILABLE, message, details);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(ErrorCode.DATA_UNAVAILABLE, message, cause);
    }
}
