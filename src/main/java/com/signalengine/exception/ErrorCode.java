package com.signalengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes returned in the {@code error.code} field. Retryable codes mark upstream or
 * capacity failures where the same request may succeed later.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    DUPLICATE_JOB("DUPLICATE_JOB", 409, false),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", 500, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false),
    DATA_UNAVAILABLE("DATA_UNAVAILABLE", 502, true),
    EMISSION_ERROR("EMISSION_ERROR", 502, true),
    JOB_TIMEOUT("JOB_TIMEOUT", 504, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
