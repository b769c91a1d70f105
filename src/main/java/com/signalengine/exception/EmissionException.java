package com.signalengine.exception;

public class EmissionException extends BaseException {

    public EmissionException(String message) {
        super(ErrorCode.EMISSION_ERROR, message);
    }

    public EmissionException(String message, Throwable cause) {
        super(ErrorCode.EMISSION_ERROR, message, cause);
    }
}
