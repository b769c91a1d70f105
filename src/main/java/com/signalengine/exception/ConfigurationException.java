package com.signalengine.exception;

/**
 * Invalid strategy policy, threshold set, venue or instrument configuration.
 *
 * <p>Fatal when raised while the configuration registry is being built: the application
 * refuses to start rather than running with a silently defaulted value.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
