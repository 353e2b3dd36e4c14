package com.xizhooou.anomaly;

/**
 * Thrown while building trackers from a configuration that cannot be honoured. The alert
 * it refers to is never created.
 */
public class InvalidAlertConfigException extends IllegalArgumentException {

    public InvalidAlertConfigException(String message) {
        super(message);
    }

    public InvalidAlertConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
