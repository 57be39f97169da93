package com.trendradar.exception;

/**
 * Raised when the persisted frequency window cannot be written.
 */
public class WindowStoreException extends TrendRadarException {

    public WindowStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
