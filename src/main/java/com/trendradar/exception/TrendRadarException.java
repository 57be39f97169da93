package com.trendradar.exception;

/**
 * Base type for failures raised by the aggregation engine and its collaborators.
 */
public class TrendRadarException extends RuntimeException {

    public TrendRadarException(String message) {
        super(message);
    }

    public TrendRadarException(String message, Throwable cause) {
        super(message, cause);
    }
}
