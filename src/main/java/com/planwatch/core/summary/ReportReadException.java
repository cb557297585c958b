package com.planwatch.core.summary;

/**
 * Thrown when a saved summary cannot be read back.
 */
public class ReportReadException extends RuntimeException {

    public ReportReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
