package com.phillippitts.djvuocr.exception;

/**
 * Thrown when a document run is interrupted by the user or cancelled before all pages resolved.
 */
public class RunInterruptedException extends DjvuOcrException {

    public RunInterruptedException(String message) {
        super(message);
    }

    public RunInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
