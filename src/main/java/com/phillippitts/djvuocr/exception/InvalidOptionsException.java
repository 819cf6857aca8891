package com.phillippitts.djvuocr.exception;

/**
 * Thrown when the command-line options are inconsistent or refer to unusable resources.
 */
public class InvalidOptionsException extends DjvuOcrException {

    public InvalidOptionsException(String message) {
        super(message);
    }

    public InvalidOptionsException(String message, Throwable cause) {
        super(message, cause);
    }
}
