package com.phillippitts.djvuocr.exception;

/**
 * Base exception for all djvu-ocr application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class DjvuOcrException extends RuntimeException {

    public DjvuOcrException(String message) {
        super(message);
    }

    public DjvuOcrException(String message, Throwable cause) {
        super(message, cause);
    }

    public DjvuOcrException(Throwable cause) {
        super(cause);
    }
}
