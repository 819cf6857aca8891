package com.phillippitts.djvuocr.exception;

/**
 * Thrown when an engine cannot enumerate its installed languages.
 * Informational: callers may proceed and assume the requested language is installed.
 */
public class UnknownLanguageListException extends DjvuOcrException {

    public UnknownLanguageListException(String message) {
        super(message);
    }

    public UnknownLanguageListException(String message, Throwable cause) {
        super(message, cause);
    }
}
