package com.phillippitts.djvuocr.exception;

/**
 * Thrown when a DjVu document cannot be read, addressed or written.
 */
public class DocumentException extends DjvuOcrException {

    public DocumentException(String message) {
        super(message);
    }

    public DocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
