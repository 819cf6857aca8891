package com.phillippitts.djvuocr.exception;

/**
 * Signals that a page has no image suitable for OCR (for example the requested layer is absent).
 * Not an error: the page is left without a text layer and processing continues.
 */
public class NoImageException extends DjvuOcrException {

    private final int pageNumber;

    public NoImageException(int pageNumber, String reason) {
        super("No image suitable for OCR on page " + pageNumber + ": " + reason);
        this.pageNumber = pageNumber;
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
