package com.phillippitts.djvuocr.exception;

/**
 * Thrown when a run is aborted because a page failed under the abort error policy.
 * Transcript entries written for earlier pages are kept.
 */
public class PageProcessingException extends DjvuOcrException {

    private final int pageNumber;

    public PageProcessingException(int pageNumber, Throwable cause) {
        super("Processing aborted at page " + pageNumber, cause);
        this.pageNumber = pageNumber;
    }

    public int getPageNumber() {
        return pageNumber;
    }
}
