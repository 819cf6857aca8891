package com.phillippitts.djvuocr.service.save;

/**
 * How the transcript is merged back into the document.
 */
public enum SaverType {
    /** Write a new bundled multi-page document. */
    BUNDLED,
    /** Write a new indirect multi-page document (index file plus components). */
    INDIRECT,
    /** Write the djvused script only. */
    SCRIPT,
    /** Modify the input document in place. */
    IN_PLACE,
    /** Recognize pages but save nothing. */
    DRY_RUN
}
