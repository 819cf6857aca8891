package com.phillippitts.djvuocr.domain;

/**
 * Granularity of the text zones extracted from OCR output.
 */
public enum TextDetails {
    LINES,
    WORDS,
    CHARS
}
