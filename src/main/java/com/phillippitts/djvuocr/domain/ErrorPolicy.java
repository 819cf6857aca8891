package com.phillippitts.djvuocr.domain;

/**
 * What a run does when processing a single page fails.
 */
public enum ErrorPolicy {
    /** Halt the run after draining in-flight work. */
    ABORT,
    /** Leave the failed page without text and continue. */
    RESUME
}
