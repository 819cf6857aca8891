package com.phillippitts.djvuocr.service.pipeline;

/**
 * Lifecycle of one page slot in the {@link ResultStore}.
 *
 * <pre>
 * UNCLAIMED → CLAIMED (worker claim, or pre-claimed by cancellation)
 * CLAIMED → SUCCESS | NO_IMAGE | FAILED (worker completion)
 * </pre>
 */
public enum PageState {
    UNCLAIMED,
    CLAIMED,
    SUCCESS,
    NO_IMAGE,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == NO_IMAGE || this == FAILED;
    }
}
