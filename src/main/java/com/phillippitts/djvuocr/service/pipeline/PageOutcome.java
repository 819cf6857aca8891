package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.zone.TextZone;

import java.util.Objects;

/**
 * Result of processing one page, or the state of a slot that never got one.
 *
 * @param state page state; {@link PageState#CLAIMED} only for slots pre-claimed by cancellation
 * @param zone text zones when {@code state} is SUCCESS, otherwise null
 * @param error cause when {@code state} is FAILED, otherwise null
 */
public record PageOutcome(PageState state, TextZone zone, Throwable error) {

    private static final PageOutcome NO_IMAGE = new PageOutcome(PageState.NO_IMAGE, null, null);
    private static final PageOutcome CANCELLED = new PageOutcome(PageState.CLAIMED, null, null);

    public PageOutcome {
        Objects.requireNonNull(state, "state");
        if (state == PageState.SUCCESS && zone == null) {
            throw new IllegalArgumentException("SUCCESS requires text zones");
        }
        if (state == PageState.FAILED && error == null) {
            throw new IllegalArgumentException("FAILED requires an error");
        }
    }

    public static PageOutcome success(TextZone zone) {
        return new PageOutcome(PageState.SUCCESS, Objects.requireNonNull(zone, "zone"), null);
    }

    public static PageOutcome noImage() {
        return NO_IMAGE;
    }

    public static PageOutcome failed(Throwable error) {
        return new PageOutcome(PageState.FAILED, null, Objects.requireNonNull(error, "error"));
    }

    /**
     * Outcome reported for a slot that cancellation claimed before any worker did.
     */
    static PageOutcome cancelled() {
        return CANCELLED;
    }
}
