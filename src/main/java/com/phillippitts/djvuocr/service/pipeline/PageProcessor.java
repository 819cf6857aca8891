package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.zone.TextZone;

/**
 * Turns one page into its text zones. Called by page workers with no lock held.
 *
 * <p>Implementations signal a page without a usable image with
 * {@link com.phillippitts.djvuocr.exception.NoImageException}; any other exception is a
 * page failure subject to the run's {@link com.phillippitts.djvuocr.domain.ErrorPolicy}.
 */
@FunctionalInterface
public interface PageProcessor {

    TextZone process(PageDescriptor page);
}
