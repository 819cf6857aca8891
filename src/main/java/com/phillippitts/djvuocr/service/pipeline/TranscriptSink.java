package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.zone.TextZone;

/**
 * Receives transcript entries from the assembler, one per requested page, in page order.
 * Only ever called from the assembling thread.
 */
public interface TranscriptSink {

    void append(PageDescriptor page, TextZone zone);

    /**
     * Records a page that ends up without a text layer, replacing any hidden text it had.
     */
    void appendEmpty(PageDescriptor page);
}
