package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.PageDescriptor;

import java.util.List;

/**
 * Summary of a completed pipeline run.
 *
 * @param pageCount number of pages in the work set
 * @param written pages that received a transcript entry, in page order
 */
public record PipelineResult(int pageCount, List<PageDescriptor> written) {

    public PipelineResult {
        written = List.copyOf(written);
    }

    /**
     * @return pages left without text (no image, or skipped after an error)
     */
    public int skippedCount() {
        return pageCount - written.size();
    }
}
