package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.ErrorPolicy;

import java.util.Objects;

/**
 * Run-wide settings of the page pipeline.
 *
 * @param jobs number of page workers
 * @param errorPolicy what to do when a page fails
 */
public record PipelineSettings(int jobs, ErrorPolicy errorPolicy) {

    public PipelineSettings {
        if (jobs < 1) {
            throw new IllegalArgumentException("jobs must be positive: " + jobs);
        }
        Objects.requireNonNull(errorPolicy, "errorPolicy");
    }
}
