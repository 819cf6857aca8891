package com.phillippitts.djvuocr.service.save;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Everything a {@link DocumentSaver} needs once the transcript is complete.
 *
 * @param document input document
 * @param script transcript script
 * @param pageCount number of pages in the input document
 * @param keepPages 1-based page numbers to keep, or {@code null} to keep every page
 * @param workDir working directory for intermediate files
 */
public record SaveRequest(Path document, Path script, int pageCount, Set<Integer> keepPages, Path workDir) {

    public SaveRequest {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(script, "script");
        Objects.requireNonNull(workDir, "workDir");
        keepPages = keepPages == null ? null : Set.copyOf(keepPages);
    }
}
