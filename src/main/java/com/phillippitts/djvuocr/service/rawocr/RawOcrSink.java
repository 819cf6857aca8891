package com.phillippitts.djvuocr.service.rawocr;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.service.engine.RawOcrOutput;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Optional side channel that keeps each page's raw engine output.
 *
 * <p>Files are named by a {@link FilenameTemplate} plus the engine's extension, e.g.
 * {@code p0001.txt}. Failures are logged and never affect the transcript.
 */
public final class RawOcrSink {

    private static final Logger LOG = LogManager.getLogger(RawOcrSink.class);

    private static final RawOcrSink DISABLED = new RawOcrSink(null, null);

    private final Path directory;
    private final FilenameTemplate template;

    private RawOcrSink(Path directory, FilenameTemplate template) {
        this.directory = directory;
        this.template = template;
    }

    /**
     * @param directory existing directory to save into
     * @param template file name template
     */
    public static RawOcrSink to(Path directory, FilenameTemplate template) {
        return new RawOcrSink(Objects.requireNonNull(directory, "directory"),
                Objects.requireNonNull(template, "template"));
    }

    public static RawOcrSink disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return directory != null;
    }

    /**
     * Saves the raw output of one page. Never throws.
     */
    public void save(PageDescriptor page, RawOcrOutput raw) {
        if (directory == null) {
            return;
        }
        Path target = null;
        try {
            String prefix = template.expand(page.pageNumber(), page.identifier());
            target = directory.resolve(prefix + "." + raw.extension());
            raw.saveTo(target);
            LOG.debug("Saved raw OCR output of page {} to {}", page.pageNumber(), target);
        } catch (IOException | RuntimeException e) {
            LOG.warn("Cannot save raw OCR output of page {}{}: {}", page.pageNumber(),
                    target == null ? "" : " to " + target, e.getMessage());
        }
    }
}
