package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.RenderLayers;
import com.phillippitts.djvuocr.domain.TextDetails;
import com.phillippitts.djvuocr.domain.zone.TextZone;
import com.phillippitts.djvuocr.service.djvu.PageSource;
import com.phillippitts.djvuocr.service.engine.ExtractSettings;
import com.phillippitts.djvuocr.service.engine.ImageFormat;
import com.phillippitts.djvuocr.service.engine.OcrEngine;
import com.phillippitts.djvuocr.service.engine.RawOcrOutput;
import com.phillippitts.djvuocr.service.rawocr.RawOcrSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Production {@link PageProcessor}: render the page, recognize it, forward the raw output,
 * extract the text zones.
 *
 * <p>Rendered images are written to the run's working directory as {@code %06d.<ext>}
 * (0-based document page number) and removed afterwards unless {@code debug} is set; in debug
 * mode the raw engine output is kept next to them.
 */
public final class EnginePageProcessor implements PageProcessor {

    private static final Logger LOG = LogManager.getLogger(EnginePageProcessor.class);

    private final OcrEngine engine;
    private final PageSource source;
    private final Path workDir;
    private final RenderLayers layers;
    private final String language;
    private final TextDetails details;
    private final RawOcrSink rawSink;
    private final boolean debug;
    private final ImageFormat imageFormat;

    public EnginePageProcessor(OcrEngine engine, PageSource source, Path workDir, RenderLayers layers,
                               String language, TextDetails details, RawOcrSink rawSink, boolean debug) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.source = Objects.requireNonNull(source, "source");
        this.workDir = Objects.requireNonNull(workDir, "workDir");
        this.layers = Objects.requireNonNull(layers, "layers");
        this.language = Objects.requireNonNull(language, "language");
        this.details = Objects.requireNonNull(details, "details");
        this.rawSink = Objects.requireNonNull(rawSink, "rawSink");
        this.debug = debug;
        this.imageFormat = engine.imageFormat(layers.bitsPerPixel());
    }

    @Override
    public TextZone process(PageDescriptor page) {
        String baseName = String.format("%06d", page.pageNumber() - 1);
        Path image = workDir.resolve(baseName + "." + imageFormat.extension());
        try {
            source.render(page, layers, imageFormat, image);
            try (RawOcrOutput raw = engine.recognize(image, language, details)) {
                if (debug) {
                    saveDebugCopy(raw, workDir.resolve(baseName + "." + raw.extension()));
                }
                rawSink.save(page, raw);
                TextZone zone = engine.extractText(raw, ExtractSettings.forPage(page, details));
                LOG.debug("Page {} recognized (chars={})", page.pageNumber(),
                        zone.text() == null ? 0 : zone.text().length());
                return zone;
            }
        } finally {
            if (!debug) {
                deleteImage(image);
            }
        }
    }

    private static void saveDebugCopy(RawOcrOutput raw, Path target) {
        try {
            raw.saveTo(target);
        } catch (IOException e) {
            LOG.warn("Cannot keep raw OCR output {}: {}", target, e.getMessage());
        }
    }

    private static void deleteImage(Path image) {
        try {
            Files.deleteIfExists(image);
        } catch (IOException e) {
            LOG.warn("Failed to delete rendered image {}: {}", image, e.getMessage());
        }
    }
}
