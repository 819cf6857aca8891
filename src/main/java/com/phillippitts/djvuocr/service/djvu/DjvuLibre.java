package com.phillippitts.djvuocr.service.djvu;

import com.phillippitts.djvuocr.config.properties.DjvuLibreConfig;
import com.phillippitts.djvuocr.exception.DocumentException;
import com.phillippitts.djvuocr.exception.ExternalToolException;
import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.exception.NoImageException;
import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.RenderLayers;
import com.phillippitts.djvuocr.service.engine.ImageFormat;
import com.phillippitts.djvuocr.service.process.ProcessResult;
import com.phillippitts.djvuocr.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Thin adapter over the DjVuLibre command-line tools.
 *
 * <p>Tools used:
 * <ul>
 *   <li>{@code djvused} - document structure queries and applying hidden text scripts</li>
 *   <li>{@code ddjvu} - rendering a page to a raster image</li>
 *   <li>{@code djvmcvt} - converting to bundled or indirect documents</li>
 *   <li>{@code djvm} - removing pages from a bundled document</li>
 * </ul>
 */
@Component
public class DjvuLibre {

    private static final Logger LOG = LogManager.getLogger(DjvuLibre.class);

    static final String DJVUSED = "djvused";
    static final String DDJVU = "ddjvu";
    static final String DJVMCVT = "djvmcvt";
    static final String DJVM = "djvm";

    private final DjvuLibreConfig cfg;
    private final ProcessRunner runner;

    public DjvuLibre(DjvuLibreConfig cfg, ProcessRunner runner) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
    }

    /**
     * Opens a document for page enumeration and rendering.
     *
     * @throws DocumentException if the file is missing or not a readable DjVu document
     */
    public DjvuPageSource open(Path document) {
        Objects.requireNonNull(document, "document");
        if (!Files.isRegularFile(document)) {
            throw new DocumentException("Document not found: " + document);
        }
        return DjvuPageSource.load(this, document);
    }

    /**
     * Runs a djvused script given on the command line and returns its output.
     */
    String query(Path document, String script) {
        try {
            return run(DJVUSED, List.of(cfg.djvusedPath(), "-e", script, document.toString())).stdout();
        } catch (ExternalToolInterruptedException e) {
            throw e;
        } catch (ExternalToolException e) {
            throw new DocumentException("Cannot read " + document.getFileName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Renders one page with ddjvu.
     *
     * @return path of the rendered image
     * @throws NoImageException if the requested layers do not exist on the page
     */
    Path render(Path document, PageDescriptor page, RenderLayers layers, ImageFormat format, Path target) {
        List<String> command = List.of(
                cfg.ddjvuPath(),
                "-format=" + format.rendererFormat(),
                "-mode=" + layers.ddjvuMode(),
                "-page=" + page.pageNumber(),
                document.toString(),
                target.toString());
        ProcessResult result = runner.run(DDJVU, command, null, timeout(), cfg.maxStdoutBytes());
        if (!result.succeeded()) {
            if (result.stderr().toLowerCase(Locale.ROOT).contains("cannot render")) {
                throw new NoImageException(page.pageNumber(), "no " + layers.name().toLowerCase(Locale.ROOT)
                        + " layer");
            }
            throw new ExternalToolException("Rendering page " + page.pageNumber() + " failed",
                    DDJVU, result.exitCode(), result.stderr(), null);
        }
        if (!isNonEmptyFile(target)) {
            throw new NoImageException(page.pageNumber(), "renderer produced no image");
        }
        return target;
    }

    /**
     * Applies a djvused script file to a document, saving the document.
     */
    public void applyScript(Path document, Path script) {
        run(DJVUSED, List.of(cfg.djvusedPath(), "-s", "-f", script.toString(), document.toString()));
    }

    /**
     * Writes a bundled copy of a document.
     */
    public void convertBundled(Path document, Path target) {
        run(DJVMCVT, List.of(cfg.djvmcvtPath(), "-b", document.toString(), target.toString()));
    }

    /**
     * Writes an indirect copy of a document: an index file plus one file per component,
     * all inside the index file's directory.
     */
    public void convertIndirect(Path document, Path indexFile) {
        Path dir = indexFile.toAbsolutePath().getParent();
        run(DJVMCVT, List.of(cfg.djvmcvtPath(), "-i", document.toString(), dir.toString(),
                indexFile.getFileName().toString()));
    }

    /**
     * Removes one page from a bundled document.
     *
     * @param pageNumber 1-based page number
     */
    public void deletePage(Path bundled, int pageNumber) {
        run(DJVM, List.of(cfg.djvmPath(), "-d", bundled.toString(), Integer.toString(pageNumber)));
    }

    private ProcessResult run(String tool, List<String> command) {
        LOG.debug("Running {}", command);
        return runner.runChecked(tool, command, null, timeout(), cfg.maxStdoutBytes());
    }

    private Duration timeout() {
        return Duration.ofSeconds(cfg.timeoutSeconds());
    }

    private static boolean isNonEmptyFile(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            LOG.debug("Cannot stat rendered image {}: {}", path, e.toString());
            return false;
        }
    }
}
