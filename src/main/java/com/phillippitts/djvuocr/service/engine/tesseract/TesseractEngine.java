package com.phillippitts.djvuocr.service.engine.tesseract;

import com.phillippitts.djvuocr.config.properties.TesseractConfig;
import com.phillippitts.djvuocr.domain.TextDetails;
import com.phillippitts.djvuocr.domain.zone.BBox;
import com.phillippitts.djvuocr.domain.zone.TextZone;
import com.phillippitts.djvuocr.domain.zone.ZoneType;
import com.phillippitts.djvuocr.exception.EngineNotFoundException;
import com.phillippitts.djvuocr.exception.ExternalToolException;
import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.exception.OcrEngineException;
import com.phillippitts.djvuocr.exception.UnknownLanguageListException;
import com.phillippitts.djvuocr.service.engine.AbstractOcrEngine;
import com.phillippitts.djvuocr.service.engine.ExtractSettings;
import com.phillippitts.djvuocr.service.engine.ImageFormat;
import com.phillippitts.djvuocr.service.engine.RawOcrOutput;
import com.phillippitts.djvuocr.service.process.ProcessResult;
import com.phillippitts.djvuocr.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Tesseract-based implementation of {@link com.phillippitts.djvuocr.service.engine.OcrEngine}
 * using the external {@code tesseract} binary.
 *
 * <p><b>Architecture:</b>
 * <ul>
 *   <li>Probes {@code tesseract --list-langs} at construction; a binary that cannot be started
 *       fails with {@link EngineNotFoundException}</li>
 *   <li>Recognizes each page into {@code out.txt} inside a private temporary directory</li>
 *   <li>Produces a single page zone holding the whole page text</li>
 * </ul>
 *
 * <p><b>Engine properties:</b> {@code psm} (page segmentation mode, 0-13) and {@code oem}
 * (OCR engine mode, 0-3) are passed through to the binary. Any other key is rejected.
 *
 * <p><b>Thread Safety:</b> Safe for concurrent recognition. Every call owns its temporary
 * directory and subprocess; the language list is computed once.
 *
 * <p><b>Privacy:</b> Never logs recognized text; only character counts.
 */
public final class TesseractEngine extends AbstractOcrEngine {

    private static final Logger LOG = LogManager.getLogger(TesseractEngine.class);
    static final String ENGINE = "tesseract";

    private static final Pattern LANGUAGE_PATTERN = Pattern.compile("[a-z]{3}([_-][a-z]+)*");
    private static final String LIST_HEADER = "List of available languages";
    private static final String OUTPUT_BASE = "out";
    private static final ImageFormat TIFF_BITONAL = new ImageFormat("tif", "tiff", 1);
    private static final ImageFormat TIFF_COLOR = new ImageFormat("tif", "tiff", 24);

    private final TesseractConfig cfg;
    private final ProcessRunner runner;
    private final Map<String, String> cliOptions;
    private final ProcessResult probe;

    private final Object lock = new Object();
    private List<String> languages;

    /**
     * Creates the engine and probes the binary.
     *
     * @param cfg tesseract configuration
     * @param engineProperties engine specific settings ({@code psm}, {@code oem})
     * @param runner process runner
     * @throws EngineNotFoundException if the binary cannot be started
     * @throws InvalidOptionsException if an engine property is unknown or out of range
     */
    public TesseractEngine(TesseractConfig cfg, Map<String, String> engineProperties, ProcessRunner runner) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.runner = Objects.requireNonNull(runner, "runner");
        this.cliOptions = parseEngineProperties(engineProperties == null ? Map.of() : engineProperties);
        this.probe = probe();
        LOG.info("Tesseract engine ready: bin={}, defaultLanguage={}, options={}",
                cfg.binaryPath(), cfg.defaultLanguage(), cliOptions);
    }

    private ProcessResult probe() {
        try {
            return runner.run(ENGINE, List.of(cfg.binaryPath(), "--list-langs"), null, timeout(),
                    cfg.maxStdoutBytes());
        } catch (ExternalToolInterruptedException e) {
            throw e;
        } catch (ExternalToolException e) {
            throw new EngineNotFoundException(ENGINE, e);
        }
    }

    private static Map<String, String> parseEngineProperties(Map<String, String> properties) {
        Map<String, String> options = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            String key = entry.getKey();
            switch (key) {
                case "psm" -> options.put("--psm", checkRange(key, entry.getValue(), 0, 13));
                case "oem" -> options.put("--oem", checkRange(key, entry.getValue(), 0, 3));
                default -> throw new InvalidOptionsException("Unknown property for " + ENGINE + ": " + key);
            }
        }
        return Map.copyOf(options);
    }

    private static String checkRange(String key, String value, int min, int max) {
        try {
            int n = Integer.parseInt(value.strip());
            if (n < min || n > max) {
                throw new InvalidOptionsException(
                        "Property " + key + " must be between " + min + " and " + max + ": " + value);
            }
            return Integer.toString(n);
        } catch (NumberFormatException e) {
            throw new InvalidOptionsException("Property " + key + " must be an integer: " + value, e);
        }
    }

    @Override
    public String engineName() {
        return ENGINE;
    }

    @Override
    protected Pattern languagePattern() {
        return LANGUAGE_PATTERN;
    }

    @Override
    public List<String> listLanguages() {
        synchronized (lock) {
            if (languages == null) {
                languages = parseLanguages(probe);
            }
            return languages;
        }
    }

    /**
     * Parses {@code --list-langs} output. Old releases print the list to stderr.
     */
    static List<String> parseLanguages(ProcessResult result) {
        String output = result.stdout().isBlank() ? result.stderr() : result.stdout();
        List<String> lines = output.lines().map(String::strip).filter(s -> !s.isEmpty()).toList();
        if (lines.isEmpty() || !lines.get(0).startsWith(LIST_HEADER)) {
            throw new UnknownLanguageListException(
                    "Unexpected output of " + ENGINE + " --list-langs (exit " + result.exitCode() + ")");
        }
        List<String> found = new ArrayList<>();
        for (String line : lines.subList(1, lines.size())) {
            if (LANGUAGE_PATTERN.matcher(line).matches()) {
                found.add(line);
            }
        }
        found.sort(null);
        return List.copyOf(found);
    }

    @Override
    public String defaultLanguage() {
        return cfg.defaultLanguage();
    }

    @Override
    public ImageFormat imageFormat(int bitsPerPixel) {
        return bitsPerPixel == 1 ? TIFF_BITONAL : TIFF_COLOR;
    }

    @Override
    public RawOcrOutput recognize(Path image, String language, TextDetails details) {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(language, "language");
        Path dir = null;
        try {
            dir = Files.createTempDirectory("djvuocr-tesseract");
            List<String> command = new ArrayList<>();
            command.add(cfg.binaryPath());
            command.add(image.toString());
            command.add(dir.resolve(OUTPUT_BASE).toString());
            command.add("-l");
            command.add(language);
            cliOptions.forEach((option, value) -> {
                command.add(option);
                command.add(value);
            });
            ProcessResult result = runner.runChecked(ENGINE, command, null, timeout(), cfg.maxStdoutBytes());
            Path out = dir.resolve(OUTPUT_BASE + ".txt");
            if (!Files.isRegularFile(out)) {
                throw new OcrEngineException("No output file produced for " + image.getFileName(), ENGINE);
            }
            LOG.debug("Recognized {} in {} ms", image.getFileName(), result.durationMs());
            return new RawOcrOutput(dir, out, "txt");
        } catch (Exception e) {
            deleteQuietly(dir);
            throw handleRecognitionError(e);
        }
    }

    /**
     * Builds a single page zone spanning the rendered image, then rotates it back to page
     * coordinates. Plain text output carries no geometry, so {@code details} has no effect.
     */
    @Override
    public TextZone extractText(RawOcrOutput raw, ExtractSettings settings) {
        try {
            String text = raw.readText().stripTrailing();
            BBox pageBox = new BBox(0, 0, settings.renderedSize().width(), settings.renderedSize().height());
            LOG.debug("Extracted page text (chars={})", text.length());
            return TextZone.leaf(ZoneType.PAGE, pageBox, text).rotate(settings.rotation());
        } catch (Exception e) {
            throw handleRecognitionError(e);
        }
    }

    private Duration timeout() {
        return Duration.ofSeconds(cfg.timeoutSeconds());
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            LOG.warn("Failed to delete temporary directory {}: {}", dir, e.getMessage());
        }
    }
}
