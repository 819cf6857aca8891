package com.phillippitts.djvuocr.service.engine;

import com.phillippitts.djvuocr.domain.TextDetails;
import com.phillippitts.djvuocr.domain.zone.TextZone;
import com.phillippitts.djvuocr.exception.EngineNotFoundException;
import com.phillippitts.djvuocr.exception.InvalidLanguageIdException;
import com.phillippitts.djvuocr.exception.MissingLanguagePackException;
import com.phillippitts.djvuocr.exception.OcrEngineException;
import com.phillippitts.djvuocr.exception.UnknownLanguageListException;

import java.nio.file.Path;
import java.util.List;

/**
 * Contract for OCR engine implementations.
 * Implementations wrap an external recognition tool behind a unified interface.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>The engine is constructed; the constructor probes the external tool and throws
 *       {@link EngineNotFoundException} if it is missing, so failure surfaces before any page work</li>
 *   <li>{@link #checkLanguage(String)} validates the requested language once per run</li>
 *   <li>{@link #recognize(Path, String, TextDetails)} and {@link #extractText(RawOcrOutput, ExtractSettings)}
 *       are called once per page, possibly from several worker threads at once</li>
 * </ol>
 *
 * <p>Thread Safety: implementations must be safe for concurrent recognition calls.
 *
 * @see com.phillippitts.djvuocr.service.engine.tesseract.TesseractEngine
 */
public interface OcrEngine {

    /**
     * @return engine name for logging and selection (e.g., "tesseract")
     */
    String engineName();

    /**
     * Lists the languages this engine can recognize.
     *
     * @return supported language identifiers
     * @throws UnknownLanguageListException if the engine cannot enumerate its languages
     */
    List<String> listLanguages();

    /**
     * @return language used when none is requested; never fails
     */
    String defaultLanguage();

    /**
     * Validates a language identifier.
     *
     * @throws InvalidLanguageIdException if the identifier is syntactically invalid
     * @throws MissingLanguagePackException if the language is valid but not installed
     * @throws UnknownLanguageListException if installed languages cannot be enumerated;
     *         callers may proceed optimistically
     */
    void checkLanguage(String language);

    /**
     * @param bitsPerPixel colour depth of the rendered page
     * @return raster format the engine needs as input
     */
    ImageFormat imageFormat(int bitsPerPixel);

    /**
     * Runs recognition on a page image.
     *
     * <p>The returned output owns temporary files and must be closed by the caller.
     * If recognition fails, temporary files are released before the exception propagates.
     *
     * @param image rendered page image in the format returned by {@link #imageFormat(int)}
     * @param language language identifier
     * @param details requested zone granularity
     * @return raw engine output
     * @throws OcrEngineException if the external tool cannot run or exits abnormally
     */
    RawOcrOutput recognize(Path image, String language, TextDetails details);

    /**
     * Converts raw engine output into the page's text zone tree, applying the page rotation.
     *
     * @throws OcrEngineException if the output cannot be parsed
     */
    TextZone extractText(RawOcrOutput raw, ExtractSettings settings);
}
