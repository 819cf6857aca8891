package com.phillippitts.djvuocr.service.engine;

import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.exception.InvalidLanguageIdException;
import com.phillippitts.djvuocr.exception.MissingLanguagePackException;
import com.phillippitts.djvuocr.exception.NoImageException;
import com.phillippitts.djvuocr.exception.OcrEngineException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Base class for OCR engines providing language validation and error wrapping.
 *
 * <p>This class implements the Template Method pattern: {@link #checkLanguage(String)} is fixed,
 * subclasses supply the language syntax via {@link #languagePattern()} and the installed
 * languages via {@link #listLanguages()}.
 *
 * <p><b>Language combinations:</b> an identifier such as {@code eng+deu} is accepted when every
 * component is valid and installed.
 */
public abstract class AbstractOcrEngine implements OcrEngine {

    /**
     * @return pattern a single language component must match
     */
    protected abstract Pattern languagePattern();

    @Override
    public final void checkLanguage(String language) {
        if (language == null || language.isEmpty()) {
            throw new InvalidLanguageIdException(String.valueOf(language));
        }
        String[] components = language.split("\\+", -1);
        for (String component : components) {
            if (!languagePattern().matcher(component).matches()) {
                throw new InvalidLanguageIdException(language);
            }
        }
        List<String> installed = listLanguages();
        for (String component : components) {
            if (!installed.contains(component)) {
                throw new MissingLanguagePackException(component);
            }
        }
    }

    /**
     * Converts a recognition failure into the exception callers expect.
     *
     * <p>Interrupts and no-image signals pass through unchanged; {@link OcrEngineException}
     * is not double-wrapped; everything else is wrapped with engine context.
     *
     * <p><b>Usage Pattern:</b>
     * <pre>{@code
     * try {
     *     // recognition logic
     * } catch (Exception e) {
     *     throw handleRecognitionError(e);
     * }
     * }</pre>
     *
     * @param exception the exception that occurred
     * @return never returns normally
     */
    protected final RuntimeException handleRecognitionError(Exception exception) {
        if (exception instanceof ExternalToolInterruptedException
                || exception instanceof NoImageException
                || exception instanceof OcrEngineException) {
            throw (RuntimeException) exception;
        }
        throw new OcrEngineException(engineName() + " recognition failed: " + exception.getMessage(),
                engineName(), exception);
    }
}
