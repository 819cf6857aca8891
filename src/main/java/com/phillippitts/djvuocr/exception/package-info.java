/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.djvuocr.exception.DjvuOcrException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.djvuocr.exception.EngineNotFoundException} - OCR engine tool is
 *       missing; fatal at startup</li>
 *   <li>{@link com.phillippitts.djvuocr.exception.InvalidLanguageIdException} and
 *       {@link com.phillippitts.djvuocr.exception.MissingLanguagePackException} - language
 *       configuration errors, fatal before any page work starts</li>
 *   <li>{@link com.phillippitts.djvuocr.exception.UnknownLanguageListException} - language
 *       discovery unsupported; informational</li>
 *   <li>{@link com.phillippitts.djvuocr.exception.OcrEngineException} and
 *       {@link com.phillippitts.djvuocr.exception.ExternalToolException} - per-page processing
 *       errors, gated by the run's error policy</li>
 *   <li>{@link com.phillippitts.djvuocr.exception.NoImageException} - page without OCR-able image</li>
 *   <li>{@link com.phillippitts.djvuocr.exception.PageProcessingException} and
 *       {@link com.phillippitts.djvuocr.exception.RunInterruptedException} - run-level outcomes</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and support exception chaining via {@code cause}.
 *
 * @since 1.0
 */
package com.phillippitts.djvuocr.exception;
