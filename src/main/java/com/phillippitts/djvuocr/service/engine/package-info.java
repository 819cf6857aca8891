/**
 * OCR engine contract and the engines shipped with the application.
 *
 * <p>Engines form a closed set ({@link com.phillippitts.djvuocr.service.engine.EngineType})
 * created by {@link com.phillippitts.djvuocr.service.engine.OcrEngineFactory}. Each engine
 * drives an external recognition tool through
 * {@link com.phillippitts.djvuocr.service.process.ProcessRunner}.
 */
package com.phillippitts.djvuocr.service.engine;
