/**
 * Tesseract OCR engine, driven through its command-line binary.
 */
package com.phillippitts.djvuocr.service.engine.tesseract;
