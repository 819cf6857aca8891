/**
 * Document-level orchestration of an OCR run.
 */
package com.phillippitts.djvuocr.service.document;
