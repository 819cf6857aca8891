/**
 * Saving raw OCR engine output next to the transcript.
 */
package com.phillippitts.djvuocr.service.rawocr;
