/**
 * Concurrent page OCR pipeline.
 *
 * <p>A run fans pages out to a fixed pool of workers that race to claim them in a shared
 * {@link com.phillippitts.djvuocr.service.pipeline.ResultStore}, and fans the results back in
 * strictly in page order on the calling thread. The store's lock is the only lock of the
 * pipeline and is never held while a page is processed.
 *
 * <p>Entry point: {@link com.phillippitts.djvuocr.service.pipeline.OcrPipeline}.
 */
package com.phillippitts.djvuocr.service.pipeline;
