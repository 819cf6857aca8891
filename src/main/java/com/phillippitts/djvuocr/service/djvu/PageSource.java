package com.phillippitts.djvuocr.service.djvu;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.RenderLayers;
import com.phillippitts.djvuocr.exception.DocumentException;
import com.phillippitts.djvuocr.exception.NoImageException;
import com.phillippitts.djvuocr.service.engine.ImageFormat;

import java.nio.file.Path;
import java.util.List;

/**
 * Ordered pages of one document and a way to rasterize them.
 *
 * <p>Descriptors have dense 0-based indices in the order the pages were requested.
 * Implementations must allow {@link #render} to be called from several threads at once.
 */
public interface PageSource {

    /**
     * @return the document this source reads
     */
    Path document();

    /**
     * @return number of pages in the document
     */
    int pageCount();

    /**
     * Builds the work set for a run.
     *
     * @param pageNumbers 1-based page numbers, or {@code null} for every page
     * @return descriptors with indices {@code 0..n-1}
     * @throws DocumentException if a page number is outside the document
     */
    List<PageDescriptor> describe(List<Integer> pageNumbers);

    /**
     * Renders a page to an image file.
     *
     * @return the rendered image
     * @throws NoImageException if the page has no image suitable for OCR
     */
    Path render(PageDescriptor page, RenderLayers layers, ImageFormat format, Path target);
}
