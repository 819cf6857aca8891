package com.phillippitts.djvuocr.domain;

import java.util.Objects;

/**
 * Immutable description of one page scheduled for OCR.
 *
 * @param index      0-based position within the requested page set (dense and contiguous)
 * @param pageNumber 1-based page number within the document
 * @param identifier document-scoped page identifier (component file name; may be non-ASCII)
 * @param rotation   page rotation in degrees, one of 0, 90, 180, 270
 * @param size       page size in pixels before rotation
 */
public record PageDescriptor(int index, int pageNumber, String identifier, int rotation, PageSize size) {

    public PageDescriptor {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        if (pageNumber < 1) {
            throw new IllegalArgumentException("pageNumber must be 1-based: " + pageNumber);
        }
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(size, "size");
        if (rotation % 90 != 0 || rotation < 0 || rotation >= 360) {
            throw new IllegalArgumentException("rotation must be one of 0, 90, 180, 270: " + rotation);
        }
    }

    /**
     * Size of the page as rendered, i.e. after applying {@link #rotation()}.
     */
    public PageSize renderedSize() {
        return rotation % 180 == 0 ? size : size.transposed();
    }
}
