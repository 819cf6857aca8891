package com.phillippitts.djvuocr.domain;

/**
 * Pixel dimensions of a page.
 */
public record PageSize(int width, int height) {

    public PageSize {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("page size must be positive: " + width + "x" + height);
        }
    }

    /**
     * @return the size with width and height exchanged
     */
    public PageSize transposed() {
        return new PageSize(height, width);
    }
}
