package com.phillippitts.djvuocr.domain.zone;

/**
 * Axis-aligned bounding box in DjVu coordinates (origin at the bottom-left corner).
 */
public record BBox(int x0, int y0, int x1, int y1) {

    public BBox {
        if (x1 < x0 || y1 < y0) {
            throw new IllegalArgumentException("invalid bounding box: " + x0 + "," + y0 + "," + x1 + "," + y1);
        }
    }

    /**
     * Creates the smallest box containing both corner points, in any order.
     */
    public static BBox ofCorners(int ax, int ay, int bx, int by) {
        return new BBox(Math.min(ax, bx), Math.min(ay, by), Math.max(ax, bx), Math.max(ay, by));
    }

    public int width() {
        return x1 - x0;
    }

    public int height() {
        return y1 - y0;
    }
}
