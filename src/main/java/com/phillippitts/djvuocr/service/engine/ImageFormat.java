package com.phillippitts.djvuocr.service.engine;

import java.util.Objects;

/**
 * Raster format an OCR engine accepts as input.
 *
 * @param extension file extension without the dot, e.g. {@code tif}
 * @param rendererFormat value passed to {@code ddjvu -format}
 * @param bitsPerPixel colour depth of the rendered image
 */
public record ImageFormat(String extension, String rendererFormat, int bitsPerPixel) {

    public ImageFormat {
        Objects.requireNonNull(extension, "extension");
        Objects.requireNonNull(rendererFormat, "rendererFormat");
        if (bitsPerPixel != 1 && bitsPerPixel != 8 && bitsPerPixel != 24) {
            throw new IllegalArgumentException("Unsupported bits per pixel: " + bitsPerPixel);
        }
    }
}
