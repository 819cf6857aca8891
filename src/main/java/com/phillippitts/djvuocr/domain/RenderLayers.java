package com.phillippitts.djvuocr.domain;

/**
 * Image layers rendered for OCR, with the matching {@code ddjvu -mode} value.
 */
public enum RenderLayers {
    MASK("mask", 1),
    FOREGROUND("foreground", 24),
    ALL("color", 24);

    private final String ddjvuMode;
    private final int bitsPerPixel;

    RenderLayers(String ddjvuMode, int bitsPerPixel) {
        this.ddjvuMode = ddjvuMode;
        this.bitsPerPixel = bitsPerPixel;
    }

    public String ddjvuMode() {
        return ddjvuMode;
    }

    public int bitsPerPixel() {
        return bitsPerPixel;
    }
}
