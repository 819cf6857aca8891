package com.phillippitts.djvuocr.service.engine;

import java.util.Locale;

/**
 * Closed set of OCR back-ends, selected by name at configuration time.
 */
public enum EngineType {
    TESSERACT("tesseract");

    private final String engineName;

    EngineType(String engineName) {
        this.engineName = engineName;
    }

    public String engineName() {
        return engineName;
    }

    /**
     * Resolves an engine by its user-facing name.
     *
     * @throws IllegalArgumentException if no engine has that name
     */
    public static EngineType fromName(String name) {
        String normalized = name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
        for (EngineType type : values()) {
            if (type.engineName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown OCR engine: " + name);
    }
}
