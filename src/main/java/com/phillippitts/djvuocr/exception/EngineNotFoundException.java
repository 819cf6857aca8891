package com.phillippitts.djvuocr.exception;

/**
 * Thrown when the external tool backing an OCR engine is missing or unusable.
 * Raised while the engine is being constructed, so it surfaces before any page work begins.
 */
public class EngineNotFoundException extends DjvuOcrException {

    private final String engineName;

    public EngineNotFoundException(String engineName) {
        super("OCR engine not found: " + engineName);
        this.engineName = engineName;
    }

    public EngineNotFoundException(String engineName, Throwable cause) {
        super("OCR engine not found: " + engineName, cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
