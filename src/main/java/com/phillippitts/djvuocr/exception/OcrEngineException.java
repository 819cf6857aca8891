package com.phillippitts.djvuocr.exception;

/**
 * Thrown when an OCR engine fails to recognize a page image or to parse its own output.
 */
public class OcrEngineException extends DjvuOcrException {

    private final String engineName;

    public OcrEngineException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public OcrEngineException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public OcrEngineException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public OcrEngineException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
