package com.phillippitts.djvuocr.exception;

/**
 * Thrown when a language identifier is well-formed but its data is not installed.
 */
public class MissingLanguagePackException extends DjvuOcrException {

    private final String language;

    public MissingLanguagePackException(String language) {
        super("Language pack for the selected language (" + language + ") is not available");
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
