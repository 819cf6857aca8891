package com.phillippitts.djvuocr.exception;

/**
 * Thrown when a language identifier is syntactically invalid for the selected engine.
 */
public class InvalidLanguageIdException extends DjvuOcrException {

    private final String language;

    public InvalidLanguageIdException(String language) {
        super("Invalid language identifier: " + language);
        this.language = language;
    }

    public String getLanguage() {
        return language;
    }
}
