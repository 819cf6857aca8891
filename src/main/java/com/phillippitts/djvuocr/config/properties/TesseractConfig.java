package com.phillippitts.djvuocr.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Configuration properties for the Tesseract OCR engine.
 * Binds to properties prefixed with "ocr.tesseract".
 *
 * <p>Example application.properties:
 * <pre>
 * ocr.tesseract.binary-path=/usr/bin/tesseract
 * ocr.tesseract.default-language=eng
 * ocr.tesseract.timeout-seconds=0
 * ocr.tesseract.max-stdout-bytes=1048576
 * </pre>
 *
 * @param binaryPath Path or name of the tesseract executable
 * @param defaultLanguage Language used when none is requested
 * @param timeoutSeconds Maximum time for one recognition; 0 waits indefinitely
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "ocr.tesseract")
@Validated
public record TesseractConfig(
        @DefaultValue("tesseract")
        @NotBlank(message = "Tesseract binary path must not be blank")
        String binaryPath,

        @DefaultValue("eng")
        @NotBlank(message = "Default language must not be blank")
        String defaultLanguage,

        @DefaultValue("0")
        @PositiveOrZero(message = "Timeout must not be negative")
        int timeoutSeconds,

        @DefaultValue("1048576")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {
}
