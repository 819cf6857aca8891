package com.phillippitts.djvuocr.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Locations of the DjVuLibre command-line tools.
 * Binds to properties prefixed with "ocr.djvulibre".
 *
 * @param djvusedPath djvused executable (document structure, hidden text)
 * @param ddjvuPath ddjvu executable (page rendering)
 * @param djvmcvtPath djvmcvt executable (bundled/indirect conversion)
 * @param djvmPath djvm executable (page removal)
 * @param timeoutSeconds Maximum run time of one tool invocation; 0 waits indefinitely
 * @param maxStdoutBytes Maximum stdout accumulation in bytes
 */
@ConfigurationProperties(prefix = "ocr.djvulibre")
@Validated
public record DjvuLibreConfig(
        @DefaultValue("djvused")
        @NotBlank(message = "djvused path must not be blank")
        String djvusedPath,

        @DefaultValue("ddjvu")
        @NotBlank(message = "ddjvu path must not be blank")
        String ddjvuPath,

        @DefaultValue("djvmcvt")
        @NotBlank(message = "djvmcvt path must not be blank")
        String djvmcvtPath,

        @DefaultValue("djvm")
        @NotBlank(message = "djvm path must not be blank")
        String djvmPath,

        @DefaultValue("0")
        @PositiveOrZero(message = "Timeout must not be negative")
        int timeoutSeconds,

        @DefaultValue("4194304")
        @Positive(message = "Max stdout bytes must be positive")
        int maxStdoutBytes
) {
}
