package com.phillippitts.djvuocr;

import com.phillippitts.djvuocr.config.properties.DjvuLibreConfig;
import com.phillippitts.djvuocr.config.properties.OcrProperties;
import com.phillippitts.djvuocr.config.properties.TesseractConfig;
import com.phillippitts.djvuocr.config.properties.ThreadPoolProperties;
import com.phillippitts.djvuocr.presentation.exception.CliExceptionHandler;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        OcrProperties.class,
        TesseractConfig.class,
        DjvuLibreConfig.class,
        ThreadPoolProperties.class
})
public class DjvuOcrApplication {

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = SpringApplication.exit(SpringApplication.run(DjvuOcrApplication.class, args));
        } catch (RuntimeException e) {
            // Startup failure; already reported by Spring Boot
            exitCode = CliExceptionHandler.exitCodeOf(e);
        }
        System.exit(exitCode);
    }
}
