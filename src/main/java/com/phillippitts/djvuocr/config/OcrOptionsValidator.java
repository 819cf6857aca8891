package com.phillippitts.djvuocr.config;

import com.phillippitts.djvuocr.config.properties.OcrProperties;
import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.service.rawocr.FilenameTemplate;
import com.phillippitts.djvuocr.service.save.DocumentSaverFactory;
import com.phillippitts.djvuocr.service.save.SaverType;
import com.phillippitts.djvuocr.util.PageRanges;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Validates cross-field {@link OcrProperties} rules at startup to fail fast with
 * actionable messages.
 */
@Component
public class OcrOptionsValidator {

    private final OcrProperties props;

    public OcrOptionsValidator(OcrProperties props) {
        this.props = props;
    }

    /**
     * @throws InvalidOptionsException if the options cannot describe a run
     */
    @PostConstruct
    public void validate() {
        if (props.isListEngines() || props.isListLanguages()) {
            return;
        }
        SaverType output = props.getOutput();
        if (output == null) {
            throw new InvalidOptionsException("ocr.output is required: one of bundled, indirect, script, "
                    + "in-place, dry-run");
        }
        if (DocumentSaverFactory.needsOutputPath(output)
                && (props.getOutputPath() == null || props.getOutputPath().isBlank())) {
            throw new InvalidOptionsException("ocr.output=" + output.name().toLowerCase().replace('_', '-')
                    + " requires ocr.output-path");
        }
        if (props.isOcrOnly() && output != SaverType.BUNDLED && output != SaverType.INDIRECT) {
            throw new InvalidOptionsException("ocr.ocr-only is only supported with bundled or indirect output");
        }
        try {
            PageRanges.parse(props.getPages());
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException("Invalid ocr.pages: " + e.getMessage(), e);
        }
        try {
            FilenameTemplate.parse(props.getRawOcrFilenameTemplate());
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException("Invalid ocr.raw-ocr-filename-template: " + e.getMessage(), e);
        }
        String rawDir = props.getSaveRawOcrDir();
        if (rawDir != null && !Files.isDirectory(Path.of(rawDir))) {
            throw new InvalidOptionsException("ocr.save-raw-ocr-dir is not a directory: " + rawDir);
        }
    }
}
