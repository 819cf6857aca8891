package com.phillippitts.djvuocr.service.engine;

import com.phillippitts.djvuocr.config.properties.TesseractConfig;
import com.phillippitts.djvuocr.exception.EngineNotFoundException;
import com.phillippitts.djvuocr.service.engine.tesseract.TesseractEngine;
import com.phillippitts.djvuocr.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creates OCR engines from the closed set of {@link EngineType}s.
 */
@Component
public class OcrEngineFactory {

    private static final Logger LOG = LogManager.getLogger(OcrEngineFactory.class);

    private final TesseractConfig tesseractConfig;
    private final ProcessRunner processRunner;

    public OcrEngineFactory(TesseractConfig tesseractConfig, ProcessRunner processRunner) {
        this.tesseractConfig = Objects.requireNonNull(tesseractConfig, "tesseractConfig");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
    }

    /**
     * Creates and probes an engine.
     *
     * @param type engine to create
     * @param engineProperties engine specific settings
     * @throws EngineNotFoundException if the engine's external tool is unusable
     */
    public OcrEngine create(EngineType type, Map<String, String> engineProperties) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case TESSERACT -> new TesseractEngine(tesseractConfig, engineProperties, processRunner);
        };
    }

    /**
     * @return engines whose external tool is present, in declaration order
     */
    public List<EngineType> availableEngines() {
        List<EngineType> available = new ArrayList<>();
        for (EngineType type : EngineType.values()) {
            try {
                create(type, Map.of());
                available.add(type);
            } catch (EngineNotFoundException e) {
                LOG.debug("Engine {} unavailable: {}", type.engineName(), e.getMessage());
            }
        }
        return available;
    }
}
