package com.phillippitts.djvuocr.service.save;

import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.service.djvu.DjvuLibre;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Creates the {@link DocumentSaver} for a {@link SaverType}.
 */
@Component
public class DocumentSaverFactory {

    private final DjvuLibre tools;

    public DocumentSaverFactory(DjvuLibre tools) {
        this.tools = Objects.requireNonNull(tools, "tools");
    }

    /**
     * @param type persistence strategy
     * @param outputPath target file; required by {@code bundled}, {@code indirect} and {@code script}
     * @throws InvalidOptionsException if a required output path is missing
     */
    public DocumentSaver create(SaverType type, String outputPath) {
        Objects.requireNonNull(type, "type");
        return switch (type) {
            case BUNDLED -> new BundledSaver(tools, requirePath(type, outputPath));
            case INDIRECT -> new IndirectSaver(tools, requirePath(type, outputPath));
            case SCRIPT -> new ScriptSaver(requirePath(type, outputPath));
            case IN_PLACE -> new InPlaceSaver(tools);
            case DRY_RUN -> new DryRunSaver();
        };
    }

    /**
     * @return whether the strategy writes to {@code ocr.output-path}
     */
    public static boolean needsOutputPath(SaverType type) {
        return type == SaverType.BUNDLED || type == SaverType.INDIRECT || type == SaverType.SCRIPT;
    }

    private static Path requirePath(SaverType type, String outputPath) {
        if (outputPath == null || outputPath.isBlank()) {
            throw new InvalidOptionsException("Output " + type.name().toLowerCase() + " requires ocr.output-path");
        }
        return Path.of(outputPath);
    }
}
