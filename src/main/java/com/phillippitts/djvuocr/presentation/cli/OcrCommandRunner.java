package com.phillippitts.djvuocr.presentation.cli;

import com.phillippitts.djvuocr.config.properties.OcrProperties;
import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.presentation.exception.CliExceptionHandler;
import com.phillippitts.djvuocr.service.document.OcrDocumentService;
import com.phillippitts.djvuocr.service.engine.EngineType;
import com.phillippitts.djvuocr.service.engine.OcrEngine;
import com.phillippitts.djvuocr.service.engine.OcrEngineFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command-line entry point: lists engines or languages, or runs OCR over the single document
 * given as non-option argument.
 *
 * <p>Usage:
 * <pre>
 * djvu-ocr --ocr.output=in-place book.djvu
 * djvu-ocr --ocr.list-languages=true
 * </pre>
 *
 * <p>Exit codes: 0 success, 1 failure or interrupt, 2 invalid options.
 */
@Component
class OcrCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private final OcrProperties props;
    private final OcrEngineFactory engineFactory;
    private final OcrDocumentService documentService;
    private final CliExceptionHandler exceptionHandler;
    private final PrintStream out;

    private volatile int exitCode = CliExceptionHandler.EXIT_OK;

    @Autowired
    OcrCommandRunner(OcrProperties props, OcrEngineFactory engineFactory, OcrDocumentService documentService,
                     CliExceptionHandler exceptionHandler) {
        this(props, engineFactory, documentService, exceptionHandler, System.out);
    }

    OcrCommandRunner(OcrProperties props, OcrEngineFactory engineFactory, OcrDocumentService documentService,
                     CliExceptionHandler exceptionHandler, PrintStream out) {
        this.props = props;
        this.engineFactory = engineFactory;
        this.documentService = documentService;
        this.exceptionHandler = exceptionHandler;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getNonOptionArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> documents) {
        try {
            if (props.isListEngines()) {
                for (EngineType type : engineFactory.availableEngines()) {
                    out.println(type.engineName());
                }
                return CliExceptionHandler.EXIT_OK;
            }
            if (props.isListLanguages()) {
                listLanguages();
                return CliExceptionHandler.EXIT_OK;
            }
            if (documents.size() != 1) {
                throw new InvalidOptionsException("Expected exactly one document, got " + documents.size());
            }
            documentService.process(Path.of(documents.get(0)));
            return CliExceptionHandler.EXIT_OK;
        } catch (RuntimeException e) {
            return exceptionHandler.handle(e);
        }
    }

    private void listLanguages() {
        OcrEngine engine = engineFactory.create(props.getEngine(), props.getEngineProperties());
        List<String> languages = new ArrayList<>(engine.listLanguages());
        Collections.sort(languages);
        for (String language : languages) {
            out.println(language);
        }
    }
}
