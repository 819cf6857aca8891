package com.phillippitts.djvuocr.service.document;

import com.phillippitts.djvuocr.config.properties.OcrProperties;
import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.exception.EngineNotFoundException;
import com.phillippitts.djvuocr.exception.InvalidLanguageIdException;
import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.exception.MissingLanguagePackException;
import com.phillippitts.djvuocr.exception.PageProcessingException;
import com.phillippitts.djvuocr.exception.RunInterruptedException;
import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.exception.UnknownLanguageListException;
import com.phillippitts.djvuocr.service.djvu.DjvuLibre;
import com.phillippitts.djvuocr.service.djvu.PageSource;
import com.phillippitts.djvuocr.service.engine.OcrEngine;
import com.phillippitts.djvuocr.service.engine.OcrEngineFactory;
import com.phillippitts.djvuocr.service.metrics.OcrMetrics;
import com.phillippitts.djvuocr.service.pipeline.EnginePageProcessor;
import com.phillippitts.djvuocr.service.pipeline.OcrPipeline;
import com.phillippitts.djvuocr.service.pipeline.PipelineMetricsPublisher;
import com.phillippitts.djvuocr.service.pipeline.PipelineResult;
import com.phillippitts.djvuocr.service.pipeline.PipelineSettings;
import com.phillippitts.djvuocr.service.pipeline.RunCancellation;
import com.phillippitts.djvuocr.service.pipeline.WorkerExecutorFactory;
import com.phillippitts.djvuocr.service.rawocr.FilenameTemplate;
import com.phillippitts.djvuocr.service.rawocr.RawOcrSink;
import com.phillippitts.djvuocr.service.save.DocumentSaver;
import com.phillippitts.djvuocr.service.save.DocumentSaverFactory;
import com.phillippitts.djvuocr.service.save.SaveRequest;
import com.phillippitts.djvuocr.service.transcript.TranscriptWriter;
import com.phillippitts.djvuocr.service.workspace.WorkingDirectory;
import com.phillippitts.djvuocr.util.PageRanges;
import com.phillippitts.djvuocr.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Runs OCR over one document: engine and language setup, page selection, the concurrent
 * pipeline, and saving the transcript.
 *
 * <p>Run lifecycle:
 * <ol>
 *   <li>Create and probe the engine, resolve and check the language</li>
 *   <li>Create the working directory and describe the requested pages</li>
 *   <li>Run the {@link OcrPipeline} into {@value #SCRIPT_NAME}</li>
 *   <li>Save through the configured {@link DocumentSaver}</li>
 *   <li>Release the working directory: deleted on success, kept otherwise</li>
 * </ol>
 */
@Service
public class OcrDocumentService {

    private static final Logger LOG = LogManager.getLogger(OcrDocumentService.class);

    static final String DOCUMENT_KEY = "document";
    static final String SCRIPT_NAME = "ocrodjvu.djvused";

    /** How long the shutdown hook waits for an interrupted run to clean up. */
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final OcrProperties props;
    private final OcrEngineFactory engineFactory;
    private final DjvuLibre djvuLibre;
    private final DocumentSaverFactory saverFactory;
    private final WorkerExecutorFactory executorFactory;
    private final OcrMetrics metrics;

    public OcrDocumentService(OcrProperties props,
                              OcrEngineFactory engineFactory,
                              DjvuLibre djvuLibre,
                              DocumentSaverFactory saverFactory,
                              WorkerExecutorFactory executorFactory,
                              OcrMetrics metrics) {
        this.props = Objects.requireNonNull(props, "props");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.djvuLibre = Objects.requireNonNull(djvuLibre, "djvuLibre");
        this.saverFactory = Objects.requireNonNull(saverFactory, "saverFactory");
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
        this.metrics = metrics;
    }

    /**
     * Processes a document with a JVM shutdown hook installed, so Ctrl-C interrupts the run
     * and waits for it to release its resources.
     *
     * @see #process(Path, RunCancellation)
     */
    public PipelineResult process(Path document) {
        RunCancellation cancellation = new RunCancellation();
        Thread hook = new Thread(() -> interruptAndWait(cancellation), "ocr-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            return process(document, cancellation);
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                LOG.debug("JVM shutting down; shutdown hook stays registered");
            }
        }
    }

    /**
     * Processes a document.
     *
     * @param document DjVu document
     * @param cancellation cancellation controller for this run
     * @return pipeline summary
     * @throws InvalidOptionsException if the engine, its settings or the language are unusable
     * @throws PageProcessingException if a page failed under the abort policy
     * @throws RunInterruptedException if the run was interrupted
     */
    public PipelineResult process(Path document, RunCancellation cancellation) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(cancellation, "cancellation");
        try {
            return doProcess(document, cancellation);
        } finally {
            cancellation.markFinished();
        }
    }

    private PipelineResult doProcess(Path document, RunCancellation cancellation) {
        OcrEngine engine = createEngine();
        String language = resolveLanguage(engine);
        List<Integer> pageNumbers = parsePages();
        DocumentSaver saver = saverFactory.create(props.getOutput(), props.getOutputPath());
        RawOcrSink rawSink = rawOcrSink();

        ThreadContext.put(DOCUMENT_KEY, String.valueOf(document.getFileName()));
        WorkingDirectory workDir = WorkingDirectory.create(props.isDebug());
        long startTime = System.nanoTime();
        boolean success = false;
        try {
            PageSource source = djvuLibre.open(document);
            List<PageDescriptor> pages = source.describe(pageNumbers);
            LOG.info("OCR of {} ({} of {} pages, engine={}, language={})",
                    document, pages.size(), source.pageCount(), engine.engineName(), language);

            OcrPipeline pipeline = new OcrPipeline(
                    new EnginePageProcessor(engine, source, workDir.path(), props.getRender(), language,
                            props.getDetails(), rawSink, props.isDebug()),
                    executorFactory,
                    new PipelineMetricsPublisher(metrics, engine.engineName()));

            Path script = workDir.resolve(SCRIPT_NAME);
            PipelineResult result;
            try (TranscriptWriter transcript = TranscriptWriter.open(script, props.isClearText())) {
                result = pipeline.run(pages, new PipelineSettings(props.getJobs(), props.getOnError()),
                        transcript, cancellation);
            }

            saver.save(new SaveRequest(document, script, source.pageCount(),
                    props.isOcrOnly() ? pageNumbersOf(pages) : null, workDir.path()));

            success = true;
            recordRun("success");
            LOG.info("Finished {} in {} ms: {} pages with text, {} without",
                    document.getFileName(), TimeUtils.elapsedMillis(startTime),
                    result.written().size(), result.skippedCount());
            return result;
        } catch (RunInterruptedException | ExternalToolInterruptedException e) {
            recordRun("interrupted");
            throw e;
        } catch (RuntimeException | Error e) {
            recordRun("failed");
            throw e;
        } finally {
            workDir.release(success);
            ThreadContext.remove(DOCUMENT_KEY);
        }
    }

    private OcrEngine createEngine() {
        try {
            return engineFactory.create(props.getEngine(), props.getEngineProperties());
        } catch (EngineNotFoundException e) {
            throw new InvalidOptionsException(e.getMessage(), e);
        }
    }

    private String resolveLanguage(OcrEngine engine) {
        String language = props.getLanguage() != null ? props.getLanguage() : engine.defaultLanguage();
        try {
            engine.checkLanguage(language);
        } catch (InvalidLanguageIdException | MissingLanguagePackException e) {
            throw new InvalidOptionsException(e.getMessage(), e);
        } catch (UnknownLanguageListException e) {
            LOG.warn("Cannot verify language '{}', assuming it is installed: {}", language, e.getMessage());
        }
        return language;
    }

    private List<Integer> parsePages() {
        try {
            return PageRanges.parse(props.getPages());
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException(e.getMessage(), e);
        }
    }

    private RawOcrSink rawOcrSink() {
        if (props.getSaveRawOcrDir() == null) {
            return RawOcrSink.disabled();
        }
        try {
            return RawOcrSink.to(Path.of(props.getSaveRawOcrDir()),
                    FilenameTemplate.parse(props.getRawOcrFilenameTemplate()));
        } catch (IllegalArgumentException e) {
            throw new InvalidOptionsException(e.getMessage(), e);
        }
    }

    private void recordRun(String status) {
        if (metrics != null) {
            metrics.incrementRun(status);
        }
    }

    private static Set<Integer> pageNumbersOf(List<PageDescriptor> pages) {
        Set<Integer> numbers = new TreeSet<>();
        for (PageDescriptor page : pages) {
            numbers.add(page.pageNumber());
        }
        return numbers;
    }

    static void interruptAndWait(RunCancellation cancellation) {
        cancellation.interrupt();
        try {
            if (!cancellation.awaitFinished(SHUTDOWN_GRACE)) {
                LOG.warn("Run did not finish within {}s after interrupt", SHUTDOWN_GRACE.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
