package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.exception.PageProcessingException;
import com.phillippitts.djvuocr.exception.RunInterruptedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Concurrent page OCR pipeline for one document run.
 *
 * <p>Fans the pages out to a fixed pool of {@link PageWorker}s and fans the results back in,
 * in strict page order, on the calling thread:
 * <pre>
 * pages → workers (parallel) → ResultStore → OrderedAssembler (sequential) → TranscriptSink
 * </pre>
 *
 * <p>Guarantees:
 * <ul>
 *   <li>Each page is processed at most once and gets exactly one outcome</li>
 *   <li>Transcript entries are appended in ascending page index order regardless of the order
 *       in which workers finish</li>
 *   <li>No worker thread is left running when {@link #run} returns or throws</li>
 * </ul>
 */
public final class OcrPipeline {

    private static final Logger LOG = LogManager.getLogger(OcrPipeline.class);

    private final PageProcessor processor;
    private final WorkerExecutorFactory executorFactory;
    private final PipelineMetricsPublisher metrics;

    public OcrPipeline(PageProcessor processor, WorkerExecutorFactory executorFactory,
                       PipelineMetricsPublisher metrics) {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.executorFactory = Objects.requireNonNull(executorFactory, "executorFactory");
        this.metrics = metrics != null ? metrics : PipelineMetricsPublisher.NOOP;
    }

    /**
     * Processes the pages and writes their transcript entries.
     *
     * @param pages work set with dense indices {@code 0..n-1} in list order
     * @param settings worker count and error policy
     * @param sink receiver of transcript entries
     * @param cancellation cancellation controller of this run
     * @return the pages that were written
     * @throws PageProcessingException if a page failed under the abort policy
     * @throws RunInterruptedException if the run was interrupted or cancelled
     */
    public PipelineResult run(List<PageDescriptor> pages, PipelineSettings settings, TranscriptSink sink,
                              RunCancellation cancellation) {
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(cancellation, "cancellation");
        List<PageDescriptor> workSet = List.copyOf(pages);
        for (int i = 0; i < workSet.size(); i++) {
            if (workSet.get(i).index() != i) {
                throw new IllegalArgumentException("page indices must be dense and ordered; expected " + i
                        + " but got " + workSet.get(i).index());
            }
        }
        if (workSet.isEmpty()) {
            LOG.info("No pages to process");
            return new PipelineResult(0, List.of());
        }

        ResultStore store = new ResultStore(workSet.size());
        int workerCount = Math.min(settings.jobs(), workSet.size());
        List<PageWorker> workers = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            workers.add(new PageWorker(workSet, store, processor, settings.errorPolicy(), metrics));
        }
        ThreadPoolTaskExecutor executor = executorFactory.create(workerCount);
        WorkerPool pool = new WorkerPool(executor, workers);

        LOG.info("Processing {} pages with {} workers (on error: {})",
                workSet.size(), workerCount, settings.errorPolicy());
        cancellation.bind(store, Thread.currentThread());
        try {
            pool.start();
            PipelineResult result = new OrderedAssembler(workSet, store, pool, cancellation, sink).assemble();
            LOG.info("Recognized {} of {} pages", result.written().size(), result.pageCount());
            return result;
        } finally {
            store.cancelRemaining(0);
            pool.join();
            cancellation.unbind();
        }
    }
}
