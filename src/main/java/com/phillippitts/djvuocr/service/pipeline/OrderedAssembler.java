package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.exception.PageProcessingException;
import com.phillippitts.djvuocr.exception.RunInterruptedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Drains the {@link ResultStore} strictly in page order on the calling thread and feeds the
 * transcript.
 *
 * <p>SUCCESS appends a transcript entry, NO_IMAGE appends an empty one. FAILED cancels the remaining
 * pages, waits for the workers and aborts with {@link PageProcessingException}; entries written
 * so far are kept. An interrupt, or a slot pre-claimed by cancellation, interrupts and drains the
 * workers and aborts with {@link RunInterruptedException}.
 */
final class OrderedAssembler {

    private static final Logger LOG = LogManager.getLogger(OrderedAssembler.class);

    private final List<PageDescriptor> pages;
    private final ResultStore store;
    private final WorkerPool pool;
    private final RunCancellation cancellation;
    private final TranscriptSink sink;

    OrderedAssembler(List<PageDescriptor> pages, ResultStore store, WorkerPool pool,
                     RunCancellation cancellation, TranscriptSink sink) {
        this.pages = pages;
        this.store = store;
        this.pool = pool;
        this.cancellation = cancellation;
        this.sink = sink;
    }

    PipelineResult assemble() {
        List<PageDescriptor> written = new ArrayList<>();
        for (PageDescriptor page : pages) {
            PageOutcome outcome;
            try {
                outcome = store.awaitTerminal(page.index());
            } catch (InterruptedException e) {
                throw abortInterrupted(e);
            }
            switch (outcome.state()) {
                case SUCCESS -> {
                    sink.append(page, outcome.zone());
                    written.add(page);
                }
                case NO_IMAGE -> {
                    LOG.debug("Page {} left without text", page.pageNumber());
                    sink.appendEmpty(page);
                }
                case FAILED -> {
                    if (cancellation.isInterrupted()) {
                        throw abortInterrupted(outcome.error());
                    }
                    throw abortFailed(page, outcome.error());
                }
                case CLAIMED -> throw abortInterrupted(null);
                default -> throw new IllegalStateException("Unexpected state of page "
                        + page.pageNumber() + ": " + outcome.state());
            }
        }
        pool.join();
        return new PipelineResult(pages.size(), written);
    }

    private PageProcessingException abortFailed(PageDescriptor page, Throwable error) {
        cancellation.cancelRemaining();
        if (pool.size() > 1) {
            LOG.info("Waiting for other workers to finish...");
        }
        pool.join();
        return new PageProcessingException(page.pageNumber(), error);
    }

    /**
     * Consumes the interrupt; it is reported by the returned exception.
     */
    private RunInterruptedException abortInterrupted(Throwable cause) {
        cancellation.cancelRemaining();
        pool.interruptWorkers();
        pool.join();
        Thread.interrupted();
        return new RunInterruptedException("OCR run interrupted", cause);
    }
}
