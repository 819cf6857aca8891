package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.ErrorPolicy;
import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.zone.TextZone;
import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.exception.NoImageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.nio.channels.ClosedByInterruptException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * One page worker: walks the whole ordered page list, claims whatever is still unclaimed and
 * processes it with no lock held.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>{@link NoImageException} records NO_IMAGE and the worker continues</li>
 *   <li>Other failures under {@link ErrorPolicy#RESUME} are logged, recorded as NO_IMAGE and
 *       the worker continues</li>
 *   <li>Other failures under {@link ErrorPolicy#ABORT} are recorded as FAILED and the worker
 *       stops. Cancelling the remaining pages is left to the assembler</li>
 *   <li>An interrupt is recorded as FAILED regardless of policy, then rethrown as
 *       {@link InterruptedException} after waiters have been woken</li>
 * </ul>
 */
final class PageWorker implements Callable<Integer> {

    private static final Logger LOG = LogManager.getLogger(PageWorker.class);

    static final String PAGE_KEY = "page";

    private final List<PageDescriptor> pages;
    private final ResultStore store;
    private final PageProcessor processor;
    private final ErrorPolicy policy;
    private final PipelineMetricsPublisher metrics;

    PageWorker(List<PageDescriptor> pages, ResultStore store, PageProcessor processor,
               ErrorPolicy policy, PipelineMetricsPublisher metrics) {
        this.pages = Objects.requireNonNull(pages, "pages");
        this.store = Objects.requireNonNull(store, "store");
        this.processor = Objects.requireNonNull(processor, "processor");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return number of pages this worker claimed
     * @throws InterruptedException if the worker was interrupted
     */
    @Override
    public Integer call() throws InterruptedException {
        int claimed = 0;
        for (PageDescriptor page : pages) {
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("Worker interrupted before page " + page.pageNumber());
            }
            if (!store.tryClaim(page.index())) {
                continue;
            }
            claimed++;
            if (!processClaimed(page)) {
                break;
            }
        }
        return claimed;
    }

    /**
     * @return {@code false} if the worker must stop
     */
    private boolean processClaimed(PageDescriptor page) throws InterruptedException {
        ThreadContext.put(PAGE_KEY, Integer.toString(page.pageNumber()));
        long start = System.nanoTime();
        try {
            LOG.info("Processing page {}", page.pageNumber());
            TextZone zone = processor.process(page);
            complete(page, PageOutcome.success(zone), PageState.SUCCESS, start);
            return true;
        } catch (NoImageException e) {
            LOG.info("No image suitable for OCR on page {}", page.pageNumber());
            complete(page, PageOutcome.noImage(), PageState.NO_IMAGE, start);
            return true;
        } catch (RuntimeException | Error e) {
            if (isInterrupt(e)) {
                LOG.warn("Processing of page {} interrupted", page.pageNumber());
                complete(page, PageOutcome.failed(e), PageState.FAILED, start);
                InterruptedException ie = new InterruptedException("Interrupted while processing page "
                        + page.pageNumber());
                ie.initCause(e);
                throw ie;
            }
            LOG.error("Exception while processing page {}", page.pageNumber(), e);
            if (policy == ErrorPolicy.RESUME && e instanceof RuntimeException) {
                complete(page, PageOutcome.noImage(), PageState.FAILED, start);
                return true;
            }
            complete(page, PageOutcome.failed(e), PageState.FAILED, start);
            if (e instanceof Error error) {
                throw error;
            }
            return false;
        } finally {
            ThreadContext.remove(PAGE_KEY);
        }
    }

    private void complete(PageDescriptor page, PageOutcome outcome, PageState metricState, long start) {
        store.complete(page.index(), outcome);
        metrics.recordPage(metricState, System.nanoTime() - start);
    }

    static boolean isInterrupt(Throwable t) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof ExternalToolInterruptedException
                    || c instanceof InterruptedException
                    || c instanceof ClosedByInterruptException) {
                return true;
            }
        }
        return false;
    }
}
