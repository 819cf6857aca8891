package com.phillippitts.djvuocr.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative shutdown signal of one document run.
 *
 * <p>{@link #cancelRemaining()} pre-claims every unclaimed page so that idle workers stop
 * picking up new work; pages already being processed run to completion.
 * {@link #interrupt()} is the user-interrupt path: it cancels and then interrupts the thread
 * assembling the transcript, which in turn interrupts and drains the workers.
 *
 * <p>The controller may be triggered before the pipeline starts; the signal is applied as soon
 * as a run binds to it.
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe and idempotent.
 */
public final class RunCancellation {

    private static final Logger LOG = LogManager.getLogger(RunCancellation.class);

    private final Object lock = new Object();
    private final CountDownLatch finished = new CountDownLatch(1);

    private ResultStore store;
    private Thread coordinator;
    private boolean interrupted;

    void bind(ResultStore store, Thread coordinator) {
        synchronized (lock) {
            this.store = store;
            this.coordinator = coordinator;
            if (interrupted) {
                store.cancelRemaining(0);
                coordinator.interrupt();
            }
        }
    }

    void unbind() {
        synchronized (lock) {
            coordinator = null;
        }
    }

    /**
     * Stops new pages from being started.
     */
    public void cancelRemaining() {
        synchronized (lock) {
            if (store != null) {
                int cancelled = store.cancelRemaining(0);
                if (cancelled > 0) {
                    LOG.debug("Cancelled {} pending pages", cancelled);
                }
            }
        }
    }

    /**
     * Cancels the run on behalf of the user and interrupts the assembling thread.
     */
    public void interrupt() {
        synchronized (lock) {
            if (!interrupted) {
                LOG.warn("Interrupt requested; stopping page workers");
            }
            interrupted = true;
            if (store != null) {
                store.cancelRemaining(0);
            }
            if (coordinator != null) {
                coordinator.interrupt();
            }
        }
    }

    public boolean isInterrupted() {
        synchronized (lock) {
            return interrupted;
        }
    }

    /**
     * Signals that the run has ended, whatever its outcome.
     */
    public void markFinished() {
        finished.countDown();
    }

    /**
     * Waits for {@link #markFinished()}.
     *
     * @return {@code true} if the run finished within the timeout
     */
    public boolean awaitFinished(Duration timeout) throws InterruptedException {
        return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
