package com.phillippitts.djvuocr.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Fixed set of page workers running on a per-run executor.
 *
 * <p>Workers register their thread while running so that {@link #interruptWorkers()} reaches
 * exactly the threads doing page work; a worker that starts after the interrupt exits at once.
 */
final class WorkerPool {

    private static final Logger LOG = LogManager.getLogger(WorkerPool.class);

    private final ThreadPoolTaskExecutor executor;
    private final List<PageWorker> workers;
    private final List<Future<Integer>> futures = new ArrayList<>();

    private final Object lock = new Object();
    private final Set<Thread> running = new HashSet<>();
    private boolean interrupted;
    private List<Throwable> failures;

    WorkerPool(ThreadPoolTaskExecutor executor, List<PageWorker> workers) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.workers = List.copyOf(workers);
    }

    int size() {
        return workers.size();
    }

    void start() {
        for (PageWorker worker : workers) {
            futures.add(executor.submit(() -> runRegistered(worker)));
        }
        LOG.debug("Started {} page workers", workers.size());
    }

    private Integer runRegistered(PageWorker worker) throws InterruptedException {
        Thread current = Thread.currentThread();
        synchronized (lock) {
            if (interrupted) {
                return 0;
            }
            running.add(current);
        }
        try {
            return worker.call();
        } finally {
            synchronized (lock) {
                running.remove(current);
            }
        }
    }

    /**
     * Interrupts every running worker and stops workers that have not started yet.
     */
    void interruptWorkers() {
        synchronized (lock) {
            interrupted = true;
            running.forEach(Thread::interrupt);
        }
    }

    /**
     * Waits for every worker to finish, then shuts the executor down. Idempotent.
     *
     * <p>Waiting is not interruptible; an interrupt received while waiting is restored
     * on return.
     *
     * @return exceptions that ended workers abnormally
     */
    List<Throwable> join() {
        if (failures != null) {
            return failures;
        }
        boolean wasInterrupted = Thread.interrupted();
        List<Throwable> collected = new ArrayList<>();
        for (Future<Integer> future : futures) {
            while (true) {
                try {
                    future.get();
                    break;
                } catch (InterruptedException e) {
                    wasInterrupted = true;
                } catch (ExecutionException e) {
                    collected.add(e.getCause());
                    break;
                }
            }
        }
        executor.shutdown();
        failures = List.copyOf(collected);
        if (!failures.isEmpty()) {
            LOG.debug("{} page workers ended abnormally", failures.size());
        }
        if (wasInterrupted) {
            Thread.currentThread().interrupt();
        }
        return failures;
    }
}
