package com.phillippitts.djvuocr.service.pipeline;

import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Creates the initialized executor that hosts the page workers of one run.
 * The pipeline shuts it down when the run ends.
 */
@FunctionalInterface
public interface WorkerExecutorFactory {

    ThreadPoolTaskExecutor create(int workers);
}
