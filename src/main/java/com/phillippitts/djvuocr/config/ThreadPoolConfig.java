package com.phillippitts.djvuocr.config;

import com.phillippitts.djvuocr.config.logging.MdcTaskDecorator;
import com.phillippitts.djvuocr.config.properties.ThreadPoolProperties;
import com.phillippitts.djvuocr.service.pipeline.WorkerExecutorFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the thread pool that hosts page workers.
 *
 * <p>The pool is created per document run rather than as a singleton bean, since its size
 * depends on {@code ocr.jobs} and the page count, and no worker may outlive its run.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates page worker executors.
     *
     * <p>Pool sizing:
     * <ul>
     *   <li>Core and max pool: the worker count of the run, one thread per worker</li>
     *   <li>Queue: none; every worker is started on its own thread immediately</li>
     * </ul>
     *
     * <p>Thread naming: configured via {@code threadpool.page.thread-name-prefix}.
     *
     * <p>MDC propagation: the submitting thread's Log4j2 ThreadContext (document name) is copied
     * to the workers.
     *
     * @return factory for initialized executors
     */
    @Bean
    public WorkerExecutorFactory pageExecutorFactory() {
        return this::pageExecutor;
    }

    ThreadPoolTaskExecutor pageExecutor(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        ThreadPoolProperties.PagePoolProperties pageProps = threadPoolProperties.getPage();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(pageProps.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(pageProps.getAwaitTerminationSeconds());
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }
}
