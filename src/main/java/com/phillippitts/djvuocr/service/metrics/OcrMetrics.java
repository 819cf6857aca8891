package com.phillippitts.djvuocr.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for OCR runs.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Per-page processing latency, tagged by outcome</li>
 *   <li>Page outcome counts (success, no_image, failed)</li>
 *   <li>Document run outcomes</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class OcrMetrics {

    private static final String METRIC_PREFIX = "djvuocr";

    private final MeterRegistry registry;

    public OcrMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the processing time of one page.
     *
     * @param engineName engine that processed the page
     * @param outcome page outcome (success, no_image, failed)
     * @param durationNanos duration in nanoseconds
     */
    public void recordPageLatency(String engineName, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".page.latency")
                .description("Time taken to render and recognize a page")
                .tag("engine", engineName)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the page outcome counter.
     */
    public void incrementPageOutcome(String engineName, String outcome) {
        Counter.builder(METRIC_PREFIX + ".page.outcome")
                .description("Number of processed pages by outcome")
                .tag("engine", engineName)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Increments the document run counter.
     *
     * @param status run status (success, failed, interrupted)
     */
    public void incrementRun(String status) {
        Counter.builder(METRIC_PREFIX + ".run")
                .description("Number of document runs by status")
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
