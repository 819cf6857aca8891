package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.service.metrics.OcrMetrics;

import java.util.Locale;

/**
 * Records page outcomes for the pipeline.
 *
 * <p><b>Null Safety:</b> all methods accept a missing {@link OcrMetrics}, so pipelines can run
 * without metrics in tests.
 */
public final class PipelineMetricsPublisher {

    /**
     * No-op instance for tests and runs without a meter registry.
     */
    public static final PipelineMetricsPublisher NOOP = new PipelineMetricsPublisher(null, "none");

    private final OcrMetrics metrics;
    private final String engineName;

    /**
     * @param metrics metrics service (nullable for test mode)
     * @param engineName engine tag for recorded meters
     */
    public PipelineMetricsPublisher(OcrMetrics metrics, String engineName) {
        this.metrics = metrics;
        this.engineName = engineName;
    }

    public void recordPage(PageState outcome, long durationNanos) {
        if (metrics == null) {
            return;
        }
        String tag = outcome.name().toLowerCase(Locale.ROOT);
        metrics.recordPageLatency(engineName, tag, durationNanos);
        metrics.incrementPageOutcome(engineName, tag);
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
