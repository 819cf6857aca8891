package com.phillippitts.djvuocr.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Configuration properties for thread pools.
 *
 * <p>The page pool is created once per document run and sized by {@code ocr.jobs};
 * only naming and shutdown behaviour are tunable here.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private PagePoolProperties page = new PagePoolProperties();

    public PagePoolProperties getPage() {
        return page;
    }

    public void setPage(PagePoolProperties page) {
        this.page = page;
    }

    /**
     * Page worker pool configuration.
     */
    public static class PagePoolProperties {

        @NotBlank(message = "Thread name prefix must not be blank")
        private String threadNamePrefix = "ocr-page-";

        /** Seconds to wait for page workers to finish when a run ends abnormally. */
        @PositiveOrZero(message = "Await termination seconds must not be negative")
        private int awaitTerminationSeconds = 30;

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getAwaitTerminationSeconds() {
            return awaitTerminationSeconds;
        }

        public void setAwaitTerminationSeconds(int awaitTerminationSeconds) {
            this.awaitTerminationSeconds = awaitTerminationSeconds;
        }
    }
}
