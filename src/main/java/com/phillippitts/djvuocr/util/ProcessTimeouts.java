package com.phillippitts.djvuocr.util;

import java.time.Duration;

/**
 * Timeouts used while tearing down external processes and their stream readers.
 *
 * <p>These bound cleanup only. The recognition and rendering commands themselves run without
 * a deadline unless one is configured.
 *
 * @see com.phillippitts.djvuocr.service.process.ProcessRunner
 * @since 1.0
 */
public final class ProcessTimeouts {

    /** Time granted to stream readers to flush buffered output after the process exited. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of stream readers during cleanup; they are daemon threads. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
