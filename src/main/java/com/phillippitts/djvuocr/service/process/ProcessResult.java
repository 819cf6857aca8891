package com.phillippitts.djvuocr.service.process;

/**
 * Captured outcome of a completed external command.
 *
 * @param exitCode process exit status
 * @param stdout captured standard output (possibly truncated at the configured cap)
 * @param stderr captured standard error (possibly truncated)
 * @param durationMs wall-clock run time
 */
public record ProcessResult(int exitCode, String stdout, String stderr, long durationMs) {

    public boolean succeeded() {
        return exitCode == 0;
    }
}
