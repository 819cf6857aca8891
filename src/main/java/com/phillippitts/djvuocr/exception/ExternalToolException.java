package com.phillippitts.djvuocr.exception;

/**
 * Thrown when an external command (tesseract, djvused, ddjvu, ...) cannot be started,
 * exits with a non-zero status or exceeds its configured timeout.
 */
public class ExternalToolException extends DjvuOcrException {

    private final String toolName;
    private final int exitCode;
    private final String stderr;

    public ExternalToolException(String message, String toolName, int exitCode, String stderr, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
        this.exitCode = exitCode;
        this.stderr = stderr == null ? "" : stderr;
    }

    public String getToolName() {
        return toolName;
    }

    /**
     * @return process exit status, or -1 if the process did not exit normally
     */
    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }
}
