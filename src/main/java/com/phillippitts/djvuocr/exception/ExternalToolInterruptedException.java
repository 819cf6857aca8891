package com.phillippitts.djvuocr.exception;

/**
 * Thrown when the thread waiting for an external command is interrupted.
 * The process is destroyed and the interrupt flag of the waiting thread is restored.
 */
public class ExternalToolInterruptedException extends ExternalToolException {

    public ExternalToolInterruptedException(String toolName, InterruptedException cause) {
        super(toolName + " interrupted", toolName, -1, "", cause);
    }
}
