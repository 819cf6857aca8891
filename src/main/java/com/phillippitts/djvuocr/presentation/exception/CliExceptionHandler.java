package com.phillippitts.djvuocr.presentation.exception;

import com.phillippitts.djvuocr.exception.DocumentException;
import com.phillippitts.djvuocr.exception.EngineNotFoundException;
import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.exception.PageProcessingException;
import com.phillippitts.djvuocr.exception.RunInterruptedException;
import com.phillippitts.djvuocr.exception.UnknownLanguageListException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.stereotype.Component;

/**
 * Command-line exception boundary.
 *
 * Converts domain exceptions to process exit codes and logs them once, without stack traces
 * for expected failures.
 */
@Component
public class CliExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(CliExceptionHandler.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_INVALID_OPTIONS = 2;

    /**
     * Logs a failure and maps it to an exit code.
     */
    public int handle(Throwable ex) {
        if (isInvalidOptions(ex)) {
            LOG.error("Invalid options: {}", ex.getMessage());
            return EXIT_INVALID_OPTIONS;
        }
        if (ex instanceof RunInterruptedException || ex instanceof ExternalToolInterruptedException) {
            LOG.info("Interrupted by user");
        } else if (ex instanceof PageProcessingException ppe) {
            LOG.error("Page {} failed: {}", ppe.getPageNumber(),
                    ppe.getCause() != null ? ppe.getCause().getMessage() : ppe.getMessage());
        } else if (ex instanceof EngineNotFoundException || ex instanceof UnknownLanguageListException
                || ex instanceof DocumentException) {
            LOG.error(ex.getMessage());
        } else {
            LOG.error("Unexpected error", ex);
        }
        return EXIT_FAILURE;
    }

    /**
     * Maps a failure to an exit code without logging. Used for startup failures, which
     * Spring Boot has already reported.
     */
    public static int exitCodeOf(Throwable ex) {
        return isInvalidOptions(ex) ? EXIT_INVALID_OPTIONS : EXIT_FAILURE;
    }

    private static boolean isInvalidOptions(Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof InvalidOptionsException || t instanceof BindException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
