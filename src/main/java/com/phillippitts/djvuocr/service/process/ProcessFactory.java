package com.phillippitts.djvuocr.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Seam between {@link ProcessRunner} and the operating system. Tests plug in fake processes
 * with scripted output and exit codes.
 */
@FunctionalInterface
public interface ProcessFactory {

    /**
     * @param command executable followed by its arguments
     * @param workingDir directory to run in, or {@code null} for the current one
     * @throws IOException if the executable cannot be launched
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
