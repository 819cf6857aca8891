package com.phillippitts.djvuocr.service.workspace;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Temporary directory of one document run, holding rendered images and the transcript script.
 *
 * <p>Deleted when the run succeeds. Kept, and its location logged, when the run fails or is
 * interrupted, or when debugging is enabled: a partial transcript can still be salvaged by hand.
 */
public final class WorkingDirectory {

    private static final Logger LOG = LogManager.getLogger(WorkingDirectory.class);

    static final String PREFIX = "djvuocr.";

    private final Path path;
    private final boolean debug;
    private boolean released;

    private WorkingDirectory(Path path, boolean debug) {
        this.path = path;
        this.debug = debug;
    }

    /**
     * Creates a fresh directory under the system temporary directory.
     *
     * @param debug keep the directory even on success
     * @throws UncheckedIOException if the directory cannot be created
     */
    public static WorkingDirectory create(boolean debug) {
        try {
            return new WorkingDirectory(Files.createTempDirectory(PREFIX), debug);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create working directory", e);
        }
    }

    /**
     * Wraps an existing directory.
     */
    public static WorkingDirectory of(Path path, boolean debug) {
        return new WorkingDirectory(Objects.requireNonNull(path, "path"), debug);
    }

    public Path path() {
        return path;
    }

    public Path resolve(String name) {
        return path.resolve(name);
    }

    /**
     * Ends the run's use of the directory. Idempotent.
     *
     * @param success whether the run completed successfully
     * @return {@code true} if the directory was kept
     */
    public synchronized boolean release(boolean success) {
        if (released) {
            return Files.exists(path);
        }
        released = true;
        if (success && !debug) {
            try {
                FileSystemUtils.deleteRecursively(path);
                return false;
            } catch (IOException e) {
                LOG.warn("Failed to delete working directory {}: {}", path, e.getMessage());
                return true;
            }
        }
        LOG.info("Working files kept in {}", path);
        return true;
    }
}
