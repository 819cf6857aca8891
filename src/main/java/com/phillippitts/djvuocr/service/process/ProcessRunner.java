package com.phillippitts.djvuocr.service.process;

import com.phillippitts.djvuocr.exception.ExternalToolException;
import com.phillippitts.djvuocr.exception.ExternalToolExceptionBuilder;
import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.util.ProcessTimeouts;
import com.phillippitts.djvuocr.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs external commands (OCR engines and DjVuLibre tools) and captures their output.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Capture stdout and stderr concurrently, each capped to protect memory
 * - Optionally enforce a timeout and terminate runaway processes
 * - Translate interrupts into {@link ExternalToolInterruptedException}, destroying the process
 * - Provide structured error context in {@link ExternalToolException}
 *
 * <p>Thread Safety: all per-invocation state is local to {@link #run}, so one runner may be
 * shared by every worker thread.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    /** Cap for stderr accumulation; only used for diagnostics. */
    static final int STDERR_MAX_BYTES = 64 * 1024;

    /** Stderr characters included in exception messages. */
    static final int ERROR_SNIPPET_MAX_CHARS = 500;

    private final ProcessFactory processFactory;

    /**
     * Holds process execution state including process reference and stream gobblers.
     */
    private record ProcessExecution(
            Process process,
            Thread outGobbler,
            Thread errGobbler,
            StringBuilder stdout,
            StringBuilder stderr
    ) {}

    public ProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Runs a command and fails on a non-zero exit status.
     *
     * @see #run(String, List, Path, Duration, int)
     * @throws ExternalToolException if the command exits with a non-zero status
     */
    public ProcessResult runChecked(String tool, List<String> command, Path workingDir,
                                    Duration timeout, int maxStdoutBytes) {
        ProcessResult result = run(tool, command, workingDir, timeout, maxStdoutBytes);
        if (!result.succeeded()) {
            throw ExternalToolExceptionBuilder.create("Non-zero exit: " + result.exitCode())
                    .tool(tool)
                    .exitCode(result.exitCode())
                    .durationMs(result.durationMs())
                    .stderr(snippet(result.stderr()))
                    .build();
        }
        return result;
    }

    /**
     * Runs a command to completion and returns its captured output, whatever its exit status.
     *
     * @param tool tool name for diagnostics
     * @param command command line, executable first
     * @param workingDir working directory (may be null)
     * @param timeout maximum run time; {@code null} or zero waits indefinitely
     * @param maxStdoutBytes cap for captured stdout
     * @return captured result
     * @throws ExternalToolInterruptedException if the calling thread is interrupted while waiting
     * @throws ExternalToolException if the process cannot be started or times out
     */
    public ProcessResult run(String tool, List<String> command, Path workingDir,
                             Duration timeout, int maxStdoutBytes) {
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(command, "command");
        long startTime = System.nanoTime();

        ProcessExecution exec;
        try {
            exec = start(tool, command, workingDir, maxStdoutBytes);
        } catch (IOException e) {
            throw ExternalToolExceptionBuilder.create("Cannot start " + tool + ": " + e.getMessage())
                    .tool(tool)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .cause(e)
                    .build();
        }

        try {
            waitForCompletion(tool, exec, timeout, startTime);
            int exitCode = exec.process().exitValue();
            long durationMs = TimeUtils.elapsedMillis(startTime);
            LOG.debug("{} exited with {} after {} ms (stdout={} chars)",
                    tool, exitCode, durationMs, exec.stdout().length());
            return new ProcessResult(exitCode, exec.stdout().toString(), exec.stderr().toString(), durationMs);
        } catch (InterruptedException e) {
            destroyProcess(exec.process());
            Thread.currentThread().interrupt();
            throw new ExternalToolInterruptedException(tool, e);
        } finally {
            cleanup(exec);
        }
    }

    private ProcessExecution start(String tool, List<String> command, Path workingDir, int maxStdoutBytes)
            throws IOException {
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();

        Process process = processFactory.start(command, workingDir);
        closeQuietly(process.getOutputStream());

        // Start gobblers before waiting to avoid deadlock on full pipes
        Thread outGobbler = startGobbler(process.getInputStream(), stdout, tool + "-out", maxStdoutBytes);
        Thread errGobbler = startGobbler(process.getErrorStream(), stderr, tool + "-err", STDERR_MAX_BYTES);
        return new ProcessExecution(process, outGobbler, errGobbler, stdout, stderr);
    }

    private void waitForCompletion(String tool, ProcessExecution exec, Duration timeout, long startTime)
            throws InterruptedException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            exec.process().waitFor();
        } else if (!exec.process().waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            destroyProcess(exec.process());
            throw ExternalToolExceptionBuilder.create("Timeout after " + timeout.toSeconds() + "s")
                    .tool(tool)
                    .durationMs(TimeUtils.elapsedMillis(startTime))
                    .stderr(snippet(exec.stderr().toString()))
                    .build();
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
    }

    private Thread startGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
        StreamGobbler gobbler = new StreamGobbler(inputStream, sink, name, maxBytes);
        Thread thread = new Thread(gobbler, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines from an input stream into a StringBuilder until capacity is reached.
     * Once the cap is hit, keeps draining the stream without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, available);
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private void cleanup(ProcessExecution exec) {
        Process process = exec.process();
        if (process.isAlive()) {
            destroyProcess(process);
        }
        joinQuietly(exec.outGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
        joinQuietly(exec.errGobbler(), ProcessTimeouts.GOBBLER_CLEANUP_TIMEOUT);
    }

    private void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        boolean interrupted = Thread.interrupted();
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void destroyProcess(Process process) {
        boolean interrupted = Thread.interrupted();
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            LOG.warn("Interrupted while destroying process");
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static void closeQuietly(OutputStream stream) {
        try {
            stream.close();
        } catch (IOException e) {
            LOG.debug("Closing process stdin failed: {}", e.toString());
        }
    }

    static String snippet(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= ERROR_SNIPPET_MAX_CHARS ? s : s.substring(0, ERROR_SNIPPET_MAX_CHARS);
    }
}
