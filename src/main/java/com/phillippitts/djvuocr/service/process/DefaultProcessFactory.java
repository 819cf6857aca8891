package com.phillippitts.djvuocr.service.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Launches DjVuLibre and OCR tools with {@link ProcessBuilder}.
 *
 * <p>Tools run in the C locale: their diagnostics are matched as text, e.g. the
 * {@code ddjvu} message for a missing layer.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    static final String LOCALE = "C";

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDir != null) {
            builder.directory(workingDir.toFile());
        }
        Map<String, String> env = builder.environment();
        env.put("LC_ALL", LOCALE);
        env.put("LANG", LOCALE);
        return builder.redirectErrorStream(false).start();
    }
}
