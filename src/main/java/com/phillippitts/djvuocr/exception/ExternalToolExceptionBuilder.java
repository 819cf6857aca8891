package com.phillippitts.djvuocr.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ExternalToolException} carrying process diagnostics.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ExternalToolExceptionBuilder.create("Non-zero exit: 1")
 *         .tool("ddjvu")
 *         .exitCode(1)
 *         .durationMs(420)
 *         .stderr(stderrSnippet)
 *         .metadata("page", 3)
 *         .build();
 * </pre>
 *
 * <p>The final message format is:
 * <pre>
 * {message} (tool={tool}, exitCode={code}, durationMs={ms}, {key1}={val1}, ..., stderr={snippet})
 * </pre>
 */
public final class ExternalToolExceptionBuilder {

    private final String message;
    private String toolName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private String stderr;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ExternalToolExceptionBuilder(String message) {
        this.message = message;
    }

    public static ExternalToolExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ExternalToolExceptionBuilder(message);
    }

    public ExternalToolExceptionBuilder tool(String toolName) {
        this.toolName = toolName;
        return this;
    }

    public ExternalToolExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ExternalToolExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ExternalToolExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    public ExternalToolExceptionBuilder stderr(String stderr) {
        this.stderr = stderr;
        return this;
    }

    /**
     * Adds a metadata entry; null keys or values are skipped.
     */
    public ExternalToolExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public ExternalToolException build() {
        String tool = toolName != null ? toolName : "unknown";
        int code = exitCode != null ? exitCode : -1;
        return new ExternalToolException(buildDetailedMessage(tool), tool, code, stderr, cause);
    }

    private String buildDetailedMessage(String tool) {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (tool=").append(tool);
        if (exitCode != null) {
            sb.append(", exitCode=").append(exitCode);
        }
        if (durationMs != null) {
            sb.append(", durationMs=").append(durationMs);
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append('=').append(entry.getValue());
        }
        if (stderr != null && !stderr.isBlank()) {
            sb.append(", stderr=").append(stderr.strip());
        }
        sb.append(')');
        return sb.toString();
    }
}
