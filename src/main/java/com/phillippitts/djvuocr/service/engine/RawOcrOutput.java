package com.phillippitts.djvuocr.service.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Raw output of one recognition call, backed by a file in a private temporary directory.
 *
 * <p>The directory is deleted on {@link #close()}; callers use try-with-resources so that
 * it is released on every exit path.
 */
public final class RawOcrOutput implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(RawOcrOutput.class);

    private static final char REPLACEMENT = '\uFFFD';

    private final Path directory;
    private final Path file;
    private final String extension;
    private boolean closed;

    /**
     * @param directory temporary directory owned by this output (deleted on close)
     * @param file output file inside {@code directory}
     * @param extension file extension used when the output is saved elsewhere
     */
    public RawOcrOutput(Path directory, Path file, String extension) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.file = Objects.requireNonNull(file, "file");
        this.extension = Objects.requireNonNull(extension, "extension");
    }

    public Path file() {
        return file;
    }

    public String extension() {
        return extension;
    }

    /**
     * Reads the whole output as UTF-8 text. Malformed byte sequences and control characters
     * other than CR, LF and TAB become U+FFFD.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public String readText() {
        try {
            return sanitize(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read OCR output " + file, e);
        }
    }

    static String sanitize(byte[] bytes) throws CharacterCodingException {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
        char[] text = decoder.decode(ByteBuffer.wrap(bytes)).toString().toCharArray();
        for (int i = 0; i < text.length; i++) {
            char c = text[i];
            if (c < 0x20 && c != '\n' && c != '\r' && c != '\t') {
                text[i] = REPLACEMENT;
            }
        }
        return new String(text);
    }

    /**
     * Copies the output to {@code target}, replacing an existing file.
     */
    public void saveTo(Path target) throws IOException {
        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING);
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            FileSystemUtils.deleteRecursively(directory);
        } catch (IOException e) {
            LOG.warn("Failed to delete OCR output directory {}: {}", directory, e.getMessage());
        }
    }
}
