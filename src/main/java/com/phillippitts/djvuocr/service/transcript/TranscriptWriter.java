package com.phillippitts.djvuocr.service.transcript;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.zone.TextZone;
import com.phillippitts.djvuocr.service.pipeline.TranscriptSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes the transcript as a djvused script.
 *
 * <p>Script layout:
 * <pre>
 * remove-txt                (only when existing text is cleared)
 * select 'p0001.djvu'
 * set-txt
 * (page 0 0 2550 3300 "...")
 * .
 * select 'p0002.djvu'       (page without text)
 * set-txt
 *
 * .
 * </pre>
 *
 * <p>Page identifiers that cannot be represented in the identifier charset are selected by
 * page number instead. The writer flushes after every page so that a retained script reflects
 * all completed pages.
 *
 * <p><b>Thread Safety:</b> Not thread-safe; used only by the assembling thread.
 */
public final class TranscriptWriter implements TranscriptSink, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(TranscriptWriter.class);

    private final Path script;
    private final Writer writer;
    private final Charset identifierCharset;
    private int pagesWritten;

    /**
     * Opens a writer using the platform charset for page identifiers.
     */
    public static TranscriptWriter open(Path script, boolean clearText) {
        return open(script, clearText, Charset.defaultCharset());
    }

    /**
     * @param script file to create or truncate
     * @param clearText start with {@code remove-txt}
     * @param identifierCharset charset page identifiers must be representable in
     * @throws UncheckedIOException if the file cannot be opened
     */
    public static TranscriptWriter open(Path script, boolean clearText, Charset identifierCharset) {
        try {
            BufferedWriter writer = Files.newBufferedWriter(script, StandardCharsets.UTF_8);
            TranscriptWriter transcript = new TranscriptWriter(script, writer, identifierCharset);
            if (clearText) {
                transcript.write("remove-txt\n");
            }
            return transcript;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create transcript " + script, e);
        }
    }

    private TranscriptWriter(Path script, Writer writer, Charset identifierCharset) {
        this.script = script;
        this.writer = writer;
        this.identifierCharset = Objects.requireNonNull(identifierCharset, "identifierCharset");
    }

    public Path script() {
        return script;
    }

    public int pagesWritten() {
        return pagesWritten;
    }

    @Override
    public void append(PageDescriptor page, TextZone zone) {
        StringBuilder entry = new StringBuilder();
        entry.append(selectCommand(page)).append('\n');
        entry.append("set-txt\n");
        entry.append(zone.toSexpr());
        entry.append("\n.\n\n");
        write(entry.toString());
        pagesWritten++;
    }

    @Override
    public void appendEmpty(PageDescriptor page) {
        write(selectCommand(page) + "\nset-txt\n\n.\n\n");
    }

    String selectCommand(PageDescriptor page) {
        String id = page.identifier();
        if (!identifierCharset.newEncoder().canEncode(id)) {
            LOG.warn("Cannot convert page {} identifier to {}; selecting by number",
                    page.pageNumber(), identifierCharset);
            return "select " + page.pageNumber();
        }
        return "select '" + id.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private void write(String text) {
        try {
            writer.write(text);
            writer.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write transcript " + script, e);
        }
    }

    @Override
    public void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot close transcript " + script, e);
        }
    }
}
