package com.phillippitts.djvuocr.service.djvu;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.PageSize;
import com.phillippitts.djvuocr.domain.RenderLayers;
import com.phillippitts.djvuocr.exception.DocumentException;
import com.phillippitts.djvuocr.service.engine.ImageFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link PageSource} backed by {@code djvused} and {@code ddjvu}.
 *
 * <p>Page identifiers come from the {@code P} entries of {@code djvused ls}; a single-page
 * document without a directory uses its file name. Sizes and rotations come from
 * {@code select N; size}.
 */
public final class DjvuPageSource implements PageSource {

    private static final Logger LOG = LogManager.getLogger(DjvuPageSource.class);

    private static final Pattern PAGE_ENTRY = Pattern.compile("^\\s*(\\d+)\\s+P\\s+\\d+\\s+(\"(?:[^\"\\\\]|\\\\.)*\"|\\S+)");
    private static final Pattern SIZE_LINE =
            Pattern.compile("width=(\\d+)\\s+height=(\\d+)(?:\\s+rotation=(\\d+))?");

    private final DjvuLibre tools;
    private final Path document;
    private final int pageCount;
    private final Map<Integer, String> identifiers;

    DjvuPageSource(DjvuLibre tools, Path document, int pageCount, Map<Integer, String> identifiers) {
        this.tools = tools;
        this.document = document;
        this.pageCount = pageCount;
        this.identifiers = Map.copyOf(identifiers);
    }

    static DjvuPageSource load(DjvuLibre tools, Path document) {
        String countOutput = tools.query(document, "n").strip();
        int count;
        try {
            count = Integer.parseInt(countOutput);
        } catch (NumberFormatException e) {
            throw new DocumentException("Unexpected page count for " + document.getFileName() + ": " + countOutput, e);
        }
        Map<Integer, String> ids = parseDirectory(tools.query(document, "ls"));
        if (ids.isEmpty() && count == 1) {
            ids = Map.of(1, String.valueOf(document.getFileName()));
        }
        if (ids.size() != count) {
            throw new DocumentException("Cannot list pages of " + document.getFileName()
                    + ": expected " + count + " pages, found " + ids.size());
        }
        LOG.info("Opened {} ({} pages)", document.getFileName(), count);
        return new DjvuPageSource(tools, document, count, ids);
    }

    /**
     * Extracts page number to identifier pairs from {@code djvused ls} output.
     */
    static Map<Integer, String> parseDirectory(String listing) {
        Map<Integer, String> ids = new TreeMap<>();
        for (String line : listing.split("\n")) {
            Matcher m = PAGE_ENTRY.matcher(line);
            if (m.find()) {
                ids.put(Integer.parseInt(m.group(1)), unquote(m.group(2)));
            }
        }
        return ids;
    }

    /**
     * Removes djvused string quoting. Escapes are {@code \\"}, {@code \\\\} and octal bytes
     * ({@code \\303\\263}) of the UTF-8 encoded identifier.
     */
    static String unquote(String id) {
        if (id.length() < 2 || !id.startsWith("\"") || !id.endsWith("\"")) {
            return id;
        }
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        String body = id.substring(1, id.length() - 1);
        int i = 0;
        while (i < body.length()) {
            char ch = body.charAt(i);
            if (ch == '\\' && i + 1 < body.length()) {
                int octalEnd = i + 1;
                while (octalEnd < body.length() && octalEnd < i + 4 && isOctal(body.charAt(octalEnd))) {
                    octalEnd++;
                }
                if (octalEnd > i + 1) {
                    bytes.write(Integer.parseInt(body.substring(i + 1, octalEnd), 8));
                    i = octalEnd;
                } else {
                    i += 1 + appendUtf8(bytes, body.codePointAt(i + 1));
                }
            } else {
                i += appendUtf8(bytes, body.codePointAt(i));
            }
        }
        return bytes.toString(StandardCharsets.UTF_8);
    }

    private static boolean isOctal(char ch) {
        return ch >= '0' && ch <= '7';
    }

    /**
     * @return number of chars consumed
     */
    private static int appendUtf8(ByteArrayOutputStream bytes, int codePoint) {
        byte[] encoded = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
        bytes.write(encoded, 0, encoded.length);
        return Character.charCount(codePoint);
    }

    @Override
    public Path document() {
        return document;
    }

    @Override
    public int pageCount() {
        return pageCount;
    }

    @Override
    public List<PageDescriptor> describe(List<Integer> pageNumbers) {
        List<Integer> selected = new ArrayList<>();
        if (pageNumbers == null) {
            for (int n = 1; n <= pageCount; n++) {
                selected.add(n);
            }
        } else {
            Set<Integer> unique = new LinkedHashSet<>(pageNumbers);
            for (int n : unique) {
                if (n < 1 || n > pageCount) {
                    throw new DocumentException("Page " + n + " does not exist in "
                            + document.getFileName() + " (" + pageCount + " pages)");
                }
                selected.add(n);
            }
        }
        if (selected.isEmpty()) {
            return List.of();
        }

        StringBuilder script = new StringBuilder();
        for (int n : selected) {
            script.append("select ").append(n).append("; size; ");
        }
        List<String> sizes = tools.query(document, script.toString()).lines()
                .filter(line -> !line.isBlank())
                .toList();
        if (sizes.size() != selected.size()) {
            throw new DocumentException("Cannot read page sizes of " + document.getFileName());
        }

        List<PageDescriptor> pages = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            int n = selected.get(i);
            Matcher m = SIZE_LINE.matcher(sizes.get(i));
            if (!m.find()) {
                throw new DocumentException("Unexpected size of page " + n + ": " + sizes.get(i));
            }
            PageSize size = new PageSize(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
            int rotation = m.group(3) == null ? 0 : Integer.parseInt(m.group(3));
            pages.add(new PageDescriptor(i, n, identifiers.get(n), rotation, size));
        }
        return List.copyOf(pages);
    }

    @Override
    public Path render(PageDescriptor page, RenderLayers layers, ImageFormat format, Path target) {
        Objects.requireNonNull(page, "page");
        return tools.render(document, page, layers, format, target);
    }
}
