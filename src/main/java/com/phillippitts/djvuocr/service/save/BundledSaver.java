package com.phillippitts.djvuocr.service.save;

import com.phillippitts.djvuocr.service.djvu.DjvuLibre;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a new bundled document carrying the transcript.
 */
final class BundledSaver implements DocumentSaver {

    private final DjvuLibre tools;
    private final Path target;

    BundledSaver(DjvuLibre tools, Path target) {
        this.tools = Objects.requireNonNull(tools, "tools");
        this.target = Objects.requireNonNull(target, "target").toAbsolutePath();
    }

    @Override
    public SaverType type() {
        return SaverType.BUNDLED;
    }

    @Override
    public void save(SaveRequest request) {
        writeBundled(tools, request, target);
    }

    /**
     * Bundles the document, applies the script, then drops pages outside
     * {@link SaveRequest#keepPages()} from the last page backwards.
     */
    static void writeBundled(DjvuLibre tools, SaveRequest request, Path bundled) {
        tools.convertBundled(request.document(), bundled);
        tools.applyScript(bundled, request.script());
        if (request.keepPages() != null) {
            for (int page = request.pageCount(); page >= 1; page--) {
                if (!request.keepPages().contains(page)) {
                    tools.deletePage(bundled, page);
                }
            }
        }
    }
}
