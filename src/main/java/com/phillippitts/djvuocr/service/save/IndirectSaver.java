package com.phillippitts.djvuocr.service.save;

import com.phillippitts.djvuocr.service.djvu.DjvuLibre;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes a new indirect document (index file plus components in the same directory).
 *
 * <p>When only some pages are kept, the document is first assembled as a bundled file in the
 * working directory, since pages are removed from bundled documents.
 */
final class IndirectSaver implements DocumentSaver {

    static final String INTERMEDIATE_NAME = "bundled.djvu";

    private final DjvuLibre tools;
    private final Path indexFile;

    IndirectSaver(DjvuLibre tools, Path indexFile) {
        this.tools = Objects.requireNonNull(tools, "tools");
        this.indexFile = Objects.requireNonNull(indexFile, "indexFile").toAbsolutePath();
    }

    @Override
    public SaverType type() {
        return SaverType.INDIRECT;
    }

    @Override
    public void save(SaveRequest request) {
        if (request.keepPages() == null) {
            tools.convertIndirect(request.document(), indexFile);
            tools.applyScript(indexFile, request.script());
            return;
        }
        Path bundled = request.workDir().resolve(INTERMEDIATE_NAME);
        BundledSaver.writeBundled(tools, request, bundled);
        tools.convertIndirect(bundled, indexFile);
    }
}
