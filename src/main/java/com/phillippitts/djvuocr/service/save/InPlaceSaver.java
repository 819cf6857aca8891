package com.phillippitts.djvuocr.service.save;

import com.phillippitts.djvuocr.service.djvu.DjvuLibre;

import java.util.Objects;

/**
 * Applies the script to the input document itself.
 */
final class InPlaceSaver implements DocumentSaver {

    private final DjvuLibre tools;

    InPlaceSaver(DjvuLibre tools) {
        this.tools = Objects.requireNonNull(tools, "tools");
    }

    @Override
    public SaverType type() {
        return SaverType.IN_PLACE;
    }

    @Override
    public void save(SaveRequest request) {
        tools.applyScript(request.document().toAbsolutePath(), request.script());
    }
}
