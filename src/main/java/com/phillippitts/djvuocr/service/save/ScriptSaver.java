package com.phillippitts.djvuocr.service.save;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Saves the djvused script only; the document is left untouched.
 */
final class ScriptSaver implements DocumentSaver {

    private final Path target;

    ScriptSaver(Path target) {
        this.target = Objects.requireNonNull(target, "target");
    }

    @Override
    public SaverType type() {
        return SaverType.SCRIPT;
    }

    @Override
    public void save(SaveRequest request) {
        try {
            Files.copy(request.script(), target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save script to " + target, e);
        }
    }
}
