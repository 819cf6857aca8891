package com.phillippitts.djvuocr.service.save;

/**
 * Persistence strategy applied to the finished transcript.
 */
public interface DocumentSaver {

    SaverType type();

    void save(SaveRequest request);
}
