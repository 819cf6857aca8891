package com.phillippitts.djvuocr.service.save;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Saves nothing.
 */
final class DryRunSaver implements DocumentSaver {

    private static final Logger LOG = LogManager.getLogger(DryRunSaver.class);

    @Override
    public SaverType type() {
        return SaverType.DRY_RUN;
    }

    @Override
    public void save(SaveRequest request) {
        LOG.info("Dry run: {} left unchanged", request.document().getFileName());
    }
}
