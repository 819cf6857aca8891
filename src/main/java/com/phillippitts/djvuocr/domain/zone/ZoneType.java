package com.phillippitts.djvuocr.domain.zone;

/**
 * DjVu hidden text zone types, outermost first.
 */
public enum ZoneType {
    PAGE("page"),
    COLUMN("column"),
    REGION("region"),
    PARAGRAPH("para"),
    LINE("line"),
    WORD("word"),
    CHARACTER("char");

    private final String keyword;

    ZoneType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return the S-expression keyword used by djvused
     */
    public String keyword() {
        return keyword;
    }
}
