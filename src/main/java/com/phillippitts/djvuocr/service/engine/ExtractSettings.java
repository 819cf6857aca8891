package com.phillippitts.djvuocr.service.engine;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.PageSize;
import com.phillippitts.djvuocr.domain.TextDetails;

import java.util.Objects;

/**
 * Parameters for turning raw engine output into a page's text zones.
 *
 * @param rotation page rotation in degrees; zones are mapped back from the rendered image
 * @param details requested zone granularity
 * @param renderedSize size of the image the engine saw
 */
public record ExtractSettings(int rotation, TextDetails details, PageSize renderedSize) {

    public ExtractSettings {
        Objects.requireNonNull(details, "details");
        Objects.requireNonNull(renderedSize, "renderedSize");
    }

    public static ExtractSettings forPage(PageDescriptor page, TextDetails details) {
        return new ExtractSettings(page.rotation(), details, page.renderedSize());
    }
}
