/**
 * Domain value types shared by the OCR pipeline: page descriptors, sizes and run-wide policies.
 *
 * <p>Text zone geometry lives in {@link com.phillippitts.djvuocr.domain.zone}.
 *
 * @since 1.0
 */
package com.phillippitts.djvuocr.domain;
