/**
 * Presentation layer: the command-line boundary of the application.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code presentation.cli} - argument handling and dispatch to services</li>
 *   <li>{@code presentation.exception} - mapping of domain exceptions to exit codes</li>
 * </ul>
 *
 * <p>The runner is a thin adapter; document processing lives in
 * {@link com.phillippitts.djvuocr.service.document.OcrDocumentService}.
 */
package com.phillippitts.djvuocr.presentation;
