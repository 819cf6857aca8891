/**
 * Logging infrastructure: Log4j2 {@code ThreadContext} keys and their propagation to page workers.
 *
 * <p>Keys in use:
 * <ul>
 *   <li>{@code document} - file name of the document being processed</li>
 *   <li>{@code page} - 1-based page number, set by a worker while it processes a page</li>
 * </ul>
 */
package com.phillippitts.djvuocr.config.logging;
