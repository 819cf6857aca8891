/**
 * Per-run working directory and its retention rules.
 */
package com.phillippitts.djvuocr.service.workspace;
