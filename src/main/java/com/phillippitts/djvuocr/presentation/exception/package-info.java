/**
 * Exception boundary of the command line: maps domain exceptions to exit codes.
 */
package com.phillippitts.djvuocr.presentation.exception;
