/**
 * The transcript: the djvused script carrying the hidden text of every recognized page.
 */
package com.phillippitts.djvuocr.service.transcript;
