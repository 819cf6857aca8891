/**
 * Persistence strategies that merge the finished transcript back into the document:
 * bundled, indirect, script only, in place, or dry run.
 */
package com.phillippitts.djvuocr.service.save;
