/**
 * Access to DjVu documents through the DjVuLibre command-line tools.
 */
package com.phillippitts.djvuocr.service.djvu;
