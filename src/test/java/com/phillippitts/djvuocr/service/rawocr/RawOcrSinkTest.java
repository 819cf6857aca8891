package com.phillippitts.djvuocr.service.rawocr;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.service.engine.RawOcrOutput;
import com.phillippitts.djvuocr.testutil.TestPages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class RawOcrSinkTest {

    @TempDir
    Path dir;

    private RawOcrOutput raw() throws IOException {
        Path engineDir = Files.createDirectory(dir.resolve("engine"));
        return new RawOcrOutput(engineDir, Files.writeString(engineDir.resolve("out.txt"), "text"), "txt");
    }

    @Test
    void savesUnderTemplateName() throws IOException {
        Path target = Files.createDirectory(dir.resolve("raw"));
        RawOcrSink sink = RawOcrSink.to(target, FilenameTemplate.parse("{id-ext}"));

        try (RawOcrOutput raw = raw()) {
            sink.save(TestPages.page(0, 3), raw);
        }

        assertThat(sink.isEnabled()).isTrue();
        assertThat(target.resolve("p0003.txt")).hasContent("text");
    }

    @Test
    void failuresDoNotPropagate() throws IOException {
        RawOcrSink sink = RawOcrSink.to(dir.resolve("gone"), FilenameTemplate.parse("{page}"));

        try (RawOcrOutput raw = raw()) {
            assertThatCode(() -> sink.save(TestPages.page(0, 1), raw)).doesNotThrowAnyException();
        }
    }

    @Test
    void disabledSinkIgnoresPages() throws IOException {
        PageDescriptor page = TestPages.page(0, 1);

        try (RawOcrOutput raw = raw()) {
            RawOcrSink.disabled().save(page, raw);
        }

        assertThat(RawOcrSink.disabled().isEnabled()).isFalse();
        assertThat(dir.resolve("p0001.txt")).doesNotExist();
    }
}
