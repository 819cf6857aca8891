package com.phillippitts.djvuocr.service.save;

import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.service.djvu.DjvuLibre;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class DocumentSaverFactoryTest {

    @TempDir
    Path dir;

    private final DjvuLibre tools = mock(DjvuLibre.class);
    private final DocumentSaverFactory factory = new DocumentSaverFactory(tools);

    private SaveRequest request(Set<Integer> keep) {
        return new SaveRequest(dir.resolve("in.djvu"), dir.resolve("ocr.djvused"), 5, keep, dir);
    }

    @Test
    void bundledConvertsThenAppliesScript() {
        Path out = dir.resolve("out.djvu");
        DocumentSaver saver = factory.create(SaverType.BUNDLED, out.toString());

        saver.save(request(null));

        assertThat(saver.type()).isEqualTo(SaverType.BUNDLED);
        InOrder order = inOrder(tools);
        order.verify(tools).convertBundled(dir.resolve("in.djvu"), out);
        order.verify(tools).applyScript(out, dir.resolve("ocr.djvused"));
        verify(tools, never()).deletePage(any(), anyInt());
    }

    @Test
    void ocrOnlyDeletesUnkeptPagesFromTheBack() {
        Path out = dir.resolve("out.djvu");

        factory.create(SaverType.BUNDLED, out.toString()).save(request(Set.of(2, 4)));

        InOrder order = inOrder(tools);
        order.verify(tools).applyScript(out, dir.resolve("ocr.djvused"));
        order.verify(tools).deletePage(out, 5);
        order.verify(tools).deletePage(out, 3);
        order.verify(tools).deletePage(out, 1);
        verify(tools, never()).deletePage(out, 2);
        verify(tools, never()).deletePage(out, 4);
    }

    @Test
    void indirectWithoutSelectionConvertsDirectly() {
        Path index = dir.resolve("index.djvu");

        factory.create(SaverType.INDIRECT, index.toString()).save(request(null));

        InOrder order = inOrder(tools);
        order.verify(tools).convertIndirect(dir.resolve("in.djvu"), index);
        order.verify(tools).applyScript(index, dir.resolve("ocr.djvused"));
    }

    @Test
    void indirectWithSelectionGoesThroughBundledIntermediate() {
        Path index = dir.resolve("index.djvu");
        Path bundled = dir.resolve(IndirectSaver.INTERMEDIATE_NAME);

        factory.create(SaverType.INDIRECT, index.toString()).save(request(Set.of(1, 2, 3, 4)));

        InOrder order = inOrder(tools);
        order.verify(tools).convertBundled(dir.resolve("in.djvu"), bundled);
        order.verify(tools).applyScript(bundled, dir.resolve("ocr.djvused"));
        order.verify(tools).deletePage(bundled, 5);
        order.verify(tools).convertIndirect(bundled, index);
    }

    @Test
    void scriptSaverCopiesTheScript() throws IOException {
        Files.writeString(dir.resolve("ocr.djvused"), "select 1\n");
        Path target = dir.resolve("copy.djvused");
        Files.writeString(target, "stale");

        factory.create(SaverType.SCRIPT, target.toString()).save(request(null));

        assertThat(target).hasContent("select 1\n");
        verifyNoInteractions(tools);
    }

    @Test
    void inPlaceAppliesScriptToInput() {
        DocumentSaver saver = factory.create(SaverType.IN_PLACE, null);

        saver.save(request(null));

        assertThat(saver.type()).isEqualTo(SaverType.IN_PLACE);
        verify(tools).applyScript(dir.resolve("in.djvu").toAbsolutePath(), dir.resolve("ocr.djvused"));
    }

    @Test
    void dryRunTouchesNothing() {
        factory.create(SaverType.DRY_RUN, "ignored").save(request(null));

        verifyNoInteractions(tools);
    }

    @Test
    void missingOutputPathIsAnOptionsError() {
        assertThatThrownBy(() -> factory.create(SaverType.BUNDLED, " "))
                .isInstanceOf(InvalidOptionsException.class)
                .hasMessageContaining("ocr.output-path");
        assertThat(DocumentSaverFactory.needsOutputPath(SaverType.SCRIPT)).isTrue();
        assertThat(DocumentSaverFactory.needsOutputPath(SaverType.IN_PLACE)).isFalse();
    }
}
