package com.phillippitts.djvuocr.service.djvu;

import com.phillippitts.djvuocr.config.properties.DjvuLibreConfig;
import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.PageSize;
import com.phillippitts.djvuocr.domain.RenderLayers;
import com.phillippitts.djvuocr.exception.DocumentException;
import com.phillippitts.djvuocr.exception.ExternalToolException;
import com.phillippitts.djvuocr.exception.NoImageException;
import com.phillippitts.djvuocr.service.engine.ImageFormat;
import com.phillippitts.djvuocr.service.process.ProcessRunner;
import com.phillippitts.djvuocr.testutil.FakeProcess.Behavior;
import com.phillippitts.djvuocr.testutil.ScriptedProcessFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DjvuPageSourceTest {

    private static final DjvuLibreConfig CFG =
            new DjvuLibreConfig("djvused", "ddjvu", "djvmcvt", "djvm", 0, 4194304);
    private static final ImageFormat TIFF = new ImageFormat("tif", "tiff", 1);

    private static final String LISTING = """
                1 P     4102 p0001.djvu
                2 P     3872 "Strona 2.djvu"
                3 P     5533 p0003.djvu
            """;

    @TempDir
    Path tmp;

    private Path document;

    @BeforeEach
    void setUp() throws IOException {
        document = Files.writeString(tmp.resolve("book.djvu"), "AT&TFORM");
    }

    private static ScriptedProcessFactory djvused(String count, String listing, String sizes) {
        return ScriptedProcessFactory.by(command -> {
            String script = command.get(2);
            if (script.equals("n")) {
                return Behavior.ok(count);
            }
            if (script.equals("ls")) {
                return Behavior.ok(listing);
            }
            return Behavior.ok(sizes);
        });
    }

    private static DjvuLibre tools(ScriptedProcessFactory factory) {
        return new DjvuLibre(CFG, new ProcessRunner(factory));
    }

    @Test
    void parsesIdentifiersFromDirectoryListing() {
        Map<Integer, String> ids = DjvuPageSource.parseDirectory(LISTING + "    4 I     1200 shared_anno.iff\n");

        assertThat(ids).containsExactly(
                Map.entry(1, "p0001.djvu"),
                Map.entry(2, "Strona 2.djvu"),
                Map.entry(3, "p0003.djvu"));
    }

    @Test
    void unquotesEscapedIdentifiers() {
        assertThat(DjvuPageSource.unquote("plain.djvu")).isEqualTo("plain.djvu");
        assertThat(DjvuPageSource.unquote("\"a \\\"b\\\" c.djvu\"")).isEqualTo("a \"b\" c.djvu");
        assertThat(DjvuPageSource.unquote("\"str\\303\\263na.djvu\"")).isEqualTo("str\u00f3na.djvu");
    }

    @Test
    void describesRequestedPagesWithDenseIndices() {
        ScriptedProcessFactory factory = djvused("3", LISTING,
                "width=2550 height=3300\nwidth=3300 height=2550 rotation=90\n");
        PageSource source = tools(factory).open(document);

        List<PageDescriptor> pages = source.describe(List.of(3, 2, 3));

        assertThat(source.pageCount()).isEqualTo(3);
        assertThat(pages).containsExactly(
                new PageDescriptor(0, 3, "p0003.djvu", 0, new PageSize(2550, 3300)),
                new PageDescriptor(1, 2, "Strona 2.djvu", 90, new PageSize(3300, 2550)));
        assertThat(factory.commands().get(2)).containsExactly(
                "djvused", "-e", "select 3; size; select 2; size; ", document.toString());
    }

    @Test
    void describesAllPagesWhenNoSelection() {
        PageSource source = tools(djvused("3", LISTING,
                "width=10 height=20\nwidth=10 height=20\nwidth=10 height=20\n")).open(document);

        assertThat(source.describe(null)).extracting(PageDescriptor::pageNumber).containsExactly(1, 2, 3);
    }

    @Test
    void singlePageDocumentUsesFileName() {
        PageSource source = tools(djvused("1", "", "width=100 height=200\n")).open(document);

        assertThat(source.describe(null)).singleElement()
                .extracting(PageDescriptor::identifier).isEqualTo("book.djvu");
    }

    @Test
    void pageOutsideDocumentIsRejected() {
        PageSource source = tools(djvused("3", LISTING, "")).open(document);

        assertThatThrownBy(() -> source.describe(List.of(1, 4)))
                .isInstanceOf(DocumentException.class)
                .hasMessageContaining("Page 4 does not exist");
    }

    @Test
    void emptySelectionNeedsNoQuery() {
        ScriptedProcessFactory factory = djvused("3", LISTING, "");
        PageSource source = tools(factory).open(document);

        assertThat(source.describe(List.of())).isEmpty();
        assertThat(factory.commands()).hasSize(2);
    }

    @Test
    void missingDocumentIsDocumentException() {
        assertThatThrownBy(() -> tools(djvused("1", "", "")).open(tmp.resolve("missing.djvu")))
                .isInstanceOf(DocumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void unreadableDocumentIsDocumentException() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.always(Behavior.fail(10, "Unrecognized DjVu file"));

        assertThatThrownBy(() -> tools(factory).open(document))
                .isInstanceOf(DocumentException.class)
                .hasCauseInstanceOf(ExternalToolException.class);
    }

    @Test
    void rendersPageWithDdjvu() {
        Path target = tmp.resolve("000001.tif");
        ScriptedProcessFactory factory = new ScriptedProcessFactory(command -> {
            if (command.get(0).equals("ddjvu")) {
                Files.writeString(Path.of(command.get(5)), "II*");
                return Behavior.ok("");
            }
            return command.get(2).equals("n") ? Behavior.ok("3") : Behavior.ok(LISTING);
        });
        PageSource source = tools(factory).open(document);
        PageDescriptor page = new PageDescriptor(0, 2, "Strona 2.djvu", 0, new PageSize(10, 10));

        assertThat(source.render(page, RenderLayers.MASK, TIFF, target)).isEqualTo(target);
        assertThat(factory.commands().get(2)).containsExactly(
                "ddjvu", "-format=tiff", "-mode=mask", "-page=2", document.toString(), target.toString());
    }

    @Test
    void missingLayerIsNoImage() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.by(command -> switch (command.get(0)) {
            case "ddjvu" -> Behavior.fail(1, "ddjvu: Cannot render the requested page or rectangle.");
            default -> command.get(2).equals("n") ? Behavior.ok("3") : Behavior.ok(LISTING);
        });
        PageSource source = tools(factory).open(document);
        PageDescriptor page = new PageDescriptor(0, 1, "p0001.djvu", 0, new PageSize(10, 10));

        assertThatThrownBy(() -> source.render(page, RenderLayers.FOREGROUND, TIFF, tmp.resolve("x.tif")))
                .isInstanceOf(NoImageException.class);
    }

    @Test
    void emptyRenderOutputIsNoImage() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.by(command -> switch (command.get(0)) {
            case "ddjvu" -> Behavior.ok("");
            default -> command.get(2).equals("n") ? Behavior.ok("3") : Behavior.ok(LISTING);
        });
        PageSource source = tools(factory).open(document);
        PageDescriptor page = new PageDescriptor(0, 1, "p0001.djvu", 0, new PageSize(10, 10));

        assertThatThrownBy(() -> source.render(page, RenderLayers.MASK, TIFF, tmp.resolve("y.tif")))
                .isInstanceOf(NoImageException.class)
                .hasMessageContaining("renderer produced no image");
    }

    @Test
    void otherRenderFailuresAreToolErrors() {
        ScriptedProcessFactory factory = ScriptedProcessFactory.by(command -> switch (command.get(0)) {
            case "ddjvu" -> Behavior.fail(2, "ddjvu: out of memory");
            default -> command.get(2).equals("n") ? Behavior.ok("3") : Behavior.ok(LISTING);
        });
        PageSource source = tools(factory).open(document);
        PageDescriptor page = new PageDescriptor(0, 1, "p0001.djvu", 0, new PageSize(10, 10));

        assertThatThrownBy(() -> source.render(page, RenderLayers.ALL, TIFF, tmp.resolve("z.tif")))
                .isInstanceOf(ExternalToolException.class)
                .isNotInstanceOf(NoImageException.class);
    }
}
