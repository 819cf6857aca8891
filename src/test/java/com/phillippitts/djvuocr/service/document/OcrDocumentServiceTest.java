package com.phillippitts.djvuocr.service.document;

import com.phillippitts.djvuocr.config.ThreadPoolConfig;
import com.phillippitts.djvuocr.config.properties.OcrProperties;
import com.phillippitts.djvuocr.config.properties.ThreadPoolProperties;
import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.zone.BBox;
import com.phillippitts.djvuocr.domain.zone.TextZone;
import com.phillippitts.djvuocr.domain.zone.ZoneType;
import com.phillippitts.djvuocr.exception.EngineNotFoundException;
import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.exception.MissingLanguagePackException;
import com.phillippitts.djvuocr.exception.OcrEngineException;
import com.phillippitts.djvuocr.exception.PageProcessingException;
import com.phillippitts.djvuocr.exception.UnknownLanguageListException;
import com.phillippitts.djvuocr.service.djvu.DjvuLibre;
import com.phillippitts.djvuocr.service.djvu.DjvuPageSource;
import com.phillippitts.djvuocr.service.engine.EngineType;
import com.phillippitts.djvuocr.service.engine.ImageFormat;
import com.phillippitts.djvuocr.service.engine.OcrEngine;
import com.phillippitts.djvuocr.service.engine.OcrEngineFactory;
import com.phillippitts.djvuocr.service.engine.RawOcrOutput;
import com.phillippitts.djvuocr.service.metrics.OcrMetrics;
import com.phillippitts.djvuocr.service.pipeline.PipelineResult;
import com.phillippitts.djvuocr.service.pipeline.RunCancellation;
import com.phillippitts.djvuocr.service.save.DocumentSaver;
import com.phillippitts.djvuocr.service.save.DocumentSaverFactory;
import com.phillippitts.djvuocr.service.save.SaveRequest;
import com.phillippitts.djvuocr.service.save.SaverType;
import com.phillippitts.djvuocr.testutil.TestPages;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OcrDocumentServiceTest {

    private static final ImageFormat TIFF = new ImageFormat("tif", "tiff", 1);
    private static final TextZone ZONE = TextZone.leaf(ZoneType.PAGE, new BBox(0, 0, 10, 10), "text");

    @TempDir
    Path tempDir;

    private final OcrProperties props = new OcrProperties();
    private final OcrEngineFactory engineFactory = mock(OcrEngineFactory.class);
    private final OcrEngine engine = mock(OcrEngine.class);
    private final DjvuLibre djvuLibre = mock(DjvuLibre.class);
    private final DjvuPageSource source = mock(DjvuPageSource.class);
    private final DocumentSaverFactory saverFactory = mock(DocumentSaverFactory.class);
    private final DocumentSaver saver = mock(DocumentSaver.class);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<Path> workDirs = Collections.synchronizedList(new ArrayList<>());
    private final Path document = Path.of("book.djvu");

    private OcrDocumentService service;

    @BeforeEach
    void setUp() {
        props.setJobs(2);
        props.setOutput(SaverType.DRY_RUN);

        when(engineFactory.create(eq(EngineType.TESSERACT), anyMap())).thenReturn(engine);
        when(engine.engineName()).thenReturn("tesseract");
        when(engine.defaultLanguage()).thenReturn("eng");
        when(engine.imageFormat(1)).thenReturn(TIFF);
        when(engine.recognize(any(), any(), any())).thenAnswer(inv -> {
            Path dir = Files.createTempDirectory(tempDir, "raw");
            return new RawOcrOutput(dir, Files.writeString(dir.resolve("out.txt"), "text"), "txt");
        });
        when(engine.extractText(any(), any())).thenReturn(ZONE);

        when(djvuLibre.open(document)).thenReturn(source);
        when(source.pageCount()).thenReturn(3);
        when(source.describe(null)).thenReturn(TestPages.pages(3));
        when(source.render(any(), any(), any(), any())).thenAnswer(inv -> {
            Path target = inv.getArgument(3);
            workDirs.add(target.getParent());
            return Files.writeString(target, "image");
        });

        when(saverFactory.create(any(), any())).thenReturn(saver);

        service = new OcrDocumentService(props, engineFactory, djvuLibre, saverFactory,
                new ThreadPoolConfig(new ThreadPoolProperties()).pageExecutorFactory(),
                new OcrMetrics(registry));
    }

    @AfterEach
    void tearDown() throws IOException {
        for (Path dir : List.copyOf(workDirs)) {
            FileSystemUtils.deleteRecursively(dir);
        }
    }

    private double runs(String status) {
        return registry.get("djvuocr.run").tag("status", status).counter().count();
    }

    @Test
    void successfulRunSavesTranscriptAndDeletesWorkingDirectory() {
        AtomicReference<SaveRequest> saved = new AtomicReference<>();
        AtomicReference<String> script = new AtomicReference<>();
        doAnswer(inv -> {
            SaveRequest request = inv.getArgument(0);
            saved.set(request);
            script.set(Files.readString(request.script()));
            return null;
        }).when(saver).save(any());

        PipelineResult result = service.process(document, new RunCancellation());

        assertThat(result.written()).extracting(PageDescriptor::pageNumber).containsExactly(1, 2, 3);
        assertThat(saved.get().keepPages()).isNull();
        assertThat(saved.get().pageCount()).isEqualTo(3);
        assertThat(saved.get().script().getFileName().toString()).isEqualTo(OcrDocumentService.SCRIPT_NAME);
        assertThat(script.get()).containsSubsequence("select 'p0001.djvu'", "select 'p0002.djvu'",
                "select 'p0003.djvu'");
        assertThat(saved.get().workDir()).doesNotExist();
        assertThat(runs("success")).isEqualTo(1.0);
    }

    @Test
    void ocrOnlyKeepsRequestedPages() {
        props.setPages("2-3");
        props.setOcrOnly(true);
        when(source.describe(List.of(2, 3))).thenReturn(List.of(TestPages.page(0, 2), TestPages.page(1, 3)));
        AtomicReference<SaveRequest> saved = new AtomicReference<>();
        doAnswer(inv -> {
            saved.set(inv.getArgument(0));
            return null;
        }).when(saver).save(any());

        service.process(document, new RunCancellation());

        assertThat(saved.get().keepPages()).containsExactlyInAnyOrder(2, 3);
    }

    @Test
    void failedRunKeepsWorkingDirectory() {
        when(engine.extractText(any(), any())).thenReturn(ZONE).thenThrow(new OcrEngineException("garbled"));
        props.setJobs(1);

        assertThatThrownBy(() -> service.process(document, new RunCancellation()))
                .isInstanceOf(PageProcessingException.class);

        assertThat(workDirs).isNotEmpty();
        assertThat(workDirs.get(0).resolve(OcrDocumentService.SCRIPT_NAME))
                .content().contains("select 'p0001.djvu'");
        verify(saver, never()).save(any());
        assertThat(runs("failed")).isEqualTo(1.0);
    }

    @Test
    void missingEngineIsAnOptionsError() {
        when(engineFactory.create(any(), anyMap())).thenThrow(new EngineNotFoundException("tesseract"));

        assertThatThrownBy(() -> service.process(document, new RunCancellation()))
                .isInstanceOf(InvalidOptionsException.class)
                .hasCauseInstanceOf(EngineNotFoundException.class);
        verify(djvuLibre, never()).open(any());
    }

    @Test
    void missingLanguagePackIsAnOptionsError() {
        props.setLanguage("deu");
        doThrow(new MissingLanguagePackException("deu")).when(engine).checkLanguage("deu");

        assertThatThrownBy(() -> service.process(document, new RunCancellation()))
                .isInstanceOf(InvalidOptionsException.class)
                .hasMessageContaining("deu");
    }

    @Test
    void unknownLanguageListProceeds() {
        doThrow(new UnknownLanguageListException("no list")).when(engine).checkLanguage("eng");

        PipelineResult result = service.process(document, new RunCancellation());

        assertThat(result.written()).hasSize(3);
        verify(engine).recognize(any(), eq("eng"), any());
    }

    @Test
    void finishedRunReleasesWaitingShutdownHook() throws InterruptedException {
        RunCancellation cancellation = new RunCancellation();

        service.process(document, cancellation);

        assertThat(cancellation.awaitFinished(Duration.ZERO)).isTrue();
    }
}
