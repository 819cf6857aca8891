package com.phillippitts.djvuocr.presentation.exception;

import com.phillippitts.djvuocr.exception.DocumentException;
import com.phillippitts.djvuocr.exception.EngineNotFoundException;
import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.exception.InvalidOptionsException;
import com.phillippitts.djvuocr.exception.PageProcessingException;
import com.phillippitts.djvuocr.exception.RunInterruptedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;

import static org.assertj.core.api.Assertions.assertThat;

class CliExceptionHandlerTest {

    private CliExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new CliExceptionHandler();
    }

    @Test
    void invalidOptionsExitWithTwo() {
        assertThat(handler.handle(new InvalidOptionsException("bad"))).isEqualTo(2);
    }

    @Test
    void wrappedInvalidOptionsExitWithTwo() {
        BeanCreationException startup = new BeanCreationException("ocrOptionsValidator",
                "Invocation of init method failed", new InvalidOptionsException("ocr.output is required"));

        assertThat(CliExceptionHandler.exitCodeOf(startup)).isEqualTo(2);
    }

    @Test
    void pageFailureExitsWithOne() {
        assertThat(handler.handle(new PageProcessingException(4, new IllegalStateException("x")))).isEqualTo(1);
    }

    @Test
    void interruptsExitWithOne() {
        assertThat(handler.handle(new RunInterruptedException("stop"))).isEqualTo(1);
        assertThat(handler.handle(new ExternalToolInterruptedException("ddjvu", new InterruptedException())))
                .isEqualTo(1);
    }

    @Test
    void engineAndDocumentFailuresExitWithOne() {
        assertThat(handler.handle(new EngineNotFoundException("tesseract"))).isEqualTo(1);
        assertThat(handler.handle(new DocumentException("no such page"))).isEqualTo(1);
    }

    @Test
    void unexpectedErrorsExitWithOne() {
        assertThat(handler.handle(new IllegalStateException("bug"))).isEqualTo(1);
        assertThat(CliExceptionHandler.exitCodeOf(new IllegalStateException("bug"))).isEqualTo(1);
    }
}
