package com.phillippitts.djvuocr.config.logging;

import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class MdcTaskDecoratorTest {

    private final MdcTaskDecorator decorator = new MdcTaskDecorator();

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void copiesSubmitterContextIntoTask() throws InterruptedException {
        ThreadContext.put("document", "book.djvu");
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable task = decorator.decorate(() -> seen.set(ThreadContext.get("document")));
        ThreadContext.clearAll();

        Thread worker = new Thread(task);
        worker.start();
        worker.join(5000);

        assertThat(seen.get()).isEqualTo("book.djvu");
    }

    @Test
    void restoresWorkerContextAfterTask() {
        ThreadContext.put("document", "submitted.djvu");
        Runnable task = decorator.decorate(() -> ThreadContext.put("page", "4"));
        ThreadContext.clearAll();
        ThreadContext.put("document", "own.djvu");

        task.run();

        assertThat(ThreadContext.get("document")).isEqualTo("own.djvu");
        assertThat(ThreadContext.containsKey("page")).isFalse();
    }
}
