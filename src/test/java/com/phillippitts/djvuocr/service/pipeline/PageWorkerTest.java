package com.phillippitts.djvuocr.service.pipeline;

import com.phillippitts.djvuocr.domain.ErrorPolicy;
import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.exception.ExternalToolInterruptedException;
import com.phillippitts.djvuocr.exception.NoImageException;
import com.phillippitts.djvuocr.testutil.TestPages;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.Test;

import java.nio.channels.ClosedByInterruptException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageWorkerTest {

    private final List<PageDescriptor> pages = TestPages.pages(3);
    private final ResultStore store = new ResultStore(3);

    private PageWorker worker(PageProcessor processor, ErrorPolicy policy) {
        return new PageWorker(pages, store, processor, policy, PipelineMetricsPublisher.NOOP);
    }

    @Test
    void processesEveryUnclaimedPage() throws InterruptedException {
        store.tryClaim(1);

        int claimed = worker(TestPages::zoneFor, ErrorPolicy.ABORT).call();

        assertThat(claimed).isEqualTo(2);
        assertThat(store.state(0)).isEqualTo(PageState.SUCCESS);
        assertThat(store.state(1)).isEqualTo(PageState.CLAIMED);
        assertThat(store.state(2)).isEqualTo(PageState.SUCCESS);
    }

    @Test
    void noImageIsRecordedAndWorkerContinues() throws InterruptedException {
        PageProcessor processor = page -> {
            if (page.pageNumber() == 1) {
                throw new NoImageException(1, "blank");
            }
            return TestPages.zoneFor(page);
        };

        worker(processor, ErrorPolicy.ABORT).call();

        assertThat(store.state(0)).isEqualTo(PageState.NO_IMAGE);
        assertThat(store.state(2)).isEqualTo(PageState.SUCCESS);
    }

    @Test
    void failureUnderResumeBecomesNoImage() throws InterruptedException {
        PageProcessor processor = page -> {
            if (page.pageNumber() == 2) {
                throw new IllegalStateException("corrupt page");
            }
            return TestPages.zoneFor(page);
        };

        worker(processor, ErrorPolicy.RESUME).call();

        assertThat(store.state(1)).isEqualTo(PageState.NO_IMAGE);
        assertThat(store.state(2)).isEqualTo(PageState.SUCCESS);
    }

    @Test
    void failureUnderAbortStopsTheWorker() throws InterruptedException {
        PageProcessor processor = page -> {
            if (page.pageNumber() == 2) {
                throw new IllegalStateException("corrupt page");
            }
            return TestPages.zoneFor(page);
        };

        int claimed = worker(processor, ErrorPolicy.ABORT).call();

        assertThat(claimed).isEqualTo(2);
        assertThat(store.state(1)).isEqualTo(PageState.FAILED);
        assertThat(store.state(2)).isEqualTo(PageState.UNCLAIMED);
    }

    @Test
    void interruptIsFailedEvenUnderResume() throws InterruptedException {
        PageProcessor processor = page -> {
            throw new ExternalToolInterruptedException("tesseract", new InterruptedException());
        };

        assertThatThrownBy(() -> worker(processor, ErrorPolicy.RESUME).call())
                .isInstanceOf(InterruptedException.class)
                .hasCauseInstanceOf(ExternalToolInterruptedException.class);

        assertThat(store.state(0)).isEqualTo(PageState.FAILED);
        assertThat(store.awaitTerminal(0).error()).isInstanceOf(ExternalToolInterruptedException.class);
        assertThat(store.state(1)).isEqualTo(PageState.UNCLAIMED);
    }

    @Test
    void errorsAreRecordedAndRethrown() {
        PageProcessor processor = page -> {
            throw new LinkageError("broken class");
        };

        assertThatThrownBy(() -> worker(processor, ErrorPolicy.RESUME).call())
                .isInstanceOf(LinkageError.class);
        assertThat(store.state(0)).isEqualTo(PageState.FAILED);
    }

    @Test
    void interruptedWorkerClaimsNothing() {
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> worker(TestPages::zoneFor, ErrorPolicy.ABORT).call())
                    .isInstanceOf(InterruptedException.class);
        } finally {
            Thread.interrupted();
        }
        assertThat(store.state(0)).isEqualTo(PageState.UNCLAIMED);
    }

    @Test
    void pageNumberIsInThreadContextWhileProcessing() throws InterruptedException {
        Map<Integer, String> seen = new ConcurrentHashMap<>();
        PageProcessor processor = page -> {
            seen.put(page.pageNumber(), ThreadContext.get(PageWorker.PAGE_KEY));
            return TestPages.zoneFor(page);
        };

        worker(processor, ErrorPolicy.ABORT).call();

        assertThat(seen).containsEntry(1, "1").containsEntry(3, "3");
        assertThat(ThreadContext.get(PageWorker.PAGE_KEY)).isNull();
    }

    @Test
    void recognizesInterruptCauses() {
        assertThat(PageWorker.isInterrupt(new RuntimeException(new ClosedByInterruptException()))).isTrue();
        assertThat(PageWorker.isInterrupt(new RuntimeException(new InterruptedException()))).isTrue();
        assertThat(PageWorker.isInterrupt(new IllegalStateException("plain"))).isFalse();
    }
}
