package com.phillippitts.djvuocr.testutil;

import com.phillippitts.djvuocr.domain.PageDescriptor;
import com.phillippitts.djvuocr.domain.zone.TextZone;
import com.phillippitts.djvuocr.service.pipeline.TranscriptSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link TranscriptSink} that records appended pages and the appending threads. Pages appended
 * without text are recorded separately.
 */
public final class RecordingSink implements TranscriptSink {

    private final List<Integer> pageNumbers = Collections.synchronizedList(new ArrayList<>());
    private final List<Integer> emptyPageNumbers = Collections.synchronizedList(new ArrayList<>());
    private final List<Thread> threads = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void append(PageDescriptor page, TextZone zone) {
        pageNumbers.add(page.pageNumber());
        threads.add(Thread.currentThread());
    }

    @Override
    public void appendEmpty(PageDescriptor page) {
        emptyPageNumbers.add(page.pageNumber());
        threads.add(Thread.currentThread());
    }

    public List<Integer> pageNumbers() {
        synchronized (pageNumbers) {
            return List.copyOf(pageNumbers);
        }
    }

    public List<Integer> emptyPageNumbers() {
        synchronized (emptyPageNumbers) {
            return List.copyOf(emptyPageNumbers);
        }
    }

    public List<Thread> threads() {
        synchronized (threads) {
            return List.copyOf(threads);
        }
    }
}
