package com.phillippitts.djvuocr.service.pipeline;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared page slots of one document run, guarded by a single lock and condition.
 *
 * <p>Workers claim and complete slots; the assembler waits for them in page order.
 * The lock protects state transitions only and is never held during page processing.
 *
 * <p><b>Invariants:</b>
 * <ul>
 *   <li>Exactly one caller moves a slot out of {@link PageState#UNCLAIMED}; claiming and
 *       checking are one atomic step</li>
 *   <li>A slot never returns to {@link PageState#UNCLAIMED}</li>
 *   <li>Every transition wakes all waiters</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> All public methods are thread-safe.
 */
public final class ResultStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();

    private final PageState[] states;
    private final PageOutcome[] outcomes;
    private final boolean[] cancelled;

    public ResultStore(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must not be negative: " + size);
        }
        this.states = new PageState[size];
        this.outcomes = new PageOutcome[size];
        this.cancelled = new boolean[size];
        Arrays.fill(states, PageState.UNCLAIMED);
    }

    public int size() {
        return states.length;
    }

    /**
     * Claims a slot for processing.
     *
     * @return {@code true} if the slot was unclaimed and now belongs to the caller
     */
    public boolean tryClaim(int index) {
        lock.lock();
        try {
            if (states[index] != PageState.UNCLAIMED) {
                return false;
            }
            states[index] = PageState.CLAIMED;
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records the terminal outcome of a claimed slot and wakes all waiters.
     *
     * @throws IllegalStateException if the slot is not claimed, or was claimed by cancellation
     * @throws IllegalArgumentException if {@code outcome} is not terminal
     */
    public void complete(int index, PageOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (!outcome.state().isTerminal()) {
            throw new IllegalArgumentException("outcome must be terminal: " + outcome.state());
        }
        lock.lock();
        try {
            if (states[index] != PageState.CLAIMED || cancelled[index]) {
                throw new IllegalStateException("page slot " + index + " is not claimed by a worker: "
                        + states[index]);
            }
            states[index] = outcome.state();
            outcomes[index] = outcome;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until the slot is terminal or has been pre-claimed by {@link #cancelRemaining(int)}.
     *
     * @return the terminal outcome, or an outcome in state {@link PageState#CLAIMED} for a
     *         slot that cancellation claimed before any worker did
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public PageOutcome awaitTerminal(int index) throws InterruptedException {
        lock.lock();
        try {
            while (!states[index].isTerminal() && !cancelled[index]) {
                changed.await();
            }
            return cancelled[index] ? PageOutcome.cancelled() : outcomes[index];
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks every unclaimed slot at or after {@code fromIndex} as claimed without doing work,
     * so that no worker starts a new page. Slots already claimed are left alone. Idempotent.
     *
     * @return number of slots this call pre-claimed
     */
    public int cancelRemaining(int fromIndex) {
        lock.lock();
        try {
            int count = 0;
            for (int i = Math.max(0, fromIndex); i < states.length; i++) {
                if (states[i] == PageState.UNCLAIMED) {
                    states[i] = PageState.CLAIMED;
                    cancelled[i] = true;
                    count++;
                }
            }
            changed.signalAll();
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return current state of a slot
     */
    public PageState state(int index) {
        lock.lock();
        try {
            return states[index];
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if the slot was pre-claimed by cancellation
     */
    public boolean isCancelled(int index) {
        lock.lock();
        try {
            return cancelled[index];
        } finally {
            lock.unlock();
        }
    }
}
