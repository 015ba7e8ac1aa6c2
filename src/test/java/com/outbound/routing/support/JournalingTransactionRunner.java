package com.outbound.routing.support;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import com.outbound.routing.application.port.out.TransactionRunner;

/**
 * Transaction runner for the in-memory stores: writes register an undo action
 * and a unit of work that throws is rolled back in reverse order. Each thread
 * keeps its own journal, so concurrent units of work roll back independently.
 */
public class JournalingTransactionRunner implements TransactionRunner {

    private final ThreadLocal<Deque<Runnable>> journal = new ThreadLocal<>();
    private final AtomicInteger commits = new AtomicInteger();
    private final AtomicInteger rollbacks = new AtomicInteger();
    private volatile RuntimeException failure;

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        RuntimeException injected = failure;
        if (injected != null) {
            throw injected;
        }
        if (journal.get() != null) {
            return work.get();
        }
        Deque<Runnable> undo = new ArrayDeque<>();
        journal.set(undo);
        try {
            T result = work.get();
            commits.incrementAndGet();
            return result;
        } catch (RuntimeException e) {
            while (!undo.isEmpty()) {
                undo.pop().run();
            }
            rollbacks.incrementAndGet();
            throw e;
        } finally {
            journal.remove();
        }
    }

    /** Registers how to revert a write made in the current thread's unit of work. */
    void onRollback(Runnable undo) {
        Deque<Runnable> current = journal.get();
        if (current != null) {
            current.push(undo);
        }
    }

    /** Every later unit of work fails with {@code e}; pass null to recover. */
    public void failWith(RuntimeException e) {
        this.failure = e;
    }

    public int commits() {
        return commits.get();
    }

    public int rollbacks() {
        return rollbacks.get();
    }
}
