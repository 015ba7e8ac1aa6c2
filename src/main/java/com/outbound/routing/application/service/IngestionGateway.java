package com.outbound.routing.application.service;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import com.outbound.routing.application.port.in.ProcessEventUseCase;
import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.entity.RoutingOutcome;
import com.outbound.routing.domain.exception.IngestionRejectedException;

/**
 * Bounded front door for synchronous event submission.
 * <p>
 * Submissions queue on a fixed-size worker pool. A full queue is rejected
 * immediately with a retriable error instead of blocking the sender; an
 * accepted submission is answered only after the pipeline finished, so the
 * caller never sees an acknowledgement before the event is durable.
 * </p>
 */
public class IngestionGateway {

    private static final Logger log = Logger.getLogger(IngestionGateway.class.getName());

    private final ProcessEventUseCase processEventUseCase;
    private final ThreadPoolExecutor workers;
    private final Duration submitTimeout;

    public IngestionGateway(ProcessEventUseCase processEventUseCase, int workerCount, int queueCapacity,
            Duration submitTimeout) {
        if (processEventUseCase == null)
            throw new IllegalArgumentException("processEventUseCase cannot be null");
        if (workerCount < 1 || queueCapacity < 1)
            throw new IllegalArgumentException("workerCount and queueCapacity must be positive");
        if (submitTimeout == null || submitTimeout.isNegative() || submitTimeout.isZero())
            throw new IllegalArgumentException("submitTimeout must be positive");

        this.processEventUseCase = processEventUseCase;
        this.submitTimeout = submitTimeout;
        this.workers = new ThreadPoolExecutor(workerCount, workerCount, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), new IngestionThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs the ingest pipeline for one event on the bounded pool and waits for it.
     *
     * @throws IngestionRejectedException if the queue is full or the wait timed out
     */
    public RoutingOutcome submit(RawEngagementEvent raw) {
        Future<RoutingOutcome> future;
        try {
            future = workers.submit(() -> processEventUseCase.process(raw));
        } catch (RejectedExecutionException e) {
            log.warning(String.format("action=ingestion_rejected reason=queue_full queued=%d",
                    workers.getQueue().size()));
            throw new IngestionRejectedException("ingestion queue is full", e);
        }

        try {
            return future.get(submitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("ingest pipeline failed", cause);
        } catch (TimeoutException e) {
            // Still running; a retry with the same dedup key is safe
            log.warning(String.format("action=ingestion_rejected reason=timeout timeoutMs=%d",
                    submitTimeout.toMillis()));
            throw new IngestionRejectedException("ingestion did not complete in time", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionRejectedException("interrupted while waiting for ingestion", e);
        }
    }

    public int queuedCount() {
        return workers.getQueue().size();
    }

    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(submitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class IngestionThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "ingestion-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
