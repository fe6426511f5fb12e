package com.demo.chatrelay.infrastructure;

import com.demo.chatrelay.domain.QueueStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs at most {@code maxConcurrent} requests at a time and queues the rest in
 * arrival order. The queue is unbounded and queued requests never time out.
 *
 * @param <P> request parameters
 * @param <R> result type
 */
@Slf4j
public class BoundedRequestDispatcher<P, R> {

    @FunctionalInterface
    public interface RequestHandler<P, R> {
        R handle(P params) throws Exception;
    }

    private final RequestHandler<P, R> handler;
    private final int maxConcurrent;
    private final ExecutorService workers;

    private final Deque<PendingRequest<P, R>> queue = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong sequence = new AtomicLong();
    private int activeRequests;

    public BoundedRequestDispatcher(String name, int maxConcurrent, RequestHandler<P, R> handler) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.handler = handler;
        this.maxConcurrent = maxConcurrent;
        this.workers = Executors.newFixedThreadPool(maxConcurrent, new CustomizableThreadFactory(name + "-"));
        log.info("Dispatcher initialized: name={}, maxConcurrent={}", name, maxConcurrent);
    }

    /**
     * Queue a request. The returned future completes with the handler's result,
     * or exceptionally with whatever the handler threw.
     */
    public CompletableFuture<R> submit(P params) {
        PendingRequest<P, R> request = new PendingRequest<>(sequence.incrementAndGet(), params, new CompletableFuture<>());
        lock.lock();
        try {
            queue.addLast(request);
            log.debug("Request queued: seq={}, active={}, queued={}", request.sequence, activeRequests, queue.size());
        } finally {
            lock.unlock();
        }
        drain();
        return request.result;
    }

    public QueueStatus status() {
        lock.lock();
        try {
            return QueueStatus.builder()
                    .activeRequests(activeRequests)
                    .queuedRequests(queue.size())
                    .maxConcurrent(maxConcurrent)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void drain() {
        List<PendingRequest<P, R>> rejected = new ArrayList<>();
        lock.lock();
        try {
            dispatchLocked(rejected);
        } finally {
            lock.unlock();
        }
        failRejected(rejected);
    }

    /**
     * Hand queued requests to the pool while slots are free. Must hold the lock,
     * so requests reach the pool in queue order.
     */
    private void dispatchLocked(List<PendingRequest<P, R>> rejected) {
        while (activeRequests < maxConcurrent && !queue.isEmpty()) {
            PendingRequest<P, R> next = queue.pollFirst();
            try {
                workers.execute(() -> run(next));
                activeRequests++;
            } catch (RejectedExecutionException e) {
                rejected.add(next);
            }
        }
    }

    private void failRejected(List<PendingRequest<P, R>> rejected) {
        for (PendingRequest<P, R> request : rejected) {
            log.warn("Request rejected, dispatcher is shut down: seq={}", request.sequence);
            request.result.completeExceptionally(
                    new RejectedExecutionException("Dispatcher is shut down"));
        }
    }

    private void run(PendingRequest<P, R> request) {
        log.debug("Request started: seq={}", request.sequence);
        R result = null;
        Throwable failure = null;
        try {
            result = handler.handle(request.params);
        } catch (Throwable t) {
            failure = t;
        }

        // Free the slot and start the next request before the caller's callbacks run
        List<PendingRequest<P, R>> rejected = new ArrayList<>();
        lock.lock();
        try {
            activeRequests--;
            dispatchLocked(rejected);
        } finally {
            lock.unlock();
        }
        failRejected(rejected);

        if (failure != null) {
            log.debug("Request failed: seq={}, error={}", request.sequence, failure.getMessage());
            request.result.completeExceptionally(failure);
        } else {
            request.result.complete(result);
        }
    }

    private static final class PendingRequest<P, R> {
        private final long sequence;
        private final P params;
        private final CompletableFuture<R> result;

        private PendingRequest(long sequence, P params, CompletableFuture<R> result) {
            this.sequence = sequence;
            this.params = params;
            this.result = result;
        }
    }
}
