package com.csd.pkghealth.service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Caps the number of asynchronous tasks in flight. Tasks beyond the limit wait in FIFO
 * order and start as earlier ones complete. A task's permit is released before its result
 * is completed, so callers chaining on the result never run while holding a permit.
 */
public class FetchLimiter {

    private final int maxConcurrent;
    private final Deque<Runnable> pending = new ArrayDeque<>();
    private int active;
    private int peak;

    public FetchLimiter(int maxConcurrent) {
        if (maxConcurrent < 1) {
            throw new IllegalArgumentException("maxConcurrent must be at least 1, got " + maxConcurrent);
        }
        this.maxConcurrent = maxConcurrent;
    }

    public <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Runnable start = () -> {
            CompletableFuture<T> started;
            try {
                started = task.get();
                if (started == null) {
                    started = CompletableFuture.failedFuture(new IllegalStateException("Task returned no future"));
                }
            } catch (RuntimeException e) {
                started = CompletableFuture.failedFuture(e);
            }
            started.whenComplete((value, error) -> {
                release();
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(value);
                }
            });
        };

        boolean runNow;
        synchronized (this) {
            runNow = active < maxConcurrent;
            if (runNow) {
                active++;
                peak = Math.max(peak, active);
            } else {
                pending.addLast(start);
            }
        }
        if (runNow) {
            start.run();
        }
        return result;
    }

    private void release() {
        Runnable next;
        synchronized (this) {
            next = pending.pollFirst();
            if (next == null) {
                active--;
            }
            // otherwise the permit passes straight to the next task
        }
        if (next != null) {
            next.run();
        }
    }

    public int getMaxConcurrent() {
        return maxConcurrent;
    }

    public synchronized int getActiveCount() {
        return active;
    }

    public synchronized int getPendingCount() {
        return pending.size();
    }

    /** Highest number of tasks that were ever in flight together. */
    public synchronized int getPeakConcurrency() {
        return peak;
    }
}
