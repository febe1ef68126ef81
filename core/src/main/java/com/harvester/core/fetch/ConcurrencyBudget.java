package com.harvester.core.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * A fixed upper bound on simultaneously running operations of one class
 * (e.g. "links" or "images"), with the worker threads that run them.
 */
public class ConcurrencyBudget implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyBudget.class);

    private final String name;
    private final int permits;
    private final Semaphore semaphore;
    private final ExecutorService executor;
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();

    public ConcurrencyBudget(String name, int permits) {
        if (permits < 1) {
            throw new IllegalArgumentException("Budget '" + name + "' needs at least one permit");
        }
        this.name = name;
        this.permits = permits;
        this.semaphore = new Semaphore(permits, true);
        this.executor = Executors.newFixedThreadPool(permits, threadFactory(name));
    }

    /**
     * Run work on the calling thread once a permit is free. The permit is
     * released when the work returns or throws.
     *
     * @throws InterruptedException if interrupted while waiting for a permit
     */
    public <T> T withPermit(Supplier<T> work) throws InterruptedException {
        semaphore.acquire();
        int now = inFlight.incrementAndGet();
        peakInFlight.accumulateAndGet(now, Math::max);
        try {
            return work.get();
        } finally {
            inFlight.decrementAndGet();
            semaphore.release();
        }
    }

    /**
     * Run work on one of this budget's workers under a permit.
     */
    public <T> Future<T> submit(Supplier<T> work) {
        return executor.submit(() -> withPermit(work));
    }

    public String getName() {
        return name;
    }

    public int getPermits() {
        return permits;
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Highest number of operations that were running at the same time.
     */
    public int getPeakInFlight() {
        return peakInFlight.get();
    }

    /**
     * Interrupt running work and drop queued work.
     */
    public void shutdownNow() {
        int dropped = executor.shutdownNow().size();
        if (dropped > 0) logger.warn("Budget '{}' stopped, {} queued task(s) dropped", name, dropped);
    }

    /**
     * Wait until all workers have stopped after a shutdown.
     *
     * @return false if workers were still running when the timeout elapsed
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                shutdownNow();
            }
        } catch (InterruptedException e) {
            shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
