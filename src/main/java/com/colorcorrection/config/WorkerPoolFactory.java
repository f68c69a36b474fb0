package com.colorcorrection.config;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Creates the bounded pool used for one batch. The caller owns the pool and
 * must shut it down, see {@link #shutdown(ExecutorService, Duration)}.
 */
@FunctionalInterface
public interface WorkerPoolFactory {

    ExecutorService newPool(int workers, String threadPrefix);

    /**
     * Stops accepting work, waits up to {@code grace} for running tasks, then
     * interrupts whatever is left.
     *
     * @return true if the pool terminated within the grace period
     */
    static boolean shutdown(ExecutorService pool, Duration grace) {
        pool.shutdown();
        try {
            if (pool.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        pool.shutdownNow();
        return false;
    }
}
