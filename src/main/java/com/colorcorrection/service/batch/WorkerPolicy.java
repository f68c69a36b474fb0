package com.colorcorrection.service.batch;

import org.springframework.stereotype.Component;

import java.util.function.IntSupplier;

/**
 * Sizes worker pools.
 *
 * CPU-bound work gets 60% of the cores, GPU work at most 2 workers (more
 * only contend for the device), and a pool is never larger than the number
 * of items it will run.
 */
@Component
public class WorkerPolicy {

    public static final int BATCH_HARD_CAP = 16;
    public static final int INFERENCE_HARD_CAP = 8;

    private static final int GPU_WORKERS = 2;
    private static final double CPU_SHARE = 0.6;
    private static final double IO_SHARE = 0.8;

    private final IntSupplier cpuCount;

    public WorkerPolicy() {
        this(() -> Runtime.getRuntime().availableProcessors());
    }

    public WorkerPolicy(IntSupplier cpuCount) {
        this.cpuCount = cpuCount;
    }

    public int computeWorkers(int itemCount, boolean hasGpu) {
        return computeWorkers(itemCount, hasGpu, null, BATCH_HARD_CAP);
    }

    public int computeWorkers(int itemCount, boolean hasGpu, Integer override) {
        return computeWorkers(itemCount, hasGpu, override, BATCH_HARD_CAP);
    }

    /**
     * @param override requested worker count, or null for automatic sizing;
     *                 clamped to {@code [1, min(hardCap, itemCount)]}
     */
    public int computeWorkers(int itemCount, boolean hasGpu, Integer override, int hardCap) {
        if (itemCount < 1) {
            throw new IllegalArgumentException("itemCount must be positive, got " + itemCount);
        }
        if (override != null) {
            return Math.max(1, Math.min(override, Math.min(hardCap, itemCount)));
        }
        if (hasGpu) {
            return Math.min(GPU_WORKERS, itemCount);
        }
        int optimal = Math.max(1, (int) (CPU_SHARE * cpuCount.getAsInt()));
        return Math.min(optimal, itemCount);
    }

    /**
     * Workers for applying a shared model. Model calls are serialized, so more
     * than two automatic workers only add waiting threads.
     */
    public int computeInferenceWorkers(int itemCount, boolean hasGpu, Integer override) {
        if (override != null) {
            return computeWorkers(itemCount, hasGpu, override, INFERENCE_HARD_CAP);
        }
        return Math.min(GPU_WORKERS, Math.min(computeWorkers(itemCount, hasGpu), itemCount));
    }

    /**
     * Workers for file writes.
     */
    public int computeIoWorkers(int taskCount) {
        if (taskCount < 1) {
            throw new IllegalArgumentException("taskCount must be positive, got " + taskCount);
        }
        int optimal = Math.max(2, (int) (IO_SHARE * cpuCount.getAsInt()));
        return Math.min(optimal, taskCount);
    }
}
