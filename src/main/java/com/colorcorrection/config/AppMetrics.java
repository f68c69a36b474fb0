package com.colorcorrection.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Application metrics for batch processing.
 *
 * View at: http://localhost:5000/actuator/metrics
 *
 * Key metrics:
 * - batch.submitted        → Batches admitted
 * - batch.rejected         → Submissions refused because a batch was active
 * - item.completed         → Items that produced a result
 * - item.failed            → Items that failed (load, pipeline, timeout)
 * - item.timeout           → Subset of failures caused by the per-item deadline
 * - item.processing.time   → Per-item wall time inside a worker
 * - batch.total.time       → Admission to teardown
 * - inference.time         → Apply-to-others run time
 * - export.time            → Result export time
 * - model.saved            → Trained models written to disk
 */
@Component
@Getter
public class AppMetrics {

    // Timers
    private final Timer itemProcessingTimer;
    private final Timer batchTotalTimer;
    private final Timer inferenceTimer;
    private final Timer exportTimer;

    // Counters
    private final Counter batchesSubmittedCounter;
    private final Counter batchesRejectedCounter;
    private final Counter itemsCompletedCounter;
    private final Counter itemsFailedCounter;
    private final Counter itemTimeoutsCounter;
    private final Counter imagesExportedCounter;
    private final Counter modelsSavedCounter;

    public AppMetrics(MeterRegistry registry) {
        // ═══════════════════════════════════════════════════════════════
        // TIMERS
        // ═══════════════════════════════════════════════════════════════

        this.itemProcessingTimer = Timer.builder("item.processing.time")
                .description("Time spent on one item inside a worker")
                .register(registry);

        this.batchTotalTimer = Timer.builder("batch.total.time")
                .description("Batch time from admission to pool teardown")
                .register(registry);

        this.inferenceTimer = Timer.builder("inference.time")
                .description("Time to apply a trained model to a set of images")
                .register(registry);

        this.exportTimer = Timer.builder("export.time")
                .description("Time to write corrected images to disk")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS
        // ═══════════════════════════════════════════════════════════════

        this.batchesSubmittedCounter = Counter.builder("batch.submitted")
                .description("Batches admitted")
                .register(registry);

        this.batchesRejectedCounter = Counter.builder("batch.rejected")
                .description("Submissions refused because a batch was already active")
                .register(registry);

        this.itemsCompletedCounter = Counter.builder("item.completed")
                .description("Items processed successfully")
                .register(registry);

        this.itemsFailedCounter = Counter.builder("item.failed")
                .description("Items that failed")
                .register(registry);

        this.itemTimeoutsCounter = Counter.builder("item.timeout")
                .description("Items that exceeded their deadline")
                .register(registry);

        this.imagesExportedCounter = Counter.builder("export.images.saved")
                .description("Corrected images written to disk")
                .register(registry);

        this.modelsSavedCounter = Counter.builder("model.saved")
                .description("Trained models written to disk")
                .register(registry);
    }

    public void recordItemTime(long millis) {
        itemProcessingTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordBatchTime(long millis) {
        batchTotalTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordInferenceTime(long millis) {
        inferenceTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void recordExportTime(long millis) {
        exportTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementBatchSubmitted() {
        batchesSubmittedCounter.increment();
    }

    public void incrementBatchRejected() {
        batchesRejectedCounter.increment();
    }

    public void incrementItemsCompleted(int count) {
        itemsCompletedCounter.increment(count);
    }

    public void incrementItemsFailed(int count) {
        itemsFailedCounter.increment(count);
    }

    public void incrementItemTimeouts() {
        itemTimeoutsCounter.increment();
    }

    public void incrementImagesExported(int count) {
        imagesExportedCounter.increment(count);
    }

    public void incrementModelsSaved() {
        modelsSavedCounter.increment();
    }
}
