package com.colorcorrection.service.processing;

import com.colorcorrection.config.AppMetrics;
import com.colorcorrection.config.WorkerPoolFactory;
import com.colorcorrection.exception.BatchValidationException;
import com.colorcorrection.exception.PipelineUnavailableException;
import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.model.InferenceRequest;
import com.colorcorrection.model.InferenceSummary;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.model.WorkItem;
import com.colorcorrection.pipeline.CorrectionModel;
import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.GpuProbe;
import com.colorcorrection.service.batch.WorkerPolicy;
import com.colorcorrection.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies the model trained by the last single-image run to other images.
 *
 * The model is not thread-safe, so every prediction goes through one lock.
 * Image loading and encoding still run in parallel. Runs synchronously on
 * the calling thread.
 */
@Service
@Slf4j
public class ModelInferenceService {

    private final SessionRegistry registry;
    private final ItemExecutor itemExecutor;
    private final WorkerPolicy workerPolicy;
    private final GpuProbe gpuProbe;
    private final WorkerPoolFactory workerPoolFactory;
    private final CorrectionPipelineFactory pipelineFactory;
    private final AppMetrics metrics;
    private final Duration itemTimeout;
    private final Duration teardownGrace;

    private final ReentrantLock modelLock = new ReentrantLock();

    public ModelInferenceService(
            SessionRegistry registry,
            ItemExecutor itemExecutor,
            WorkerPolicy workerPolicy,
            GpuProbe gpuProbe,
            WorkerPoolFactory workerPoolFactory,
            CorrectionPipelineFactory pipelineFactory,
            AppMetrics metrics,
            @Value("${app.batch.item-timeout-seconds:300}") long itemTimeoutSeconds,
            @Value("${app.batch.teardown-grace-seconds:5}") long teardownGraceSeconds) {
        this.registry = registry;
        this.itemExecutor = itemExecutor;
        this.workerPolicy = workerPolicy;
        this.gpuProbe = gpuProbe;
        this.workerPoolFactory = workerPoolFactory;
        this.pipelineFactory = pipelineFactory;
        this.metrics = metrics;
        this.itemTimeout = Duration.ofSeconds(itemTimeoutSeconds);
        this.teardownGrace = Duration.ofSeconds(teardownGraceSeconds);
    }

    public InferenceSummary apply(InferenceRequest request) {
        if (!pipelineFactory.isAvailable()) {
            throw new PipelineUnavailableException("Color correction pipeline not available");
        }
        List<Integer> requested = request.imageIndices();
        if (requested.isEmpty()) {
            throw new BatchValidationException("No images specified");
        }
        List<ImageDescriptor> images = registry.images();
        if (images.isEmpty()) {
            throw new BatchValidationException("No images loaded");
        }
        CorrectionModel model = registry.modelHandle()
                .orElseThrow(() -> new BatchValidationException(
                        "No trained model available. Run correction on at least one image first."));
        if (!model.hasTrainedModel()) {
            throw new BatchValidationException("No trained models available in the stored model");
        }

        List<WorkItem> items = new ArrayList<>();
        for (Integer index : requested) {
            if (index != null && index >= 0 && index < images.size()) {
                ImageDescriptor image = images.get(index);
                items.add(new WorkItem(index, image.path(), image.filename(), null, null));
            } else {
                log.warn("Invalid image index: {}", index);
            }
        }
        if (items.isEmpty()) {
            throw new BatchValidationException("No valid image indices provided");
        }

        boolean hasGpu = gpuProbe.isGpuAvailable();
        int workers = workerPolicy.computeInferenceWorkers(items.size(), hasGpu, request.maxWorkers());
        log.info("Applying trained model to {} images with {} workers (GPU: {})", items.size(), workers, hasGpu);

        long start = System.currentTimeMillis();
        int processed = 0;
        int failed = 0;
        ExecutorService pool = workerPoolFactory.newPool(workers, "cc-apply-");
        try {
            CompletionService<ItemResult> completion = new ExecutorCompletionService<>(pool);
            for (WorkItem item : items) {
                completion.submit(() -> itemExecutor.executeInference(item, model, modelLock, itemTimeout));
            }

            long bound = itemTimeout.plus(teardownGrace).toMillis();
            for (int resolved = 0; resolved < items.size(); resolved++) {
                Future<ItemResult> future = completion.poll(bound, TimeUnit.MILLISECONDS);
                if (future == null) {
                    int stalled = items.size() - resolved;
                    log.error("✗ {} image(s) did not finish within {}ms", stalled, bound);
                    failed += stalled;
                    break;
                }
                ItemResult result = resultOf(future);
                if (result.success()) {
                    registry.addProcessedImage(result);
                    processed++;
                    log.info("✓ Applied model to image {}: {} ({} steps)",
                            result.index() + 1, result.filename(), result.correctedImages().size());
                } else {
                    failed++;
                    log.error("✗ Failed to apply model to image {}: {}", result.index(), result.error());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed = items.size() - processed;
            log.warn("Apply-to-others interrupted after {} images", processed);
        } finally {
            WorkerPoolFactory.shutdown(pool, teardownGrace);
            metrics.recordInferenceTime(System.currentTimeMillis() - start);
            metrics.incrementItemsCompleted(processed);
            metrics.incrementItemsFailed(failed);
        }

        log.info("Apply-to-others complete: {} succeeded, {} failed", processed, failed);
        return new InferenceSummary(processed, failed, requested.size());
    }

    private static ItemResult resultOf(Future<ItemResult> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // ItemExecutor does not throw; treat it as a failure of an unknown item
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return new ItemResult(false, -1, null, null, List.of(), null, cause.getMessage());
        }
    }
}
