package com.colorcorrection.service;

import com.colorcorrection.config.AppMetrics;
import com.colorcorrection.config.TraceContextManager;
import com.colorcorrection.config.WorkerPoolFactory;
import com.colorcorrection.exception.AdmissionConflictException;
import com.colorcorrection.exception.BatchValidationException;
import com.colorcorrection.exception.PipelineUnavailableException;
import com.colorcorrection.model.BatchRequest;
import com.colorcorrection.model.BatchStatus;
import com.colorcorrection.model.BatchSubmission;
import com.colorcorrection.model.CorrectionMethod;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.model.ItemStatus;
import com.colorcorrection.model.PipelineConfig;
import com.colorcorrection.model.WorkItem;
import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.GpuProbe;
import com.colorcorrection.pipeline.ImageFrame;
import com.colorcorrection.service.batch.BatchState;
import com.colorcorrection.service.batch.WorkerPolicy;
import com.colorcorrection.service.processing.ItemExecutor;
import com.colorcorrection.session.ImageRegistrationService;
import com.colorcorrection.session.PipelineConfigFactory;
import com.colorcorrection.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Admits, runs and tracks parallel batches.
 *
 * {@link #submit} validates the request, reserves the single batch slot in
 * {@link BatchState} and hands the batch to the launcher thread, returning
 * at once. The launcher fans items out to a pool sized by
 * {@link WorkerPolicy} and records each result as it completes. Clients
 * follow along with {@link #getProgress()}.
 */
@Service
@Slf4j
public class BatchOrchestrator {

    private final BatchState batchState;
    private final SessionRegistry registry;
    private final ImageRegistrationService imageService;
    private final PipelineConfigFactory configFactory;
    private final WorkerPolicy workerPolicy;
    private final GpuProbe gpuProbe;
    private final ItemExecutor itemExecutor;
    private final WorkerPoolFactory workerPoolFactory;
    private final CorrectionPipelineFactory pipelineFactory;
    private final AppMetrics metrics;
    private final ExecutorService launcher;
    private final Duration itemTimeout;
    private final Duration teardownGrace;

    @Autowired
    public BatchOrchestrator(
            BatchState batchState,
            SessionRegistry registry,
            ImageRegistrationService imageService,
            PipelineConfigFactory configFactory,
            WorkerPolicy workerPolicy,
            GpuProbe gpuProbe,
            ItemExecutor itemExecutor,
            WorkerPoolFactory workerPoolFactory,
            CorrectionPipelineFactory pipelineFactory,
            AppMetrics metrics,
            @Qualifier("batchLauncherExecutor") ExecutorService launcher,
            @Value("${app.batch.item-timeout-seconds:300}") long itemTimeoutSeconds,
            @Value("${app.batch.teardown-grace-seconds:5}") long teardownGraceSeconds) {
        this(batchState, registry, imageService, configFactory, workerPolicy, gpuProbe, itemExecutor, workerPoolFactory,
                pipelineFactory, metrics, launcher,
                Duration.ofSeconds(itemTimeoutSeconds), Duration.ofSeconds(teardownGraceSeconds));
    }

    BatchOrchestrator(
            BatchState batchState,
            SessionRegistry registry,
            ImageRegistrationService imageService,
            PipelineConfigFactory configFactory,
            WorkerPolicy workerPolicy,
            GpuProbe gpuProbe,
            ItemExecutor itemExecutor,
            WorkerPoolFactory workerPoolFactory,
            CorrectionPipelineFactory pipelineFactory,
            AppMetrics metrics,
            ExecutorService launcher,
            Duration itemTimeout,
            Duration teardownGrace) {
        this.batchState = batchState;
        this.registry = registry;
        this.imageService = imageService;
        this.configFactory = configFactory;
        this.workerPolicy = workerPolicy;
        this.gpuProbe = gpuProbe;
        this.itemExecutor = itemExecutor;
        this.workerPoolFactory = workerPoolFactory;
        this.pipelineFactory = pipelineFactory;
        this.metrics = metrics;
        this.launcher = launcher;
        this.itemTimeout = itemTimeout;
        this.teardownGrace = teardownGrace;
    }

    /**
     * Admits a batch and starts it in the background.
     *
     * @throws PipelineUnavailableException if the correction library is missing
     * @throws AdmissionConflictException   if another batch is active
     * @throws BatchValidationException     if nothing valid is left to process
     */
    public BatchSubmission submit(BatchRequest request) {
        if (!pipelineFactory.isAvailable()) {
            throw new PipelineUnavailableException("Color correction pipeline not available");
        }
        if (batchState.isActive()) {
            metrics.incrementBatchRejected();
            throw new AdmissionConflictException(batchState.batchId());
        }

        List<ImageDescriptor> images = registry.images();
        if (images.isEmpty()) {
            throw new BatchValidationException("No images loaded");
        }
        String methodKey = request.method() == null ? CorrectionMethod.DEFAULT.key() : request.method();
        CorrectionMethod method = CorrectionMethod.fromKey(methodKey)
                .orElseThrow(() -> new BatchValidationException(
                        "Invalid method '" + methodKey + "'. Must be one of: " + CorrectionMethod.validKeys()));

        Set<Integer> validIndices = new LinkedHashSet<>();
        for (Integer index : request.imageIndices()) {
            if (index != null && index >= 0 && index < images.size()) {
                if (!validIndices.add(index)) {
                    log.warn("Duplicate image index {} ignored", index);
                }
            } else {
                log.warn("Invalid image index {} ignored", index);
            }
        }
        if (validIndices.isEmpty()) {
            throw new BatchValidationException("No valid images to process");
        }

        PipelineConfig config = configFactory.create(request.enabledStages(), method, request.settingOverrides());

        List<Integer> indices = new ArrayList<>(validIndices);
        List<String> filenames = new ArrayList<>();
        for (int index : indices) {
            filenames.add(images.get(index).filename());
        }

        boolean hasGpu = gpuProbe.isGpuAvailable();
        int workers = workerPolicy.computeWorkers(indices.size(), hasGpu, request.maxWorkers());
        String batchId = newBatchId();

        try {
            batchState.reset(batchId, indices, filenames);
        } catch (AdmissionConflictException e) {
            metrics.incrementBatchRejected();
            throw e;
        }
        registry.setBatchMode(true);
        metrics.incrementBatchSubmitted();

        ImageFrame whiteImage = config.isEnabled(CorrectionStage.FFC) ? imageService.loadWhiteReference() : null;
        List<WorkItem> items = new ArrayList<>();
        for (int index : indices) {
            ImageDescriptor image = images.get(index);
            items.add(new WorkItem(index, image.path(), image.filename(), config, whiteImage));
        }

        try {
            launcher.execute(() -> runBatch(batchId, items, whiteImage, workers, hasGpu));
        } catch (RejectedExecutionException e) {
            if (whiteImage != null) {
                whiteImage.close();
            }
            batchState.failPending("Batch could not be scheduled");
            registry.setBatchMode(false);
            batchState.markComplete();
            throw new IllegalStateException("Batch executor is not accepting work", e);
        }

        log.info("Batch {} admitted: {} images, {} workers (GPU: {})", batchId, items.size(), workers, hasGpu);
        return new BatchSubmission(batchId, items.size(), workers, hasGpu);
    }

    public BatchStatus getProgress() {
        return batchState.getStatus();
    }

    void runBatch(String batchId, List<WorkItem> items, ImageFrame whiteImage, int workers, boolean hasGpu) {
        TraceContextManager.enterBatch(batchId);
        long startTime = System.currentTimeMillis();

        log.info("═══════════════════════════════════════════════════════════════");
        log.info("BATCH START: {} | {} images | {} workers | GPU: {}", batchId, items.size(), workers, hasGpu);
        log.info("   Item timeout: {}s", itemTimeout.toSeconds());
        log.info("═══════════════════════════════════════════════════════════════");

        ExecutorService pool = null;
        try {
            pool = workerPoolFactory.newPool(workers, "cc-worker-");
            CompletionService<ItemResult> completion = new ExecutorCompletionService<>(pool);
            Map<Future<ItemResult>, WorkItem> pending = new HashMap<>();
            for (WorkItem item : items) {
                batchState.updateStatus(item.index(), ItemStatus.QUEUED);
                pending.put(completion.submit(() -> itemExecutor.execute(item, itemTimeout)), item);
            }

            long bound = itemTimeout.plus(teardownGrace).toMillis();
            for (int resolved = 0; resolved < items.size(); resolved++) {
                Future<ItemResult> future = completion.poll(bound, TimeUnit.MILLISECONDS);
                if (future == null) {
                    int stalled = batchState.failPending(ItemExecutor.timeoutReason(itemTimeout));
                    log.error("✗ No item finished within {}ms, failed {} remaining item(s)", bound, stalled);
                    break;
                }
                record(pending.get(future), future);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            int stalled = batchState.failPending("Batch interrupted");
            log.warn("Batch {} interrupted, failed {} remaining item(s)", batchId, stalled);
        } catch (Exception e) {
            log.error("Batch {} orchestration failed: {}", batchId, e.getMessage(), e);
            batchState.failPending("Batch orchestration failed: " + e.getMessage());
        } finally {
            if (pool != null && !WorkerPoolFactory.shutdown(pool, teardownGrace)) {
                log.warn("Worker pool of batch {} did not stop within {}s", batchId, teardownGrace.toSeconds());
            }
            if (whiteImage != null) {
                whiteImage.close();
            }
            BatchStatus status = batchState.getStatus();
            registry.setBatchMode(false);
            batchState.markComplete();

            long totalTime = System.currentTimeMillis() - startTime;
            metrics.recordBatchTime(totalTime);
            metrics.incrementItemsCompleted(status.completed());
            metrics.incrementItemsFailed(status.failed());

            log.info("═══════════════════════════════════════════════════════════════");
            log.info("BATCH COMPLETE: {} | Total: {}ms", batchId, totalTime);
            log.info("  Completed: {} | Failed: {} | Total: {}", status.completed(), status.failed(), status.total());
            log.info("═══════════════════════════════════════════════════════════════");
            TraceContextManager.exitBatch();
        }
    }

    private void record(WorkItem item, Future<ItemResult> future) throws InterruptedException {
        ItemResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("✗ Worker failed on image {}: {}", item.filename(), cause.getMessage(), cause);
            result = ItemResult.failure(item, cause.getMessage());
        }

        batchState.completeItem(result);
        if (result.success()) {
            registry.addProcessedImage(result);
            log.info("✓ Completed image {}: {}", item.index() + 1, item.filename());
        } else {
            log.error("✗ Failed image {}: {}", item.index() + 1, result.error());
        }
    }

    static String newBatchId() {
        return "batch_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
