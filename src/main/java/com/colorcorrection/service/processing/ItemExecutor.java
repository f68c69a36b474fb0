package com.colorcorrection.service.processing;

import com.colorcorrection.config.AppMetrics;
import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.model.WorkItem;
import com.colorcorrection.pipeline.CorrectionModel;
import com.colorcorrection.pipeline.CorrectionPipeline;
import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.ImageCodec;
import com.colorcorrection.pipeline.ImageFrame;
import com.colorcorrection.pipeline.PipelineOutput;
import com.colorcorrection.session.SettingsMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Lock;

/**
 * Runs the pipeline for one item and turns every outcome into an
 * {@link ItemResult}. Nothing thrown by the codec or the pipeline escapes.
 *
 * The actual work runs on the attempt executor while the calling worker
 * waits with a deadline. When the deadline passes the attempt is cancelled
 * with an interrupt and the worker moves on; a pipeline that ignores
 * interrupts keeps running on its attempt thread until it returns, and its
 * result is discarded.
 */
@Component
@Slf4j
public class ItemExecutor {

    private final ImageCodec codec;
    private final CorrectionPipelineFactory pipelineFactory;
    private final SettingsMapper settingsMapper;
    private final AppMetrics metrics;
    private final ExecutorService attemptExecutor;

    public ItemExecutor(
            ImageCodec codec,
            CorrectionPipelineFactory pipelineFactory,
            SettingsMapper settingsMapper,
            AppMetrics metrics,
            @Qualifier("itemAttemptExecutor") ExecutorService attemptExecutor) {
        this.codec = codec;
        this.pipelineFactory = pipelineFactory;
        this.settingsMapper = settingsMapper;
        this.metrics = metrics;
        this.attemptExecutor = attemptExecutor;
    }

    /**
     * Runs a fresh pipeline on one image with plots and Delta E turned off.
     */
    public ItemResult execute(WorkItem item, Duration timeout) {
        return runWithDeadline(item, timeout, () -> runPipeline(item));
    }

    /**
     * Applies an already trained model to one image. Only the model call
     * holds {@code modelLock}; loading and encoding run unlocked.
     */
    public ItemResult executeInference(WorkItem item, CorrectionModel model, Lock modelLock, Duration timeout) {
        return runWithDeadline(item, timeout, () -> runInference(item, model, modelLock));
    }

    public static String timeoutReason(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0
                ? "Processing timeout after " + (millis / 1000) + "s"
                : "Processing timeout after " + millis + "ms";
    }

    private ItemResult runWithDeadline(WorkItem item, Duration timeout, Callable<ItemResult> attempt) {
        long start = System.currentTimeMillis();
        Future<ItemResult> future;
        try {
            future = attemptExecutor.submit(attempt);
        } catch (RejectedExecutionException e) {
            log.warn("Attempt executor rejected image {}: {}", item.filename(), e.getMessage());
            return ItemResult.failure(item, "Processing rejected: " + e.getMessage());
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.incrementItemTimeouts();
            String reason = timeoutReason(timeout);
            log.error("✗ Image {} ({}): {}", item.index() + 1, item.filename(), reason);
            return ItemResult.failure(item, reason);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.warn("Worker interrupted while waiting for image {}", item.filename());
            return ItemResult.failure(item, "Processing interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("✗ Unexpected failure on image {}: {}", item.filename(), cause.getMessage(), cause);
            return ItemResult.failure(item, "Error processing " + item.filename() + ": " + cause.getMessage());
        } finally {
            metrics.recordItemTime(System.currentTimeMillis() - start);
        }
    }

    private ItemResult runPipeline(WorkItem item) {
        String thread = Thread.currentThread().getName();
        String name = StageOutputs.baseName(item.filename());
        log.info("[{}] Processing image {}: {}", thread, item.index() + 1, item.filename());

        try (ImageFrame image = codec.read(item.sourcePath())) {

            PipelineOutput output;
            try {
                CorrectionPipeline pipeline = pipelineFactory.create();
                output = pipeline.run(image, item.whiteImage(), name, settingsMapper.suppressDiagnostics(item.config()));
            } catch (Exception e) {
                log.error("[{}] Pipeline failed for {}: {}", thread, item.filename(), e.getMessage());
                return ItemResult.failure(item, "Pipeline error: " + e.getMessage());
            }

            try {
                if (output.warning() != null) {
                    log.warn("[{}] Warning for {}: {}", thread, item.filename(), output.warning());
                }
                List<CorrectedImage> encoded = StageOutputs.encodeAll(output.images(), name, codec);
                String finalStage = StageOutputs.selectFinal(output.images().keySet());
                log.info("[{}] Completed image {}: {} - Generated {} results",
                        thread, item.index() + 1, item.filename(), encoded.size());
                return ItemResult.success(item, encoded, finalStage);
            } finally {
                StageOutputs.closeAll(output.images());
            }
        } catch (IOException e) {
            log.error("[{}] {}", thread, e.getMessage());
            return ItemResult.failure(item, e.getMessage());
        } catch (Exception e) {
            log.error("[{}] Error processing {}: {}", thread, item.filename(), e.getMessage(), e);
            return ItemResult.failure(item, "Error processing " + item.filename() + ": " + e.getMessage());
        }
    }

    private ItemResult runInference(WorkItem item, CorrectionModel model, Lock modelLock) {
        String name = StageOutputs.baseName(item.filename());
        log.info("[Worker] Starting image {}: {}", item.index() + 1, item.filename());

        try (ImageFrame image = codec.read(item.sourcePath())) {
            Map<String, ImageFrame> predicted;
            modelLock.lockInterruptibly();
            try {
                predicted = model.predictImage(image);
            } finally {
                modelLock.unlock();
            }
            if (predicted == null) {
                predicted = Map.of();
            }

            try {
                List<CorrectedImage> encoded = StageOutputs.encodeStages(predicted, name, codec);
                if (encoded.isEmpty()) {
                    return ItemResult.failure(item, "No corrected images produced by model");
                }
                return ItemResult.success(item, encoded, StageOutputs.selectFinal(predicted.keySet()));
            } finally {
                StageOutputs.closeAll(predicted);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ItemResult.failure(item, "Processing interrupted");
        } catch (IOException e) {
            log.error("Error applying model to image {}: {}", item.index(), e.getMessage());
            return ItemResult.failure(item, e.getMessage());
        } catch (Exception e) {
            log.error("Error applying model to image {}: {}", item.index(), e.getMessage(), e);
            return ItemResult.failure(item, "Error processing " + item.filename() + ": " + e.getMessage());
        }
    }
}
