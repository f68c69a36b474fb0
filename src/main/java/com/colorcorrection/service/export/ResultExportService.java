package com.colorcorrection.service.export;

import com.colorcorrection.config.AppMetrics;
import com.colorcorrection.config.WorkerPoolFactory;
import com.colorcorrection.exception.BatchValidationException;
import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.ExportRequest;
import com.colorcorrection.model.ExportResult;
import com.colorcorrection.model.ItemResult;
import com.colorcorrection.pipeline.ImageCodec;
import com.colorcorrection.service.batch.WorkerPolicy;
import com.colorcorrection.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;

/**
 * Writes corrected images to disk as {@code <name>.jpg}, in parallel.
 */
@Service
@Slf4j
public class ResultExportService {

    private final SessionRegistry registry;
    private final ImageCodec codec;
    private final WorkerPolicy workerPolicy;
    private final WorkerPoolFactory workerPoolFactory;
    private final AppMetrics metrics;
    private final Path resultsFolder;

    public ResultExportService(
            SessionRegistry registry,
            ImageCodec codec,
            WorkerPolicy workerPolicy,
            WorkerPoolFactory workerPoolFactory,
            AppMetrics metrics,
            @Value("${app.workspace.results-folder:results}") String resultsFolder) {
        this.registry = registry;
        this.codec = codec;
        this.workerPolicy = workerPolicy;
        this.workerPoolFactory = workerPoolFactory;
        this.metrics = metrics;
        this.resultsFolder = Paths.get(resultsFolder);
    }

    /**
     * Saves images of the last single-image run whose name contains one of the
     * selected steps (and one of the selected names, if any are given).
     */
    public ExportResult saveImages(ExportRequest request) {
        Path directory = resolveDirectory(request.directory(), resultsFolder);
        List<CorrectedImage> corrected = registry.correctedImages();
        if (corrected.isEmpty()) {
            throw new BatchValidationException("No processed images available");
        }

        List<SaveTask> tasks = new ArrayList<>();
        for (CorrectedImage image : corrected) {
            if (matchesAny(image.name(), request.selectedSteps())
                    && (request.selectedImages().isEmpty() || matchesAny(image.name(), request.selectedImages()))) {
                addTask(tasks, image, directory);
            }
        }
        if (tasks.isEmpty()) {
            throw new BatchValidationException("No images to save with selected criteria");
        }
        return write(tasks, directory, 1);
    }

    /**
     * Saves the selected steps of batch and apply-to-others results,
     * optionally limited to some image indices.
     */
    public ExportResult saveBatchImages(ExportRequest request) {
        Path directory = resolveDirectory(request.directory(), resultsFolder);
        List<ItemResult> processed = registry.processedImages();
        if (processed.isEmpty()) {
            throw new BatchValidationException("No batch processed images available");
        }
        if (!request.imageIndices().isEmpty()) {
            processed = processed.stream()
                    .filter(result -> request.imageIndices().contains(result.index()))
                    .toList();
        }

        List<SaveTask> tasks = new ArrayList<>();
        for (ItemResult result : processed) {
            for (CorrectedImage image : result.correctedImages()) {
                if (matchesAny(image.name(), request.selectedSteps())) {
                    addTask(tasks, image, directory);
                }
            }
        }
        if (tasks.isEmpty()) {
            throw new BatchValidationException("No images to save with selected steps");
        }
        log.info("Preparing to save {} batch images to {}", processed.size(), directory);
        return write(tasks, directory, processed.size());
    }

    /**
     * Uses {@code directory} when given, else {@code fallback}, creating it if needed.
     *
     * @throws BatchValidationException if the directory cannot be created
     */
    static Path resolveDirectory(String directory, Path fallback) {
        Path target = directory == null || directory.isBlank()
                ? fallback
                : Paths.get(directory.strip()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(target);
            return target;
        } catch (IOException | SecurityException e) {
            throw new BatchValidationException("Cannot create directory: " + e.getMessage(), e);
        }
    }

    private ExportResult write(List<SaveTask> tasks, Path directory, int imageCount) {
        int workers = workerPolicy.computeIoWorkers(tasks.size());
        log.info("Saving {} images with {} parallel workers", tasks.size(), workers);

        long start = System.currentTimeMillis();
        List<Path> saved = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        ExecutorService pool = workerPoolFactory.newPool(workers, "cc-save-");
        try {
            CompletionService<SaveOutcome> completion = new ExecutorCompletionService<>(pool);
            tasks.forEach(task -> completion.submit(() -> save(task)));

            for (int i = 0; i < tasks.size(); i++) {
                SaveOutcome outcome = completion.take().get();
                if (outcome.error() == null) {
                    saved.add(outcome.task().path());
                    log.info("✓ Saved: {}", outcome.task().path());
                } else {
                    failed.add(outcome.task().name());
                    log.error("✗ Failed to save {}: {}", outcome.task().name(), outcome.error());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Export interrupted after {} files", saved.size());
        } catch (ExecutionException e) {
            // save() catches everything it can throw
            throw new IllegalStateException("Unexpected export failure", e.getCause());
        } finally {
            WorkerPoolFactory.shutdown(pool, Duration.ofSeconds(5));
            metrics.recordExportTime(System.currentTimeMillis() - start);
            metrics.incrementImagesExported(saved.size());
        }

        log.info("Save complete: {} succeeded, {} failed", saved.size(), failed.size());
        return new ExportResult(directory, saved, failed, imageCount);
    }

    private SaveOutcome save(SaveTask task) {
        try {
            Files.write(task.path(), codec.decode(task.data()));
            return new SaveOutcome(task, null);
        } catch (Exception e) {
            return new SaveOutcome(task, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private static void addTask(List<SaveTask> tasks, CorrectedImage image, Path directory) {
        if (image.data() != null && !image.data().isEmpty()) {
            tasks.add(new SaveTask(image.name(), image.data(), directory.resolve(image.name() + ".jpg")));
        }
    }

    private static boolean matchesAny(String name, List<String> needles) {
        return name != null && needles.stream().anyMatch(name::contains);
    }

    private record SaveTask(String name, String data, Path path) {}

    private record SaveOutcome(SaveTask task, String error) {}
}
