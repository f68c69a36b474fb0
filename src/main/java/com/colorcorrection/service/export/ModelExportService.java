package com.colorcorrection.service.export;

import com.colorcorrection.config.AppMetrics;
import com.colorcorrection.exception.BatchValidationException;
import com.colorcorrection.exception.PipelineUnavailableException;
import com.colorcorrection.model.ModelExportRequest;
import com.colorcorrection.model.ModelExportResult;
import com.colorcorrection.pipeline.CorrectionModel;
import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Persists the trained model of the last single-image run as
 * {@code <name>.pkl}, either on request or automatically after the run.
 */
@Service
@Slf4j
public class ModelExportService {

    static final String EXTENSION = ".pkl";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final SessionRegistry registry;
    private final CorrectionPipelineFactory pipelineFactory;
    private final AppMetrics metrics;
    private final Path modelsFolder;

    public ModelExportService(
            SessionRegistry registry,
            CorrectionPipelineFactory pipelineFactory,
            AppMetrics metrics,
            @Value("${app.workspace.models-folder:models}") String modelsFolder) {
        this.registry = registry;
        this.pipelineFactory = pipelineFactory;
        this.metrics = metrics;
        this.modelsFolder = Paths.get(modelsFolder);
    }

    /**
     * Saves the stored model. An existing file of the same name is never
     * overwritten; the name gets a seconds timestamp suffix instead.
     *
     * @throws PipelineUnavailableException if the correction library is missing
     * @throws BatchValidationException     if no model is stored or the folder is unusable
     */
    public ModelExportResult saveModel(ModelExportRequest request) {
        if (!pipelineFactory.isAvailable()) {
            throw new PipelineUnavailableException("Color correction pipeline not available");
        }
        CorrectionModel model = registry.modelHandle()
                .orElseThrow(() -> new BatchValidationException(
                        "No trained model available. Please run color correction first."));

        String name = sanitizeName(request.name());
        if (name.isEmpty()) {
            name = defaultName();
        }

        Path directory;
        try {
            directory = ResultExportService.resolveDirectory(request.folder(), modelsFolder);
        } catch (BatchValidationException e) {
            throw new BatchValidationException("Invalid save directory: " + e.getMessage(), e);
        }
        log.info("Saving model to directory: {}", directory);

        Path path = directory.resolve(name + EXTENSION);
        if (Files.exists(path)) {
            log.warn("Model file already exists: {}", path);
            name = name + "_" + (System.currentTimeMillis() / 1000);
            path = directory.resolve(name + EXTENSION);
        }

        try {
            model.saveModel(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save model: " + e.getMessage(), e);
        }
        metrics.incrementModelsSaved();
        log.info("✓ Saved model to: {}", path);
        return new ModelExportResult(name, path, directory);
    }

    /**
     * Saves {@code model} to the models folder as {@code model_<image>_<timestamp>}.
     * Failures are logged and reported as empty.
     */
    public Optional<Path> autoSave(CorrectionModel model, String imageName) {
        try {
            Files.createDirectories(modelsFolder);
            Path path = modelsFolder.resolve("model_" + sanitizeName(imageName) + "_"
                    + STAMP.format(LocalDateTime.now()) + EXTENSION);
            model.saveModel(path);
            metrics.incrementModelsSaved();
            log.info("✓ Auto-saved model: {}", path);
            return Optional.of(path);
        } catch (IOException | RuntimeException e) {
            log.warn("⚠ Failed to auto-save model: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Keeps letters, digits, {@code _} and {@code -}.
     */
    static String sanitizeName(String name) {
        if (name == null) {
            return "";
        }
        StringBuilder clean = new StringBuilder();
        name.codePoints()
                .filter(c -> Character.isLetterOrDigit(c) || c == '_' || c == '-')
                .forEach(clean::appendCodePoint);
        return clean.toString();
    }

    private static String defaultName() {
        return "model_" + STAMP.format(LocalDateTime.now());
    }
}
