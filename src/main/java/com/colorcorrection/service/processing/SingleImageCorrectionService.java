package com.colorcorrection.service.processing;

import com.colorcorrection.exception.BatchValidationException;
import com.colorcorrection.exception.ImageProcessingException;
import com.colorcorrection.exception.PipelineUnavailableException;
import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.CorrectionMethod;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.ImageDescriptor;
import com.colorcorrection.model.PipelineConfig;
import com.colorcorrection.model.SingleRunRequest;
import com.colorcorrection.model.SingleRunResult;
import com.colorcorrection.pipeline.CorrectionModel;
import com.colorcorrection.pipeline.CorrectionPipeline;
import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.ImageCodec;
import com.colorcorrection.pipeline.ImageFrame;
import com.colorcorrection.pipeline.PipelineOutput;
import com.colorcorrection.service.export.ModelExportService;
import com.colorcorrection.session.ImageRegistrationService;
import com.colorcorrection.session.PipelineConfigFactory;
import com.colorcorrection.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interactive run on one image. Unlike batch items, diagnostics follow the
 * caller's choice, and the trained model is kept for apply-to-others.
 */
@Service
@Slf4j
public class SingleImageCorrectionService {

    private final SessionRegistry registry;
    private final ImageRegistrationService imageService;
    private final PipelineConfigFactory configFactory;
    private final CorrectionPipelineFactory pipelineFactory;
    private final ImageCodec codec;
    private final ModelExportService modelExportService;

    public SingleImageCorrectionService(
            SessionRegistry registry,
            ImageRegistrationService imageService,
            PipelineConfigFactory configFactory,
            CorrectionPipelineFactory pipelineFactory,
            ImageCodec codec,
            ModelExportService modelExportService) {
        this.registry = registry;
        this.imageService = imageService;
        this.configFactory = configFactory;
        this.pipelineFactory = pipelineFactory;
        this.codec = codec;
        this.modelExportService = modelExportService;
    }

    public SingleRunResult run(SingleRunRequest request) {
        if (!pipelineFactory.isAvailable()) {
            throw new PipelineUnavailableException("Color correction pipeline not available");
        }
        if (request.imageIndex() == null) {
            throw new BatchValidationException("image_index is required");
        }
        List<ImageDescriptor> images = registry.images();
        if (images.isEmpty()) {
            throw new BatchValidationException("No images uploaded");
        }
        int index = request.imageIndex();
        if (index < 0 || index >= images.size()) {
            throw new BatchValidationException(
                    "Image index " + index + " out of range [0, " + (images.size() - 1) + "]");
        }
        String methodKey = request.method() == null ? CorrectionMethod.DEFAULT.key() : request.method();
        CorrectionMethod method = CorrectionMethod.fromKey(methodKey)
                .orElseThrow(() -> new BatchValidationException(
                        "Invalid method '" + methodKey + "'. Must be one of: " + CorrectionMethod.validKeys()));

        PipelineConfig config = configFactory.create(request.enabledStages(), method, request.settingOverrides());
        boolean deltaE = request.deltaERequested();
        config.stageSettings().forEach((stage, settings) ->
                settings.setComputeDeltaE(deltaE && config.isEnabled(stage)));
        log.info("Delta E computation {}", deltaE ? "ENABLED" : "DISABLED by user preference");

        ImageDescriptor image = images.get(index);
        String name = StageOutputs.baseName(image.filename());
        log.info("Processing single image: {} (stages={}, method={})", image.filename(), config.enabledStages(), method.key());

        CorrectionPipeline pipeline = pipelineFactory.create();
        PipelineOutput output;
        try (ImageFrame frame = codec.read(image.path());
             ImageFrame white = config.isEnabled(CorrectionStage.FFC) ? imageService.loadWhiteReference() : null) {
            output = pipeline.run(frame, white, name, config);
        } catch (IOException e) {
            throw new ImageProcessingException(e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ImageProcessingException("Pipeline error: " + e.getMessage(), e);
        }

        List<CorrectedImage> encoded;
        try {
            if (output.warning() != null) {
                log.warn("Pipeline warning: {}", output.warning());
            }
            encoded = StageOutputs.encodeAll(output.images(), name, codec);
        } finally {
            StageOutputs.closeAll(output.images());
        }
        registry.setCorrectedImages(encoded);

        boolean modelStored = false;
        Path savedModelPath = null;
        CorrectionModel model = pipeline.model();
        if (config.isEnabled(CorrectionStage.CC) && model != null && model.hasTrainedModel()) {
            registry.setModelHandle(model);
            modelStored = true;
            log.info("✓ Stored trained model from {} for apply-to-others", image.filename());
            if (request.saveCcModel()) {
                savedModelPath = modelExportService.autoSave(model, name).orElse(null);
            }
        }

        return new SingleRunResult(
                image.filename(),
                encoded,
                StageOutputs.selectFinal(output.images().keySet()),
                output.metrics(),
                output.warning(),
                modelStored,
                savedModelPath);
    }
}
