package com.colorcorrection.pipeline;

import com.colorcorrection.model.PipelineConfig;

/**
 * One instance of the external correction pipeline.
 *
 * Instances are stateful (they hold the models fitted by {@link #run}) and
 * not safe for concurrent use. Create one per item, or guard a shared
 * instance with a lock.
 */
public interface CorrectionPipeline {

    /**
     * Runs every enabled stage on {@code image}.
     *
     * @param image      source image
     * @param whiteImage optional white reference for flat-field correction
     * @param name       base name used to key the outputs
     * @param config     stage flags and settings
     */
    PipelineOutput run(ImageFrame image, ImageFrame whiteImage, String name, PipelineConfig config);

    /**
     * Models fitted by the last {@link #run}.
     */
    CorrectionModel model();
}
