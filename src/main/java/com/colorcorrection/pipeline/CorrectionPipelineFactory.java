package com.colorcorrection.pipeline;

/**
 * Entry point to the external correction library.
 */
public interface CorrectionPipelineFactory {

    /**
     * Whether the correction library is installed and usable.
     */
    boolean isAvailable();

    /**
     * Creates a fresh, independent pipeline instance.
     */
    CorrectionPipeline create();
}
