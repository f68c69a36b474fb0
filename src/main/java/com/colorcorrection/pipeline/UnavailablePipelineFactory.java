package com.colorcorrection.pipeline;

import com.colorcorrection.exception.PipelineUnavailableException;

/**
 * Used when no correction library is on the classpath. Every run is rejected.
 */
public class UnavailablePipelineFactory implements CorrectionPipelineFactory {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public CorrectionPipeline create() {
        throw new PipelineUnavailableException("Color correction pipeline not available");
    }
}
