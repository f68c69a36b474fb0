package com.colorcorrection.pipeline;

import java.util.Map;

/**
 * @param metrics per-stage metrics, empty when diagnostics are suppressed
 * @param images  corrected images keyed by {@code STAGE} or {@code <name>_STAGE}
 * @param warning non-fatal message from the pipeline, may be null
 */
public record PipelineOutput(
    Map<String, Object> metrics,
    Map<String, ImageFrame> images,
    String warning
) {
    public PipelineOutput {
        metrics = metrics == null ? Map.of() : metrics;
        images = images == null ? Map.of() : images;
    }
}
