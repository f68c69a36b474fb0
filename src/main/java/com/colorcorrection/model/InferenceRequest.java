package com.colorcorrection.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request to apply the trained model to other registered images.
 */
public record InferenceRequest(
    @JsonProperty("image_indices") List<Integer> imageIndices,
    @JsonProperty("max_workers") Integer maxWorkers
) {
    public InferenceRequest {
        imageIndices = imageIndices == null ? List.of() : List.copyOf(imageIndices);
    }
}
