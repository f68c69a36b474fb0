package com.colorcorrection.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * @param directory      target directory, blank for the configured results folder
 * @param selectedSteps  stage labels to keep, e.g. {@code CC}
 * @param selectedImages optional name filters for single-run images
 * @param imageIndices   optional image indices for batch results, empty for all
 */
public record ExportRequest(
    String directory,
    @JsonProperty("selected_steps") List<String> selectedSteps,
    @JsonProperty("selected_images") List<String> selectedImages,
    @JsonProperty("image_indices") List<Integer> imageIndices
) {
    public ExportRequest {
        selectedSteps = selectedSteps == null || selectedSteps.isEmpty() ? List.of("CC") : List.copyOf(selectedSteps);
        selectedImages = selectedImages == null ? List.of() : List.copyOf(selectedImages);
        imageIndices = imageIndices == null ? List.of() : List.copyOf(imageIndices);
    }
}
