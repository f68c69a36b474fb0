package com.colorcorrection.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Request to run the pipeline over several registered images.
 *
 * @param imageIndices indices into the session image list
 * @param maxWorkers   optional worker-count override, clamped by the worker policy
 * @param ffcSettings  optional per-request overrides merged onto the session settings
 */
@Builder
public record BatchRequest(
    @JsonProperty("image_indices") List<Integer> imageIndices,
    boolean ffcEnabled,
    boolean gcEnabled,
    boolean wbEnabled,
    boolean ccEnabled,
    String method,
    @JsonProperty("max_workers") Integer maxWorkers,
    Map<String, Object> ffcSettings,
    Map<String, Object> gcSettings,
    Map<String, Object> ccSettings
) {
    public BatchRequest {
        imageIndices = imageIndices == null ? List.of() : List.copyOf(imageIndices);
    }

    public Set<CorrectionStage> enabledStages() {
        return StageFlags.toSet(ffcEnabled, gcEnabled, wbEnabled, ccEnabled);
    }

    public Map<CorrectionStage, Map<String, Object>> settingOverrides() {
        return StageFlags.overrides(ffcSettings, gcSettings, ccSettings);
    }
}
