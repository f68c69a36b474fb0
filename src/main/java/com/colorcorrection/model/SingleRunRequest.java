package com.colorcorrection.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Map;
import java.util.Set;

/**
 * Request to run the full pipeline on one image, optionally training the correction model.
 */
@Builder
public record SingleRunRequest(
    @JsonProperty("image_index") Integer imageIndex,
    boolean ffcEnabled,
    boolean gcEnabled,
    boolean wbEnabled,
    boolean ccEnabled,
    String method,
    Boolean computeDeltaE,
    boolean saveCcModel,
    Map<String, Object> ffcSettings,
    Map<String, Object> gcSettings,
    Map<String, Object> ccSettings
) {
    public Set<CorrectionStage> enabledStages() {
        return StageFlags.toSet(ffcEnabled, gcEnabled, wbEnabled, ccEnabled);
    }

    public Map<CorrectionStage, Map<String, Object>> settingOverrides() {
        return StageFlags.overrides(ffcSettings, gcSettings, ccSettings);
    }

    public boolean deltaERequested() {
        return computeDeltaE == null || computeDeltaE;
    }
}
