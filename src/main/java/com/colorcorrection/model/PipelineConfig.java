package com.colorcorrection.model;

import com.colorcorrection.model.settings.StageSettings;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Configuration handed to the correction pipeline: which stages run, the
 * fitting method, and the settings record of every stage.
 */
public record PipelineConfig(
    Set<CorrectionStage> enabledStages,
    CorrectionMethod method,
    Map<CorrectionStage, StageSettings> stageSettings
) {
    public PipelineConfig {
        enabledStages = enabledStages.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(CorrectionStage.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(enabledStages));
        EnumMap<CorrectionStage, StageSettings> copy = new EnumMap<>(CorrectionStage.class);
        copy.putAll(stageSettings);
        stageSettings = Collections.unmodifiableMap(copy);
    }

    public boolean isEnabled(CorrectionStage stage) {
        return enabledStages.contains(stage);
    }

    public <T extends StageSettings> T settings(CorrectionStage stage, Class<T> type) {
        return type.cast(stageSettings.get(stage));
    }
}
