package com.colorcorrection.session;

import com.colorcorrection.model.CorrectionMethod;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.PipelineConfig;
import com.colorcorrection.model.settings.ColorCorrectionSettings;
import com.colorcorrection.model.settings.StageSettings;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds the config of one run from the session settings. Request overrides
 * are merged onto copies, so they never leak back into the session.
 */
@Component
public class PipelineConfigFactory {

    private final SessionRegistry registry;
    private final SettingsMapper settingsMapper;

    public PipelineConfigFactory(SessionRegistry registry, SettingsMapper settingsMapper) {
        this.registry = registry;
        this.settingsMapper = settingsMapper;
    }

    public PipelineConfig create(Set<CorrectionStage> enabledStages,
                                 CorrectionMethod method,
                                 Map<CorrectionStage, Map<String, Object>> overrides) {
        Map<CorrectionStage, StageSettings> stageSettings = new EnumMap<>(CorrectionStage.class);
        for (CorrectionStage stage : CorrectionStage.values()) {
            StageSettings settings = registry.settings(stage);
            Map<String, Object> override = overrides.get(stage);
            if (override != null) {
                settings = settingsMapper.merge(settings, override);
            }
            stageSettings.put(stage, settings);
        }
        ((ColorCorrectionSettings) stageSettings.get(CorrectionStage.CC)).setMtd(method.key());
        return new PipelineConfig(enabledStages, method, stageSettings);
    }
}
