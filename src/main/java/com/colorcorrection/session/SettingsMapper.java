package com.colorcorrection.session;

import com.colorcorrection.exception.BatchValidationException;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.model.PipelineConfig;
import com.colorcorrection.model.settings.ColorCorrectionSettings;
import com.colorcorrection.model.settings.FlatFieldSettings;
import com.colorcorrection.model.settings.GammaSettings;
import com.colorcorrection.model.settings.StageSettings;
import com.colorcorrection.model.settings.WhiteBalanceSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Copies and merges stage settings through Jackson, so the JSON names used
 * by clients are also the names accepted in partial updates.
 */
@Component
public class SettingsMapper {

    private final ObjectMapper objectMapper;

    public SettingsMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static StageSettings defaultsFor(CorrectionStage stage) {
        return switch (stage) {
            case FFC -> new FlatFieldSettings();
            case GC -> new GammaSettings();
            case WB -> new WhiteBalanceSettings();
            case CC -> new ColorCorrectionSettings();
        };
    }

    /**
     * Deep copy, including extra options.
     */
    @SuppressWarnings("unchecked")
    public <T extends StageSettings> T copy(T settings) {
        return (T) objectMapper.convertValue(settings, settings.getClass());
    }

    /**
     * Returns a copy of {@code base} with the given keys overwritten. Keys
     * that are not named fields are kept as extra options.
     *
     * @throws BatchValidationException if a value has the wrong type
     */
    public <T extends StageSettings> T merge(T base, Map<String, Object> updates) {
        T copy = copy(base);
        if (updates == null || updates.isEmpty()) {
            return copy;
        }
        try {
            return objectMapper.updateValue(copy, updates);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new BatchValidationException("Invalid settings: " + e.getMessage(), e);
        }
    }

    public Map<String, Object> toMap(StageSettings settings) {
        return objectMapper.convertValue(settings, objectMapper.getTypeFactory()
                .constructMapType(Map.class, String.class, Object.class));
    }

    /**
     * Copy of {@code config} with plots and Delta E turned off on every stage.
     * The original config is left untouched.
     */
    public PipelineConfig suppressDiagnostics(PipelineConfig config) {
        Map<CorrectionStage, StageSettings> quiet = new EnumMap<>(CorrectionStage.class);
        config.stageSettings().forEach((stage, settings) -> {
            StageSettings copy = copy(settings);
            copy.suppressDiagnostics();
            quiet.put(stage, copy);
        });
        return new PipelineConfig(config.enabledStages(), config.method(), quiet);
    }
}
