package com.colorcorrection.model.settings;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common options of every pipeline stage.
 *
 * Keys the pipeline understands but this model does not name are kept in
 * {@link #getExtraOptions()} and written back out unchanged.
 */
@Getter
@Setter
@ToString
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public abstract class StageSettings {

    /** Generate plots/visualizations for this stage. */
    private boolean show = false;

    /** Compute the Delta E error metric for this stage. */
    @JsonProperty("get_deltaE")
    private boolean computeDeltaE = true;

    @Getter(lombok.AccessLevel.NONE)
    @Setter(lombok.AccessLevel.NONE)
    private final Map<String, Object> extraOptions = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtraOptions() {
        return extraOptions;
    }

    @JsonAnySetter
    public void putExtraOption(String key, Object value) {
        extraOptions.put(key, value);
    }

    /**
     * Turns off everything that is expensive and only useful interactively.
     */
    public void suppressDiagnostics() {
        show = false;
        computeDeltaE = false;
    }
}
