package com.colorcorrection.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Steps of the correction pipeline, declared in pipeline order.
 * The order matters: the last enabled stage produces the final image.
 */
public enum CorrectionStage {
    FFC("ffc"),   // flat-field correction
    GC("gc"),     // gamma correction
    WB("wb"),     // white balance
    CC("cc");     // color correction model

    private final String key;

    CorrectionStage(String key) {
        this.key = key;
    }

    /**
     * Settings key, e.g. {@code ffc}.
     */
    public String key() {
        return key;
    }

    /**
     * Output label used by the pipeline, e.g. {@code FFC}.
     */
    public String label() {
        return name();
    }

    public static Optional<CorrectionStage> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(stage -> stage.key.equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
