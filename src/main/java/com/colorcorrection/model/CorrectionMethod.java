package com.colorcorrection.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fitting method for the color correction stage.
 */
public enum CorrectionMethod {
    PLS("pls"),
    NN("nn"),
    LINEAR("linear"),
    SVM("svm"),
    CONVENTIONAL("conventional");

    public static final CorrectionMethod DEFAULT = PLS;

    private final String key;

    CorrectionMethod(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<CorrectionMethod> fromKey(String key) {
        if (key == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(method -> method.key.equals(key))
                .findFirst();
    }

    public static String validKeys() {
        return Arrays.stream(values()).map(CorrectionMethod::key).collect(Collectors.joining(", ", "[", "]"));
    }
}
