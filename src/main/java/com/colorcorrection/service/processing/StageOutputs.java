package com.colorcorrection.service.processing;

import com.colorcorrection.model.CorrectedImage;
import com.colorcorrection.model.CorrectionStage;
import com.colorcorrection.pipeline.ImageCodec;
import com.colorcorrection.pipeline.ImageFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the image maps returned by the pipeline and by the model.
 * Keys are a stage label ({@code CC}) or a name plus stage label
 * ({@code sample_CC}).
 */
@Slf4j
public final class StageOutputs {

    private StageOutputs() {}

    /**
     * Label of the last pipeline stage present in {@code keys}, or null if none is.
     */
    public static String selectFinal(Collection<String> keys) {
        String last = null;
        for (CorrectionStage stage : CorrectionStage.values()) {
            if (keys.stream().anyMatch(key -> matches(key, stage))) {
                last = stage.label();
            }
        }
        return last;
    }

    static boolean matches(String key, CorrectionStage stage) {
        return key != null && (key.equals(stage.label()) || key.endsWith("_" + stage.label()));
    }

    /**
     * File name without extension, used to name the outputs.
     */
    public static String baseName(String filename) {
        if (filename == null) return "image";
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        String name = filename.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * Encodes every image of a pipeline run as {@code <baseName>_<key>}.
     * An image that fails to encode is logged and left out.
     */
    public static List<CorrectedImage> encodeAll(Map<String, ImageFrame> images, String baseName, ImageCodec codec) {
        List<CorrectedImage> encoded = new ArrayList<>();
        images.forEach((key, frame) -> {
            if (frame != null) {
                encodeInto(encoded, baseName + "_" + key, frame, codec);
            }
        });
        return encoded;
    }

    /**
     * Encodes only the known stage outputs, in pipeline order.
     */
    public static List<CorrectedImage> encodeStages(Map<String, ImageFrame> images, String baseName, ImageCodec codec) {
        List<CorrectedImage> encoded = new ArrayList<>();
        for (CorrectionStage stage : CorrectionStage.values()) {
            ImageFrame frame = images.get(stage.label());
            if (frame != null) {
                encodeInto(encoded, baseName + "_" + stage.label(), frame, codec);
            }
        }
        return encoded;
    }

    public static void closeAll(Map<String, ImageFrame> images) {
        images.values().forEach(frame -> {
            if (frame != null) frame.close();
        });
    }

    private static void encodeInto(List<CorrectedImage> target, String name, ImageFrame frame, ImageCodec codec) {
        try {
            target.add(new CorrectedImage(name, codec.encode(frame)));
        } catch (Exception e) {
            log.warn("Failed to encode {}: {}", name, e.getMessage());
        }
    }
}
