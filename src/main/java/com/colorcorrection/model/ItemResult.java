package com.colorcorrection.model;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of processing one item. Failures carry an error message instead of images.
 */
public record ItemResult(
    boolean success,
    int index,
    String filename,
    Path originalPath,
    List<CorrectedImage> correctedImages,
    String finalStage,
    String error
) {
    public ItemResult {
        correctedImages = correctedImages == null ? List.of() : List.copyOf(correctedImages);
    }

    public static ItemResult success(WorkItem item, List<CorrectedImage> images, String finalStage) {
        return new ItemResult(true, item.index(), item.filename(), item.sourcePath(), images, finalStage, null);
    }

    public static ItemResult failure(WorkItem item, String error) {
        return new ItemResult(false, item.index(), item.filename(), item.sourcePath(), List.of(), null, error);
    }
}
