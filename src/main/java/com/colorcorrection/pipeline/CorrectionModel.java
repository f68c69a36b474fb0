package com.colorcorrection.pipeline;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Trained correction models that can be applied to new images without
 * refitting. Not thread-safe.
 */
public interface CorrectionModel {

    boolean hasTrainedModel();

    /**
     * Applies every trained stage.
     *
     * @return corrected images keyed by stage label ({@code FFC}, {@code GC}, {@code WB}, {@code CC})
     */
    Map<String, ImageFrame> predictImage(ImageFrame image);

    /**
     * Writes the trained stages to {@code path} in the pipeline's own format.
     */
    void saveModel(Path path) throws IOException;
}
