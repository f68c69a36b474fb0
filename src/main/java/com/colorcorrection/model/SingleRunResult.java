package com.colorcorrection.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public record SingleRunResult(
    String filename,
    List<CorrectedImage> correctedImages,
    String finalStage,
    Map<String, Object> metrics,
    String warning,
    boolean modelStored,
    Path savedModelPath
) {}
