package com.colorcorrection.model;

/**
 * One encoded pipeline output, named {@code <image>_<STAGE>}.
 */
public record CorrectedImage(
    String name,
    String data
) {}
