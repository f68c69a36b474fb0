package com.colorcorrection.model;

import com.colorcorrection.pipeline.ImageFrame;

import java.nio.file.Path;

/**
 * Unit of work handed to a single worker. Immutable once dispatched.
 *
 * {@code whiteImage} is decoded once per batch and shared by every item;
 * workers only read it, and the batch closes it when it ends.
 */
public record WorkItem(
    int index,
    Path sourcePath,
    String filename,
    PipelineConfig config,
    ImageFrame whiteImage
) {}
