package com.colorcorrection.model;

/**
 * Snapshot of a single item's progress.
 */
public record ItemProgress(
    int imageIndex,
    String filename,
    ItemStatus status,
    String error
) {}
