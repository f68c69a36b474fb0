package com.colorcorrection.model;

/**
 * Result of applying a trained model to other images.
 */
public record InferenceSummary(
    int processed,
    int failed,
    int total
) {}
