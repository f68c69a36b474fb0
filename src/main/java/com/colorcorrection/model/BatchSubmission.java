package com.colorcorrection.model;

/**
 * Returned when a batch has been admitted and scheduled.
 */
public record BatchSubmission(
    String batchId,
    int totalItems,
    int workerCount,
    boolean hasGpu
) {}
