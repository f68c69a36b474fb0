package com.colorcorrection.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Point-in-time copy of the batch state. Safe to serialize without locking.
 */
public record BatchStatus(
    String batchId,
    boolean active,
    int total,
    int completed,
    int failed,
    List<ItemProgress> progress,
    int resultCount
) {
    @JsonProperty("hasResults")
    public boolean hasResults() {
        return resultCount > 0;
    }

    public boolean isTerminal() {
        return completed + failed == total;
    }
}
