package com.colorcorrection.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-item state: PENDING → QUEUED → COMPLETED | FAILED.
 */
public enum ItemStatus {
    PENDING,
    QUEUED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonValue
    public String jsonValue() {
        return name().toLowerCase();
    }
}
