package org.cloudvision.scalp.service;

public enum EvaluationStatus {
    EVALUATED("Evaluated"),
    DUPLICATE_CANDLE("Duplicate candle - already evaluated"),
    DROPPED_BUSY("Dropped - evaluation already in progress");

    private final String displayName;

    EvaluationStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
