package org.cloudvision.scalp.model;

import java.time.Duration;

/**
 * Bar intervals consumed by the signal pipeline.
 */
public enum Timeframe {
    ONE_MINUTE("1m", Duration.ofMinutes(1)),
    TWO_MINUTE("2m", Duration.ofMinutes(2)),
    FIVE_MINUTE("5m", Duration.ofMinutes(5));

    private final String value;
    private final Duration duration;

    Timeframe(String value, Duration duration) {
        this.value = value;
        this.duration = duration;
    }

    public String getValue() {
        return value;
    }

    public Duration getDuration() {
        return duration;
    }
}
