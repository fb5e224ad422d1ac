package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;

/**
 * ADX strength buckets.
 */
public enum TrendStrength {
    NO_TREND("No Trend", 0),
    WEAK("Weak", 15),
    MODERATE("Moderate", 25),
    STRONG("Strong", 40),
    VERY_STRONG("Very Strong", 50);

    private final String displayName;
    private final int floor;

    TrendStrength(String displayName, int floor) {
        this.displayName = displayName;
        this.floor = floor;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static TrendStrength fromAdx(BigDecimal adx) {
        TrendStrength[] values = values();
        for (int i = values.length - 1; i > 0; i--) {
            if (adx.compareTo(BigDecimal.valueOf(values[i].floor)) >= 0) {
                return values[i];
            }
        }
        return NO_TREND;
    }
}
