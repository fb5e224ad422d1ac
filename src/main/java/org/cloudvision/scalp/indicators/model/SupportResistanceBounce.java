package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;

public class SupportResistanceBounce {
    private final BounceSignal signal;
    private final String nearestLevelName;
    private final BigDecimal nearestLevel;
    private final BigDecimal distance;
    private final boolean atSupport;
    private final boolean atResistance;

    public SupportResistanceBounce(BounceSignal signal, String nearestLevelName, BigDecimal nearestLevel,
                                   BigDecimal distance, boolean atSupport, boolean atResistance) {
        this.signal = signal;
        this.nearestLevelName = nearestLevelName;
        this.nearestLevel = nearestLevel;
        this.distance = distance;
        this.atSupport = atSupport;
        this.atResistance = atResistance;
    }

    public BounceSignal getSignal() { return signal; }
    public String getNearestLevelName() { return nearestLevelName; }
    public BigDecimal getNearestLevel() { return nearestLevel; }
    public BigDecimal getDistance() { return distance; }
    public boolean isAtSupport() { return atSupport; }
    public boolean isAtResistance() { return atResistance; }
}
