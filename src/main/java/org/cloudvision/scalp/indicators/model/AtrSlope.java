package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;

public class AtrSlope {
    private final BigDecimal atr;
    private final BigDecimal slope;
    private final BigDecimal expansionRate;

    public AtrSlope(BigDecimal atr, BigDecimal slope, BigDecimal expansionRate) {
        this.atr = atr;
        this.slope = slope;
        this.expansionRate = expansionRate;
    }

    public static AtrSlope empty() {
        return new AtrSlope(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public BigDecimal getAtr() { return atr; }
    public BigDecimal getSlope() { return slope; }

    /** Percent change across the slope window. */
    public BigDecimal getExpansionRate() { return expansionRate; }

    public boolean isExpanding() {
        return slope.signum() > 0;
    }
}
