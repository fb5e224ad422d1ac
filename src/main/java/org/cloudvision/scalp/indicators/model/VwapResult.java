package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;

/**
 * Volume-weighted average price over a whole window, with 2-sigma bands.
 */
public class VwapResult {
    private final BigDecimal vwap;
    private final BigDecimal upperBand;
    private final BigDecimal lowerBand;
    private final BigDecimal standardDeviation;
    private final VwapPosition position;

    public VwapResult(BigDecimal vwap, BigDecimal upperBand, BigDecimal lowerBand,
                      BigDecimal standardDeviation, VwapPosition position) {
        this.vwap = vwap;
        this.upperBand = upperBand;
        this.lowerBand = lowerBand;
        this.standardDeviation = standardDeviation;
        this.position = position;
    }

    public static VwapResult empty() {
        return new VwapResult(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
            VwapPosition.AT_VWAP);
    }

    public BigDecimal getVwap() { return vwap; }
    public BigDecimal getUpperBand() { return upperBand; }
    public BigDecimal getLowerBand() { return lowerBand; }
    public BigDecimal getStandardDeviation() { return standardDeviation; }
    public VwapPosition getPosition() { return position; }
}
