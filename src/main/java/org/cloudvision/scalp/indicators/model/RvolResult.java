package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;

/**
 * Relative volume of the latest bar against the mean of the preceding bars.
 */
public class RvolResult {
    private final BigDecimal rvol;
    private final BigDecimal currentVolume;
    private final BigDecimal averageVolume;
    private final boolean spike;

    public RvolResult(BigDecimal rvol, BigDecimal currentVolume, BigDecimal averageVolume, boolean spike) {
        this.rvol = rvol;
        this.currentVolume = currentVolume;
        this.averageVolume = averageVolume;
        this.spike = spike;
    }

    public static RvolResult neutral(BigDecimal currentVolume) {
        return new RvolResult(BigDecimal.ONE, currentVolume, BigDecimal.ZERO, false);
    }

    public BigDecimal getRvol() { return rvol; }
    public BigDecimal getCurrentVolume() { return currentVolume; }
    public BigDecimal getAverageVolume() { return averageVolume; }
    public boolean isSpike() { return spike; }
}
