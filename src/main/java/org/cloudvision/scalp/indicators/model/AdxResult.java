package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * ADX series with the latest directional indicators.
 */
public class AdxResult {
    private final List<BigDecimal> adxSeries;
    private final BigDecimal plusDI;
    private final BigDecimal minusDI;
    private final TrendDirection direction;
    private final TrendStrength strength;

    public AdxResult(List<BigDecimal> adxSeries, BigDecimal plusDI, BigDecimal minusDI,
                     TrendDirection direction, TrendStrength strength) {
        this.adxSeries = Collections.unmodifiableList(adxSeries);
        this.plusDI = plusDI;
        this.minusDI = minusDI;
        this.direction = direction;
        this.strength = strength;
    }

    public static AdxResult empty() {
        return new AdxResult(List.of(), BigDecimal.ZERO, BigDecimal.ZERO,
            TrendDirection.NEUTRAL, TrendStrength.NO_TREND);
    }

    public List<BigDecimal> getAdxSeries() { return adxSeries; }
    public BigDecimal getPlusDI() { return plusDI; }
    public BigDecimal getMinusDI() { return minusDI; }
    public TrendDirection getDirection() { return direction; }
    public TrendStrength getStrength() { return strength; }

    public BigDecimal getAdx() {
        return adxSeries.isEmpty() ? BigDecimal.ZERO : adxSeries.get(adxSeries.size() - 1);
    }

    /**
     * Value one bar back, or the current value when only one exists.
     */
    public BigDecimal getPreviousAdx() {
        return adxSeries.size() < 2 ? getAdx() : adxSeries.get(adxSeries.size() - 2);
    }

    public boolean isRising() {
        return getAdx().compareTo(getPreviousAdx()) > 0;
    }

    public boolean isFalling() {
        return getAdx().compareTo(getPreviousAdx()) < 0;
    }

    public String getDescription() {
        return strength.getDisplayName() + " " + direction.name().toLowerCase() + " trend";
    }
}
