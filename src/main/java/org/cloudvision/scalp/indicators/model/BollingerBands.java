package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.List;

/**
 * Bollinger band series aligned to the latest bar.
 */
public class BollingerBands {
    private final List<BigDecimal> upper;
    private final List<BigDecimal> middle;
    private final List<BigDecimal> lower;

    public BollingerBands(List<BigDecimal> upper, List<BigDecimal> middle, List<BigDecimal> lower) {
        this.upper = Collections.unmodifiableList(upper);
        this.middle = Collections.unmodifiableList(middle);
        this.lower = Collections.unmodifiableList(lower);
    }

    public static BollingerBands empty() {
        return new BollingerBands(List.of(), List.of(), List.of());
    }

    public List<BigDecimal> getUpper() { return upper; }
    public List<BigDecimal> getMiddle() { return middle; }
    public List<BigDecimal> getLower() { return lower; }

    public int size() {
        return middle.size();
    }

    public boolean isEmpty() {
        return middle.isEmpty();
    }

    public BigDecimal getLatestUpper() { return latest(upper); }
    public BigDecimal getLatestMiddle() { return latest(middle); }
    public BigDecimal getLatestLower() { return latest(lower); }

    /** Absolute band width at a series index. */
    public BigDecimal getWidth(int index) {
        return upper.get(index).subtract(lower.get(index));
    }

    /**
     * Latest width relative to the middle band, zero when unavailable.
     */
    public BigDecimal getLatestBandwidth() {
        if (isEmpty() || getLatestMiddle().signum() == 0) {
            return BigDecimal.ZERO;
        }
        return getWidth(size() - 1).divide(getLatestMiddle(), 8, RoundingMode.HALF_UP);
    }

    private static BigDecimal latest(List<BigDecimal> series) {
        return series.isEmpty() ? BigDecimal.ZERO : series.get(series.size() - 1);
    }
}
