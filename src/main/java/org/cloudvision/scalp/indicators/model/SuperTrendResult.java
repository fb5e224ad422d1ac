package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * SuperTrend series aligned to the latest bar. Trend 1 means uptrend, -1 downtrend.
 */
public class SuperTrendResult {
    private final List<Integer> trend;
    private final List<SignalAction> signals;
    private final List<BigDecimal> upperBand;
    private final List<BigDecimal> lowerBand;

    public SuperTrendResult(List<Integer> trend, List<SignalAction> signals,
                            List<BigDecimal> upperBand, List<BigDecimal> lowerBand) {
        this.trend = Collections.unmodifiableList(trend);
        this.signals = Collections.unmodifiableList(signals);
        this.upperBand = Collections.unmodifiableList(upperBand);
        this.lowerBand = Collections.unmodifiableList(lowerBand);
    }

    public static SuperTrendResult empty() {
        return new SuperTrendResult(List.of(), List.of(), List.of(), List.of());
    }

    public List<Integer> getTrend() { return trend; }
    public List<SignalAction> getSignals() { return signals; }
    public List<BigDecimal> getUpperBand() { return upperBand; }
    public List<BigDecimal> getLowerBand() { return lowerBand; }

    public boolean isEmpty() {
        return trend.isEmpty();
    }

    /** 0 when no value is available. */
    public int getLatestTrend() {
        return trend.isEmpty() ? 0 : trend.get(trend.size() - 1);
    }

    public SignalAction getLatestSignal() {
        return signals.isEmpty() ? SignalAction.HOLD : signals.get(signals.size() - 1);
    }

    /**
     * True when the last {@code count} bars all carry the given trend.
     */
    public boolean lastTrendsEqual(int count, int expected) {
        if (trend.size() < count) {
            return false;
        }
        for (int i = trend.size() - count; i < trend.size(); i++) {
            if (trend.get(i) != expected) {
                return false;
            }
        }
        return true;
    }
}
