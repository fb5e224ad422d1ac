package org.cloudvision.scalp.indicators.model;

public class RsiDivergence {
    private final boolean bullish;
    private final boolean bearish;

    public RsiDivergence(boolean bullish, boolean bearish) {
        this.bullish = bullish;
        this.bearish = bearish;
    }

    public static RsiDivergence none() {
        return new RsiDivergence(false, false);
    }

    /** Price made a lower low while RSI made a higher low. */
    public boolean isBullish() { return bullish; }

    /** Price made a higher high while RSI made a lower high. */
    public boolean isBearish() { return bearish; }
}
