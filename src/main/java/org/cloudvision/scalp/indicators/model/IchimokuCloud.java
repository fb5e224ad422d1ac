package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;

/**
 * Latest Ichimoku lines. Spans are evaluated on the current bar without the
 * forward displacement, so the cloud describes the present bar.
 */
public class IchimokuCloud {
    private final boolean available;
    private final BigDecimal tenkan;
    private final BigDecimal kijun;
    private final BigDecimal spanA;
    private final BigDecimal spanB;
    private final BigDecimal chikou;
    private final BigDecimal close;

    public IchimokuCloud(BigDecimal tenkan, BigDecimal kijun, BigDecimal spanA, BigDecimal spanB,
                         BigDecimal chikou, BigDecimal close) {
        this.available = true;
        this.tenkan = tenkan;
        this.kijun = kijun;
        this.spanA = spanA;
        this.spanB = spanB;
        this.chikou = chikou;
        this.close = close;
    }

    private IchimokuCloud() {
        this.available = false;
        this.tenkan = BigDecimal.ZERO;
        this.kijun = BigDecimal.ZERO;
        this.spanA = BigDecimal.ZERO;
        this.spanB = BigDecimal.ZERO;
        this.chikou = BigDecimal.ZERO;
        this.close = BigDecimal.ZERO;
    }

    public static IchimokuCloud unavailable() {
        return new IchimokuCloud();
    }

    public boolean isAvailable() { return available; }
    public BigDecimal getTenkan() { return tenkan; }
    public BigDecimal getKijun() { return kijun; }
    public BigDecimal getSpanA() { return spanA; }
    public BigDecimal getSpanB() { return spanB; }
    public BigDecimal getChikou() { return chikou; }

    public BigDecimal getCloudTop() {
        return spanA.max(spanB);
    }

    public BigDecimal getCloudBottom() {
        return spanA.min(spanB);
    }

    public boolean isPriceAboveCloud() {
        return available && close.compareTo(getCloudTop()) > 0;
    }

    public boolean isPriceBelowCloud() {
        return available && close.compareTo(getCloudBottom()) < 0;
    }

    public boolean isPriceInsideCloud() {
        return available && !isPriceAboveCloud() && !isPriceBelowCloud();
    }

    public TrendDirection getSignal() {
        if (isPriceAboveCloud() && tenkan.compareTo(kijun) > 0) {
            return TrendDirection.BULLISH;
        }
        if (isPriceBelowCloud() && tenkan.compareTo(kijun) < 0) {
            return TrendDirection.BEARISH;
        }
        return TrendDirection.NEUTRAL;
    }
}
