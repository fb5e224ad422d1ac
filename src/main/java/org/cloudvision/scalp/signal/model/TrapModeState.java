package org.cloudvision.scalp.signal.model;

import org.cloudvision.scalp.model.Candle;

import java.math.BigDecimal;

/**
 * Lifecycle of a detected liquidity-sweep wick. Active until the candle index
 * reaches {@code expiresAtCandleIndex} or a fade is confirmed.
 */
public class TrapModeState {
    private static final TrapModeState INACTIVE =
        new TrapModeState(false, TrapType.NONE, 0, 0, BigDecimal.ZERO, BigDecimal.ZERO, null);

    private final boolean active;
    private final TrapType type;
    private final long detectedAtCandleIndex;
    private final long expiresAtCandleIndex;
    private final BigDecimal wickHigh;
    private final BigDecimal wickLow;
    private final Candle trapCandle;

    public TrapModeState(boolean active, TrapType type, long detectedAtCandleIndex, long expiresAtCandleIndex,
                         BigDecimal wickHigh, BigDecimal wickLow, Candle trapCandle) {
        this.active = active;
        this.type = type;
        this.detectedAtCandleIndex = detectedAtCandleIndex;
        this.expiresAtCandleIndex = expiresAtCandleIndex;
        this.wickHigh = wickHigh;
        this.wickLow = wickLow;
        this.trapCandle = trapCandle;
    }

    public static TrapModeState inactive() {
        return INACTIVE;
    }

    public static TrapModeState detected(TrapType type, long candleIndex, int durationCandles, Candle trapCandle) {
        return new TrapModeState(true, type, candleIndex, candleIndex + durationCandles,
            trapCandle.getHigh(), trapCandle.getLow(), trapCandle);
    }

    public boolean isActive() { return active; }
    public TrapType getType() { return type; }
    public long getDetectedAtCandleIndex() { return detectedAtCandleIndex; }
    public long getExpiresAtCandleIndex() { return expiresAtCandleIndex; }
    public BigDecimal getWickHigh() { return wickHigh; }
    public BigDecimal getWickLow() { return wickLow; }
    public Candle getTrapCandle() { return trapCandle; }

    public boolean isActiveAt(long candleIndex) {
        return active && candleIndex < expiresAtCandleIndex;
    }

    @Override
    public String toString() {
        return active
            ? String.format("Trap[%s idx=%d expires=%d]", type, detectedAtCandleIndex, expiresAtCandleIndex)
            : "Trap[inactive]";
    }
}
