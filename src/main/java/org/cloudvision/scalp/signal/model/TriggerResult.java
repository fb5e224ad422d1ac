package org.cloudvision.scalp.signal.model;

import java.math.BigDecimal;

/**
 * 1-minute entry verdict. Carries the RVOL and ADX readings the confidence
 * score reuses.
 */
public class TriggerResult {
    private final boolean valid;
    private final TradeDirection direction;
    private final TriggerConditions conditions;
    private final BigDecimal rvol;
    private final BigDecimal adx;
    private final boolean adxRising;

    public TriggerResult(boolean valid, TradeDirection direction, TriggerConditions conditions,
                         BigDecimal rvol, BigDecimal adx, boolean adxRising) {
        this.valid = valid;
        this.direction = direction;
        this.conditions = conditions;
        this.rvol = rvol;
        this.adx = adx;
        this.adxRising = adxRising;
    }

    public static TriggerResult invalid() {
        return new TriggerResult(false, null, TriggerConditions.none(), BigDecimal.ONE, BigDecimal.ZERO, false);
    }

    public boolean isValid() { return valid; }
    public TradeDirection getDirection() { return direction; }
    public TriggerConditions getConditions() { return conditions; }
    public BigDecimal getRvol() { return rvol; }
    public BigDecimal getAdx() { return adx; }
    public boolean isAdxRising() { return adxRising; }
}
