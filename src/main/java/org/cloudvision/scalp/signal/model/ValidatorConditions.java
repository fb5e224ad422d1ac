package org.cloudvision.scalp.signal.model;

/**
 * The five conjunctive checks for one side of the Validator.
 */
public class ValidatorConditions {
    private final boolean vwap;
    private final boolean superTrend;
    private final boolean rsi;
    private final boolean ewo;
    private final boolean adx;

    public ValidatorConditions(boolean vwap, boolean superTrend, boolean rsi, boolean ewo, boolean adx) {
        this.vwap = vwap;
        this.superTrend = superTrend;
        this.rsi = rsi;
        this.ewo = ewo;
        this.adx = adx;
    }

    public static ValidatorConditions none() {
        return new ValidatorConditions(false, false, false, false, false);
    }

    public boolean isVwap() { return vwap; }
    public boolean isSuperTrend() { return superTrend; }
    public boolean isRsi() { return rsi; }
    public boolean isEwo() { return ewo; }
    public boolean isAdx() { return adx; }

    public boolean allMet() {
        return vwap && superTrend && rsi && ewo && adx;
    }
}
