package org.cloudvision.scalp.signal.model;

/**
 * The nine 1-minute entry checks for one side. Admission needs all nine.
 */
public class TriggerConditions {
    private final boolean vwapHysteresis;
    private final boolean superTrendHysteresis;
    private final boolean rvol;
    private final boolean adx;
    private final boolean rsi;
    private final boolean ewo;
    private final boolean notInCloud;
    private final boolean pivotConfirm;
    private final boolean bollingerConfirm;

    public TriggerConditions(boolean vwapHysteresis, boolean superTrendHysteresis, boolean rvol, boolean adx,
                             boolean rsi, boolean ewo, boolean notInCloud, boolean pivotConfirm,
                             boolean bollingerConfirm) {
        this.vwapHysteresis = vwapHysteresis;
        this.superTrendHysteresis = superTrendHysteresis;
        this.rvol = rvol;
        this.adx = adx;
        this.rsi = rsi;
        this.ewo = ewo;
        this.notInCloud = notInCloud;
        this.pivotConfirm = pivotConfirm;
        this.bollingerConfirm = bollingerConfirm;
    }

    public static TriggerConditions none() {
        return new TriggerConditions(false, false, false, false, false, false, false, false, false);
    }

    public boolean isVwapHysteresis() { return vwapHysteresis; }
    public boolean isSuperTrendHysteresis() { return superTrendHysteresis; }
    public boolean isRvol() { return rvol; }
    public boolean isAdx() { return adx; }
    public boolean isRsi() { return rsi; }
    public boolean isEwo() { return ewo; }
    public boolean isNotInCloud() { return notInCloud; }
    public boolean isPivotConfirm() { return pivotConfirm; }
    public boolean isBollingerConfirm() { return bollingerConfirm; }

    public boolean allMet() {
        return vwapHysteresis && superTrendHysteresis && rvol && adx && rsi && ewo
            && notInCloud && pivotConfirm && bollingerConfirm;
    }

    @Override
    public String toString() {
        return String.format("vwap=%s st=%s rvol=%s adx=%s rsi=%s ewo=%s cloud=%s pivot=%s boll=%s",
            vwapHysteresis, superTrendHysteresis, rvol, adx, rsi, ewo, notInCloud, pivotConfirm, bollingerConfirm);
    }
}
