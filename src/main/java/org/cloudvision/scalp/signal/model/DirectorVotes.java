package org.cloudvision.scalp.signal.model;

/**
 * Per-indicator votes behind a Director bias score. Each vote is -1, 0 or +1.
 */
public class DirectorVotes {
    private final int superTrend;
    private final int vwap;
    private final int rsi;
    private final int ewo;
    private final int adx;
    private final int ichimoku;

    public DirectorVotes(int superTrend, int vwap, int rsi, int ewo, int adx, int ichimoku) {
        this.superTrend = superTrend;
        this.vwap = vwap;
        this.rsi = rsi;
        this.ewo = ewo;
        this.adx = adx;
        this.ichimoku = ichimoku;
    }

    public static DirectorVotes none() {
        return new DirectorVotes(0, 0, 0, 0, 0, 0);
    }

    public int getSuperTrend() { return superTrend; }
    public int getVwap() { return vwap; }
    public int getRsi() { return rsi; }
    public int getEwo() { return ewo; }
    public int getAdx() { return adx; }
    public int getIchimoku() { return ichimoku; }

    public int total() {
        return superTrend + vwap + rsi + ewo + adx + ichimoku;
    }

    @Override
    public String toString() {
        return String.format("ST:%+d VWAP:%+d RSI:%+d EWO:%+d ADX:%+d ICHI:%+d",
            superTrend, vwap, rsi, ewo, adx, ichimoku);
    }
}
