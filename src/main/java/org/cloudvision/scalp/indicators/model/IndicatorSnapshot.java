package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time view of every indicator for one candle window. Recomputed on demand,
 * never persisted.
 */
public class IndicatorSnapshot {
    private final Instant timestamp;
    private final BigDecimal close;
    private final BigDecimal rsi;
    private final AdxResult adx;
    private final int superTrend;
    private final SignalAction superTrendSignal;
    private final BigDecimal ewo;
    private final SignalAction ewoSignal;
    private final BigDecimal bollingerUpper;
    private final BigDecimal bollingerMiddle;
    private final BigDecimal bollingerLower;
    private final VwapResult vwap;
    private final AtrSlope atr;
    private final IchimokuCloud ichimoku;
    private final RvolResult rvol;
    private final MacdResult macd;
    private final HeikinAshiTrend heikinAshiTrend;
    private final PivotLevels pivots;
    private final SupportResistanceBounce bounce;
    private final RsiDivergence divergence;
    private final BigDecimal netVolume;

    private IndicatorSnapshot(Builder builder) {
        this.timestamp = builder.timestamp;
        this.close = builder.close;
        this.rsi = builder.rsi;
        this.adx = builder.adx;
        this.superTrend = builder.superTrend;
        this.superTrendSignal = builder.superTrendSignal;
        this.ewo = builder.ewo;
        this.ewoSignal = builder.ewoSignal;
        this.bollingerUpper = builder.bollingerUpper;
        this.bollingerMiddle = builder.bollingerMiddle;
        this.bollingerLower = builder.bollingerLower;
        this.vwap = builder.vwap;
        this.atr = builder.atr;
        this.ichimoku = builder.ichimoku;
        this.rvol = builder.rvol;
        this.macd = builder.macd;
        this.heikinAshiTrend = builder.heikinAshiTrend;
        this.pivots = builder.pivots;
        this.bounce = builder.bounce;
        this.divergence = builder.divergence;
        this.netVolume = builder.netVolume;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Instant getTimestamp() { return timestamp; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getRsi() { return rsi; }
    public BigDecimal getAdx() { return adx.getAdx(); }
    public BigDecimal getPlusDI() { return adx.getPlusDI(); }
    public BigDecimal getMinusDI() { return adx.getMinusDI(); }
    public TrendDirection getAdxDirection() { return adx.getDirection(); }
    public TrendStrength getAdxStrength() { return adx.getStrength(); }
    public int getSuperTrend() { return superTrend; }
    public SignalAction getSuperTrendSignal() { return superTrendSignal; }
    public BigDecimal getEwo() { return ewo; }
    public SignalAction getEwoSignal() { return ewoSignal; }
    public BigDecimal getBollingerUpper() { return bollingerUpper; }
    public BigDecimal getBollingerMiddle() { return bollingerMiddle; }
    public BigDecimal getBollingerLower() { return bollingerLower; }
    public VwapResult getVwap() { return vwap; }
    public AtrSlope getAtr() { return atr; }
    public IchimokuCloud getIchimoku() { return ichimoku; }
    public RvolResult getRvol() { return rvol; }
    public MacdResult getMacd() { return macd; }
    public HeikinAshiTrend getHeikinAshiTrend() { return heikinAshiTrend; }
    public PivotLevels getPivots() { return pivots; }
    public SupportResistanceBounce getBounce() { return bounce; }
    public RsiDivergence getDivergence() { return divergence; }
    public BigDecimal getNetVolume() { return netVolume; }

    public static class Builder {
        private Instant timestamp;
        private BigDecimal close = BigDecimal.ZERO;
        private BigDecimal rsi = BigDecimal.valueOf(50);
        private AdxResult adx = AdxResult.empty();
        private int superTrend;
        private SignalAction superTrendSignal = SignalAction.HOLD;
        private BigDecimal ewo = BigDecimal.ZERO;
        private SignalAction ewoSignal = SignalAction.HOLD;
        private BigDecimal bollingerUpper = BigDecimal.ZERO;
        private BigDecimal bollingerMiddle = BigDecimal.ZERO;
        private BigDecimal bollingerLower = BigDecimal.ZERO;
        private VwapResult vwap = VwapResult.empty();
        private AtrSlope atr = AtrSlope.empty();
        private IchimokuCloud ichimoku = IchimokuCloud.unavailable();
        private RvolResult rvol = RvolResult.neutral(BigDecimal.ZERO);
        private MacdResult macd = MacdResult.empty();
        private HeikinAshiTrend heikinAshiTrend = HeikinAshiTrend.NEUTRAL;
        private PivotLevels pivots = PivotLevels.empty();
        private SupportResistanceBounce bounce;
        private RsiDivergence divergence = RsiDivergence.none();
        private BigDecimal netVolume = BigDecimal.ZERO;

        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder close(BigDecimal close) { this.close = close; return this; }
        public Builder rsi(BigDecimal rsi) { this.rsi = rsi; return this; }
        public Builder adx(AdxResult adx) { this.adx = adx; return this; }
        public Builder superTrend(SuperTrendResult result) {
            this.superTrend = result.getLatestTrend();
            this.superTrendSignal = result.getLatestSignal();
            return this;
        }
        public Builder ewo(EwoResult result) {
            this.ewo = result.getCurrent();
            this.ewoSignal = result.getSignal();
            return this;
        }
        public Builder bollinger(BollingerBands bands) {
            this.bollingerUpper = bands.getLatestUpper();
            this.bollingerMiddle = bands.getLatestMiddle();
            this.bollingerLower = bands.getLatestLower();
            return this;
        }
        public Builder vwap(VwapResult vwap) { this.vwap = vwap; return this; }
        public Builder atr(AtrSlope atr) { this.atr = atr; return this; }
        public Builder ichimoku(IchimokuCloud ichimoku) { this.ichimoku = ichimoku; return this; }
        public Builder rvol(RvolResult rvol) { this.rvol = rvol; return this; }
        public Builder macd(MacdResult macd) { this.macd = macd; return this; }
        public Builder heikinAshiTrend(HeikinAshiTrend trend) { this.heikinAshiTrend = trend; return this; }
        public Builder pivots(PivotLevels pivots) { this.pivots = pivots; return this; }
        public Builder bounce(SupportResistanceBounce bounce) { this.bounce = bounce; return this; }
        public Builder divergence(RsiDivergence divergence) { this.divergence = divergence; return this; }
        public Builder netVolume(BigDecimal netVolume) { this.netVolume = netVolume; return this; }

        public IndicatorSnapshot build() {
            return new IndicatorSnapshot(this);
        }
    }
}
