package org.cloudvision.scalp.indicators;

import org.cloudvision.scalp.indicators.model.IndicatorSnapshot;
import org.cloudvision.scalp.indicators.model.PivotLevels;
import org.cloudvision.scalp.model.Candle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Computes a full {@link IndicatorSnapshot} for a candle window.
 *
 * Periods follow the 1-minute trigger settings: RSI 14, ADX 14, SuperTrend 7/2.5,
 * EWO 5/35, Bollinger 20/2, ATR 14 with a 5-value slope, Ichimoku 9/26/52, RVOL 20,
 * MACD 12/26/9.
 */
@Service
public class IndicatorService {

    private static final Logger logger = LoggerFactory.getLogger(IndicatorService.class);

    private static final BigDecimal SUPERTREND_MULTIPLIER = new BigDecimal("2.5");
    private static final BigDecimal BOLLINGER_MULTIPLIER = BigDecimal.valueOf(2);
    private static final BigDecimal BOUNCE_THRESHOLD_POINTS = BigDecimal.valueOf(5);
    private static final int DIVERGENCE_LOOKBACK = 10;

    public IndicatorSnapshot snapshot(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            throw new IllegalArgumentException("At least one candle is required");
        }

        List<BigDecimal> closes = TechnicalIndicators.closes(candles);
        List<BigDecimal> rsiSeries = TechnicalIndicators.rsiSeries(closes, 14);
        BigDecimal rsi = TechnicalIndicators.latest(rsiSeries, BigDecimal.valueOf(50));
        Candle last = candles.get(candles.size() - 1);
        PivotLevels pivots = candles.size() >= 2
            ? PriceLevelIndicators.calculatePivotPoints(candles.get(candles.size() - 2))
            : PivotLevels.empty();

        IndicatorSnapshot snapshot = IndicatorSnapshot.builder()
            .timestamp(last.getTimestamp())
            .close(last.getClose())
            .rsi(rsi)
            .adx(TechnicalIndicators.calculateADX(candles, 14))
            .superTrend(TechnicalIndicators.calculateSuperTrend(candles, 7, SUPERTREND_MULTIPLIER))
            .ewo(TechnicalIndicators.calculateEWO(candles, 5, 35))
            .bollinger(TechnicalIndicators.calculateBollingerBands(closes, 20, BOLLINGER_MULTIPLIER))
            .vwap(PriceLevelIndicators.calculateVWAP(candles))
            .atr(TechnicalIndicators.calculateATRWithSlope(candles, 14, 5))
            .ichimoku(PriceLevelIndicators.calculateIchimoku(candles, 9, 26, 52))
            .rvol(PriceLevelIndicators.calculateRVOL(candles, 20))
            .macd(TechnicalIndicators.calculateMACD(candles, 12, 26, 9))
            .heikinAshiTrend(PriceLevelIndicators.calculateHeikinAshi(candles).getTrend())
            .pivots(pivots)
            .bounce(PriceLevelIndicators.detectSupportResistanceBounce(
                last.getClose(), pivots, rsi, BOUNCE_THRESHOLD_POINTS))
            .divergence(TechnicalIndicators.detectRSIDivergence(closes, rsiSeries, DIVERGENCE_LOOKBACK))
            .netVolume(PriceLevelIndicators.calculateNetVolume(candles, 5))
            .build();

        logger.debug("Snapshot over {} candles: rsi={} adx={} vwap={}",
            candles.size(), snapshot.getRsi(), snapshot.getAdx(), snapshot.getVwap().getVwap());
        return snapshot;
    }
}
