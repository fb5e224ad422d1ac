package org.cloudvision.scalp.indicators;

import org.cloudvision.scalp.indicators.model.BounceSignal;
import org.cloudvision.scalp.indicators.model.HeikinAshiResult;
import org.cloudvision.scalp.indicators.model.HeikinAshiTrend;
import org.cloudvision.scalp.indicators.model.IchimokuCloud;
import org.cloudvision.scalp.indicators.model.PivotLevels;
import org.cloudvision.scalp.indicators.model.RvolResult;
import org.cloudvision.scalp.indicators.model.SupportResistanceBounce;
import org.cloudvision.scalp.indicators.model.VwapPosition;
import org.cloudvision.scalp.indicators.model.VwapResult;
import org.cloudvision.scalp.model.Candle;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.cloudvision.scalp.indicators.TechnicalIndicators.divide;
import static org.cloudvision.scalp.indicators.TechnicalIndicators.sqrt;

/**
 * Volume and price-level indicators: VWAP, relative volume, pivots, Ichimoku
 * and Heikin-Ashi.
 *
 * This class is stateless and thread-safe - all methods are static
 */
public class PriceLevelIndicators {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal THREE = BigDecimal.valueOf(3);
    private static final BigDecimal FOUR = BigDecimal.valueOf(4);
    private static final BigDecimal SPIKE_RVOL = new BigDecimal("1.5");

    private PriceLevelIndicators() {
        // Utility class - prevent instantiation
    }

    // ==================== Volume ====================

    /**
     * VWAP of typical price over the whole window with bands at two standard deviations
     * of typical price around it. Falls back to the last close when total volume is zero.
     */
    public static VwapResult calculateVWAP(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return VwapResult.empty();
        }

        BigDecimal cumulativeTpv = BigDecimal.ZERO;
        BigDecimal cumulativeVolume = BigDecimal.ZERO;
        List<BigDecimal> typicalPrices = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            BigDecimal typical = typicalPrice(candle);
            typicalPrices.add(typical);
            cumulativeTpv = cumulativeTpv.add(typical.multiply(candle.getVolume()));
            cumulativeVolume = cumulativeVolume.add(candle.getVolume());
        }

        BigDecimal close = candles.get(candles.size() - 1).getClose();
        BigDecimal vwap = cumulativeVolume.signum() > 0 ? divide(cumulativeTpv, cumulativeVolume) : close;

        BigDecimal sumSquares = BigDecimal.ZERO;
        for (BigDecimal typical : typicalPrices) {
            BigDecimal diff = typical.subtract(vwap);
            sumSquares = sumSquares.add(diff.multiply(diff));
        }
        BigDecimal stdDev = sqrt(divide(sumSquares, BigDecimal.valueOf(typicalPrices.size())));
        BigDecimal upper = vwap.add(stdDev.multiply(TWO));
        BigDecimal lower = vwap.subtract(stdDev.multiply(TWO));

        VwapPosition position;
        if (close.compareTo(upper) > 0) {
            position = VwapPosition.ABOVE_UPPER;
        } else if (close.compareTo(lower) < 0) {
            position = VwapPosition.BELOW_LOWER;
        } else if (close.compareTo(vwap) > 0) {
            position = VwapPosition.ABOVE_VWAP;
        } else if (close.compareTo(vwap) < 0) {
            position = VwapPosition.BELOW_VWAP;
        } else {
            position = VwapPosition.AT_VWAP;
        }

        return new VwapResult(vwap, upper, lower, stdDev, position);
    }

    public static BigDecimal typicalPrice(Candle candle) {
        return divide(candle.getHigh().add(candle.getLow()).add(candle.getClose()), THREE);
    }

    /**
     * Latest volume over the mean of the preceding {@code lookback} bars. Neutral (1.0)
     * when the window is too short or the mean is zero.
     */
    public static RvolResult calculateRVOL(List<Candle> candles, int lookback) {
        if (candles == null || candles.isEmpty()) {
            return RvolResult.neutral(BigDecimal.ZERO);
        }
        BigDecimal currentVolume = candles.get(candles.size() - 1).getVolume();
        if (lookback <= 0 || candles.size() < lookback + 1) {
            return RvolResult.neutral(currentVolume);
        }

        BigDecimal sum = BigDecimal.ZERO;
        for (int i = candles.size() - lookback - 1; i < candles.size() - 1; i++) {
            sum = sum.add(candles.get(i).getVolume());
        }
        BigDecimal average = divide(sum, BigDecimal.valueOf(lookback));
        BigDecimal rvol = average.signum() > 0 ? divide(currentVolume, average) : BigDecimal.ONE;

        return new RvolResult(rvol, currentVolume, average, rvol.compareTo(SPIKE_RVOL) > 0);
    }

    /**
     * Buy volume (green bars) minus sell volume (everything else) over the last
     * {@code lookback} bars.
     */
    public static BigDecimal calculateNetVolume(List<Candle> candles, int lookback) {
        if (candles == null || lookback <= 0 || candles.size() < lookback) {
            return BigDecimal.ZERO;
        }

        BigDecimal net = BigDecimal.ZERO;
        for (Candle candle : candles.subList(candles.size() - lookback, candles.size())) {
            net = candle.isGreen() ? net.add(candle.getVolume()) : net.subtract(candle.getVolume());
        }
        return net;
    }

    // ==================== Price Levels ====================

    public static PivotLevels calculatePivotPoints(Candle candle) {
        if (candle == null) {
            return PivotLevels.empty();
        }

        BigDecimal high = candle.getHigh();
        BigDecimal low = candle.getLow();
        BigDecimal pivot = typicalPrice(candle);
        BigDecimal range = high.subtract(low);

        return new PivotLevels(
            pivot,
            pivot.multiply(TWO).subtract(low),
            pivot.add(range),
            high.add(pivot.subtract(low).multiply(TWO)),
            pivot.multiply(TWO).subtract(high),
            pivot.subtract(range),
            low.subtract(high.subtract(pivot).multiply(TWO))
        );
    }

    /**
     * Classifies the price against its nearest pivot level.
     *
     * @param threshold maximum distance, in price points, to count as "at" a level
     */
    public static SupportResistanceBounce detectSupportResistanceBounce(BigDecimal price, PivotLevels pivots,
                                                                        BigDecimal rsi, BigDecimal threshold) {
        String nearestName = null;
        BigDecimal nearestLevel = BigDecimal.ZERO;
        BigDecimal minDistance = null;
        for (Map.Entry<String, BigDecimal> level : pivots.asLevels().entrySet()) {
            BigDecimal distance = price.subtract(level.getValue()).abs();
            if (minDistance == null || distance.compareTo(minDistance) < 0) {
                minDistance = distance;
                nearestName = level.getKey();
                nearestLevel = level.getValue();
            }
        }

        boolean near = minDistance.compareTo(threshold) <= 0;
        boolean atSupport = near && nearestName.startsWith("S");
        boolean atResistance = near && nearestName.startsWith("R");

        BounceSignal signal = BounceSignal.NONE;
        if (atSupport && rsi.compareTo(BigDecimal.valueOf(35)) < 0) {
            signal = BounceSignal.STRONG_BUY;
        } else if (atSupport && rsi.compareTo(BigDecimal.valueOf(45)) < 0) {
            signal = BounceSignal.BUY;
        } else if (atResistance && rsi.compareTo(BigDecimal.valueOf(65)) > 0) {
            signal = BounceSignal.STRONG_SELL;
        } else if (atResistance && rsi.compareTo(BigDecimal.valueOf(55)) > 0) {
            signal = BounceSignal.SELL;
        }

        return new SupportResistanceBounce(signal, nearestName, nearestLevel, minDistance, atSupport, atResistance);
    }

    /**
     * Ichimoku lines for the latest bar. Unavailable below {@code senkouBPeriod} bars.
     */
    public static IchimokuCloud calculateIchimoku(List<Candle> candles, int tenkanPeriod,
                                                  int kijunPeriod, int senkouBPeriod) {
        int longest = Math.max(senkouBPeriod, Math.max(tenkanPeriod, kijunPeriod));
        if (candles == null || candles.size() < longest) {
            return IchimokuCloud.unavailable();
        }

        BigDecimal tenkan = midpoint(candles, tenkanPeriod);
        BigDecimal kijun = midpoint(candles, kijunPeriod);
        BigDecimal spanA = divide(tenkan.add(kijun), TWO);
        BigDecimal spanB = midpoint(candles, senkouBPeriod);
        int lagIndex = candles.size() - 1 - kijunPeriod;
        BigDecimal chikou = lagIndex >= 0 ? candles.get(lagIndex).getClose() : BigDecimal.ZERO;

        return new IchimokuCloud(tenkan, kijun, spanA, spanB, chikou,
            candles.get(candles.size() - 1).getClose());
    }

    /** (highest high + lowest low) / 2 over the trailing period. */
    private static BigDecimal midpoint(List<Candle> candles, int period) {
        BigDecimal highest = null;
        BigDecimal lowest = null;
        for (Candle candle : candles.subList(candles.size() - period, candles.size())) {
            highest = highest == null ? candle.getHigh() : highest.max(candle.getHigh());
            lowest = lowest == null ? candle.getLow() : lowest.min(candle.getLow());
        }
        return divide(highest.add(lowest), TWO);
    }

    // ==================== Heikin-Ashi ====================

    public static HeikinAshiResult calculateHeikinAshi(List<Candle> candles) {
        if (candles == null || candles.size() < 2) {
            return new HeikinAshiResult(List.of(), HeikinAshiTrend.NEUTRAL);
        }

        List<Candle> haCandles = new ArrayList<>(candles.size());
        Candle previous = null;
        for (Candle candle : candles) {
            BigDecimal haClose = divide(candle.getOpen().add(candle.getHigh())
                .add(candle.getLow()).add(candle.getClose()), FOUR);
            BigDecimal haOpen = previous == null
                ? divide(candle.getOpen().add(candle.getClose()), TWO)
                : divide(previous.getOpen().add(previous.getClose()), TWO);
            BigDecimal haHigh = candle.getHigh().max(haOpen).max(haClose);
            BigDecimal haLow = candle.getLow().min(haOpen).min(haClose);

            previous = new Candle(candle.getTimestamp(), haOpen, haHigh, haLow, haClose, candle.getVolume());
            haCandles.add(previous);
        }

        Candle last = haCandles.get(haCandles.size() - 1);
        Candle prior = haCandles.get(haCandles.size() - 2);
        HeikinAshiTrend trend = HeikinAshiTrend.NEUTRAL;
        if (last.isGreen() && prior.isGreen()) {
            trend = HeikinAshiTrend.UP;
        } else if (last.isRed() && prior.isRed()) {
            trend = HeikinAshiTrend.DOWN;
        }
        return new HeikinAshiResult(haCandles, trend);
    }
}
