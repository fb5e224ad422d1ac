package org.cloudvision.scalp.indicators;

import org.cloudvision.scalp.indicators.model.AdxResult;
import org.cloudvision.scalp.indicators.model.AtrSlope;
import org.cloudvision.scalp.indicators.model.BollingerBands;
import org.cloudvision.scalp.indicators.model.EwoResult;
import org.cloudvision.scalp.indicators.model.MacdResult;
import org.cloudvision.scalp.indicators.model.RsiDivergence;
import org.cloudvision.scalp.indicators.model.SignalAction;
import org.cloudvision.scalp.indicators.model.SuperTrendResult;
import org.cloudvision.scalp.indicators.model.TrendDirection;
import org.cloudvision.scalp.indicators.model.TrendStrength;
import org.cloudvision.scalp.model.Candle;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Technical Indicators Calculator
 * Trend, momentum and volatility indicators used by the signal pipeline.
 *
 * Series-returning methods align their output to the latest bar: the last element
 * always describes the last input bar. A method that needs N bars returns an empty
 * series (or a neutral result) when given fewer.
 *
 * This class is stateless and thread-safe - all methods are static
 */
public class TechnicalIndicators {

    public static final int SCALE = 8;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final MathContext SQRT_CONTEXT = new MathContext(20, RoundingMode.HALF_UP);
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final BigDecimal DI_SPREAD = BigDecimal.valueOf(5);

    private TechnicalIndicators() {
        // Utility class - prevent instantiation
    }

    // ==================== Helpers ====================

    public static List<BigDecimal> closes(List<Candle> candles) {
        List<BigDecimal> closes = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            closes.add(candle.getClose());
        }
        return closes;
    }

    public static BigDecimal latest(List<BigDecimal> series, BigDecimal fallback) {
        return series == null || series.isEmpty() ? fallback : series.get(series.size() - 1);
    }

    /**
     * Value one step before the latest, or the latest when the series has a single value.
     */
    public static BigDecimal previous(List<BigDecimal> series, BigDecimal fallback) {
        if (series == null || series.size() < 2) {
            return latest(series, fallback);
        }
        return series.get(series.size() - 2);
    }

    static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        return dividend.divide(divisor, SCALE, ROUNDING);
    }

    static BigDecimal sqrt(BigDecimal value) {
        if (value.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return value.sqrt(SQRT_CONTEXT).setScale(SCALE, ROUNDING);
    }

    // ==================== Moving Averages ====================

    /**
     * Calculate Simple Moving Average (SMA)
     * @param prices List of prices
     * @param period Number of periods
     * @return SMA value, or zero if insufficient data
     */
    public static BigDecimal calculateSMA(List<BigDecimal> prices, int period) {
        if (prices == null || prices.size() < period || period <= 0) {
            return BigDecimal.ZERO;
        }

        BigDecimal sum = BigDecimal.ZERO;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            sum = sum.add(prices.get(i));
        }

        return divide(sum, BigDecimal.valueOf(period));
    }

    /**
     * Rolling simple mean. Element j covers input values j..j+period-1.
     */
    public static List<BigDecimal> smaSeries(List<BigDecimal> values, int period) {
        if (values == null || period <= 0 || values.size() < period) {
            return Collections.emptyList();
        }

        List<BigDecimal> result = new ArrayList<>(values.size() - period + 1);
        BigDecimal divisor = BigDecimal.valueOf(period);
        BigDecimal sum = BigDecimal.ZERO;
        for (int i = 0; i < values.size(); i++) {
            sum = sum.add(values.get(i));
            if (i >= period) {
                sum = sum.subtract(values.get(i - period));
            }
            if (i >= period - 1) {
                result.add(divide(sum, divisor));
            }
        }
        return result;
    }

    /**
     * Exponential moving average seeded with the SMA of the first {@code period} values.
     */
    public static List<BigDecimal> emaSeries(List<BigDecimal> values, int period) {
        if (values == null || period <= 0 || values.size() < period) {
            return Collections.emptyList();
        }

        BigDecimal multiplier = divide(TWO, BigDecimal.valueOf(period + 1));
        List<BigDecimal> result = new ArrayList<>(values.size() - period + 1);

        BigDecimal ema = calculateSMA(values.subList(0, period), period);
        result.add(ema);
        for (int i = period; i < values.size(); i++) {
            ema = values.get(i).subtract(ema).multiply(multiplier).add(ema).setScale(SCALE, ROUNDING);
            result.add(ema);
        }
        return result;
    }

    public static BigDecimal calculateEMA(List<BigDecimal> prices, int period) {
        return latest(emaSeries(prices, period), BigDecimal.ZERO);
    }

    // ==================== Momentum ====================

    /**
     * RSI with Wilder smoothing. Element j describes close j+period.
     * Returns 100 whenever the average loss is zero.
     */
    public static List<BigDecimal> rsiSeries(List<BigDecimal> closes, int period) {
        if (closes == null || period <= 0 || closes.size() <= period) {
            return Collections.emptyList();
        }

        BigDecimal periodValue = BigDecimal.valueOf(period);
        BigDecimal gainSum = BigDecimal.ZERO;
        BigDecimal lossSum = BigDecimal.ZERO;
        for (int i = 1; i <= period; i++) {
            BigDecimal change = closes.get(i).subtract(closes.get(i - 1));
            if (change.signum() > 0) {
                gainSum = gainSum.add(change);
            } else {
                lossSum = lossSum.add(change.negate());
            }
        }

        BigDecimal avgGain = divide(gainSum, periodValue);
        BigDecimal avgLoss = divide(lossSum, periodValue);
        List<BigDecimal> result = new ArrayList<>(closes.size() - period);
        result.add(rsiValue(avgGain, avgLoss));

        BigDecimal carry = BigDecimal.valueOf(period - 1L);
        for (int i = period + 1; i < closes.size(); i++) {
            BigDecimal change = closes.get(i).subtract(closes.get(i - 1));
            BigDecimal gain = change.signum() > 0 ? change : BigDecimal.ZERO;
            BigDecimal loss = change.signum() < 0 ? change.negate() : BigDecimal.ZERO;
            avgGain = divide(avgGain.multiply(carry).add(gain), periodValue);
            avgLoss = divide(avgLoss.multiply(carry).add(loss), periodValue);
            result.add(rsiValue(avgGain, avgLoss));
        }
        return result;
    }

    private static BigDecimal rsiValue(BigDecimal avgGain, BigDecimal avgLoss) {
        if (avgLoss.signum() == 0) {
            return HUNDRED.setScale(SCALE, ROUNDING);
        }
        BigDecimal rs = divide(avgGain, avgLoss);
        return HUNDRED.subtract(divide(HUNDRED, BigDecimal.ONE.add(rs)));
    }

    /**
     * Latest RSI, or 50 (neutral) when there is not enough data.
     */
    public static BigDecimal calculateRSI(List<BigDecimal> closes, int period) {
        return latest(rsiSeries(closes, period), BigDecimal.valueOf(50));
    }

    /**
     * Elliott Wave Oscillator: EMA(fast) - EMA(slow) of closes, aligned to the latest bar.
     */
    public static EwoResult calculateEWO(List<Candle> candles, int fastPeriod, int slowPeriod) {
        List<BigDecimal> closes = closes(candles);
        List<BigDecimal> fast = emaSeries(closes, fastPeriod);
        List<BigDecimal> slow = emaSeries(closes, slowPeriod);
        if (fast.isEmpty() || slow.isEmpty()) {
            return EwoResult.empty();
        }

        int offset = fast.size() - slow.size();
        List<BigDecimal> values = new ArrayList<>(slow.size());
        for (int j = 0; j < slow.size(); j++) {
            values.add(fast.get(j + offset).subtract(slow.get(j)));
        }
        return new EwoResult(values);
    }

    /**
     * MACD line, signal line and histogram. The crossover is BUY/SELL only when the
     * MACD line crosses the signal line on the latest bar.
     */
    public static MacdResult calculateMACD(List<Candle> candles, int fastPeriod, int slowPeriod, int signalPeriod) {
        EwoResult spread = calculateEWO(candles, fastPeriod, slowPeriod);
        List<BigDecimal> macdLine = spread.getValues();
        List<BigDecimal> signalLine = emaSeries(macdLine, signalPeriod);
        if (signalLine.isEmpty()) {
            return MacdResult.empty();
        }

        int offset = macdLine.size() - signalLine.size();
        List<BigDecimal> histogram = new ArrayList<>(signalLine.size());
        for (int j = 0; j < signalLine.size(); j++) {
            histogram.add(macdLine.get(j + offset).subtract(signalLine.get(j)));
        }

        SignalAction crossover = SignalAction.HOLD;
        if (signalLine.size() >= 2) {
            List<BigDecimal> alignedMacd = macdLine.subList(offset, macdLine.size());
            if (isCrossover(alignedMacd, signalLine)) {
                crossover = SignalAction.BUY;
            } else if (isCrossunder(alignedMacd, signalLine)) {
                crossover = SignalAction.SELL;
            }
        }
        return new MacdResult(macdLine, signalLine, histogram, crossover);
    }

    /**
     * Compares the two halves of the trailing {@code lookback} window of closes and RSI.
     */
    public static RsiDivergence detectRSIDivergence(List<BigDecimal> closes, List<BigDecimal> rsi, int lookback) {
        if (closes == null || rsi == null || lookback < 2
                || closes.size() < lookback || rsi.size() < lookback) {
            return RsiDivergence.none();
        }

        List<BigDecimal> prices = closes.subList(closes.size() - lookback, closes.size());
        List<BigDecimal> rsiWindow = rsi.subList(rsi.size() - lookback, rsi.size());
        int half = lookback / 2;

        List<BigDecimal> firstPrices = prices.subList(0, half);
        List<BigDecimal> secondPrices = prices.subList(half, lookback);
        List<BigDecimal> firstRsi = rsiWindow.subList(0, half);
        List<BigDecimal> secondRsi = rsiWindow.subList(half, lookback);

        boolean bullish = Collections.min(secondPrices).compareTo(Collections.min(firstPrices)) < 0
            && Collections.min(secondRsi).compareTo(Collections.min(firstRsi)) > 0;
        boolean bearish = Collections.max(secondPrices).compareTo(Collections.max(firstPrices)) > 0
            && Collections.max(secondRsi).compareTo(Collections.max(firstRsi)) < 0;

        return new RsiDivergence(bullish, bearish);
    }

    // ==================== Volatility ====================

    /**
     * True range of each bar against the previous close. Element k describes bar k+1.
     */
    public static List<BigDecimal> trueRanges(List<Candle> candles) {
        if (candles == null || candles.size() < 2) {
            return Collections.emptyList();
        }

        List<BigDecimal> ranges = new ArrayList<>(candles.size() - 1);
        for (int i = 1; i < candles.size(); i++) {
            Candle current = candles.get(i);
            BigDecimal prevClose = candles.get(i - 1).getClose();
            BigDecimal tr = current.getRange()
                .max(current.getHigh().subtract(prevClose).abs())
                .max(current.getLow().subtract(prevClose).abs());
            ranges.add(tr);
        }
        return ranges;
    }

    /**
     * ATR as an EMA of true range. Element j describes bar j+period.
     */
    public static List<BigDecimal> atrSeries(List<Candle> candles, int period) {
        return emaSeries(trueRanges(candles), period);
    }

    public static BigDecimal calculateATR(List<Candle> candles, int period) {
        return latest(atrSeries(candles, period), BigDecimal.ZERO);
    }

    /**
     * ATR with its change across the trailing {@code slopeLookback} values.
     */
    public static AtrSlope calculateATRWithSlope(List<Candle> candles, int period, int slopeLookback) {
        List<BigDecimal> atr = atrSeries(candles, period);
        BigDecimal current = latest(atr, BigDecimal.ZERO);
        if (slopeLookback < 2 || atr.size() < slopeLookback + 1) {
            return new AtrSlope(current, BigDecimal.ZERO, BigDecimal.ZERO);
        }

        BigDecimal oldAtr = atr.get(atr.size() - slopeLookback);
        BigDecimal slope = current.subtract(oldAtr);
        BigDecimal expansionRate = oldAtr.signum() == 0
            ? BigDecimal.ZERO
            : divide(slope.multiply(HUNDRED), oldAtr);
        return new AtrSlope(current, slope, expansionRate);
    }

    /**
     * Population standard deviation.
     */
    public static BigDecimal calculateStandardDeviation(List<BigDecimal> values) {
        if (values == null || values.isEmpty()) {
            return BigDecimal.ZERO;
        }

        BigDecimal mean = calculateSMA(values, values.size());
        BigDecimal sumSquares = BigDecimal.ZERO;
        for (BigDecimal value : values) {
            BigDecimal diff = value.subtract(mean);
            sumSquares = sumSquares.add(diff.multiply(diff));
        }
        return sqrt(divide(sumSquares, BigDecimal.valueOf(values.size())));
    }

    /**
     * Bollinger Bands over closes, aligned to the latest bar.
     */
    public static BollingerBands calculateBollingerBands(List<BigDecimal> closes, int period, BigDecimal multiplier) {
        if (closes == null || period <= 0 || closes.size() < period) {
            return BollingerBands.empty();
        }

        int count = closes.size() - period + 1;
        List<BigDecimal> upper = new ArrayList<>(count);
        List<BigDecimal> middle = new ArrayList<>(count);
        List<BigDecimal> lower = new ArrayList<>(count);

        for (int i = period - 1; i < closes.size(); i++) {
            List<BigDecimal> window = closes.subList(i - period + 1, i + 1);
            BigDecimal mean = calculateSMA(window, period);
            BigDecimal offset = calculateStandardDeviation(window).multiply(multiplier);
            middle.add(mean);
            upper.add(mean.add(offset));
            lower.add(mean.subtract(offset));
        }
        return new BollingerBands(upper, middle, lower);
    }

    // ==================== Trend ====================

    /**
     * ADX with +DI/-DI. True range and directional movement are smoothed with a rolling
     * mean (not Wilder/EMA); ADX is the rolling mean of DX over {@code period} values.
     */
    public static AdxResult calculateADX(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period + 1) {
            return AdxResult.empty();
        }

        List<BigDecimal> plusDm = new ArrayList<>();
        List<BigDecimal> minusDm = new ArrayList<>();
        for (int i = 1; i < candles.size(); i++) {
            BigDecimal upMove = candles.get(i).getHigh().subtract(candles.get(i - 1).getHigh());
            BigDecimal downMove = candles.get(i - 1).getLow().subtract(candles.get(i).getLow());
            plusDm.add(upMove.compareTo(downMove) > 0 && upMove.signum() > 0 ? upMove : BigDecimal.ZERO);
            minusDm.add(downMove.compareTo(upMove) > 0 && downMove.signum() > 0 ? downMove : BigDecimal.ZERO);
        }

        List<BigDecimal> smoothedTr = smaSeries(trueRanges(candles), period);
        List<BigDecimal> smoothedPlus = smaSeries(plusDm, period);
        List<BigDecimal> smoothedMinus = smaSeries(minusDm, period);

        List<BigDecimal> dx = new ArrayList<>(smoothedTr.size());
        BigDecimal plusDi = BigDecimal.ZERO;
        BigDecimal minusDi = BigDecimal.ZERO;
        for (int k = 0; k < smoothedTr.size(); k++) {
            BigDecimal tr = smoothedTr.get(k);
            if (tr.signum() == 0) {
                plusDi = BigDecimal.ZERO;
                minusDi = BigDecimal.ZERO;
            } else {
                plusDi = divide(smoothedPlus.get(k).multiply(HUNDRED), tr);
                minusDi = divide(smoothedMinus.get(k).multiply(HUNDRED), tr);
            }
            BigDecimal diSum = plusDi.add(minusDi);
            dx.add(diSum.signum() == 0
                ? BigDecimal.ZERO
                : divide(plusDi.subtract(minusDi).abs().multiply(HUNDRED), diSum));
        }

        List<BigDecimal> adx = smaSeries(dx, period);

        TrendDirection direction = TrendDirection.NEUTRAL;
        if (plusDi.compareTo(minusDi.add(DI_SPREAD)) > 0) {
            direction = TrendDirection.BULLISH;
        } else if (minusDi.compareTo(plusDi.add(DI_SPREAD)) > 0) {
            direction = TrendDirection.BEARISH;
        }
        TrendStrength strength = TrendStrength.fromAdx(latest(adx, BigDecimal.ZERO));

        return new AdxResult(adx, plusDi, minusDi, direction, strength);
    }

    /**
     * SuperTrend with ratcheting bands. Starts in the uptrend state; the series begins
     * at the first bar with an ATR value (bar {@code period}).
     */
    public static SuperTrendResult calculateSuperTrend(List<Candle> candles, int period, BigDecimal multiplier) {
        List<BigDecimal> atr = atrSeries(candles, period);
        if (atr.isEmpty()) {
            return SuperTrendResult.empty();
        }

        List<Integer> trend = new ArrayList<>(atr.size());
        List<SignalAction> signals = new ArrayList<>(atr.size());
        List<BigDecimal> upperBand = new ArrayList<>(atr.size());
        List<BigDecimal> lowerBand = new ArrayList<>(atr.size());

        int prevTrend = 1;
        BigDecimal prevUpper = null;
        BigDecimal prevLower = null;

        for (int j = 0; j < atr.size(); j++) {
            Candle candle = candles.get(j + period);
            BigDecimal prevClose = candles.get(j + period - 1).getClose();
            BigDecimal hl2 = divide(candle.getHigh().add(candle.getLow()), TWO);
            BigDecimal offset = atr.get(j).multiply(multiplier);
            BigDecimal basicUpper = hl2.add(offset);
            BigDecimal basicLower = hl2.subtract(offset);

            BigDecimal finalUpper = prevUpper == null
                || basicUpper.compareTo(prevUpper) < 0
                || prevClose.compareTo(prevUpper) > 0 ? basicUpper : prevUpper;
            BigDecimal finalLower = prevLower == null
                || basicLower.compareTo(prevLower) > 0
                || prevClose.compareTo(prevLower) < 0 ? basicLower : prevLower;

            BigDecimal close = candle.getClose();
            if (close.compareTo(finalUpper) > 0) {
                signals.add(prevTrend == -1 ? SignalAction.BUY : SignalAction.HOLD);
                prevTrend = 1;
            } else if (close.compareTo(finalLower) < 0) {
                signals.add(prevTrend == 1 ? SignalAction.SELL : SignalAction.HOLD);
                prevTrend = -1;
            } else {
                signals.add(SignalAction.HOLD);
            }
            trend.add(prevTrend);
            upperBand.add(finalUpper);
            lowerBand.add(finalLower);

            prevUpper = finalUpper;
            prevLower = finalLower;
        }

        return new SuperTrendResult(trend, signals, upperBand, lowerBand);
    }

    // ==================== Crossovers ====================

    /**
     * Check if series1 crossed above series2 on the last value
     */
    public static boolean isCrossover(List<BigDecimal> series1, List<BigDecimal> series2) {
        if (series1.size() < 2 || series2.size() < 2) {
            return false;
        }

        BigDecimal prev1 = series1.get(series1.size() - 2);
        BigDecimal curr1 = series1.get(series1.size() - 1);
        BigDecimal prev2 = series2.get(series2.size() - 2);
        BigDecimal curr2 = series2.get(series2.size() - 1);

        return prev1.compareTo(prev2) <= 0 && curr1.compareTo(curr2) > 0;
    }

    /**
     * Check if series1 crossed below series2 on the last value
     */
    public static boolean isCrossunder(List<BigDecimal> series1, List<BigDecimal> series2) {
        if (series1.size() < 2 || series2.size() < 2) {
            return false;
        }

        BigDecimal prev1 = series1.get(series1.size() - 2);
        BigDecimal curr1 = series1.get(series1.size() - 1);
        BigDecimal prev2 = series2.get(series2.size() - 2);
        BigDecimal curr2 = series2.get(series2.size() - 1);

        return prev1.compareTo(prev2) >= 0 && curr1.compareTo(curr2) < 0;
    }
}
