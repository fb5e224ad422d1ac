package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.indicators.PriceLevelIndicators;
import org.cloudvision.scalp.indicators.TechnicalIndicators;
import org.cloudvision.scalp.indicators.model.BollingerBands;
import org.cloudvision.scalp.indicators.model.PivotLevels;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.signal.model.FadeConfirmation;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.cloudvision.scalp.signal.model.TrapModeState;
import org.cloudvision.scalp.signal.model.TrapType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Trap Mode - 1-minute liquidity wick detection
 *
 * A trap is a bar that spikes volume and range into a key level and gets rejected,
 * leaving a long wick against its close. While a trap is active the squeeze path is
 * suppressed and only a fade back through VWAP can alert.
 */
@Component
public class TrapModeDetector {

    private static final Logger logger = LoggerFactory.getLogger(TrapModeDetector.class);

    private static final int BOLLINGER_PERIOD = 20;
    private static final BigDecimal BOLLINGER_MULTIPLIER = BigDecimal.valueOf(2);
    private static final BigDecimal RSI_PIVOT = BigDecimal.valueOf(50);

    private final ScalpSignalProperties properties;

    public TrapModeDetector(ScalpSignalProperties properties) {
        this.properties = properties;
    }

    public TrapModeState detect(List<Candle> candles1m, long candleIndex, TrapModeState previous) {
        if (previous != null && previous.isActiveAt(candleIndex)) {
            return previous;
        }

        int baselineBars = properties.getTrapBaselineBars();
        if (candles1m.size() < baselineBars + 1) {
            return TrapModeState.inactive();
        }

        Candle current = candles1m.get(candles1m.size() - 1);
        List<Candle> baseline = candles1m.subList(candles1m.size() - baselineBars - 1, candles1m.size() - 1);

        BigDecimal volumeSum = BigDecimal.ZERO;
        BigDecimal rangeSum = BigDecimal.ZERO;
        for (Candle candle : baseline) {
            volumeSum = volumeSum.add(candle.getVolume());
            rangeSum = rangeSum.add(candle.getRange());
        }
        BigDecimal bars = BigDecimal.valueOf(baselineBars);
        BigDecimal avgVolume = volumeSum.divide(bars, TechnicalIndicators.SCALE, TechnicalIndicators.ROUNDING);
        BigDecimal avgRange = rangeSum.divide(bars, TechnicalIndicators.SCALE, TechnicalIndicators.ROUNDING);

        BigDecimal range = current.getRange();
        boolean volumeSpike = current.getVolume()
            .compareTo(avgVolume.multiply(properties.getTrapVolumeMultiplier())) >= 0
            && avgVolume.signum() > 0;
        boolean rangeSpike = range.signum() > 0
            && range.compareTo(avgRange.multiply(properties.getTrapRangeMultiplier())) >= 0;
        if (!volumeSpike || !rangeSpike || !tagsKeyLevel(candles1m, current)) {
            return TrapModeState.inactive();
        }

        BigDecimal bodyTop = current.getOpen().max(current.getClose());
        BigDecimal bodyBottom = current.getOpen().min(current.getClose());
        BigDecimal minimumWick = range.multiply(properties.getTrapWickRatio());
        boolean longUpperWick = current.getHigh().subtract(bodyTop).compareTo(minimumWick) >= 0;
        boolean longLowerWick = bodyBottom.subtract(current.getLow()).compareTo(minimumWick) >= 0;

        TrapType type = TrapType.NONE;
        if (longUpperWick && current.isRed()) {
            type = TrapType.UP_WICK;
        } else if (longLowerWick && current.isGreen()) {
            type = TrapType.DOWN_WICK;
        }
        if (type == TrapType.NONE) {
            return TrapModeState.inactive();
        }

        TrapModeState trap = TrapModeState.detected(type, candleIndex, properties.getTrapDurationCandles(), current);
        logger.info("🪤 {} trap detected at candle {} (high {}, low {})",
            type, candleIndex, current.getHigh(), current.getLow());
        return trap;
    }

    /**
     * True when the bar's high or low sits within tolerance of a pivot of the previous
     * bar (R1-R3, S1-S3) or of the Bollinger bands.
     */
    private boolean tagsKeyLevel(List<Candle> candles1m, Candle current) {
        PivotLevels pivots = PriceLevelIndicators.calculatePivotPoints(candles1m.get(candles1m.size() - 2));
        List<BigDecimal> levels = new ArrayList<>(List.of(
            pivots.getR1(), pivots.getR2(), pivots.getR3(),
            pivots.getS1(), pivots.getS2(), pivots.getS3()));

        List<Candle> window = candles1m.subList(Math.max(0, candles1m.size() - BOLLINGER_PERIOD - 1), candles1m.size());
        BollingerBands bands = TechnicalIndicators.calculateBollingerBands(
            TechnicalIndicators.closes(window), BOLLINGER_PERIOD, BOLLINGER_MULTIPLIER);
        if (!bands.isEmpty()) {
            levels.add(bands.getLatestUpper());
            levels.add(bands.getLatestLower());
        }

        BigDecimal lowerFactor = BigDecimal.ONE.subtract(properties.getKeyLevelTolerance());
        BigDecimal upperFactor = BigDecimal.ONE.add(properties.getKeyLevelTolerance());
        for (BigDecimal level : levels) {
            BigDecimal floor = level.multiply(lowerFactor);
            BigDecimal ceiling = level.multiply(upperFactor);
            if (within(current.getHigh(), floor, ceiling) || within(current.getLow(), floor, ceiling)) {
                return true;
            }
        }
        return false;
    }

    private static boolean within(BigDecimal price, BigDecimal floor, BigDecimal ceiling) {
        return price.compareTo(floor) >= 0 && price.compareTo(ceiling) <= 0;
    }

    /**
     * Fade of an up-wick trap: two closes below VWAP, a lower high, RSI under 50 and a
     * red bar. The down-wick case mirrors it.
     */
    public FadeConfirmation confirmFade(List<Candle> candles1m, TrapModeState trap, BigDecimal vwap) {
        if (!trap.isActive() || trap.getTrapCandle() == null || candles1m.size() < 2) {
            return FadeConfirmation.none();
        }

        Candle current = candles1m.get(candles1m.size() - 1);
        Candle prior = candles1m.get(candles1m.size() - 2);
        BigDecimal rsi = TechnicalIndicators.calculateRSI(TechnicalIndicators.closes(candles1m), 14);

        if (trap.getType() == TrapType.UP_WICK
                && current.getClose().compareTo(vwap) < 0
                && prior.getClose().compareTo(vwap) < 0
                && current.getHigh().compareTo(prior.getHigh()) < 0
                && rsi.compareTo(RSI_PIVOT) < 0
                && current.isRed()) {
            return FadeConfirmation.confirmed(TradeDirection.SHORT, "Liquidity trap + VWAP reject");
        }

        if (trap.getType() == TrapType.DOWN_WICK
                && current.getClose().compareTo(vwap) > 0
                && prior.getClose().compareTo(vwap) > 0
                && current.getLow().compareTo(prior.getLow()) > 0
                && rsi.compareTo(RSI_PIVOT) >= 0
                && current.isGreen()) {
            return FadeConfirmation.confirmed(TradeDirection.LONG, "Liquidity trap + VWAP reclaim");
        }

        return FadeConfirmation.none();
    }
}
