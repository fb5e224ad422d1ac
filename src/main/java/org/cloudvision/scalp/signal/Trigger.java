package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.indicators.PriceLevelIndicators;
import org.cloudvision.scalp.indicators.TechnicalIndicators;
import org.cloudvision.scalp.indicators.model.AdxResult;
import org.cloudvision.scalp.indicators.model.BollingerBands;
import org.cloudvision.scalp.indicators.model.EwoResult;
import org.cloudvision.scalp.indicators.model.PivotLevels;
import org.cloudvision.scalp.indicators.model.RvolResult;
import org.cloudvision.scalp.indicators.model.SuperTrendResult;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.cloudvision.scalp.signal.model.TrapModeState;
import org.cloudvision.scalp.signal.model.TriggerConditions;
import org.cloudvision.scalp.signal.model.TriggerResult;
import org.cloudvision.scalp.signal.model.ValidatorResult;
import org.cloudvision.scalp.signal.model.ValidatorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Trigger - 1-minute entry timing
 *
 * Runs only when the Validator agrees with the Director. The side they agree on must
 * pass all nine checks:
 * - last N closes on the right side of VWAP (hysteresis)
 * - last N SuperTrend(7, 2.5) bars in the trade's colour
 * - RVOL(20) at or above threshold
 * - ADX(14) at or above the trend threshold and not falling
 * - RSI(14) at least 52 and rising (short: at most 48 and falling)
 * - EWO(5, 35) positive and rising (short: negative and falling)
 * - 5-minute price outside the Ichimoku cloud
 * - break of R1, or hold above S1 and VWAP, against the previous bar's pivots
 * - Bollinger(20, 2) width more than 10% wider than five bars back, close on the
 *   trade's side of the middle band
 */
@Component
public class Trigger {

    private static final Logger logger = LoggerFactory.getLogger(Trigger.class);

    private static final BigDecimal SUPERTREND_MULTIPLIER = new BigDecimal("2.5");
    private static final BigDecimal RSI_LONG = BigDecimal.valueOf(52);
    private static final BigDecimal RSI_SHORT = BigDecimal.valueOf(48);
    private static final BigDecimal BOLLINGER_MULTIPLIER = BigDecimal.valueOf(2);
    private static final BigDecimal EXPANSION_FACTOR = new BigDecimal("1.1");
    private static final int BOLLINGER_LAG = 5;

    private final ScalpSignalProperties properties;

    public Trigger(ScalpSignalProperties properties) {
        this.properties = properties;
    }

    public TriggerResult evaluate(List<Candle> candles1m, DirectorResult director,
                                  ValidatorResult validator, TrapModeState trap) {
        if (candles1m.size() < properties.getMinBars() || trap.isActive()) {
            return TriggerResult.invalid();
        }

        TradeDirection direction;
        if (director.getState() == DirectorState.BULL && validator.getState() == ValidatorState.BULL) {
            direction = TradeDirection.LONG;
        } else if (director.getState() == DirectorState.BEAR && validator.getState() == ValidatorState.BEAR) {
            direction = TradeDirection.SHORT;
        } else {
            return TriggerResult.invalid();
        }
        boolean isLong = direction == TradeDirection.LONG;

        Candle current = candles1m.get(candles1m.size() - 1);
        BigDecimal close = current.getClose();
        BigDecimal vwap = PriceLevelIndicators.calculateVWAP(candles1m).getVwap();

        boolean vwapHysteresis = holdsVwapSide(candles1m, vwap, isLong);

        SuperTrendResult superTrend = TechnicalIndicators.calculateSuperTrend(candles1m, 7, SUPERTREND_MULTIPLIER);
        boolean superTrendHysteresis = superTrend.lastTrendsEqual(properties.getHysteresisCandles(), isLong ? 1 : -1);

        RvolResult rvol = PriceLevelIndicators.calculateRVOL(candles1m, 20);
        boolean rvolOk = rvol.getRvol().compareTo(properties.getRvolThreshold()) >= 0;

        AdxResult adx = TechnicalIndicators.calculateADX(candles1m, 14);
        boolean adxOk = adx.getAdx().compareTo(properties.getAdxTrendThreshold()) >= 0
            && adx.getAdx().compareTo(adx.getPreviousAdx()) >= 0;

        List<BigDecimal> closes = TechnicalIndicators.closes(candles1m);
        List<BigDecimal> rsi = TechnicalIndicators.rsiSeries(closes, 14);
        BigDecimal currentRsi = TechnicalIndicators.latest(rsi, BigDecimal.valueOf(50));
        BigDecimal previousRsi = TechnicalIndicators.previous(rsi, BigDecimal.valueOf(50));
        boolean rsiOk = isLong
            ? currentRsi.compareTo(RSI_LONG) >= 0 && currentRsi.compareTo(previousRsi) > 0
            : currentRsi.compareTo(RSI_SHORT) <= 0 && currentRsi.compareTo(previousRsi) < 0;

        EwoResult ewo = TechnicalIndicators.calculateEWO(candles1m, 5, 35);
        boolean ewoOk = isLong
            ? ewo.getCurrent().signum() > 0 && ewo.isRising()
            : ewo.getCurrent().signum() < 0 && ewo.isFalling();

        PivotLevels pivots = PriceLevelIndicators.calculatePivotPoints(candles1m.get(candles1m.size() - 2));
        boolean pivotOk = isLong
            ? close.compareTo(pivots.getR1()) > 0
                || (close.compareTo(pivots.getS1()) > 0 && close.compareTo(vwap) > 0)
            : close.compareTo(pivots.getS1()) < 0
                || (close.compareTo(pivots.getR1()) < 0 && close.compareTo(vwap) < 0);

        BollingerBands bands = TechnicalIndicators.calculateBollingerBands(closes, 20, BOLLINGER_MULTIPLIER);
        boolean bollingerOk = isBollingerExpanding(bands) && (isLong
            ? close.compareTo(bands.getLatestMiddle()) > 0
            : close.compareTo(bands.getLatestMiddle()) < 0);

        TriggerConditions conditions = new TriggerConditions(vwapHysteresis, superTrendHysteresis, rvolOk,
            adxOk, rsiOk, ewoOk, !director.isInsideCloud(), pivotOk, bollingerOk);

        boolean valid = conditions.allMet();
        if (!valid) {
            logger.debug("Trigger {} rejected: {}", direction, conditions);
        }
        return new TriggerResult(valid, valid ? direction : null, conditions,
            rvol.getRvol(), adx.getAdx(), adx.isRising());
    }

    private boolean holdsVwapSide(List<Candle> candles1m, BigDecimal vwap, boolean isLong) {
        int count = properties.getHysteresisCandles();
        if (candles1m.size() < count) {
            return false;
        }
        for (Candle candle : candles1m.subList(candles1m.size() - count, candles1m.size())) {
            int side = candle.getClose().compareTo(vwap);
            if (isLong ? side <= 0 : side >= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Latest band width against the width five values back. With too little history
     * the reference width is zero, so any positive width counts as expanding.
     */
    private static boolean isBollingerExpanding(BollingerBands bands) {
        if (bands.isEmpty()) {
            return false;
        }
        BigDecimal current = bands.getWidth(bands.size() - 1);
        BigDecimal reference = bands.size() > BOLLINGER_LAG
            ? bands.getWidth(bands.size() - BOLLINGER_LAG)
            : BigDecimal.ZERO;
        return current.compareTo(reference.multiply(EXPANSION_FACTOR)) > 0;
    }
}
