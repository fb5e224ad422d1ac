package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.indicators.PriceLevelIndicators;
import org.cloudvision.scalp.indicators.TechnicalIndicators;
import org.cloudvision.scalp.indicators.model.AdxResult;
import org.cloudvision.scalp.indicators.model.EwoResult;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.ValidatorConditions;
import org.cloudvision.scalp.signal.model.ValidatorResult;
import org.cloudvision.scalp.signal.model.ValidatorState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Validator - 2-minute confirmation gate
 *
 * A side is valid only when all five of its conditions hold. The state follows
 * the Director: BULL needs a valid long side and a BULL Director, BEAR mirrors it.
 * ADX comes from the 2-minute series, or from the 1-minute series when the
 * 2-minute one is too short to show a slope.
 */
@Component
public class Validator {

    private static final int SUPERTREND_PERIOD = 7;
    private static final BigDecimal SUPERTREND_MULTIPLIER = new BigDecimal("2.5");
    private static final BigDecimal RSI_LONG = BigDecimal.valueOf(52);
    private static final BigDecimal RSI_SHORT = BigDecimal.valueOf(48);
    private static final int ADX_PERIOD = 14;

    private final ScalpSignalProperties properties;

    public Validator(ScalpSignalProperties properties) {
        this.properties = properties;
    }

    public ValidatorResult evaluate(List<Candle> candles2m, List<Candle> candles1m, DirectorResult director) {
        if (candles2m.size() < properties.getMinBars()) {
            return ValidatorResult.neutral();
        }

        BigDecimal close = candles2m.get(candles2m.size() - 1).getClose();
        BigDecimal vwap = PriceLevelIndicators.calculateVWAP(candles2m).getVwap();
        int trend = TechnicalIndicators
            .calculateSuperTrend(candles2m, SUPERTREND_PERIOD, SUPERTREND_MULTIPLIER)
            .getLatestTrend();

        List<BigDecimal> rsi = TechnicalIndicators.rsiSeries(TechnicalIndicators.closes(candles2m), 14);
        BigDecimal currentRsi = TechnicalIndicators.latest(rsi, BigDecimal.valueOf(50));
        BigDecimal previousRsi = TechnicalIndicators.previous(rsi, BigDecimal.valueOf(50));

        EwoResult ewo = TechnicalIndicators.calculateEWO(candles2m, 5, 35);
        AdxResult adx = slopedAdx(candles2m, candles1m);
        boolean adxOk = adx.getAdx().compareTo(properties.getAdxTrendThreshold()) >= 0 || adx.isRising();

        ValidatorConditions longConditions = new ValidatorConditions(
            close.compareTo(vwap) > 0,
            trend == 1,
            currentRsi.compareTo(RSI_LONG) >= 0 && currentRsi.compareTo(previousRsi) > 0,
            ewo.getCurrent().signum() > 0 || ewo.isRising(),
            adxOk
        );
        ValidatorConditions shortConditions = new ValidatorConditions(
            close.compareTo(vwap) < 0,
            trend == -1,
            currentRsi.compareTo(RSI_SHORT) <= 0 && currentRsi.compareTo(previousRsi) < 0,
            ewo.getCurrent().signum() < 0 || ewo.isFalling(),
            adxOk
        );

        ValidatorState state = ValidatorState.NEUTRAL;
        if (longConditions.allMet() && director.getState() == DirectorState.BULL) {
            state = ValidatorState.BULL;
        } else if (shortConditions.allMet() && director.getState() == DirectorState.BEAR) {
            state = ValidatorState.BEAR;
        }
        return new ValidatorResult(state, longConditions, shortConditions);
    }

    /**
     * 2-minute ADX, or 1-minute ADX when the 2-minute series has no slope yet.
     * The fallback is only reachable with {@code min-bars} configured below 30: a 30-bar
     * 2-minute window already yields at least two ADX values.
     */
    private AdxResult slopedAdx(List<Candle> candles2m, List<Candle> candles1m) {
        AdxResult adx = TechnicalIndicators.calculateADX(candles2m, ADX_PERIOD);
        if (adx.getAdxSeries().size() >= 2 || candles1m == null) {
            return adx;
        }
        AdxResult fallback = TechnicalIndicators.calculateADX(candles1m, ADX_PERIOD);
        return fallback.getAdxSeries().size() >= 2 ? fallback : adx;
    }
}
