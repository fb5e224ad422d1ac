package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.indicators.PriceLevelIndicators;
import org.cloudvision.scalp.indicators.TechnicalIndicators;
import org.cloudvision.scalp.indicators.model.AdxResult;
import org.cloudvision.scalp.indicators.model.BollingerBands;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.signal.model.ChopCheck;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Cross-timeframe noise veto. Any single condition marks the market as chop.
 */
@Component
public class ChopFilter {

    private static final Logger logger = LoggerFactory.getLogger(ChopFilter.class);

    private static final int ADX_PERIOD = 14;
    private static final int BOLLINGER_PERIOD = 20;
    private static final BigDecimal BOLLINGER_MULTIPLIER = BigDecimal.valueOf(2);

    private final ScalpSignalProperties properties;

    public ChopFilter(ScalpSignalProperties properties) {
        this.properties = properties;
    }

    public ChopCheck evaluate(DirectorResult director, List<Candle> candles5m,
                              List<Candle> candles2m, List<Candle> candles1m) {
        ChopCheck check = check(director, candles5m, candles2m, candles1m);
        if (check.isChop()) {
            logger.debug("Chop: {}", check.getReason());
        }
        return check;
    }

    private ChopCheck check(DirectorResult director, List<Candle> candles5m,
                            List<Candle> candles2m, List<Candle> candles1m) {
        if (director.isInsideCloud()) {
            return ChopCheck.chop("Price inside 5m Ichimoku cloud");
        }
        if (isAdxFading(candles5m)) {
            return ChopCheck.chop("ADX below " + properties.getAdxChopThreshold() + " and falling on 5m");
        }
        if (isAdxFading(candles2m)) {
            return ChopCheck.chop("ADX below " + properties.getAdxChopThreshold() + " and falling on 2m");
        }

        if (candles1m.isEmpty()) {
            return ChopCheck.clear();
        }
        BigDecimal vwap = PriceLevelIndicators.calculateVWAP(candles1m).getVwap();

        int crosses = countVwapCrosses(candles1m, vwap);
        if (crosses >= properties.getVwapCrossLimit()) {
            return ChopCheck.chop("VWAP crossed " + crosses + " times in last "
                + properties.getVwapCrossLookback() + " bars");
        }

        BollingerBands bands = TechnicalIndicators.calculateBollingerBands(
            TechnicalIndicators.closes(candles1m), BOLLINGER_PERIOD, BOLLINGER_MULTIPLIER);
        BigDecimal close = candles1m.get(candles1m.size() - 1).getClose();
        if (!bands.isEmpty()
                && bands.getLatestBandwidth().compareTo(properties.getTightBandwidth()) < 0
                && isNearVwap(close, vwap, properties.getVwapTouchTolerance())) {
            return ChopCheck.chop("Tight Bollinger bands with price pinned to VWAP");
        }

        return ChopCheck.clear();
    }

    private boolean isAdxFading(List<Candle> candles) {
        AdxResult adx = TechnicalIndicators.calculateADX(candles, ADX_PERIOD);
        return adx.getAdxSeries().size() >= 2
            && adx.getAdx().compareTo(properties.getAdxChopThreshold()) < 0
            && adx.isFalling();
    }

    /**
     * Side changes between consecutive closes over the trailing lookback. A close
     * exactly at VWAP counts as below it.
     */
    int countVwapCrosses(List<Candle> candles1m, BigDecimal vwap) {
        int lookback = properties.getVwapCrossLookback();
        if (candles1m.size() < lookback) {
            return 0;
        }
        int crosses = 0;
        boolean previousAbove = false;
        for (int i = candles1m.size() - lookback; i < candles1m.size(); i++) {
            boolean above = candles1m.get(i).getClose().compareTo(vwap) > 0;
            if (i > candles1m.size() - lookback && above != previousAbove) {
                crosses++;
            }
            previousAbove = above;
        }
        return crosses;
    }

    /**
     * |price - vwap| / vwap strictly below the tolerance. False for a zero VWAP.
     */
    static boolean isNearVwap(BigDecimal price, BigDecimal vwap, BigDecimal tolerance) {
        if (vwap.signum() == 0) {
            return false;
        }
        BigDecimal distance = price.subtract(vwap).abs()
            .divide(vwap.abs(), TechnicalIndicators.SCALE, TechnicalIndicators.ROUNDING);
        return distance.compareTo(tolerance) < 0;
    }
}
