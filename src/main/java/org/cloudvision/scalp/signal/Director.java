package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.indicators.PriceLevelIndicators;
import org.cloudvision.scalp.indicators.TechnicalIndicators;
import org.cloudvision.scalp.indicators.model.AdxResult;
import org.cloudvision.scalp.indicators.model.EwoResult;
import org.cloudvision.scalp.indicators.model.IchimokuCloud;
import org.cloudvision.scalp.indicators.model.TrendDirection;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.DirectorVotes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Director - 5-minute bias classifier
 *
 * Six indicator votes, each -1/0/+1, are summed into a bias score:
 * - SuperTrend (10, 3) direction
 * - Close above/below the session VWAP
 * - RSI(14) above 55 / below 45
 * - EWO(5, 35) sign agreeing with its slope
 * - ADX(14) at least the trend threshold and rising, in the +DI/-DI direction,
 *   counted only when it agrees with SuperTrend
 * - Price above/below the Ichimoku cloud (0 inside)
 *
 * Price inside the cloud forces CHOP. The result is locked until the next
 * 5-minute boundary so intra-bar invocations see a stable bias.
 */
@Component
public class Director {

    private static final Logger logger = LoggerFactory.getLogger(Director.class);

    private static final int SUPERTREND_PERIOD = 10;
    private static final BigDecimal SUPERTREND_MULTIPLIER = BigDecimal.valueOf(3);
    private static final int RSI_PERIOD = 14;
    private static final BigDecimal RSI_BULL = BigDecimal.valueOf(55);
    private static final BigDecimal RSI_BEAR = BigDecimal.valueOf(45);
    private static final int ADX_PERIOD = 14;
    private static final long LOCK_MINUTES = 5;

    private final ScalpSignalProperties properties;

    public Director(ScalpSignalProperties properties) {
        this.properties = properties;
    }

    public DirectorResult evaluate(List<Candle> candles5m, Instant now, DirectorResult previous) {
        if (candles5m.size() < properties.getDirectorMinBars()) {
            return DirectorResult.insufficientData();
        }
        if (previous != null && previous.isLockedAt(now)) {
            logger.debug("Director cached until {}", previous.getLockedUntil());
            return previous;
        }

        BigDecimal close = candles5m.get(candles5m.size() - 1).getClose();

        int superTrendVote = TechnicalIndicators
            .calculateSuperTrend(candles5m, SUPERTREND_PERIOD, SUPERTREND_MULTIPLIER)
            .getLatestTrend();

        BigDecimal vwap = PriceLevelIndicators.calculateVWAP(candles5m).getVwap();
        int vwapVote = close.compareTo(vwap);

        BigDecimal rsi = TechnicalIndicators.calculateRSI(TechnicalIndicators.closes(candles5m), RSI_PERIOD);
        int rsiVote = rsi.compareTo(RSI_BULL) > 0 ? 1 : rsi.compareTo(RSI_BEAR) < 0 ? -1 : 0;

        EwoResult ewo = TechnicalIndicators.calculateEWO(candles5m, 5, 35);
        int ewoVote = 0;
        if (ewo.getCurrent().signum() > 0 && ewo.isRising()) {
            ewoVote = 1;
        } else if (ewo.getCurrent().signum() < 0 && ewo.isFalling()) {
            ewoVote = -1;
        }

        int adxVote = adxVote(TechnicalIndicators.calculateADX(candles5m, ADX_PERIOD), superTrendVote);

        IchimokuCloud cloud = PriceLevelIndicators.calculateIchimoku(candles5m, 9, 26, 52);
        boolean insideCloud = cloud.isPriceInsideCloud();
        int ichimokuVote = cloud.isPriceAboveCloud() ? 1 : cloud.isPriceBelowCloud() ? -1 : 0;

        DirectorVotes votes = new DirectorVotes(superTrendVote, vwapVote, rsiVote, ewoVote, adxVote, ichimokuVote);
        int score = votes.total();

        DirectorState state;
        if (insideCloud) {
            state = DirectorState.CHOP;
        } else if (score >= properties.getDirectorBiasThreshold()) {
            state = DirectorState.BULL;
        } else if (score <= -properties.getDirectorBiasThreshold()) {
            state = DirectorState.BEAR;
        } else {
            state = DirectorState.CHOP;
        }

        DirectorResult result = new DirectorResult(state, score, votes, nextBoundary(now), insideCloud);
        logger.debug("Director recomputed: {}", result);
        return result;
    }

    /**
     * A strong, rising ADX confirms whichever side +DI/-DI favour. Disagreement with
     * SuperTrend makes it non-confirming.
     */
    private int adxVote(AdxResult adx, int superTrendVote) {
        boolean strong = adx.getAdx().compareTo(properties.getAdxTrendThreshold()) >= 0 && adx.isRising();
        if (!strong) {
            return 0;
        }
        if (adx.getDirection() == TrendDirection.BULLISH && superTrendVote >= 0) {
            return 1;
        }
        if (adx.getDirection() == TrendDirection.BEARISH && superTrendVote <= 0) {
            return -1;
        }
        return 0;
    }

    /**
     * The first 5-minute boundary strictly after the minute containing {@code now}.
     */
    static Instant nextBoundary(Instant now) {
        long epochMinute = Math.floorDiv(now.getEpochSecond(), 60L);
        long boundary = (Math.floorDiv(epochMinute, LOCK_MINUTES) + 1) * LOCK_MINUTES;
        return Instant.ofEpochSecond(boundary * 60L);
    }
}
