package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.indicators.PriceLevelIndicators;
import org.cloudvision.scalp.indicators.TechnicalIndicators;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.signal.model.AlertType;
import org.cloudvision.scalp.signal.model.ChopCheck;
import org.cloudvision.scalp.signal.model.CooldownState;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.FadeConfirmation;
import org.cloudvision.scalp.signal.model.GateDecision;
import org.cloudvision.scalp.signal.model.ScalpAlert;
import org.cloudvision.scalp.signal.model.ScalpSignalInput;
import org.cloudvision.scalp.signal.model.ScalpSignalResult;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.cloudvision.scalp.signal.model.TrapModeState;
import org.cloudvision.scalp.signal.model.TriggerResult;
import org.cloudvision.scalp.signal.model.ValidatorResult;
import org.cloudvision.scalp.signal.model.ValidatorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

/**
 * Alert Orchestrator
 *
 * Composes the pipeline into at most one alert per 1-minute bar close:
 * Director → Validator → Trap Mode (fade or suppress) → Chop Filter → Trigger
 * → Cooldown → Confidence.
 *
 * Stateless between calls. Director, trap and cooldown state come in with the
 * input and go back out with the result, so callers own them and must not run two
 * evaluations for the same symbol concurrently.
 */
@Component
public class AlertOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(AlertOrchestrator.class);

    private static final int ATR_PERIOD = 14;
    private static final String SQUEEZE_HOLD_TIME = "5-15 min";
    private static final String FADE_HOLD_TIME = "3-8 min";

    private final ScalpSignalProperties properties;
    private final Director director;
    private final Validator validator;
    private final ChopFilter chopFilter;
    private final TrapModeDetector trapModeDetector;
    private final Trigger trigger;
    private final ConfidenceScorer confidenceScorer;
    private final CooldownGate cooldownGate;

    @Autowired
    public AlertOrchestrator(ScalpSignalProperties properties, Director director, Validator validator,
                             ChopFilter chopFilter, TrapModeDetector trapModeDetector, Trigger trigger,
                             ConfidenceScorer confidenceScorer, CooldownGate cooldownGate) {
        this.properties = properties;
        this.director = director;
        this.validator = validator;
        this.chopFilter = chopFilter;
        this.trapModeDetector = trapModeDetector;
        this.trigger = trigger;
        this.confidenceScorer = confidenceScorer;
        this.cooldownGate = cooldownGate;
    }

    public AlertOrchestrator(ScalpSignalProperties properties) {
        this(properties, new Director(properties), new Validator(properties), new ChopFilter(properties),
            new TrapModeDetector(properties), new Trigger(properties), new ConfidenceScorer(properties),
            new CooldownGate(properties));
    }

    public ScalpSignalResult evaluate(ScalpSignalInput input) {
        Instant now = input.getNow();
        List<Candle> candles1m = input.getCandles1m();
        List<Candle> candles2m = input.getCandles2m();
        List<Candle> candles5m = input.getCandles5m();

        DirectorResult directorResult = director.evaluate(candles5m, now, input.getPreviousDirector());
        ValidatorResult validatorResult = validator.evaluate(candles2m, candles1m, directorResult);
        TrapModeState trap = trapModeDetector.detect(candles1m, input.getCandleIndex(), input.getPreviousTrap());
        ChopCheck chop = chopFilter.evaluate(directorResult, candles5m, candles2m, candles1m);

        BigDecimal vwap = PriceLevelIndicators.calculateVWAP(candles1m).getVwap();
        BigDecimal price = candles1m.isEmpty() ? BigDecimal.ZERO : candles1m.get(candles1m.size() - 1).getClose();
        CooldownState cooldown = input.getCooldown();
        if (!candles1m.isEmpty() && ChopFilter.isNearVwap(price, vwap, properties.getVwapTouchTolerance())) {
            cooldown = cooldown.withVwapRetest();
        }

        Outcome outcome = new Outcome(directorResult, validatorResult, trap, cooldown, chop);

        if (candles1m.size() < properties.getMinBars()) {
            return outcome.suppressed("Insufficient 1m history (" + candles1m.size() + " bars)");
        }

        if (trap.isActive()) {
            FadeConfirmation fade = trapModeDetector.confirmFade(candles1m, trap, vwap);
            if (!fade.isConfirmed()) {
                return outcome.suppressed("Trap mode active (" + trap.getType() + ")");
            }
            ScalpAlert alert = fadeAlert(fade, trap, directorResult, price, atr(candles1m), now);
            logger.info("🔔 {}", alert);
            return outcome.emitted(alert, TrapModeState.inactive(),
                cooldown.afterAlert(fade.getDirection(), now), TriggerResult.invalid());
        }

        if (chop.isChop()) {
            return outcome.suppressed(chop.getReason());
        }
        if (directorResult.getState() == DirectorState.CHOP) {
            return outcome.suppressed("Director is CHOP");
        }

        TriggerResult triggerResult = trigger.evaluate(candles1m, directorResult, validatorResult, trap);
        if (!triggerResult.isValid()) {
            return outcome.suppressed("Trigger conditions not met", triggerResult);
        }

        GateDecision gate = cooldownGate.check(triggerResult.getDirection(), cooldown, now);
        if (!gate.isAllowed()) {
            logger.debug("{} squeeze blocked: {}", triggerResult.getDirection(), gate.getReason());
            return outcome.suppressed(gate.getReason(), triggerResult);
        }

        int confidence = confidenceScorer.score(directorResult, validatorResult, triggerResult.getConditions(),
            triggerResult.getRvol(), triggerResult.isAdxRising(), triggerResult.getAdx());
        ScalpAlert alert = squeezeAlert(triggerResult, directorResult, validatorResult, confidence,
            price, atr(candles1m), now);
        logger.info("🔔 {}", alert);
        return outcome.emitted(alert, trap, cooldown.afterAlert(triggerResult.getDirection(), now), triggerResult);
    }

    private ScalpAlert squeezeAlert(TriggerResult triggerResult, DirectorResult directorResult,
                                    ValidatorResult validatorResult, int confidence,
                                    BigDecimal price, BigDecimal atr, Instant now) {
        TradeDirection direction = triggerResult.getDirection();
        boolean isLong = direction == TradeDirection.LONG;
        BigDecimal stopOffset = atr.multiply(properties.getSqueezeStopAtr());
        BigDecimal targetOffset = atr.multiply(properties.getSqueezeTargetAtr());

        String rvol = triggerResult.getRvol().setScale(1, RoundingMode.HALF_UP).toPlainString();
        String reason = (isLong ? "VWAP hold + RVOL " : "VWAP loss + RVOL ") + rvol + "x";

        return ScalpAlert.builder()
            .id("squeeze-" + direction + "-" + now.toEpochMilli())
            .type(AlertType.squeeze(direction))
            .timestamp(now)
            .confidence(confidence)
            .shouldPush(confidenceScorer.shouldPush(confidence))
            .director(directorResult.getState())
            .validator(validatorResult.getState())
            .triggerReason(reason)
            .explanation(explanation(directorResult.getState(), validatorResult.getState().name(), reason))
            .entryPrice(price)
            .stopLoss(scaled(isLong ? price.subtract(stopOffset) : price.add(stopOffset)))
            .targetPrice(scaled(isLong ? price.add(targetOffset) : price.subtract(targetOffset)))
            .holdTime(SQUEEZE_HOLD_TIME)
            .build();
    }

    /**
     * Fade stops sit beyond the trap wick rather than the entry.
     */
    private ScalpAlert fadeAlert(FadeConfirmation fade, TrapModeState trap, DirectorResult directorResult,
                                 BigDecimal price, BigDecimal atr, Instant now) {
        TradeDirection direction = fade.getDirection();
        boolean isLong = direction == TradeDirection.LONG;
        BigDecimal stopOffset = atr.multiply(properties.getFadeStopAtr());
        BigDecimal targetOffset = atr.multiply(properties.getFadeTargetAtr());
        int confidence = properties.getTrapFadeConfidence();

        return ScalpAlert.builder()
            .id("trap-fade-" + direction + "-" + now.toEpochMilli())
            .type(AlertType.trapFade(direction))
            .timestamp(now)
            .confidence(confidence)
            .shouldPush(confidenceScorer.shouldPush(confidence))
            .director(directorResult.getState())
            .validator(ValidatorState.NEUTRAL)
            .triggerReason(fade.getReason())
            .explanation(explanation(directorResult.getState(), "n/a", fade.getReason()))
            .entryPrice(price)
            .stopLoss(scaled(isLong ? trap.getWickLow().subtract(stopOffset) : trap.getWickHigh().add(stopOffset)))
            .targetPrice(scaled(isLong ? price.add(targetOffset) : price.subtract(targetOffset)))
            .holdTime(FADE_HOLD_TIME)
            .build();
    }

    private static String explanation(DirectorState directorState, String validatorLabel, String reason) {
        return "Director: " + directorState + " | Validator: " + validatorLabel + " | Trigger: " + reason;
    }

    /** ATR(14) of the 1-minute series, 1 when unavailable. */
    private static BigDecimal atr(List<Candle> candles1m) {
        BigDecimal atr = TechnicalIndicators.calculateATR(candles1m, ATR_PERIOD);
        return atr.signum() > 0 ? atr : BigDecimal.ONE;
    }

    private static BigDecimal scaled(BigDecimal value) {
        return value.setScale(TechnicalIndicators.SCALE, TechnicalIndicators.ROUNDING);
    }

    /**
     * State shared by every exit of one evaluation.
     */
    private static final class Outcome {
        private final DirectorResult director;
        private final ValidatorResult validator;
        private final TrapModeState trap;
        private final CooldownState cooldown;
        private final ChopCheck chop;

        private Outcome(DirectorResult director, ValidatorResult validator, TrapModeState trap,
                        CooldownState cooldown, ChopCheck chop) {
            this.director = director;
            this.validator = validator;
            this.trap = trap;
            this.cooldown = cooldown;
            this.chop = chop;
        }

        ScalpSignalResult suppressed(String reason) {
            return suppressed(reason, TriggerResult.invalid());
        }

        ScalpSignalResult suppressed(String reason, TriggerResult triggerResult) {
            logger.debug("No alert: {}", reason);
            return new ScalpSignalResult(null, director, validator, trap, cooldown, chop, triggerResult, reason);
        }

        ScalpSignalResult emitted(ScalpAlert alert, TrapModeState nextTrap, CooldownState nextCooldown,
                                  TriggerResult triggerResult) {
            return new ScalpSignalResult(alert, director, validator, nextTrap, nextCooldown, chop,
                triggerResult, null);
        }
    }
}
