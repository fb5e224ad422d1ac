package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.TriggerConditions;
import org.cloudvision.scalp.signal.model.ValidatorResult;
import org.cloudvision.scalp.signal.model.ValidatorState;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Additive 0-100 confidence over the sub-conditions behind a squeeze alert.
 * Every contribution is non-negative, so enabling a condition never lowers the score.
 */
@Component
public class ConfidenceScorer {

    private static final int MAX_CONFIDENCE = 100;

    private final ScalpSignalProperties properties;

    public ConfidenceScorer(ScalpSignalProperties properties) {
        this.properties = properties;
    }

    public int score(DirectorResult director, ValidatorResult validator, TriggerConditions conditions,
                     BigDecimal rvol, boolean adxRising, BigDecimal adx) {
        int score = 0;

        if (Math.abs(director.getBiasScore()) >= properties.getStrongBiasThreshold()) {
            score += 20;
        }
        if (validator.getState() != ValidatorState.NEUTRAL) {
            score += 15;
        }
        if (conditions.isVwapHysteresis()) {
            score += 15;
        }
        if (rvol.compareTo(properties.getRvolThreshold()) >= 0) {
            score += 10;
        }
        if (adxRising || adx.compareTo(properties.getAdxTrendThreshold()) >= 0) {
            score += 10;
        }
        if (conditions.isRsi()) {
            score += 10;
        }
        if (conditions.isEwo()) {
            score += 5;
        }
        if (conditions.isPivotConfirm()) {
            score += 5;
        }
        if (conditions.isBollingerConfirm()) {
            score += 5;
        }

        return Math.min(score, MAX_CONFIDENCE);
    }

    public boolean shouldPush(int confidence) {
        return confidence >= properties.getPushConfidenceThreshold();
    }
}
