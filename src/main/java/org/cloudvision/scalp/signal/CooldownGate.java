package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.signal.model.CooldownState;
import org.cloudvision.scalp.signal.model.GateDecision;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Re-alert gate for squeeze alerts.
 * Opposite direction: blocked for the cooldown window after the last alert.
 * Same direction: blocked until price has retested VWAP since the last alert.
 */
@Component
public class CooldownGate {

    private final ScalpSignalProperties properties;

    public CooldownGate(ScalpSignalProperties properties) {
        this.properties = properties;
    }

    public GateDecision check(TradeDirection direction, CooldownState state, Instant now) {
        if (!state.hasAlerted()) {
            return GateDecision.allowed();
        }

        if (state.getLastAlertDirection() != direction && isOppositeWindowOpen(state, now)) {
            Duration remaining = properties.getOppositeDirectionCooldown()
                .minus(Duration.between(state.getLastAlertTimestamp(), now));
            long seconds = (remaining.toMillis() + 999) / 1000;
            return GateDecision.blocked("Opposite direction cooldown: " + seconds + "s remaining");
        }

        if (state.getLastAlertDirection() == direction && !state.isVwapRetestSinceLastAlert()) {
            return GateDecision.blocked("Same direction blocked until VWAP retest");
        }

        return GateDecision.allowed();
    }

    public boolean isOppositeWindowOpen(CooldownState state, Instant now) {
        if (!state.hasAlerted()) {
            return false;
        }
        Duration elapsed = Duration.between(state.getLastAlertTimestamp(), now);
        return elapsed.compareTo(properties.getOppositeDirectionCooldown()) < 0;
    }
}
