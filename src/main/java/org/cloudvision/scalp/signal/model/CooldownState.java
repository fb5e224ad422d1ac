package org.cloudvision.scalp.signal.model;

import java.time.Instant;

/**
 * Cross-cycle re-alert suppression. Immutable; transitions return new instances.
 */
public class CooldownState {
    private static final CooldownState INITIAL = new CooldownState(null, null, false, false);

    private final TradeDirection lastAlertDirection;
    private final Instant lastAlertTimestamp;
    private final boolean vwapRetestSinceLastAlert;
    private final boolean sameDirectionBlocked;

    public CooldownState(TradeDirection lastAlertDirection, Instant lastAlertTimestamp,
                         boolean vwapRetestSinceLastAlert, boolean sameDirectionBlocked) {
        this.lastAlertDirection = lastAlertDirection;
        this.lastAlertTimestamp = lastAlertTimestamp;
        this.vwapRetestSinceLastAlert = vwapRetestSinceLastAlert;
        this.sameDirectionBlocked = sameDirectionBlocked;
    }

    public static CooldownState initial() {
        return INITIAL;
    }

    public TradeDirection getLastAlertDirection() { return lastAlertDirection; }
    public Instant getLastAlertTimestamp() { return lastAlertTimestamp; }
    public boolean isVwapRetestSinceLastAlert() { return vwapRetestSinceLastAlert; }
    public boolean isSameDirectionBlocked() { return sameDirectionBlocked; }

    public boolean hasAlerted() {
        return lastAlertDirection != null;
    }

    /**
     * Records a touch of VWAP. No-op before the first alert.
     */
    public CooldownState withVwapRetest() {
        if (!hasAlerted() || vwapRetestSinceLastAlert) {
            return this;
        }
        return new CooldownState(lastAlertDirection, lastAlertTimestamp, true, false);
    }

    public CooldownState afterAlert(TradeDirection direction, Instant timestamp) {
        return new CooldownState(direction, timestamp, false, true);
    }
}
