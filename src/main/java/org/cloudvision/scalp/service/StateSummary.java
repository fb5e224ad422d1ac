package org.cloudvision.scalp.service;

import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.cloudvision.scalp.signal.model.TrapType;
import org.cloudvision.scalp.signal.model.ValidatorState;

import java.time.Instant;

/**
 * Read-only view of a symbol session for dashboards.
 */
public class StateSummary {
    private final String symbol;
    private final long candleIndex;
    private final DirectorState directorState;
    private final int biasScore;
    private final boolean insideCloud;
    private final ValidatorState validatorState;
    private final boolean trapActive;
    private final TrapType trapType;
    private final boolean cooldownActive;
    private final TradeDirection lastAlertDirection;
    private final Instant lastAlertTimestamp;
    private final int alertCount;

    public StateSummary(String symbol, long candleIndex, DirectorState directorState, int biasScore,
                        boolean insideCloud, ValidatorState validatorState, boolean trapActive, TrapType trapType,
                        boolean cooldownActive, TradeDirection lastAlertDirection, Instant lastAlertTimestamp,
                        int alertCount) {
        this.symbol = symbol;
        this.candleIndex = candleIndex;
        this.directorState = directorState;
        this.biasScore = biasScore;
        this.insideCloud = insideCloud;
        this.validatorState = validatorState;
        this.trapActive = trapActive;
        this.trapType = trapType;
        this.cooldownActive = cooldownActive;
        this.lastAlertDirection = lastAlertDirection;
        this.lastAlertTimestamp = lastAlertTimestamp;
        this.alertCount = alertCount;
    }

    public String getSymbol() { return symbol; }
    public long getCandleIndex() { return candleIndex; }
    public DirectorState getDirectorState() { return directorState; }
    public int getBiasScore() { return biasScore; }
    public boolean isInsideCloud() { return insideCloud; }
    public ValidatorState getValidatorState() { return validatorState; }
    public boolean isTrapActive() { return trapActive; }
    public TrapType getTrapType() { return trapType; }
    public boolean isCooldownActive() { return cooldownActive; }
    public TradeDirection getLastAlertDirection() { return lastAlertDirection; }
    public Instant getLastAlertTimestamp() { return lastAlertTimestamp; }
    public int getAlertCount() { return alertCount; }
}
