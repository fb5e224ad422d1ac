package org.cloudvision.scalp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Thresholds for the scalp signal pipeline, bound from {@code scalp.signal.*}.
 * Defaults are the tuned values the engine ships with.
 */
@ConfigurationProperties(prefix = "scalp.signal")
public class ScalpSignalProperties {

    // Admission thresholds
    private BigDecimal rvolThreshold = new BigDecimal("1.7");
    private int pushConfidenceThreshold = 72;
    private BigDecimal adxTrendThreshold = BigDecimal.valueOf(18);
    private BigDecimal adxChopThreshold = BigDecimal.valueOf(16);
    private int directorBiasThreshold = 3;
    private int strongBiasThreshold = 4;
    private int hysteresisCandles = 2;

    // Minimum history
    private int directorMinBars = 52;
    private int minBars = 30;

    // Chop filter
    private int vwapCrossLookback = 10;
    private int vwapCrossLimit = 3;
    private BigDecimal tightBandwidth = new BigDecimal("0.01");
    private BigDecimal vwapTouchTolerance = new BigDecimal("0.001");

    // Trap mode
    private int trapDurationCandles = 3;
    private int trapBaselineBars = 20;
    private BigDecimal trapVolumeMultiplier = BigDecimal.valueOf(2);
    private BigDecimal trapRangeMultiplier = new BigDecimal("1.6");
    private BigDecimal trapWickRatio = new BigDecimal("0.3");
    private BigDecimal keyLevelTolerance = new BigDecimal("0.001");
    private int trapFadeConfidence = 75;

    // Cooldown
    private Duration oppositeDirectionCooldown = Duration.ofMinutes(3);

    // Risk levels in ATR multiples
    private BigDecimal squeezeStopAtr = new BigDecimal("0.5");
    private BigDecimal squeezeTargetAtr = BigDecimal.ONE;
    private BigDecimal fadeStopAtr = new BigDecimal("0.3");
    private BigDecimal fadeTargetAtr = new BigDecimal("0.8");

    // Session handling
    private int maxAlertHistory = 50;
    private Duration singleFlightWait = Duration.ZERO;
    private int staleAfterBars = 2;

    public BigDecimal getRvolThreshold() { return rvolThreshold; }
    public void setRvolThreshold(BigDecimal rvolThreshold) { this.rvolThreshold = rvolThreshold; }

    public int getPushConfidenceThreshold() { return pushConfidenceThreshold; }
    public void setPushConfidenceThreshold(int pushConfidenceThreshold) { this.pushConfidenceThreshold = pushConfidenceThreshold; }

    public BigDecimal getAdxTrendThreshold() { return adxTrendThreshold; }
    public void setAdxTrendThreshold(BigDecimal adxTrendThreshold) { this.adxTrendThreshold = adxTrendThreshold; }

    public BigDecimal getAdxChopThreshold() { return adxChopThreshold; }
    public void setAdxChopThreshold(BigDecimal adxChopThreshold) { this.adxChopThreshold = adxChopThreshold; }

    public int getDirectorBiasThreshold() { return directorBiasThreshold; }
    public void setDirectorBiasThreshold(int directorBiasThreshold) { this.directorBiasThreshold = directorBiasThreshold; }

    public int getStrongBiasThreshold() { return strongBiasThreshold; }
    public void setStrongBiasThreshold(int strongBiasThreshold) { this.strongBiasThreshold = strongBiasThreshold; }

    public int getHysteresisCandles() { return hysteresisCandles; }
    public void setHysteresisCandles(int hysteresisCandles) { this.hysteresisCandles = hysteresisCandles; }

    public int getDirectorMinBars() { return directorMinBars; }
    public void setDirectorMinBars(int directorMinBars) { this.directorMinBars = directorMinBars; }

    public int getMinBars() { return minBars; }
    public void setMinBars(int minBars) { this.minBars = minBars; }

    public int getVwapCrossLookback() { return vwapCrossLookback; }
    public void setVwapCrossLookback(int vwapCrossLookback) { this.vwapCrossLookback = vwapCrossLookback; }

    public int getVwapCrossLimit() { return vwapCrossLimit; }
    public void setVwapCrossLimit(int vwapCrossLimit) { this.vwapCrossLimit = vwapCrossLimit; }

    public BigDecimal getTightBandwidth() { return tightBandwidth; }
    public void setTightBandwidth(BigDecimal tightBandwidth) { this.tightBandwidth = tightBandwidth; }

    public BigDecimal getVwapTouchTolerance() { return vwapTouchTolerance; }
    public void setVwapTouchTolerance(BigDecimal vwapTouchTolerance) { this.vwapTouchTolerance = vwapTouchTolerance; }

    public int getTrapDurationCandles() { return trapDurationCandles; }
    public void setTrapDurationCandles(int trapDurationCandles) { this.trapDurationCandles = trapDurationCandles; }

    public int getTrapBaselineBars() { return trapBaselineBars; }
    public void setTrapBaselineBars(int trapBaselineBars) { this.trapBaselineBars = trapBaselineBars; }

    public BigDecimal getTrapVolumeMultiplier() { return trapVolumeMultiplier; }
    public void setTrapVolumeMultiplier(BigDecimal trapVolumeMultiplier) { this.trapVolumeMultiplier = trapVolumeMultiplier; }

    public BigDecimal getTrapRangeMultiplier() { return trapRangeMultiplier; }
    public void setTrapRangeMultiplier(BigDecimal trapRangeMultiplier) { this.trapRangeMultiplier = trapRangeMultiplier; }

    public BigDecimal getTrapWickRatio() { return trapWickRatio; }
    public void setTrapWickRatio(BigDecimal trapWickRatio) { this.trapWickRatio = trapWickRatio; }

    public BigDecimal getKeyLevelTolerance() { return keyLevelTolerance; }
    public void setKeyLevelTolerance(BigDecimal keyLevelTolerance) { this.keyLevelTolerance = keyLevelTolerance; }

    public int getTrapFadeConfidence() { return trapFadeConfidence; }
    public void setTrapFadeConfidence(int trapFadeConfidence) { this.trapFadeConfidence = trapFadeConfidence; }

    public Duration getOppositeDirectionCooldown() { return oppositeDirectionCooldown; }
    public void setOppositeDirectionCooldown(Duration oppositeDirectionCooldown) { this.oppositeDirectionCooldown = oppositeDirectionCooldown; }

    public BigDecimal getSqueezeStopAtr() { return squeezeStopAtr; }
    public void setSqueezeStopAtr(BigDecimal squeezeStopAtr) { this.squeezeStopAtr = squeezeStopAtr; }

    public BigDecimal getSqueezeTargetAtr() { return squeezeTargetAtr; }
    public void setSqueezeTargetAtr(BigDecimal squeezeTargetAtr) { this.squeezeTargetAtr = squeezeTargetAtr; }

    public BigDecimal getFadeStopAtr() { return fadeStopAtr; }
    public void setFadeStopAtr(BigDecimal fadeStopAtr) { this.fadeStopAtr = fadeStopAtr; }

    public BigDecimal getFadeTargetAtr() { return fadeTargetAtr; }
    public void setFadeTargetAtr(BigDecimal fadeTargetAtr) { this.fadeTargetAtr = fadeTargetAtr; }

    public int getMaxAlertHistory() { return maxAlertHistory; }
    public void setMaxAlertHistory(int maxAlertHistory) { this.maxAlertHistory = maxAlertHistory; }

    public Duration getSingleFlightWait() { return singleFlightWait; }
    public void setSingleFlightWait(Duration singleFlightWait) { this.singleFlightWait = singleFlightWait; }

    public int getStaleAfterBars() { return staleAfterBars; }
    public void setStaleAfterBars(int staleAfterBars) { this.staleAfterBars = staleAfterBars; }
}
