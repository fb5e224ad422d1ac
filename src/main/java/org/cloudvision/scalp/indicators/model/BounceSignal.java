package org.cloudvision.scalp.indicators.model;

/**
 * Support/resistance bounce classification.
 */
public enum BounceSignal {
    STRONG_BUY, BUY, SELL, STRONG_SELL, NONE
}
