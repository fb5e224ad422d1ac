package org.cloudvision.scalp.indicators.model;

/**
 * Discrete action emitted on the bar where a crossover or flip happens.
 */
public enum SignalAction {
    BUY, SELL, HOLD
}
