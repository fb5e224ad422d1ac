package org.cloudvision.scalp.indicators.model;

/**
 * Directional bias derived from +DI/-DI or cloud position.
 */
public enum TrendDirection {
    BULLISH, BEARISH, NEUTRAL
}
