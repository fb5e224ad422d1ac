package org.cloudvision.scalp.indicators.model;

/**
 * Where the latest close sits relative to VWAP and its deviation bands.
 */
public enum VwapPosition {
    ABOVE_UPPER,
    ABOVE_VWAP,
    AT_VWAP,
    BELOW_VWAP,
    BELOW_LOWER
}
