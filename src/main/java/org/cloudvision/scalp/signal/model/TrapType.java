package org.cloudvision.scalp.signal.model;

/**
 * Liquidity-sweep wick shape. An up-wick trap fades short, a down-wick trap fades long.
 */
public enum TrapType {
    UP_WICK,
    DOWN_WICK,
    NONE
}
