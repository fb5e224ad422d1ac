package org.cloudvision.scalp.signal.model;

/**
 * 5-minute bias classification.
 */
public enum DirectorState {
    BULL,
    BEAR,
    CHOP
}
