package org.cloudvision.scalp.signal.model;

public enum ValidatorState {
    BULL,
    BEAR,
    NEUTRAL
}
