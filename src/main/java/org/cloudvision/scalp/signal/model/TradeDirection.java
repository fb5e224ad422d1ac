package org.cloudvision.scalp.signal.model;

public enum TradeDirection {
    LONG,
    SHORT;

    public TradeDirection opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
