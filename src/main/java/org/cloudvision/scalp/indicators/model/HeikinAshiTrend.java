package org.cloudvision.scalp.indicators.model;

public enum HeikinAshiTrend {
    UP, DOWN, NEUTRAL
}
