package org.cloudvision.scalp.indicators.model;

import org.cloudvision.scalp.model.Candle;

import java.util.Collections;
import java.util.List;

public class HeikinAshiResult {
    private final List<Candle> candles;
    private final HeikinAshiTrend trend;

    public HeikinAshiResult(List<Candle> candles, HeikinAshiTrend trend) {
        this.candles = Collections.unmodifiableList(candles);
        this.trend = trend;
    }

    public List<Candle> getCandles() { return candles; }
    public HeikinAshiTrend getTrend() { return trend; }
}
