package org.cloudvision.scalp.controller.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.cloudvision.scalp.model.Candle;

import java.time.Instant;
import java.util.List;

/**
 * Candle windows for one evaluation. A missing timeframe reuses the session's
 * last-known window; a missing timestamp means "now".
 */
public class EvaluateRequest {
    private final List<Candle> candles1m;
    private final List<Candle> candles2m;
    private final List<Candle> candles5m;
    private final Instant timestamp;

    @JsonCreator
    public EvaluateRequest(@JsonProperty("candles1m") List<Candle> candles1m,
                           @JsonProperty("candles2m") List<Candle> candles2m,
                           @JsonProperty("candles5m") List<Candle> candles5m,
                           @JsonProperty("timestamp") Instant timestamp) {
        this.candles1m = candles1m;
        this.candles2m = candles2m;
        this.candles5m = candles5m;
        this.timestamp = timestamp;
    }

    public List<Candle> getCandles1m() { return candles1m; }
    public List<Candle> getCandles2m() { return candles2m; }
    public List<Candle> getCandles5m() { return candles5m; }
    public Instant getTimestamp() { return timestamp; }
}
