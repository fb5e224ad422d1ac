package org.cloudvision.scalp.controller.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.cloudvision.scalp.model.Candle;

import java.util.List;

public class SnapshotRequest {
    private final List<Candle> candles;

    @JsonCreator
    public SnapshotRequest(@JsonProperty("candles") List<Candle> candles) {
        this.candles = candles;
    }

    public List<Candle> getCandles() { return candles; }
}
