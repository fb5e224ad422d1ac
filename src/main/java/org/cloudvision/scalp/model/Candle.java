package org.cloudvision.scalp.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable OHLCV bar. The timestamp is the bar's open time.
 */
public class Candle {
    private final Instant timestamp;
    private final BigDecimal open;
    private final BigDecimal high;
    private final BigDecimal low;
    private final BigDecimal close;
    private final BigDecimal volume;

    @JsonCreator
    public Candle(@JsonProperty("timestamp") Instant timestamp,
                  @JsonProperty("open") BigDecimal open,
                  @JsonProperty("high") BigDecimal high,
                  @JsonProperty("low") BigDecimal low,
                  @JsonProperty("close") BigDecimal close,
                  @JsonProperty("volume") BigDecimal volume) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.open = Objects.requireNonNull(open, "open");
        this.high = Objects.requireNonNull(high, "high");
        this.low = Objects.requireNonNull(low, "low");
        this.close = Objects.requireNonNull(close, "close");
        this.volume = volume != null ? volume : BigDecimal.ZERO;
    }

    public static Candle of(Instant timestamp, double open, double high, double low, double close, double volume) {
        return new Candle(timestamp, BigDecimal.valueOf(open), BigDecimal.valueOf(high),
            BigDecimal.valueOf(low), BigDecimal.valueOf(close), BigDecimal.valueOf(volume));
    }

    public Instant getTimestamp() { return timestamp; }
    public BigDecimal getOpen() { return open; }
    public BigDecimal getHigh() { return high; }
    public BigDecimal getLow() { return low; }
    public BigDecimal getClose() { return close; }
    public BigDecimal getVolume() { return volume; }

    public BigDecimal getRange() {
        return high.subtract(low);
    }

    public boolean isGreen() {
        return close.compareTo(open) > 0;
    }

    public boolean isRed() {
        return close.compareTo(open) < 0;
    }

    @Override
    public String toString() {
        return String.format("Candle[%s O:%s H:%s L:%s C:%s V:%s]",
            timestamp, open, high, low, close, volume);
    }
}
