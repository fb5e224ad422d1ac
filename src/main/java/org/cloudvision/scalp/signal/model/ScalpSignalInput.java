package org.cloudvision.scalp.signal.model;

import org.cloudvision.scalp.model.Candle;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One orchestrator invocation: the three candle windows, the current time, the
 * caller's candle counter and the state returned by the previous invocation.
 */
public class ScalpSignalInput {
    private final List<Candle> candles1m;
    private final List<Candle> candles2m;
    private final List<Candle> candles5m;
    private final Instant now;
    private final long candleIndex;
    private final DirectorResult previousDirector;
    private final TrapModeState previousTrap;
    private final CooldownState cooldown;

    private ScalpSignalInput(Builder builder) {
        this.candles1m = builder.candles1m;
        this.candles2m = builder.candles2m;
        this.candles5m = builder.candles5m;
        this.now = Objects.requireNonNull(builder.now, "now");
        this.candleIndex = builder.candleIndex;
        this.previousDirector = builder.previousDirector;
        this.previousTrap = builder.previousTrap;
        this.cooldown = builder.cooldown;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Candle> getCandles1m() { return candles1m; }
    public List<Candle> getCandles2m() { return candles2m; }
    public List<Candle> getCandles5m() { return candles5m; }
    public Instant getNow() { return now; }
    public long getCandleIndex() { return candleIndex; }

    /** May be null on the first invocation. */
    public DirectorResult getPreviousDirector() { return previousDirector; }
    public TrapModeState getPreviousTrap() { return previousTrap; }
    public CooldownState getCooldown() { return cooldown; }

    public static class Builder {
        private List<Candle> candles1m = List.of();
        private List<Candle> candles2m = List.of();
        private List<Candle> candles5m = List.of();
        private Instant now;
        private long candleIndex;
        private DirectorResult previousDirector;
        private TrapModeState previousTrap = TrapModeState.inactive();
        private CooldownState cooldown = CooldownState.initial();

        public Builder candles1m(List<Candle> candles) { this.candles1m = orEmpty(candles); return this; }
        public Builder candles2m(List<Candle> candles) { this.candles2m = orEmpty(candles); return this; }
        public Builder candles5m(List<Candle> candles) { this.candles5m = orEmpty(candles); return this; }
        public Builder now(Instant now) { this.now = now; return this; }
        public Builder candleIndex(long candleIndex) { this.candleIndex = candleIndex; return this; }
        public Builder previousDirector(DirectorResult director) { this.previousDirector = director; return this; }
        public Builder previousTrap(TrapModeState trap) {
            this.previousTrap = trap != null ? trap : TrapModeState.inactive();
            return this;
        }
        public Builder cooldown(CooldownState cooldown) {
            this.cooldown = cooldown != null ? cooldown : CooldownState.initial();
            return this;
        }

        public ScalpSignalInput build() {
            return new ScalpSignalInput(this);
        }

        private static List<Candle> orEmpty(List<Candle> candles) {
            return candles != null ? candles : List.of();
        }
    }
}
