package org.cloudvision.scalp.service;

import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.model.Timeframe;
import org.cloudvision.scalp.signal.model.CooldownState;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.ScalpAlert;
import org.cloudvision.scalp.signal.model.ScalpSignalResult;
import org.cloudvision.scalp.signal.model.TrapModeState;
import org.cloudvision.scalp.signal.model.ValidatorResult;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Caller-side pipeline state for one symbol. Fields are guarded by {@link #lock()}.
 */
class SymbolSession {
    private final String symbol;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Timeframe, List<Candle>> lastKnownWindows = new EnumMap<>(Timeframe.class);
    private final Deque<ScalpAlert> alertHistory = new ArrayDeque<>();

    private DirectorResult director;
    private ValidatorResult validator = ValidatorResult.neutral();
    private TrapModeState trap = TrapModeState.inactive();
    private CooldownState cooldown = CooldownState.initial();
    private long candleIndex;
    private Instant lastProcessedCandle;

    SymbolSession(String symbol) {
        this.symbol = symbol;
    }

    String getSymbol() { return symbol; }
    ReentrantLock lock() { return lock; }
    DirectorResult getDirector() { return director; }
    ValidatorResult getValidator() { return validator; }
    TrapModeState getTrap() { return trap; }
    CooldownState getCooldown() { return cooldown; }
    long getCandleIndex() { return candleIndex; }
    Instant getLastProcessedCandle() { return lastProcessedCandle; }

    List<Candle> getWindow(Timeframe timeframe) {
        return lastKnownWindows.getOrDefault(timeframe, List.of());
    }

    void putWindow(Timeframe timeframe, List<Candle> candles) {
        lastKnownWindows.put(timeframe, List.copyOf(candles));
    }

    long nextCandleIndex() {
        return ++candleIndex;
    }

    void apply(ScalpSignalResult result, Instant processedCandle, int maxHistory) {
        director = result.getDirector();
        validator = result.getValidator();
        trap = result.getTrap();
        cooldown = result.getCooldown();
        lastProcessedCandle = processedCandle;
        if (result.hasAlert()) {
            alertHistory.addFirst(result.getAlert());
            while (alertHistory.size() > maxHistory) {
                alertHistory.removeLast();
            }
        }
    }

    /** Most recent first. */
    List<ScalpAlert> getAlertHistory() {
        return new ArrayList<>(alertHistory);
    }
}
