package org.cloudvision.scalp.service;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.model.Timeframe;
import org.cloudvision.scalp.signal.AlertOrchestrator;
import org.cloudvision.scalp.signal.CooldownGate;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.ScalpAlert;
import org.cloudvision.scalp.signal.model.ScalpSignalInput;
import org.cloudvision.scalp.signal.model.ScalpSignalResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Service for running the signal pipeline once per closed 1-minute bar, per symbol.
 *
 * Provides:
 * - Per-symbol state threading between orchestrator calls
 * - Single-flight evaluation (a busy symbol drops the new call)
 * - Duplicate-bar suppression and candle indexing
 * - Reuse of the last-known window when a timeframe feed is missing, with a stale marker
 * - Bounded alert history, reset and state summaries
 */
@Service
public class ScalpSignalService {

    private static final Logger logger = LoggerFactory.getLogger(ScalpSignalService.class);

    private final Map<String, SymbolSession> sessions = new ConcurrentHashMap<>();
    private final AlertOrchestrator orchestrator;
    private final CooldownGate cooldownGate;
    private final ScalpSignalProperties properties;

    @Autowired
    public ScalpSignalService(AlertOrchestrator orchestrator, CooldownGate cooldownGate,
                              ScalpSignalProperties properties) {
        this.orchestrator = orchestrator;
        this.cooldownGate = cooldownGate;
        this.properties = properties;
    }

    /**
     * Evaluate the pipeline for a symbol.
     *
     * @param candles1m 1-minute window; required for a new session, otherwise the last-known window is reused
     * @param candles2m 2-minute window, may be null or empty
     * @param candles5m 5-minute window, may be null or empty
     * @param now evaluation time, used for the Director lock and the cooldown
     */
    public SessionEvaluation evaluate(String symbol, List<Candle> candles1m, List<Candle> candles2m,
                                      List<Candle> candles5m, Instant now) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        if (now == null) {
            throw new IllegalArgumentException("Evaluation time is required");
        }
        String key = symbol.toUpperCase();
        if (!sessions.containsKey(key) && isEmpty(candles1m)) {
            throw new IllegalArgumentException("1m candles are required to start a session for " + key);
        }

        Map<Timeframe, List<Candle>> supplied = new EnumMap<>(Timeframe.class);
        supplied.put(Timeframe.ONE_MINUTE, candles1m);
        supplied.put(Timeframe.TWO_MINUTE, candles2m);
        supplied.put(Timeframe.FIVE_MINUTE, candles5m);
        supplied.forEach(ScalpSignalService::requireAscending);

        SymbolSession session;
        ReentrantLock lock;
        while (true) {
            session = sessions.computeIfAbsent(key, s -> {
                logger.info("📈 New signal session for {}", s);
                return new SymbolSession(s);
            });
            lock = session.lock();
            if (!tryAcquire(lock)) {
                logger.warn("⚠️ Evaluation for {} dropped: previous evaluation still running", key);
                return new SessionEvaluation(key, EvaluationStatus.DROPPED_BUSY, session.getCandleIndex(),
                    null, EnumSet.noneOf(Timeframe.class));
            }
            if (sessions.get(key) == session) {
                break;
            }
            // reset between lookup and lock; retry on the current session
            lock.unlock();
        }

        try {
            Set<Timeframe> stale = EnumSet.noneOf(Timeframe.class);
            for (Map.Entry<Timeframe, List<Candle>> entry : supplied.entrySet()) {
                resolveWindow(session, entry.getKey(), entry.getValue(), now, stale);
            }

            List<Candle> window1m = session.getWindow(Timeframe.ONE_MINUTE);
            if (window1m.isEmpty()) {
                // a session without a 1m window has never been evaluated
                sessions.remove(key, session);
                throw new IllegalArgumentException("1m candles are required to start a session for " + key);
            }
            if (!stale.isEmpty()) {
                logger.info("Using stale data for {}: {}", key, stale);
            }

            Instant latestCandle = window1m.get(window1m.size() - 1).getTimestamp();
            if (latestCandle.equals(session.getLastProcessedCandle())) {
                return new SessionEvaluation(key, EvaluationStatus.DUPLICATE_CANDLE, session.getCandleIndex(),
                    null, stale);
            }

            long candleIndex = session.nextCandleIndex();
            ScalpSignalInput input = ScalpSignalInput.builder()
                .candles1m(window1m)
                .candles2m(session.getWindow(Timeframe.TWO_MINUTE))
                .candles5m(session.getWindow(Timeframe.FIVE_MINUTE))
                .now(now)
                .candleIndex(candleIndex)
                .previousDirector(session.getDirector())
                .previousTrap(session.getTrap())
                .cooldown(session.getCooldown())
                .build();

            ScalpSignalResult result = orchestrator.evaluate(input);
            session.apply(result, latestCandle, properties.getMaxAlertHistory());

            return new SessionEvaluation(key, EvaluationStatus.EVALUATED, candleIndex, result, stale);
        } finally {
            lock.unlock();
        }
    }

    private boolean tryAcquire(ReentrantLock lock) {
        try {
            return lock.tryLock(properties.getSingleFlightWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Replaces the last-known window when data was supplied. Missing data, or a window
     * whose newest bar is older than the staleness allowance, is marked stale.
     */
    private void resolveWindow(SymbolSession session, Timeframe timeframe, List<Candle> supplied,
                               Instant now, Set<Timeframe> stale) {
        if (!isEmpty(supplied)) {
            session.putWindow(timeframe, supplied);
        } else {
            stale.add(timeframe);
            return;
        }

        Instant newest = supplied.get(supplied.size() - 1).getTimestamp();
        Instant freshUntil = newest.plus(timeframe.getDuration().multipliedBy(properties.getStaleAfterBars()));
        if (freshUntil.isBefore(now)) {
            stale.add(timeframe);
        }
    }

    private static void requireAscending(Timeframe timeframe, List<Candle> candles) {
        if (candles == null) {
            return;
        }
        for (int i = 1; i < candles.size(); i++) {
            if (!candles.get(i).getTimestamp().isAfter(candles.get(i - 1).getTimestamp())) {
                throw new IllegalArgumentException(timeframe.getValue()
                    + " candles must be in strictly increasing timestamp order (index " + i + ")");
            }
        }
    }

    private static boolean isEmpty(List<Candle> candles) {
        return candles == null || candles.isEmpty();
    }

    public boolean hasSession(String symbol) {
        return symbol != null && sessions.containsKey(symbol.toUpperCase());
    }

    public Set<String> getSymbols() {
        return new TreeSet<>(sessions.keySet());
    }

    public StateSummary getStateSummary(String symbol, Instant now) {
        SymbolSession session = getSession(symbol);
        session.lock().lock();
        try {
            DirectorResult director = session.getDirector();
            return new StateSummary(
                session.getSymbol(),
                session.getCandleIndex(),
                director != null ? director.getState() : DirectorState.CHOP,
                director != null ? director.getBiasScore() : 0,
                director != null && director.isInsideCloud(),
                session.getValidator().getState(),
                session.getTrap().isActive(),
                session.getTrap().getType(),
                cooldownGate.isOppositeWindowOpen(session.getCooldown(), now),
                session.getCooldown().getLastAlertDirection(),
                session.getCooldown().getLastAlertTimestamp(),
                session.getAlertHistory().size()
            );
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Alerts for a symbol, most recent first.
     */
    public List<ScalpAlert> getAlertHistory(String symbol) {
        SymbolSession session = getSession(symbol);
        session.lock().lock();
        try {
            return session.getAlertHistory();
        } finally {
            session.lock().unlock();
        }
    }

    /**
     * Drop all state for a symbol.
     *
     * @return true if a session existed
     */
    public boolean reset(String symbol) {
        if (symbol == null) {
            return false;
        }
        String key = symbol.toUpperCase();
        SymbolSession session = sessions.get(key);
        if (session == null) {
            return false;
        }

        // waits for a running evaluation so it cannot write into a discarded session
        session.lock().lock();
        boolean removed;
        try {
            removed = sessions.remove(key, session);
        } finally {
            session.lock().unlock();
        }
        if (removed) {
            logger.info("🔄 Signal session reset for {}", key);
        }
        return removed;
    }

    private SymbolSession getSession(String symbol) {
        SymbolSession session = symbol != null ? sessions.get(symbol.toUpperCase()) : null;
        if (session == null) {
            throw new IllegalArgumentException("No signal session for symbol: " + symbol);
        }
        return session;
    }
}
