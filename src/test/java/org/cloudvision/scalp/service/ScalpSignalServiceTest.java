package org.cloudvision.scalp.service;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.model.Timeframe;
import org.cloudvision.scalp.signal.AlertOrchestrator;
import org.cloudvision.scalp.signal.CooldownGate;
import org.cloudvision.scalp.signal.model.AlertType;
import org.cloudvision.scalp.signal.model.ChopCheck;
import org.cloudvision.scalp.signal.model.CooldownState;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.ScalpAlert;
import org.cloudvision.scalp.signal.model.ScalpSignalInput;
import org.cloudvision.scalp.signal.model.ScalpSignalResult;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.cloudvision.scalp.signal.model.TrapModeState;
import org.cloudvision.scalp.signal.model.TriggerResult;
import org.cloudvision.scalp.signal.model.ValidatorResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.cloudvision.scalp.CandleFixtures.NOW;
import static org.cloudvision.scalp.CandleFixtures.ONE_MINUTE;
import static org.cloudvision.scalp.CandleFixtures.TWO_MINUTES;
import static org.cloudvision.scalp.CandleFixtures.fiveMinuteRamp;
import static org.cloudvision.scalp.CandleFixtures.flat;
import static org.cloudvision.scalp.CandleFixtures.staircase;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ScalpSignalService
 *
 * Tests cover:
 * - Session creation, symbol normalisation and state threading
 * - Duplicate-bar suppression and candle indexing
 * - Stale timeframe handling
 * - Alert history bounds, reset and summaries
 * - Single-flight evaluation per symbol
 */
class ScalpSignalServiceTest {

    private ScalpSignalProperties properties;
    private ScalpSignalService service;

    @BeforeEach
    void setUp() {
        properties = new ScalpSignalProperties();
        service = new ScalpSignalService(new AlertOrchestrator(properties), new CooldownGate(properties), properties);
    }

    private SessionEvaluation evaluateTrend(String symbol) {
        return service.evaluate(symbol, staircase(60, ONE_MINUTE), staircase(60, TWO_MINUTES),
            fiveMinuteRamp(60), NOW);
    }

    /**
     * Orchestrator that emits an alert on every call and can hold the caller inside evaluate.
     */
    private static class StubOrchestrator extends AlertOrchestrator {
        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release;

        StubOrchestrator(ScalpSignalProperties properties, CountDownLatch release) {
            super(properties);
            this.release = release;
        }

        @Override
        public ScalpSignalResult evaluate(ScalpSignalInput input) {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            ScalpAlert alert = ScalpAlert.builder()
                .id("squeeze-LONG-" + input.getNow().toEpochMilli())
                .type(AlertType.SQUEEZE_LONG)
                .timestamp(input.getNow())
                .confidence(80)
                .build();
            return new ScalpSignalResult(alert, DirectorResult.insufficientData(), ValidatorResult.neutral(),
                TrapModeState.inactive(), CooldownState.initial().afterAlert(TradeDirection.LONG, input.getNow()),
                ChopCheck.clear(), TriggerResult.invalid(), null);
        }
    }

    @Test
    @DisplayName("Should evaluate a new session and keep its state")
    void testEvaluateNewSession() {
        SessionEvaluation evaluation = evaluateTrend("aapl");

        assertEquals("AAPL", evaluation.getSymbol());
        assertEquals(EvaluationStatus.EVALUATED, evaluation.getStatus());
        assertEquals(1, evaluation.getCandleIndex());
        assertTrue(evaluation.getStaleTimeframes().isEmpty());
        assertTrue(evaluation.getResult().hasAlert());

        assertTrue(service.hasSession("AAPL"));
        assertTrue(service.hasSession("aapl"));
        assertEquals(Set.of("AAPL"), service.getSymbols());

        List<ScalpAlert> history = service.getAlertHistory("AAPL");
        assertEquals(1, history.size());
        assertEquals(AlertType.SQUEEZE_LONG, history.get(0).getType());
    }

    @Test
    @DisplayName("Should summarise the session state")
    void testStateSummary() {
        evaluateTrend("AAPL");

        StateSummary summary = service.getStateSummary("AAPL", NOW.plusSeconds(60));

        assertEquals("AAPL", summary.getSymbol());
        assertEquals(1, summary.getCandleIndex());
        assertEquals(DirectorState.BULL, summary.getDirectorState());
        assertFalse(summary.isTrapActive());
        assertTrue(summary.isCooldownActive());
        assertEquals(TradeDirection.LONG, summary.getLastAlertDirection());
        assertEquals(NOW, summary.getLastAlertTimestamp());
        assertEquals(1, summary.getAlertCount());

        assertFalse(service.getStateSummary("AAPL", NOW.plusSeconds(180)).isCooldownActive());
    }

    @Test
    @DisplayName("Should skip a bar that was already processed")
    void testDuplicateCandle() {
        evaluateTrend("AAPL");

        SessionEvaluation duplicate = evaluateTrend("AAPL");

        assertEquals(EvaluationStatus.DUPLICATE_CANDLE, duplicate.getStatus());
        assertEquals(1, duplicate.getCandleIndex());
        assertNull(duplicate.getResult());
        assertEquals(1, service.getAlertHistory("AAPL").size());
    }

    @Test
    @DisplayName("Should reuse last-known windows and mark them stale")
    void testMissingTimeframesReused() {
        evaluateTrend("AAPL");
        Instant next = NOW.plusSeconds(60);

        SessionEvaluation evaluation = service.evaluate("AAPL", staircase(61, ONE_MINUTE, next), null, List.of(), next);

        assertEquals(EvaluationStatus.EVALUATED, evaluation.getStatus());
        assertEquals(2, evaluation.getCandleIndex());
        assertEquals(Set.of(Timeframe.TWO_MINUTE, Timeframe.FIVE_MINUTE), evaluation.getStaleTimeframes());
        // the reused 5m window still yields the cached BULL Director
        assertEquals(DirectorState.BULL, evaluation.getResult().getDirector().getState());
    }

    @Test
    @DisplayName("Should mark windows stale when their newest bar is too old")
    void testOutdatedTimeframes() {
        Instant later = NOW.plusSeconds(3600);

        SessionEvaluation evaluation = service.evaluate("AAPL", flat(40, later),
            staircase(60, TWO_MINUTES), fiveMinuteRamp(60), later);

        assertEquals(Set.of(Timeframe.TWO_MINUTE, Timeframe.FIVE_MINUTE), evaluation.getStaleTimeframes());
    }

    @Test
    @DisplayName("Should reject invalid requests")
    void testValidation() {
        List<Candle> candles = staircase(60, ONE_MINUTE);

        assertThrows(IllegalArgumentException.class, () -> service.evaluate(" ", candles, null, null, NOW));
        assertThrows(IllegalArgumentException.class, () -> service.evaluate("AAPL", candles, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> service.evaluate("AAPL", List.of(), null, null, NOW));

        List<Candle> unordered = new ArrayList<>(candles);
        unordered.set(10, candles.get(9));
        assertThrows(IllegalArgumentException.class, () -> service.evaluate("AAPL", unordered, null, null, NOW));

        assertFalse(service.hasSession("AAPL"));
        assertThrows(IllegalArgumentException.class, () -> service.getStateSummary("AAPL", NOW));
        assertThrows(IllegalArgumentException.class, () -> service.getAlertHistory("AAPL"));
    }

    @Test
    @DisplayName("Should drop all state on reset")
    void testReset() {
        evaluateTrend("AAPL");

        assertTrue(service.reset("aapl"));
        assertFalse(service.hasSession("AAPL"));
        assertFalse(service.reset("AAPL"));

        SessionEvaluation fresh = evaluateTrend("AAPL");
        assertEquals(1, fresh.getCandleIndex());
        assertEquals(EvaluationStatus.EVALUATED, fresh.getStatus());
    }

    @Test
    @DisplayName("Should reject reusing the 1m window of a session that was reset")
    void testEvaluateAfterReset() {
        evaluateTrend("AAPL");
        assertTrue(service.reset("AAPL"));

        Instant next = NOW.plusSeconds(60);
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> service.evaluate("AAPL", null, staircase(60, TWO_MINUTES, next), null, next));

        assertTrue(error.getMessage().startsWith("1m candles are required"));
        assertFalse(service.hasSession("AAPL"));
        assertTrue(service.getSymbols().isEmpty());
    }

    @Test
    @DisplayName("Should wait for a running evaluation before resetting")
    void testResetWaitsForEvaluation() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        StubOrchestrator orchestrator = new StubOrchestrator(properties, release);
        ScalpSignalService stubbed = new ScalpSignalService(orchestrator, new CooldownGate(properties), properties);

        CompletableFuture<SessionEvaluation> evaluation = CompletableFuture.supplyAsync(
            () -> stubbed.evaluate("AAPL", flat(1, NOW), null, null, NOW));
        assertTrue(orchestrator.entered.await(5, TimeUnit.SECONDS));

        CompletableFuture<Boolean> reset = CompletableFuture.supplyAsync(() -> stubbed.reset("AAPL"));
        Thread.sleep(100);
        assertFalse(reset.isDone());

        release.countDown();
        assertEquals(EvaluationStatus.EVALUATED, evaluation.get(5, TimeUnit.SECONDS).getStatus());
        assertTrue(reset.get(5, TimeUnit.SECONDS));
        assertFalse(stubbed.hasSession("AAPL"));
    }

    @Test
    @DisplayName("Should keep only the most recent alerts, newest first")
    void testHistoryBound() {
        properties.setMaxAlertHistory(2);
        CountDownLatch open = new CountDownLatch(0);
        ScalpSignalService stubbed = new ScalpSignalService(new StubOrchestrator(properties, open),
            new CooldownGate(properties), properties);

        for (int i = 0; i < 3; i++) {
            Instant at = NOW.plusSeconds(60L * i);
            stubbed.evaluate("AAPL", flat(1, at), null, null, at);
        }

        List<ScalpAlert> history = stubbed.getAlertHistory("AAPL");
        assertEquals(2, history.size());
        assertEquals(NOW.plusSeconds(120), history.get(0).getTimestamp());
        assertEquals(NOW.plusSeconds(60), history.get(1).getTimestamp());
    }

    @Test
    @DisplayName("Should drop a call while the same symbol is still being evaluated")
    void testSingleFlight() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        StubOrchestrator orchestrator = new StubOrchestrator(properties, release);
        ScalpSignalService stubbed = new ScalpSignalService(orchestrator, new CooldownGate(properties), properties);

        CompletableFuture<SessionEvaluation> first = CompletableFuture.supplyAsync(
            () -> stubbed.evaluate("AAPL", flat(1, NOW), null, null, NOW));
        assertTrue(orchestrator.entered.await(5, TimeUnit.SECONDS));

        Instant next = NOW.plusSeconds(60);
        SessionEvaluation dropped = stubbed.evaluate("AAPL", flat(1, next), null, null, next);
        assertEquals(EvaluationStatus.DROPPED_BUSY, dropped.getStatus());
        assertNull(dropped.getResult());

        release.countDown();
        assertEquals(EvaluationStatus.EVALUATED, first.get(5, TimeUnit.SECONDS).getStatus());
        assertEquals(1, stubbed.getAlertHistory("AAPL").size());
    }
}
