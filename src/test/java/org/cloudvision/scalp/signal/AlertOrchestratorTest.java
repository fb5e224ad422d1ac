package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.signal.model.AlertType;
import org.cloudvision.scalp.signal.model.CooldownState;
import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.ScalpAlert;
import org.cloudvision.scalp.signal.model.ScalpSignalInput;
import org.cloudvision.scalp.signal.model.ScalpSignalResult;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.cloudvision.scalp.signal.model.TrapType;
import org.cloudvision.scalp.signal.model.ValidatorState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.cloudvision.scalp.CandleFixtures.NOW;
import static org.cloudvision.scalp.CandleFixtures.ONE_MINUTE;
import static org.cloudvision.scalp.CandleFixtures.TWO_MINUTES;
import static org.cloudvision.scalp.CandleFixtures.assertDecimal;
import static org.cloudvision.scalp.CandleFixtures.fiveMinuteDecline;
import static org.cloudvision.scalp.CandleFixtures.fiveMinuteRamp;
import static org.cloudvision.scalp.CandleFixtures.staircase;
import static org.cloudvision.scalp.CandleFixtures.upWickTrap;
import static org.cloudvision.scalp.CandleFixtures.upWickTrapFade;
import static org.cloudvision.scalp.CandleFixtures.vwapChop;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for the alert pipeline
 *
 * Scenarios:
 * - Squeeze long on an aligned uptrend
 * - Insufficient history
 * - Director caching across intra-bar calls
 * - Same and opposite direction cooldowns
 * - Trap suppression followed by a fade
 * - Chop suppression
 */
class AlertOrchestratorTest {

    private AlertOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = new AlertOrchestrator(new ScalpSignalProperties());
    }

    private ScalpSignalInput.Builder trendingInput(int oneMinuteBars) {
        return ScalpSignalInput.builder()
            .candles1m(staircase(oneMinuteBars, ONE_MINUTE))
            .candles2m(staircase(60, TWO_MINUTES))
            .candles5m(fiveMinuteRamp(60))
            .candleIndex(oneMinuteBars)
            .now(NOW);
    }

    @Test
    @DisplayName("Should emit a pushable squeeze long when every timeframe agrees")
    void testSqueezeLong() {
        ScalpSignalResult result = orchestrator.evaluate(trendingInput(60).build());

        assertTrue(result.hasAlert(), "Expected alert but was suppressed: " + result.getSuppressedReason());
        ScalpAlert alert = result.getAlert();
        assertEquals(AlertType.SQUEEZE_LONG, alert.getType());
        assertEquals(TradeDirection.LONG, alert.getDirection());
        assertEquals("squeeze-LONG-" + NOW.toEpochMilli(), alert.getId());
        assertEquals(NOW, alert.getTimestamp());
        assertEquals(95, alert.getConfidence());
        assertTrue(alert.isShouldPush());
        assertEquals(DirectorState.BULL, alert.getDirector());
        assertEquals(ValidatorState.BULL, alert.getValidator());
        assertEquals("VWAP hold + RVOL 3.0x", alert.getTriggerReason());
        assertEquals("Director: BULL | Validator: BULL | Trigger: VWAP hold + RVOL 3.0x", alert.getExplanation());
        assertEquals("5-15 min", alert.getHoldTime());

        assertDecimal("171", alert.getEntryPrice());
        assertTrue(alert.getStopLoss().compareTo(alert.getEntryPrice()) < 0);
        assertTrue(alert.getTargetPrice().compareTo(alert.getEntryPrice()) > 0);

        // stop sits half an ATR away, target a full ATR
        BigDecimal stopDistance = alert.getEntryPrice().subtract(alert.getStopLoss());
        BigDecimal targetDistance = alert.getTargetPrice().subtract(alert.getEntryPrice());
        BigDecimal drift = targetDistance.subtract(stopDistance.multiply(BigDecimal.valueOf(2))).abs();
        assertTrue(drift.compareTo(new BigDecimal("0.0000001")) < 0);

        assertTrue(result.getTrigger().isValid());
        assertTrue(result.getTrigger().getConditions().allMet());
        assertNull(result.getSuppressedReason());
    }

    @Test
    @DisplayName("Should record the alert in the returned cooldown state")
    void testCooldownUpdatedAfterAlert() {
        ScalpSignalResult result = orchestrator.evaluate(trendingInput(60).build());

        CooldownState cooldown = result.getCooldown();
        assertEquals(TradeDirection.LONG, cooldown.getLastAlertDirection());
        assertEquals(NOW, cooldown.getLastAlertTimestamp());
        assertTrue(cooldown.isSameDirectionBlocked());
        assertFalse(cooldown.isVwapRetestSinceLastAlert());
    }

    @Test
    @DisplayName("Should suppress everything with too little 1m history")
    void testInsufficientHistory() {
        ScalpSignalInput input = ScalpSignalInput.builder()
            .candles1m(staircase(20, ONE_MINUTE))
            .now(NOW)
            .candleIndex(20)
            .build();

        ScalpSignalResult result = orchestrator.evaluate(input);

        assertFalse(result.hasAlert());
        assertEquals(DirectorState.CHOP, result.getDirector().getState());
        assertEquals(Instant.EPOCH, result.getDirector().getLockedUntil());
        assertEquals(ValidatorState.NEUTRAL, result.getValidator().getState());
        assertTrue(result.getSuppressedReason().startsWith("Insufficient 1m history"));
    }

    @Test
    @DisplayName("Should reuse the locked Director result within the same 5-minute window")
    void testDirectorCacheStability() {
        ScalpSignalResult first = orchestrator.evaluate(trendingInput(60).build());
        assertEquals(Instant.parse("2024-01-02T14:35:00Z"), first.getDirector().getLockedUntil());

        // 5m data flips bearish but the lock has not expired
        ScalpSignalResult second = orchestrator.evaluate(trendingInput(60)
            .candles5m(fiveMinuteDecline(60))
            .now(NOW.plusSeconds(120))
            .previousDirector(first.getDirector())
            .build());

        assertSame(first.getDirector(), second.getDirector());
        assertEquals(DirectorState.BULL, second.getDirector().getState());
    }

    @Test
    @DisplayName("Should block a second alert in the same direction until VWAP is retested")
    void testSameDirectionBlockedWithoutRetest() {
        CooldownState afterLong = CooldownState.initial().afterAlert(TradeDirection.LONG, NOW.minusSeconds(120));

        ScalpSignalResult result = orchestrator.evaluate(trendingInput(62).cooldown(afterLong).build());

        assertFalse(result.hasAlert());
        assertTrue(result.getTrigger().isValid());
        assertEquals("Same direction blocked until VWAP retest", result.getSuppressedReason());
        assertSame(afterLong, result.getCooldown());
    }

    @Test
    @DisplayName("Should allow the same direction again after a VWAP retest")
    void testSameDirectionAllowedAfterRetest() {
        CooldownState retested = CooldownState.initial()
            .afterAlert(TradeDirection.LONG, NOW.minusSeconds(600))
            .withVwapRetest();

        ScalpSignalResult result = orchestrator.evaluate(trendingInput(60).cooldown(retested).build());

        assertTrue(result.hasAlert());
        assertEquals(AlertType.SQUEEZE_LONG, result.getAlert().getType());
    }

    @Test
    @DisplayName("Should block the opposite direction inside the cooldown window")
    void testOppositeDirectionCooldown() {
        CooldownState afterShort = CooldownState.initial().afterAlert(TradeDirection.SHORT, NOW.minusSeconds(60));

        ScalpSignalResult result = orchestrator.evaluate(trendingInput(60).cooldown(afterShort).build());

        assertFalse(result.hasAlert());
        assertEquals("Opposite direction cooldown: 120s remaining", result.getSuppressedReason());
    }

    @Test
    @DisplayName("Should allow the opposite direction once the cooldown window has passed")
    void testOppositeDirectionAfterCooldown() {
        CooldownState afterShort = CooldownState.initial().afterAlert(TradeDirection.SHORT, NOW.minusSeconds(181));

        ScalpSignalResult result = orchestrator.evaluate(trendingInput(60).cooldown(afterShort).build());

        assertTrue(result.hasAlert());
        assertEquals(TradeDirection.LONG, result.getCooldown().getLastAlertDirection());
    }

    @Test
    @DisplayName("Should suppress squeezes while a trap is active, then emit the fade")
    void testTrapSuppressionAndFade() {
        ScalpSignalResult onTrapBar = orchestrator.evaluate(ScalpSignalInput.builder()
            .candles1m(upWickTrap(NOW))
            .now(NOW)
            .candleIndex(31)
            .build());

        assertFalse(onTrapBar.hasAlert());
        assertTrue(onTrapBar.getTrap().isActive());
        assertEquals(TrapType.UP_WICK, onTrapBar.getTrap().getType());
        assertEquals("Trap mode active (UP_WICK)", onTrapBar.getSuppressedReason());

        Instant next = NOW.plus(ONE_MINUTE);
        ScalpSignalResult onFadeBar = orchestrator.evaluate(ScalpSignalInput.builder()
            .candles1m(upWickTrapFade(next))
            .now(next)
            .candleIndex(32)
            .previousTrap(onTrapBar.getTrap())
            .cooldown(onTrapBar.getCooldown())
            .build());

        assertTrue(onFadeBar.hasAlert(), "Expected fade but was: " + onFadeBar.getSuppressedReason());
        ScalpAlert alert = onFadeBar.getAlert();
        assertEquals(AlertType.TRAP_FADE_SHORT, alert.getType());
        assertEquals("trap-fade-SHORT-" + next.toEpochMilli(), alert.getId());
        assertEquals(75, alert.getConfidence());
        assertTrue(alert.isShouldPush());
        assertEquals(ValidatorState.NEUTRAL, alert.getValidator());
        assertEquals("Liquidity trap + VWAP reject", alert.getTriggerReason());
        assertEquals("Director: CHOP | Validator: n/a | Trigger: Liquidity trap + VWAP reject",
            alert.getExplanation());
        assertEquals("3-8 min", alert.getHoldTime());
        assertDecimal("97.0", alert.getEntryPrice());
        assertTrue(alert.getStopLoss().compareTo(BigDecimal.valueOf(101)) > 0, "Stop must sit above the wick");
        assertTrue(alert.getTargetPrice().compareTo(alert.getEntryPrice()) < 0);

        assertFalse(onFadeBar.getTrap().isActive());
        assertEquals(TradeDirection.SHORT, onFadeBar.getCooldown().getLastAlertDirection());
    }

    @Test
    @DisplayName("Should suppress alerts when 1m price keeps crossing VWAP")
    void testChopSuppression() {
        List<Candle> chop = vwapChop(30);
        ScalpSignalResult result = orchestrator.evaluate(ScalpSignalInput.builder()
            .candles1m(chop)
            .candles2m(staircase(60, TWO_MINUTES))
            .candles5m(fiveMinuteRamp(60))
            .now(NOW)
            .candleIndex(30)
            .build());

        assertEquals(DirectorState.BULL, result.getDirector().getState());
        assertTrue(result.getChop().isChop());
        assertFalse(result.hasAlert());
        assertEquals("VWAP crossed 9 times in last 10 bars", result.getSuppressedReason());
    }
}
