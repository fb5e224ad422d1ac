package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.signal.model.CooldownState;
import org.cloudvision.scalp.signal.model.GateDecision;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.cloudvision.scalp.CandleFixtures.NOW;
import static org.junit.jupiter.api.Assertions.*;

class CooldownGateTest {

    private CooldownGate gate;

    @BeforeEach
    void setUp() {
        gate = new CooldownGate(new ScalpSignalProperties());
    }

    private static CooldownState after(TradeDirection direction, Instant when) {
        return CooldownState.initial().afterAlert(direction, when);
    }

    @Test
    @DisplayName("Should allow anything before the first alert")
    void testInitial() {
        assertTrue(gate.check(TradeDirection.LONG, CooldownState.initial(), NOW).isAllowed());
        assertTrue(gate.check(TradeDirection.SHORT, CooldownState.initial(), NOW).isAllowed());
        assertFalse(gate.isOppositeWindowOpen(CooldownState.initial(), NOW));
    }

    @Test
    @DisplayName("Should block the opposite direction for three minutes")
    void testOppositeDirection() {
        CooldownState state = after(TradeDirection.LONG, NOW);

        GateDecision blocked = gate.check(TradeDirection.SHORT, state, NOW.plusMillis(60_500));
        assertFalse(blocked.isAllowed());
        assertEquals("Opposite direction cooldown: 120s remaining", blocked.getReason());

        assertTrue(gate.isOppositeWindowOpen(state, NOW.plusSeconds(179)));
        assertFalse(gate.isOppositeWindowOpen(state, NOW.plusSeconds(180)));
        assertTrue(gate.check(TradeDirection.SHORT, state, NOW.plusSeconds(180)).isAllowed());
    }

    @Test
    @DisplayName("Should block the same direction until VWAP is retested")
    void testSameDirection() {
        CooldownState state = after(TradeDirection.LONG, NOW);

        GateDecision blocked = gate.check(TradeDirection.LONG, state, NOW.plusSeconds(600));
        assertFalse(blocked.isAllowed());
        assertEquals("Same direction blocked until VWAP retest", blocked.getReason());

        CooldownState retested = state.withVwapRetest();
        assertTrue(retested.isVwapRetestSinceLastAlert());
        assertFalse(retested.isSameDirectionBlocked());
        assertTrue(gate.check(TradeDirection.LONG, retested, NOW.plusSeconds(600)).isAllowed());
    }

    @Test
    @DisplayName("Should ignore VWAP touches before the first alert")
    void testRetestBeforeAlert() {
        CooldownState state = CooldownState.initial().withVwapRetest();

        assertSame(CooldownState.initial(), state);
        assertFalse(state.isVwapRetestSinceLastAlert());
    }

    @Test
    @DisplayName("Should reset the retest flag on every new alert")
    void testAlertResetsRetest() {
        CooldownState state = after(TradeDirection.LONG, NOW).withVwapRetest()
            .afterAlert(TradeDirection.SHORT, NOW.plusSeconds(300));

        assertEquals(TradeDirection.SHORT, state.getLastAlertDirection());
        assertFalse(state.isVwapRetestSinceLastAlert());
        assertTrue(state.isSameDirectionBlocked());
    }
}
