package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.indicators.PriceLevelIndicators;
import org.cloudvision.scalp.model.Candle;
import org.cloudvision.scalp.signal.model.FadeConfirmation;
import org.cloudvision.scalp.signal.model.TradeDirection;
import org.cloudvision.scalp.signal.model.TrapModeState;
import org.cloudvision.scalp.signal.model.TrapType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.cloudvision.scalp.CandleFixtures.NOW;
import static org.cloudvision.scalp.CandleFixtures.assertDecimal;
import static org.cloudvision.scalp.CandleFixtures.flat;
import static org.cloudvision.scalp.CandleFixtures.mirror;
import static org.cloudvision.scalp.CandleFixtures.upWickTrap;
import static org.cloudvision.scalp.CandleFixtures.upWickTrapFade;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TrapModeDetector
 *
 * Tests cover:
 * - Up-wick and down-wick detection at key levels
 * - Trap lifetime in candles
 * - Fade confirmation in both directions
 */
class TrapModeDetectorTest {

    private static final long TRAP_INDEX = 31;

    private TrapModeDetector detector;

    @BeforeEach
    void setUp() {
        detector = new TrapModeDetector(new ScalpSignalProperties());
    }

    private static BigDecimal vwap(List<Candle> candles) {
        return PriceLevelIndicators.calculateVWAP(candles).getVwap();
    }

    @Test
    @DisplayName("Should detect an up-wick trap into R1 on a volume and range spike")
    void testUpWickDetection() {
        TrapModeState trap = detector.detect(upWickTrap(NOW), TRAP_INDEX, TrapModeState.inactive());

        assertTrue(trap.isActive());
        assertEquals(TrapType.UP_WICK, trap.getType());
        assertEquals(TRAP_INDEX, trap.getDetectedAtCandleIndex());
        assertEquals(TRAP_INDEX + 3, trap.getExpiresAtCandleIndex());
        assertDecimal("101", trap.getWickHigh());
        assertDecimal("97", trap.getWickLow());
    }

    @Test
    @DisplayName("Should detect the mirrored down-wick trap into S1")
    void testDownWickDetection() {
        TrapModeState trap = detector.detect(mirror(upWickTrap(NOW), 200), TRAP_INDEX, null);

        assertTrue(trap.isActive());
        assertEquals(TrapType.DOWN_WICK, trap.getType());
        assertDecimal("99", trap.getWickLow());
    }

    @Test
    @DisplayName("Should detect on a window shorter than the Bollinger period with a small baseline")
    void testShortBaseline() {
        ScalpSignalProperties properties = new ScalpSignalProperties();
        properties.setTrapBaselineBars(10);
        TrapModeDetector shortBaseline = new TrapModeDetector(properties);
        List<Candle> candles = upWickTrap(NOW);
        List<Candle> window = candles.subList(candles.size() - 15, candles.size());

        TrapModeState trap = shortBaseline.detect(window, TRAP_INDEX, TrapModeState.inactive());

        assertTrue(trap.isActive());
        assertEquals(TrapType.UP_WICK, trap.getType());
    }

    @Test
    @DisplayName("Should ignore quiet bars and short windows")
    void testNoTrap() {
        assertFalse(detector.detect(flat(40, NOW), 40, TrapModeState.inactive()).isActive());
        assertFalse(detector.detect(flat(20, NOW), 20, TrapModeState.inactive()).isActive());
    }

    @Test
    @DisplayName("Should stay active for three candles and then expire")
    void testTrapLifetime() {
        TrapModeState trap = detector.detect(upWickTrap(NOW), TRAP_INDEX, TrapModeState.inactive());
        List<Candle> quiet = flat(40, NOW);

        assertSame(trap, detector.detect(quiet, TRAP_INDEX + 1, trap));
        assertSame(trap, detector.detect(quiet, TRAP_INDEX + 2, trap));
        assertFalse(detector.detect(quiet, TRAP_INDEX + 3, trap).isActive());

        assertTrue(trap.isActiveAt(TRAP_INDEX));
        assertTrue(trap.isActiveAt(TRAP_INDEX + 2));
        assertFalse(trap.isActiveAt(TRAP_INDEX + 3));
    }

    @Test
    @DisplayName("Should not confirm a fade on the trap bar itself")
    void testNoFadeOnTrapBar() {
        List<Candle> candles = upWickTrap(NOW);
        TrapModeState trap = detector.detect(candles, TRAP_INDEX, TrapModeState.inactive());

        assertFalse(detector.confirmFade(candles, trap, vwap(candles)).isConfirmed());
    }

    @Test
    @DisplayName("Should confirm a short fade when price rejects below VWAP")
    void testShortFade() {
        TrapModeState trap = detector.detect(upWickTrap(NOW), TRAP_INDEX, TrapModeState.inactive());
        List<Candle> candles = upWickTrapFade(NOW.plusSeconds(60));

        FadeConfirmation fade = detector.confirmFade(candles, trap, vwap(candles));

        assertTrue(fade.isConfirmed());
        assertEquals(TradeDirection.SHORT, fade.getDirection());
        assertEquals("Liquidity trap + VWAP reject", fade.getReason());
    }

    @Test
    @DisplayName("Should confirm a long fade when price reclaims VWAP")
    void testLongFade() {
        TrapModeState trap = detector.detect(mirror(upWickTrap(NOW), 200), TRAP_INDEX, TrapModeState.inactive());
        List<Candle> candles = mirror(upWickTrapFade(NOW.plusSeconds(60)), 200);

        FadeConfirmation fade = detector.confirmFade(candles, trap, vwap(candles));

        assertTrue(fade.isConfirmed());
        assertEquals(TradeDirection.LONG, fade.getDirection());
        assertEquals("Liquidity trap + VWAP reclaim", fade.getReason());
    }

    @Test
    @DisplayName("Should never confirm a fade without an active trap")
    void testFadeWithoutTrap() {
        List<Candle> candles = upWickTrapFade(NOW);

        assertFalse(detector.confirmFade(candles, TrapModeState.inactive(), vwap(candles)).isConfirmed());
    }
}
