package org.cloudvision.scalp.indicators;

import org.cloudvision.scalp.indicators.model.BounceSignal;
import org.cloudvision.scalp.indicators.model.IndicatorSnapshot;
import org.cloudvision.scalp.indicators.model.TrendDirection;
import org.cloudvision.scalp.model.Candle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.cloudvision.scalp.CandleFixtures.ONE_MINUTE;
import static org.cloudvision.scalp.CandleFixtures.assertDecimal;
import static org.cloudvision.scalp.CandleFixtures.staircase;
import static org.junit.jupiter.api.Assertions.*;

class IndicatorServiceTest {

    private IndicatorService indicatorService;

    @BeforeEach
    void setUp() {
        indicatorService = new IndicatorService();
    }

    @Test
    @DisplayName("Should build a full snapshot for a trending window")
    void testSnapshot() {
        List<Candle> candles = staircase(60, ONE_MINUTE);

        IndicatorSnapshot snapshot = indicatorService.snapshot(candles);

        assertEquals(candles.get(59).getTimestamp(), snapshot.getTimestamp());
        assertDecimal("171", snapshot.getClose());
        assertDecimal("100", snapshot.getAdx());
        assertEquals(TrendDirection.BULLISH, snapshot.getAdxDirection());
        assertEquals(1, snapshot.getSuperTrend());
        assertTrue(snapshot.getEwo().signum() > 0);
        assertTrue(snapshot.getRsi().doubleValue() > 50);
        assertTrue(snapshot.getBollingerUpper().compareTo(snapshot.getBollingerLower()) > 0);
        assertTrue(snapshot.getIchimoku().isAvailable());
        assertDecimal("3", snapshot.getRvol().getRvol());
        assertFalse(snapshot.getMacd().getHistogram().isEmpty());
        assertTrue(snapshot.getAtr().getAtr().signum() > 0);
        assertNotNull(snapshot.getBounce());
    }

    @Test
    @DisplayName("Should degrade to neutral values for a single candle")
    void testSingleCandle() {
        IndicatorSnapshot snapshot = indicatorService.snapshot(staircase(1, ONE_MINUTE));

        assertDecimal("50", snapshot.getRsi());
        assertDecimal("0", snapshot.getAdx());
        assertEquals(0, snapshot.getSuperTrend());
        assertFalse(snapshot.getIchimoku().isAvailable());
        assertDecimal("1", snapshot.getRvol().getRvol());
        assertEquals(BounceSignal.NONE, snapshot.getBounce().getSignal());
    }

    @Test
    @DisplayName("Should reject an empty window")
    void testEmptyWindow() {
        assertThrows(IllegalArgumentException.class, () -> indicatorService.snapshot(List.of()));
        assertThrows(IllegalArgumentException.class, () -> indicatorService.snapshot(null));
    }
}
