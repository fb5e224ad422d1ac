package org.cloudvision.scalp.signal;

import org.cloudvision.scalp.config.ScalpSignalProperties;
import org.cloudvision.scalp.signal.model.DirectorResult;
import org.cloudvision.scalp.signal.model.DirectorState;
import org.cloudvision.scalp.signal.model.DirectorVotes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.cloudvision.scalp.CandleFixtures.NOW;
import static org.cloudvision.scalp.CandleFixtures.fiveMinuteDecline;
import static org.cloudvision.scalp.CandleFixtures.fiveMinuteRamp;
import static org.cloudvision.scalp.CandleFixtures.flat;
import static org.junit.jupiter.api.Assertions.*;

class DirectorTest {

    private static final Instant BOUNDARY = Instant.parse("2024-01-02T14:35:00Z");

    private Director director;

    @BeforeEach
    void setUp() {
        director = new Director(new ScalpSignalProperties());
    }

    @Test
    @DisplayName("Should classify a steady 5m uptrend as BULL")
    void testBull() {
        DirectorResult result = director.evaluate(fiveMinuteRamp(60), NOW, null);

        assertEquals(DirectorState.BULL, result.getState());
        assertTrue(result.getBiasScore() >= 4);
        assertFalse(result.isInsideCloud());
        assertEquals(BOUNDARY, result.getLockedUntil());

        DirectorVotes votes = result.getVotes();
        assertEquals(1, votes.getSuperTrend());
        assertEquals(1, votes.getVwap());
        assertEquals(1, votes.getRsi());
        assertEquals(1, votes.getIchimoku());
        // ADX is pinned at 100, so it is strong but not rising
        assertEquals(0, votes.getAdx());
        assertEquals(result.getBiasScore(), votes.total());
    }

    @Test
    @DisplayName("Should classify a steady 5m downtrend as BEAR")
    void testBear() {
        DirectorResult result = director.evaluate(fiveMinuteDecline(60), NOW, null);

        assertEquals(DirectorState.BEAR, result.getState());
        assertTrue(result.getBiasScore() <= -4);
        assertEquals(-1, result.getVotes().getSuperTrend());
        assertEquals(-1, result.getVotes().getIchimoku());
    }

    @Test
    @DisplayName("Should force CHOP when price sits inside the cloud")
    void testInsideCloud() {
        DirectorResult result = director.evaluate(flat(60, NOW), NOW, null);

        assertTrue(result.isInsideCloud());
        assertEquals(DirectorState.CHOP, result.getState());
    }

    @Test
    @DisplayName("Should return an unlocked CHOP for insufficient history")
    void testInsufficientData() {
        DirectorResult result = director.evaluate(fiveMinuteRamp(51), NOW, null);

        assertEquals(DirectorState.CHOP, result.getState());
        assertEquals(0, result.getBiasScore());
        assertEquals(Instant.EPOCH, result.getLockedUntil());
        assertFalse(result.isLockedAt(NOW));
    }

    @Test
    @DisplayName("Should return the cached result until the lock expires")
    void testCaching() {
        DirectorResult first = director.evaluate(fiveMinuteRamp(60), NOW, null);

        DirectorResult cached = director.evaluate(fiveMinuteDecline(60), BOUNDARY.minusSeconds(1), first);
        assertSame(first, cached);

        DirectorResult recomputed = director.evaluate(fiveMinuteDecline(60), BOUNDARY, first);
        assertNotSame(first, recomputed);
        assertEquals(DirectorState.BEAR, recomputed.getState());
        assertEquals(Instant.parse("2024-01-02T14:40:00Z"), recomputed.getLockedUntil());
    }

    @Test
    @DisplayName("Should lock until the next 5-minute boundary after the current minute")
    void testNextBoundary() {
        assertEquals(BOUNDARY, Director.nextBoundary(Instant.parse("2024-01-02T14:31:00Z")));
        assertEquals(BOUNDARY, Director.nextBoundary(Instant.parse("2024-01-02T14:34:59Z")));
        assertEquals(BOUNDARY, Director.nextBoundary(Instant.parse("2024-01-02T14:30:00Z")));
        assertEquals(Instant.parse("2024-01-02T14:40:00Z"), Director.nextBoundary(BOUNDARY));
    }
}
