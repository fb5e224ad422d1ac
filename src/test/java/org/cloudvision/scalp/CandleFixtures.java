package org.cloudvision.scalp;

import org.cloudvision.scalp.model.Candle;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Deterministic candle series shared by the signal and service tests.
 *
 * All series end with a bar that opens one step before {@link #NOW}, so the
 * newest bar has just closed at evaluation time.
 */
public final class CandleFixtures {

    public static final Instant NOW = Instant.parse("2024-01-02T14:31:00Z");
    public static final Duration ONE_MINUTE = Duration.ofMinutes(1);
    public static final Duration TWO_MINUTES = Duration.ofMinutes(2);
    public static final Duration FIVE_MINUTES = Duration.ofMinutes(5);

    private CandleFixtures() {
    }

    /**
     * Rising staircase of alternating green/red bars with range 4 that steepens after
     * bar 55. The last bar carries triple volume.
     */
    public static List<Candle> staircase(int count, Duration step, Instant evaluationTime) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double low = i <= 55 ? 100 + i : 158 + 3 * (i - 56);
            double high = low + 4;
            boolean green = i % 2 == 1;
            double volume = i == count - 1 ? 3000 : 1000;
            candles.add(Candle.of(timeOf(i, count, step, evaluationTime),
                green ? low : high, high, low, green ? high : low, volume));
        }
        return candles;
    }

    public static List<Candle> staircase(int count, Duration step) {
        return staircase(count, step, NOW);
    }

    /**
     * Steady 5-minute uptrend, one point per bar, with doubled volume on the last ten bars.
     */
    public static List<Candle> fiveMinuteRamp(int count) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double volume = i >= count - 10 ? 2000 : 1000;
            candles.add(Candle.of(timeOf(i, count, FIVE_MINUTES, NOW),
                101 + i, 104 + i, 100 + i, 103 + i, volume));
        }
        return candles;
    }

    /**
     * Mirror image of {@link #fiveMinuteRamp(int)}: a steady downtrend.
     */
    public static List<Candle> fiveMinuteDecline(int count) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(Candle.of(timeOf(i, count, FIVE_MINUTES, NOW),
                199 - i, 200 - i, 196 - i, 197 - i, 1000));
        }
        return candles;
    }

    /**
     * Quiet 1-minute bars: open = close = 100, high 101, low 99, volume 1000.
     */
    public static List<Candle> flat(int count, Instant evaluationTime) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(Candle.of(timeOf(i, count, ONE_MINUTE, evaluationTime), 100, 101, 99, 100, 1000));
        }
        return candles;
    }

    /**
     * Thirty quiet bars followed by a bar that spikes into R1 at 101 on triple volume
     * and closes near its low.
     */
    public static List<Candle> upWickTrap(Instant evaluationTime) {
        List<Candle> candles = new ArrayList<>(flat(30, evaluationTime.minus(ONE_MINUTE)));
        candles.add(Candle.of(evaluationTime.minus(ONE_MINUTE), 98.5, 101, 97, 97.5, 3000));
        return candles;
    }

    /**
     * {@link #upWickTrap(Instant)} plus a red follow-through bar with a lower high.
     */
    public static List<Candle> upWickTrapFade(Instant evaluationTime) {
        List<Candle> candles = new ArrayList<>(upWickTrap(evaluationTime.minus(ONE_MINUTE)));
        candles.add(Candle.of(evaluationTime.minus(ONE_MINUTE), 97.8, 98.2, 96.8, 97.0, 1000));
        return candles;
    }

    /**
     * Closes alternating 100.02 / 99.98 around a VWAP of 100.
     */
    public static List<Candle> vwapChop(int count) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            double close = i % 2 == 0 ? 100.02 : 99.98;
            candles.add(Candle.of(timeOf(i, count, ONE_MINUTE, NOW),
                close, close + 0.01, close - 0.01, close, 1000));
        }
        return candles;
    }

    /**
     * Reflects every price through {@code axis} (p becomes axis - p), turning highs into
     * lows and green bars into red ones. Timestamps and volumes are kept.
     */
    public static List<Candle> mirror(List<Candle> candles, double axis) {
        BigDecimal pivot = BigDecimal.valueOf(axis);
        List<Candle> mirrored = new ArrayList<>(candles.size());
        for (Candle candle : candles) {
            mirrored.add(new Candle(candle.getTimestamp(),
                pivot.subtract(candle.getOpen()),
                pivot.subtract(candle.getLow()),
                pivot.subtract(candle.getHigh()),
                pivot.subtract(candle.getClose()),
                candle.getVolume()));
        }
        return mirrored;
    }

    public static void assertDecimal(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
            () -> "expected " + expected + " but was " + actual);
    }

    private static Instant timeOf(int index, int count, Duration step, Instant evaluationTime) {
        return evaluationTime.minus(step.multipliedBy(count - index));
    }
}
