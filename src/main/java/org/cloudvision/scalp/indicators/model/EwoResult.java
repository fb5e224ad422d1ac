package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * Elliott Wave Oscillator series (fast EMA minus slow EMA).
 */
public class EwoResult {
    private final List<BigDecimal> values;

    public EwoResult(List<BigDecimal> values) {
        this.values = Collections.unmodifiableList(values);
    }

    public static EwoResult empty() {
        return new EwoResult(List.of());
    }

    public List<BigDecimal> getValues() { return values; }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public BigDecimal getCurrent() {
        return values.isEmpty() ? BigDecimal.ZERO : values.get(values.size() - 1);
    }

    public BigDecimal getPrevious() {
        return values.size() < 2 ? getCurrent() : values.get(values.size() - 2);
    }

    public boolean isRising() {
        return getCurrent().compareTo(getPrevious()) > 0;
    }

    public boolean isFalling() {
        return getCurrent().compareTo(getPrevious()) < 0;
    }

    /**
     * BUY on a cross above zero, SELL on a cross below.
     */
    public SignalAction getSignal() {
        if (values.size() < 2) {
            return SignalAction.HOLD;
        }
        if (getPrevious().signum() <= 0 && getCurrent().signum() > 0) {
            return SignalAction.BUY;
        }
        if (getPrevious().signum() >= 0 && getCurrent().signum() < 0) {
            return SignalAction.SELL;
        }
        return SignalAction.HOLD;
    }
}
