package org.cloudvision.scalp.indicators.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

public class MacdResult {
    private final List<BigDecimal> macdLine;
    private final List<BigDecimal> signalLine;
    private final List<BigDecimal> histogram;
    private final SignalAction crossover;

    public MacdResult(List<BigDecimal> macdLine, List<BigDecimal> signalLine,
                      List<BigDecimal> histogram, SignalAction crossover) {
        this.macdLine = Collections.unmodifiableList(macdLine);
        this.signalLine = Collections.unmodifiableList(signalLine);
        this.histogram = Collections.unmodifiableList(histogram);
        this.crossover = crossover;
    }

    public static MacdResult empty() {
        return new MacdResult(List.of(), List.of(), List.of(), SignalAction.HOLD);
    }

    public List<BigDecimal> getMacdLine() { return macdLine; }
    public List<BigDecimal> getSignalLine() { return signalLine; }
    public List<BigDecimal> getHistogram() { return histogram; }
    public SignalAction getCrossover() { return crossover; }

    public BigDecimal getMacd() {
        return macdLine.isEmpty() ? BigDecimal.ZERO : macdLine.get(macdLine.size() - 1);
    }

    public BigDecimal getSignal() {
        return signalLine.isEmpty() ? BigDecimal.ZERO : signalLine.get(signalLine.size() - 1);
    }

    public BigDecimal getLatestHistogram() {
        return histogram.isEmpty() ? BigDecimal.ZERO : histogram.get(histogram.size() - 1);
    }
}
