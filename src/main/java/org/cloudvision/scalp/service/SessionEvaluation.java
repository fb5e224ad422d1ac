package org.cloudvision.scalp.service;

import org.cloudvision.scalp.model.Timeframe;
import org.cloudvision.scalp.signal.model.ScalpSignalResult;

import java.util.Collections;
import java.util.Set;

/**
 * Outcome of one service-level evaluation. {@code result} is present only for
 * {@link EvaluationStatus#EVALUATED}.
 */
public class SessionEvaluation {
    private final String symbol;
    private final EvaluationStatus status;
    private final long candleIndex;
    private final ScalpSignalResult result;
    private final Set<Timeframe> staleTimeframes;

    public SessionEvaluation(String symbol, EvaluationStatus status, long candleIndex,
                             ScalpSignalResult result, Set<Timeframe> staleTimeframes) {
        this.symbol = symbol;
        this.status = status;
        this.candleIndex = candleIndex;
        this.result = result;
        this.staleTimeframes = Collections.unmodifiableSet(staleTimeframes);
    }

    public String getSymbol() { return symbol; }
    public EvaluationStatus getStatus() { return status; }
    public long getCandleIndex() { return candleIndex; }
    public ScalpSignalResult getResult() { return result; }
    public Set<Timeframe> getStaleTimeframes() { return staleTimeframes; }
}
