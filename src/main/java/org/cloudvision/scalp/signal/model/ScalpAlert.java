package org.cloudvision.scalp.signal.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Actionable alert emitted by the orchestrator. Immutable.
 */
public class ScalpAlert {
    private final String id;
    private final AlertType type;
    private final Instant timestamp;
    private final int confidence;
    private final boolean shouldPush;
    private final DirectorState director;
    private final ValidatorState validator;
    private final String triggerReason;
    private final String explanation;
    private final BigDecimal entryPrice;
    private final BigDecimal stopLoss;
    private final BigDecimal targetPrice;
    private final String holdTime;

    private ScalpAlert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.type = Objects.requireNonNull(builder.type, "type");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp");
        this.confidence = builder.confidence;
        this.shouldPush = builder.shouldPush;
        this.director = builder.director;
        this.validator = builder.validator;
        this.triggerReason = builder.triggerReason;
        this.explanation = builder.explanation;
        this.entryPrice = builder.entryPrice;
        this.stopLoss = builder.stopLoss;
        this.targetPrice = builder.targetPrice;
        this.holdTime = builder.holdTime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() { return id; }
    public AlertType getType() { return type; }
    public Instant getTimestamp() { return timestamp; }
    public int getConfidence() { return confidence; }
    public boolean isShouldPush() { return shouldPush; }
    public DirectorState getDirector() { return director; }
    public ValidatorState getValidator() { return validator; }
    public String getTriggerReason() { return triggerReason; }
    public String getExplanation() { return explanation; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getStopLoss() { return stopLoss; }
    public BigDecimal getTargetPrice() { return targetPrice; }
    public String getHoldTime() { return holdTime; }

    public TradeDirection getDirection() {
        return type.getDirection();
    }

    @Override
    public String toString() {
        return String.format("%s %s conf=%d entry=%s stop=%s target=%s (%s)",
            id, type, confidence, entryPrice, stopLoss, targetPrice, triggerReason);
    }

    public static class Builder {
        private String id;
        private AlertType type;
        private Instant timestamp;
        private int confidence;
        private boolean shouldPush;
        private DirectorState director;
        private ValidatorState validator;
        private String triggerReason;
        private String explanation;
        private BigDecimal entryPrice;
        private BigDecimal stopLoss;
        private BigDecimal targetPrice;
        private String holdTime;

        public Builder id(String id) { this.id = id; return this; }
        public Builder type(AlertType type) { this.type = type; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }
        public Builder confidence(int confidence) { this.confidence = confidence; return this; }
        public Builder shouldPush(boolean shouldPush) { this.shouldPush = shouldPush; return this; }
        public Builder director(DirectorState director) { this.director = director; return this; }
        public Builder validator(ValidatorState validator) { this.validator = validator; return this; }
        public Builder triggerReason(String triggerReason) { this.triggerReason = triggerReason; return this; }
        public Builder explanation(String explanation) { this.explanation = explanation; return this; }
        public Builder entryPrice(BigDecimal entryPrice) { this.entryPrice = entryPrice; return this; }
        public Builder stopLoss(BigDecimal stopLoss) { this.stopLoss = stopLoss; return this; }
        public Builder targetPrice(BigDecimal targetPrice) { this.targetPrice = targetPrice; return this; }
        public Builder holdTime(String holdTime) { this.holdTime = holdTime; return this; }

        public ScalpAlert build() {
            return new ScalpAlert(this);
        }
    }
}
