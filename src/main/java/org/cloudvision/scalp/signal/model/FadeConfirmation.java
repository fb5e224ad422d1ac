package org.cloudvision.scalp.signal.model;

public class FadeConfirmation {
    private static final FadeConfirmation NONE = new FadeConfirmation(false, null, null);

    private final boolean confirmed;
    private final TradeDirection direction;
    private final String reason;

    private FadeConfirmation(boolean confirmed, TradeDirection direction, String reason) {
        this.confirmed = confirmed;
        this.direction = direction;
        this.reason = reason;
    }

    public static FadeConfirmation none() {
        return NONE;
    }

    public static FadeConfirmation confirmed(TradeDirection direction, String reason) {
        return new FadeConfirmation(true, direction, reason);
    }

    public boolean isConfirmed() { return confirmed; }
    public TradeDirection getDirection() { return direction; }
    public String getReason() { return reason; }
}
