package org.cloudvision.scalp.signal.model;

public enum AlertType {
    SQUEEZE_LONG("Squeeze Long", TradeDirection.LONG),
    SQUEEZE_SHORT("Squeeze Short", TradeDirection.SHORT),
    TRAP_FADE_LONG("Trap Fade Long", TradeDirection.LONG),
    TRAP_FADE_SHORT("Trap Fade Short", TradeDirection.SHORT);

    private final String displayName;
    private final TradeDirection direction;

    AlertType(String displayName, TradeDirection direction) {
        this.displayName = displayName;
        this.direction = direction;
    }

    public String getDisplayName() {
        return displayName;
    }

    public TradeDirection getDirection() {
        return direction;
    }

    public boolean isTrapFade() {
        return this == TRAP_FADE_LONG || this == TRAP_FADE_SHORT;
    }

    public static AlertType squeeze(TradeDirection direction) {
        return direction == TradeDirection.LONG ? SQUEEZE_LONG : SQUEEZE_SHORT;
    }

    public static AlertType trapFade(TradeDirection direction) {
        return direction == TradeDirection.LONG ? TRAP_FADE_LONG : TRAP_FADE_SHORT;
    }
}
