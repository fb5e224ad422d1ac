package org.cloudvision.scalp.signal.model;

/**
 * Chop filter verdict with the first condition that fired.
 */
public class ChopCheck {
    private static final ChopCheck CLEAR = new ChopCheck(false, null);

    private final boolean chop;
    private final String reason;

    private ChopCheck(boolean chop, String reason) {
        this.chop = chop;
        this.reason = reason;
    }

    public static ChopCheck clear() {
        return CLEAR;
    }

    public static ChopCheck chop(String reason) {
        return new ChopCheck(true, reason);
    }

    public boolean isChop() { return chop; }
    public String getReason() { return reason; }
}
