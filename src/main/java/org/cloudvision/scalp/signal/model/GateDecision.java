package org.cloudvision.scalp.signal.model;

public class GateDecision {
    private static final GateDecision ALLOWED = new GateDecision(true, null);

    private final boolean allowed;
    private final String reason;

    private GateDecision(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    public static GateDecision allowed() {
        return ALLOWED;
    }

    public static GateDecision blocked(String reason) {
        return new GateDecision(false, reason);
    }

    public boolean isAllowed() { return allowed; }
    public String getReason() { return reason; }
}
