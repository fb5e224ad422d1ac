package org.cloudvision.scalp.signal.model;

/**
 * Output of one orchestrator invocation. The alert is null when nothing fired;
 * the state objects are always present and are passed back in on the next call.
 */
public class ScalpSignalResult {
    private final ScalpAlert alert;
    private final DirectorResult director;
    private final ValidatorResult validator;
    private final TrapModeState trap;
    private final CooldownState cooldown;
    private final ChopCheck chop;
    private final TriggerResult trigger;
    private final String suppressedReason;

    public ScalpSignalResult(ScalpAlert alert, DirectorResult director, ValidatorResult validator,
                             TrapModeState trap, CooldownState cooldown, ChopCheck chop,
                             TriggerResult trigger, String suppressedReason) {
        this.alert = alert;
        this.director = director;
        this.validator = validator;
        this.trap = trap;
        this.cooldown = cooldown;
        this.chop = chop;
        this.trigger = trigger;
        this.suppressedReason = suppressedReason;
    }

    public ScalpAlert getAlert() { return alert; }
    public DirectorResult getDirector() { return director; }
    public ValidatorResult getValidator() { return validator; }
    public TrapModeState getTrap() { return trap; }
    public CooldownState getCooldown() { return cooldown; }
    public ChopCheck getChop() { return chop; }
    public TriggerResult getTrigger() { return trigger; }

    /** Why no alert was emitted, or null when one was. */
    public String getSuppressedReason() { return suppressedReason; }

    public boolean hasAlert() {
        return alert != null;
    }
}
