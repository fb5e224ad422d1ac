package org.cloudvision.scalp.signal.model;

public class ValidatorResult {
    private final ValidatorState state;
    private final ValidatorConditions longConditions;
    private final ValidatorConditions shortConditions;

    public ValidatorResult(ValidatorState state, ValidatorConditions longConditions,
                           ValidatorConditions shortConditions) {
        this.state = state;
        this.longConditions = longConditions;
        this.shortConditions = shortConditions;
    }

    public static ValidatorResult neutral() {
        return new ValidatorResult(ValidatorState.NEUTRAL, ValidatorConditions.none(), ValidatorConditions.none());
    }

    public ValidatorState getState() { return state; }
    public ValidatorConditions getLongConditions() { return longConditions; }
    public ValidatorConditions getShortConditions() { return shortConditions; }

    public boolean isLongValid() {
        return longConditions.allMet();
    }

    public boolean isShortValid() {
        return shortConditions.allMet();
    }
}
