package io.github.drompincen.autopilot.runtime.executor;

public class UnknownActionTypeException extends IllegalArgumentException {

    private final String actionType;

    public UnknownActionTypeException(String actionType) {
        super("No executor found for action type: " + actionType);
        this.actionType = actionType;
    }

    public String getActionType() { return actionType; }
}
