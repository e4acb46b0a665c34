package io.github.drompincen.autopilot.runtime.scheduler;

public class ActionNotFoundException extends RuntimeException {

    private final String actionId;

    public ActionNotFoundException(String actionId) {
        super("Scheduled action not found: " + actionId);
        this.actionId = actionId;
    }

    public String getActionId() { return actionId; }
}
