package io.github.drompincen.autopilot.runtime.scheduler;

import java.util.*;

/**
 * Per-id result of a reconcile pass.
 */
public class ReconcileReport {

    private final List<String> armed = new ArrayList<>();
    private final List<String> unchanged = new ArrayList<>();
    private final List<String> disarmed = new ArrayList<>();
    private final List<String> deferred = new ArrayList<>();
    private final Map<String, String> failures = new LinkedHashMap<>();

    void armed(String actionId) { armed.add(actionId); }
    void unchanged(String actionId) { unchanged.add(actionId); }
    void disarmed(String actionId) { disarmed.add(actionId); }
    // In flight when reconciled; re-read once the fire finishes
    void deferred(String actionId) { deferred.add(actionId); }
    void failed(String actionId, String reason) { failures.put(actionId, reason); }

    public List<String> getArmed() { return Collections.unmodifiableList(armed); }
    public List<String> getUnchanged() { return Collections.unmodifiableList(unchanged); }
    public List<String> getDisarmed() { return Collections.unmodifiableList(disarmed); }
    public List<String> getDeferred() { return Collections.unmodifiableList(deferred); }
    public Map<String, String> getFailures() { return Collections.unmodifiableMap(failures); }

    /** True when the pass armed, re-armed or disarmed anything. */
    public boolean hasChanges() {
        return !armed.isEmpty() || !disarmed.isEmpty();
    }

    @Override
    public String toString() {
        return "armed=" + armed.size() + ", unchanged=" + unchanged.size() + ", disarmed=" + disarmed.size()
                + ", deferred=" + deferred.size() + ", failed=" + failures.size();
    }
}
