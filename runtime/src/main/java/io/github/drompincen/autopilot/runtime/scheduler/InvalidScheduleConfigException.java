package io.github.drompincen.autopilot.runtime.scheduler;

/**
 * A schedule type or schedule config that cannot produce fire times.
 */
public class InvalidScheduleConfigException extends IllegalArgumentException {

    public InvalidScheduleConfigException(String message) {
        super(message);
    }

    public InvalidScheduleConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
